package prayer.devotions_be.config;

import prayer.devotions_be.reminders.notification.LoggingNotificationSink;
import prayer.devotions_be.reminders.notification.NotificationSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationConfig {

    @Bean
    @ConditionalOnMissingBean(NotificationSink.class)
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }
}
