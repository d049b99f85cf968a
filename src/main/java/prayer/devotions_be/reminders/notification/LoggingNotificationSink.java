package prayer.devotions_be.reminders.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink used until a real provider is wired in; it only records what would be sent.
 */
public class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public boolean send(NotificationChannel channel, String recipient, String message) {
        log.info("[{}] to {}: {}", channel.code(), recipient, message);
        return true;
    }
}
