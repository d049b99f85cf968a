package prayer.devotions_be.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class ReminderPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    void defaults() {
        runner.run(context -> {
            ReminderProperties reminders = context.getBean(ReminderProperties.class);
            DevotionsProperties devotions = context.getBean(DevotionsProperties.class);
            assertThat(reminders.isDispatchEnabled()).isTrue();
            assertThat(reminders.getSweepIntervalMs()).isEqualTo(60_000);
            assertThat(reminders.getSendTimeoutMs()).isEqualTo(10_000);
            assertThat(reminders.getSenderThreads()).isEqualTo(4);
            assertThat(devotions.getHomeTimezone()).isEqualTo("America/New_York");
            assertThat(devotions.getBaseUrl()).isEqualTo("https://www.asimplewaytopray.com");
        });
    }

    @Test
    void bindsKebabCaseKeys() {
        runner.withPropertyValues(
                        "devotions.reminders.dispatch-enabled=false",
                        "devotions.reminders.send-timeout-ms=2500",
                        "devotions.home-timezone=Europe/Prague")
                .run(context -> {
                    assertThat(context.getBean(ReminderProperties.class).isDispatchEnabled()).isFalse();
                    assertThat(context.getBean(ReminderProperties.class).getSendTimeoutMs()).isEqualTo(2_500);
                    assertThat(context.getBean(DevotionsProperties.class).getHomeTimezone()).isEqualTo("Europe/Prague");
                });
    }

    @Test
    void rejectsTooShortSweepInterval() {
        runner.withPropertyValues("devotions.reminders.sweep-interval-ms=10")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsBlankBaseUrl() {
        runner.withPropertyValues("devotions.base-url= ")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties({ReminderProperties.class, DevotionsProperties.class})
    static class PropertiesConfig {
    }
}
