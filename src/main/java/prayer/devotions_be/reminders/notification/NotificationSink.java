package prayer.devotions_be.reminders.notification;

/**
 * Outbound delivery of a reminder message (push, email or SMS provider).
 */
public interface NotificationSink {

    /**
     * @return {@code true} when the provider accepted the message
     */
    boolean send(NotificationChannel channel, String recipient, String message);
}
