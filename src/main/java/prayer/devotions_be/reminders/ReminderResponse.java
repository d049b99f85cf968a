package prayer.devotions_be.reminders;

import com.fasterxml.jackson.annotation.JsonProperty;
import prayer.devotions_be.reminders.notification.NotificationChannel;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

public record ReminderResponse(
        @JsonProperty("id") String id,
        @JsonProperty("time") String time,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("devotion") Devotion devotion,
        @JsonProperty("devotion_name") String devotionName,
        @JsonProperty("methods") List<NotificationChannel> methods,
        @JsonProperty("reading_type") String readingType,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("next_run_utc") Instant nextRunUtc) {

    public static ReminderResponse from(Reminder reminder) {
        return new ReminderResponse(
                reminder.id(),
                reminder.timeOfDay(),
                reminder.timezone(),
                reminder.devotion(),
                reminder.devotion().displayName(),
                reminder.methods(),
                reminder.readingType(),
                reminder.createdAt(),
                reminder.nextRunUtc());
    }
}
