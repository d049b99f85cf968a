package prayer.devotions_be.reminders;

import prayer.devotions_be.reminders.notification.NotificationChannel;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Immutable projection of the {@code reminder} table.
 *
 * @param timeOfDay  local wall-clock time, {@code HH:MM}
 * @param timezone   IANA zone the time of day is interpreted in
 * @param nextRunUtc the only field the dispatch sweep rewrites
 */
public record Reminder(
        String id,
        String userId,
        String timeOfDay,
        String timezone,
        Devotion devotion,
        List<NotificationChannel> methods,
        String readingType,
        OffsetDateTime createdAt,
        Instant nextRunUtc) {

    public Reminder {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(timeOfDay, "timeOfDay");
        Objects.requireNonNull(timezone, "timezone");
        Objects.requireNonNull(devotion, "devotion");
        Objects.requireNonNull(nextRunUtc, "nextRunUtc");
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    public Reminder withSchedule(String newTimezone, Instant newNextRunUtc) {
        return new Reminder(id, userId, timeOfDay, newTimezone, devotion, methods, readingType, createdAt, newNextRunUtc);
    }
}
