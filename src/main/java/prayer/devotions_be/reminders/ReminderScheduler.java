package prayer.devotions_be.reminders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Next fire instant of a daily reminder.
 *
 * <p>After a reminder fires the sweep calls {@link #calculateNextRun} again with a fresh "now"
 * rather than adding a day to the previous schedule, so a late sweep never produces a burst of
 * catch-up fires. A dispatcher that is down across a whole day boundary therefore skips that day.
 */
public final class ReminderScheduler {
    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    private ReminderScheduler() {
    }

    /**
     * @param timeOfDay    validated {@code HH:MM} wall-clock time
     * @param timezoneName IANA zone; unknown or blank names are treated as UTC
     * @return first instant strictly after {@code now} showing {@code timeOfDay} in the zone
     */
    public static Instant calculateNextRun(String timeOfDay, String timezoneName, Instant now) {
        return calculateNextRun(ReminderTimeValidator.parse(timeOfDay), resolveZone(timezoneName), now);
    }

    public static Instant calculateNextRun(LocalTime timeOfDay, ZoneId zone, Instant now) {
        ZonedDateTime localNow = now.atZone(zone);
        ZonedDateTime candidate = localNow
                .withHour(timeOfDay.getHour())
                .withMinute(timeOfDay.getMinute())
                .withSecond(0)
                .withNano(0);
        if (!candidate.isAfter(localNow)) {
            candidate = candidate.plusDays(1)
                    .withHour(timeOfDay.getHour())
                    .withMinute(timeOfDay.getMinute());
        }
        return candidate.toInstant();
    }

    public static ZoneId resolveZone(String timezoneName) {
        if (timezoneName == null || timezoneName.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezoneName.trim());
        } catch (DateTimeException ex) {
            log.warn("Unknown time zone '{}', scheduling in UTC", timezoneName);
            return ZoneOffset.UTC;
        }
    }
}
