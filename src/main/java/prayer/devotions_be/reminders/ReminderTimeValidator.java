package prayer.devotions_be.reminders;

import prayer.devotions_be.web.ApiException;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Input checks for reminder times and zones, run before anything is scheduled.
 */
public final class ReminderTimeValidator {

    private static final Pattern TIME_OF_DAY = Pattern.compile("^([01]?\\d|2[0-3]):([0-5]\\d)$");
    private static final int MINUTE_STEP = 15;

    private ReminderTimeValidator() {
    }

    /**
     * Parses a 24-hour {@code H:MM} or {@code HH:MM} value.
     */
    public static LocalTime parse(String timeOfDay) {
        if (timeOfDay == null) {
            throw ApiException.validation("Time is required.", "time_required");
        }
        Matcher m = TIME_OF_DAY.matcher(timeOfDay.trim());
        if (!m.matches()) {
            throw ApiException.validation("Invalid time format. Use HH:MM in 24-hour time.", "time_format_invalid");
        }
        return LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    public static LocalTime requireQuarterHour(String timeOfDay) {
        LocalTime time = parse(timeOfDay);
        if (time.getMinute() % MINUTE_STEP != 0) {
            throw ApiException.validation(
                    "Time must be in 15-minute increments (e.g. :00, :15, :30, :45).", "time_not_quarter_hour");
        }
        return time;
    }

    /**
     * Zone check for user input; blank means UTC. The scheduler itself stays lenient.
     */
    public static ZoneId requireZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException ex) {
            throw ApiException.validation("Unknown time zone '" + timezone + "'.", "timezone_invalid");
        }
    }

    /** Canonical {@code HH:MM} form used for storage. */
    public static String format(LocalTime time) {
        return String.format("%02d:%02d", time.getHour(), time.getMinute());
    }
}
