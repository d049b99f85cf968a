package prayer.devotions_be.reminders;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Devotions a reminder can point to.
 */
public enum Devotion {
    MORNING("morning", "Morning Prayer", "/morning_devotion"),
    MIDDAY("midday", "Midday Prayer", "/midday_devotion"),
    EVENING("evening", "Evening Prayer", "/evening_devotion"),
    CLOSE_OF_DAY("close_of_day", "Close of the Day", "/close_of_day_devotion"),
    NIGHT_WATCH("night_watch", "Night Watch", "/night_watch_devotion"),
    BIBLE_IN_A_YEAR("bible_in_a_year", "Bible in a Year", "/bible_in_a_year"),
    LENT("lent", "Lenten Devotion", "/lent_devotion");

    private final String code;
    private final String displayName;
    private final String path;

    Devotion(String code, String displayName, String path) {
        this.code = code;
        this.displayName = displayName;
        this.path = path;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /** Site-relative URL of the devotion page. */
    public String path() {
        return path;
    }

    /** Only offered between Ash Wednesday and Easter Sunday. */
    public boolean isLentOnly() {
        return this == LENT;
    }

    public static Optional<Devotion> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (Devotion devotion : values()) {
            if (devotion.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(devotion);
            }
        }
        return Optional.empty();
    }
}
