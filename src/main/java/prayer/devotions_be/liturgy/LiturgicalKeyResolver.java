package prayer.devotions_be.liturgy;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Maps a calendar date to the key used to join against the daily lectionary.
 *
 * <p>Inside the movable season (Ash Wednesday through Holy Trinity) the key is a season label such
 * as {@code "Lent 3 Tuesday"} or {@code "Pentecost Monday"}; outside it the key is the fixed date
 * in {@code "dd MMM"} form, e.g. {@code "25 Dec"}.
 */
public final class LiturgicalKeyResolver {

    private static final DateTimeFormatter FIXED_DATE_KEY = DateTimeFormatter.ofPattern("dd MMM", Locale.ENGLISH);

    private static final String[] WEEKDAYS = {
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };

    private static final String[] ASH_DAYS = {
            "Ash Wednesday", "Ash Thursday", "Ash Friday", "Ash Saturday"
    };

    private static final String[] HOLY_WEEK = {
            "Palm Sunday",
            "Holy Week Monday",
            "Holy Week Tuesday",
            "Holy Week Wednesday",
            "Maundy Thursday",
            "Good Friday",
            "Holy Saturday"
    };

    private LiturgicalKeyResolver() {
    }

    public static String getKey(LocalDate date, ChurchYearAnchors anchors) {
        if (!anchors.isInMovableSeason(date)) {
            return fixedDateKey(date);
        }
        if (date.isBefore(anchors.easterDate())) {
            return lentKey((int) ChronoUnit.DAYS.between(anchors.ashWednesday(), date));
        }
        return easterKey((int) ChronoUnit.DAYS.between(anchors.easterDate(), date));
    }

    public static String fixedDateKey(LocalDate date) {
        return date.format(FIXED_DATE_KEY);
    }

    private static String lentKey(int daysSinceAsh) {
        if (daysSinceAsh < ASH_DAYS.length) {
            return ASH_DAYS[daysSinceAsh];
        }
        int daysIntoLent = daysSinceAsh - ASH_DAYS.length;
        int week = daysIntoLent / 7 + 1;
        int weekday = daysIntoLent % 7;
        if (week == 6) {
            return HOLY_WEEK[weekday];
        }
        return "Lent " + week + " " + WEEKDAYS[weekday];
    }

    private static String easterKey(int daysSinceEaster) {
        int week = daysSinceEaster / 7 + 1;
        String weekday = WEEKDAYS[daysSinceEaster % 7];
        if (daysSinceEaster == 0) {
            return "Easter Sunday";
        }
        if (daysSinceEaster == 39) {
            return "Ascension Day";
        }
        if (daysSinceEaster == 49) {
            return "Pentecost Sunday";
        }
        if (daysSinceEaster > 49 && daysSinceEaster < 56) {
            return "Pentecost " + weekday;
        }
        if (daysSinceEaster == 56) {
            return "Holy Trinity";
        }
        String prefix = week == 1 ? "Easter" : "Easter " + week;
        return prefix + " " + weekday;
    }
}
