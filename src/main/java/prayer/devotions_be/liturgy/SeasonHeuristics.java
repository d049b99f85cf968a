package prayer.devotions_be.liturgy;

import java.time.LocalDate;
import java.time.Month;
import java.util.List;

/**
 * Keyword and date-window fallbacks for colour and season when no registry colour applies.
 */
public final class SeasonHeuristics {

    static final List<String> WHITE_KEYWORDS = List.of(
            "Christmas",
            "Epiphany of Our Lord",
            "All Saints",
            "Trinity",
            "Conversion of St. Paul",
            "Confession of St. Peter",
            "St. John, Apostle",
            "Nativity of St. John the Baptist",
            "Circumcision",
            "Presentation",
            "Annunciation",
            "Visitation",
            "St. Mary",
            "St. Joseph",
            "St. Timothy",
            "St. Titus",
            "Easter",
            "Ascension");

    static final List<String> RED_KEYWORDS = List.of(
            "Palm Sunday",
            "Pentecost",
            "Reformation",
            "Martyr",
            "Holy Cross",
            "Andrew",
            "Thomas",
            "James",
            "Simon",
            "Jude",
            "Matthew",
            "Luke",
            "Mark",
            "Peter",
            "Paul",
            "Bartholomew",
            "Philip",
            "Barnabas",
            "Matthias");

    static final List<String> VIOLET_KEYWORDS = List.of("Ash", "Lent");
    static final List<String> BLACK_KEYWORDS = List.of("Ash Wednesday", "Good Friday");
    static final List<String> PRE_LENT_KEYWORDS = List.of("Septuagesima", "Sexagesima", "Quinquagesima");

    public static final String SEASON_PRE_LENT = "Pre-Lent";
    public static final String SEASON_ADVENT = "Advent";
    public static final String SEASON_CHRISTMAS = "Christmas";
    public static final String SEASON_EPIPHANY = "Epiphany";
    public static final String SEASON_LENT = "Lent";
    public static final String SEASON_EASTER = "Easter";
    public static final String SEASON_PENTECOST = "Pentecost";
    public static final String SEASON_HOLY_TRINITY = "Holy Trinity";
    public static final String SEASON_AFTER_PENTECOST = "Season after Pentecost (Ordinary Time)";
    public static final String SEASON_ORDINARY = "Ordinary Time";

    private SeasonHeuristics() {
    }

    /**
     * Colour from keywords of {@code name} first, then from the date's position in the church year.
     *
     * @param anchors anchors of {@code date}'s own year
     */
    public static LiturgicalColor colorFor(String name, LocalDate date, ChurchYearAnchors anchors) {
        if (containsAny(name, PRE_LENT_KEYWORDS)) {
            return LiturgicalColor.GREEN;
        }
        if (containsAny(name, BLACK_KEYWORDS)) {
            return LiturgicalColor.BLACK;
        }
        if (containsAny(name, WHITE_KEYWORDS)) {
            return LiturgicalColor.WHITE;
        }
        if (containsAny(name, RED_KEYWORDS)) {
            return LiturgicalColor.RED;
        }
        if (containsAny(name, VIOLET_KEYWORDS)) {
            return LiturgicalColor.VIOLET;
        }

        LocalDate advent1 = ChurchYearAnchors.advent1(date.getYear());
        if (isInAdvent(date, advent1)) {
            return date.equals(advent1.plusDays(14)) ? LiturgicalColor.ROSE : LiturgicalColor.VIOLET;
        }
        if (isInChristmastide(date)) {
            return LiturgicalColor.WHITE;
        }
        if (isInEpiphanytide(date, anchors)) {
            // Transfiguration Sunday
            if (date.equals(anchors.ashWednesday().minusDays(3))) {
                return LiturgicalColor.WHITE;
            }
            return LiturgicalColor.GREEN;
        }
        return LiturgicalColor.GREEN;
    }

    /**
     * Season from keywords of the liturgical key first, then from date windows.
     *
     * @param anchors anchors of {@code date}'s own year
     */
    public static String seasonFor(String key, LocalDate date, ChurchYearAnchors anchors) {
        if (containsAny(key, PRE_LENT_KEYWORDS)) {
            return SEASON_PRE_LENT;
        }
        if (!date.isBefore(anchors.septuagesima()) && date.isBefore(anchors.ashWednesday())) {
            return SEASON_PRE_LENT;
        }
        if (key.contains("Advent")) {
            return SEASON_ADVENT;
        }
        if (key.contains("Christmas")) {
            return SEASON_CHRISTMAS;
        }
        if (key.contains("Epiphany")) {
            return SEASON_EPIPHANY;
        }
        if (containsAny(key, VIOLET_KEYWORDS)) {
            return SEASON_LENT;
        }
        if (key.contains("Easter")) {
            return SEASON_EASTER;
        }
        if (key.contains("Pentecost")) {
            return SEASON_PENTECOST;
        }
        if (key.contains("Trinity")) {
            return SEASON_HOLY_TRINITY;
        }

        if (isInAdvent(date, ChurchYearAnchors.advent1(date.getYear()))) {
            return SEASON_ADVENT;
        }
        if (isInChristmastide(date)) {
            return SEASON_CHRISTMAS;
        }
        if (isInEpiphanytide(date, anchors)) {
            return SEASON_EPIPHANY;
        }
        if (date.isAfter(anchors.holyTrinity())) {
            return SEASON_AFTER_PENTECOST;
        }
        return SEASON_ORDINARY;
    }

    static boolean containsAny(String text, List<String> keywords) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isInAdvent(LocalDate date, LocalDate advent1) {
        return !date.isBefore(advent1) && !date.isAfter(LocalDate.of(date.getYear(), Month.DECEMBER, 24));
    }

    private static boolean isInChristmastide(LocalDate date) {
        return (date.getMonth() == Month.DECEMBER && date.getDayOfMonth() >= 25)
                || (date.getMonth() == Month.JANUARY && date.getDayOfMonth() <= 5);
    }

    private static boolean isInEpiphanytide(LocalDate date, ChurchYearAnchors anchors) {
        return !date.isBefore(LocalDate.of(date.getYear(), Month.JANUARY, 6)) && date.isBefore(anchors.ashWednesday());
    }
}
