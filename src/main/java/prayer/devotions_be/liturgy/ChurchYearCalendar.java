package prayer.devotions_be.liturgy;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the liturgical calendar engine.
 *
 * <p>Keeps one {@link ChurchYearAnchors} per year for the life of the application and combines
 * the key resolver with the observance matcher into a {@link LiturgicalDay}.
 */
@Component
public class ChurchYearCalendar {

    private static final Set<String> SUPPRESSED_KEYS = Set.of(
            "Ash Thursday",
            "Ash Friday",
            "Ash Saturday",
            "Pentecost Monday",
            "Pentecost Tuesday",
            "Pentecost Wednesday",
            "Pentecost Thursday",
            "Pentecost Friday",
            "Pentecost Saturday");

    private final ObservanceRegistry registry;
    private final Map<Integer, ChurchYearAnchors> anchorsByYear = new ConcurrentHashMap<>();

    public ChurchYearCalendar(ObservanceRegistry registry) {
        this.registry = registry;
    }

    public ChurchYearAnchors anchorsFor(int year) {
        return anchorsByYear.computeIfAbsent(year, ChurchYearAnchors::build);
    }

    public String keyFor(LocalDate date) {
        return LiturgicalKeyResolver.getKey(date, anchorsFor(date.getYear()));
    }

    public boolean isLent(LocalDate date) {
        return anchorsFor(date.getYear()).isLent(date);
    }

    public LiturgicalDay describe(LocalDate date) {
        ChurchYearAnchors anchors = anchorsFor(date.getYear());
        String key = LiturgicalKeyResolver.getKey(date, anchors);
        ObservanceMatcher.Resolution resolution = ObservanceMatcher.resolve(date, key, anchors, registry);

        String displayName = resolution.hasObservance() ? resolution.displayName() : plainDayLabel(key);
        return new LiturgicalDay(
                date,
                key,
                displayName,
                resolution.color(),
                resolution.season(),
                anchors.weekOfChurchYear(date));
    }

    /**
     * Label of a day without observances; weekdays inside Advent, Lent and Easter are not labelled.
     */
    static String plainDayLabel(String key) {
        if (SUPPRESSED_KEYS.contains(key)) {
            return "";
        }
        boolean seasonalWeekday = !key.contains("Sunday")
                && (key.startsWith("Easter") || key.startsWith("Lent") || key.startsWith("Advent"));
        return seasonalWeekday ? "" : key;
    }
}
