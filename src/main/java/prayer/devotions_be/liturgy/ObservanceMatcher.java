package prayer.devotions_be.liturgy;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reduces the observances matching a date to one display name, colour and season.
 *
 * <p>Matches are split into movable (no absolute date) and fixed observances, then narrowed in
 * this order:
 * <ol>
 *     <li>Reformation Day (Observed) replaces every other movable observance.</li>
 *     <li>All Saints' Day clears the movable observances.</li>
 *     <li>An Advent Sunday drops movable Trinity observances.</li>
 *     <li>A pre-Lent, Transfiguration, Lent or Ash Wednesday observance drops movable Epiphany
 *     observances, keeping The Baptism of Our Lord and Epiphany of Our Lord.</li>
 * </ol>
 * Fixed observances are never narrowed against each other; they are concatenated.
 */
public final class ObservanceMatcher {

    public static final String REFORMATION_OBSERVED = "Reformation Day (Observed)";
    public static final String ALL_SAINTS = "All Saints' Day";
    public static final String NAME_SEPARATOR = " / ";

    private static final List<String> EPIPHANY_OVERRIDES = List.of(
            "Septuagesima", "Sexagesima", "Quinquagesima", "Transfiguration", "Lent", "Ash Wednesday");
    private static final List<String> EPIPHANY_KEEPERS = List.of("The Baptism of Our Lord", "Epiphany of Our Lord");

    private ObservanceMatcher() {
    }

    /**
     * @param displayName surviving observance names, movable first; empty when none survive
     */
    public record Resolution(String displayName, LiturgicalColor color, String season, List<Observance> survivors) {
        public Resolution {
            survivors = List.copyOf(survivors);
        }

        public boolean hasObservance() {
            return !survivors.isEmpty();
        }
    }

    /**
     * @param key     liturgical key of {@code date} (see {@link LiturgicalKeyResolver})
     * @param anchors anchors of {@code date}'s own year
     */
    public static Resolution resolve(LocalDate date, String key, ChurchYearAnchors anchors, ObservanceRegistry registry) {
        List<Observance> matched = registry.matching(date, anchors);
        List<Observance> movable = matched.stream().filter(o -> !o.isFixed()).toList();
        List<Observance> fixed = matched.stream().filter(Observance::isFixed).toList();

        movable = applyPriorities(movable, fixed);

        String displayName = Stream.concat(movable.stream(), fixed.stream())
                .map(Observance::name)
                .collect(Collectors.joining(NAME_SEPARATOR));

        LiturgicalColor color = explicitColor(movable, fixed);
        if (color == null) {
            color = SeasonHeuristics.colorFor(displayName.isEmpty() ? key : displayName, date, anchors);
        }
        String season = SeasonHeuristics.seasonFor(key, date, anchors);

        List<Observance> survivors = new ArrayList<>(movable);
        survivors.addAll(fixed);
        return new Resolution(displayName, color, season, survivors);
    }

    static List<Observance> applyPriorities(List<Observance> movable, List<Observance> fixed) {
        List<Observance> result = movable;

        if (result.stream().anyMatch(o -> o.name().equals(REFORMATION_OBSERVED))) {
            result = result.stream().filter(o -> o.name().equals(REFORMATION_OBSERVED)).toList();
        }

        if (fixed.stream().anyMatch(o -> o.name().equals(ALL_SAINTS))) {
            result = List.of();
        }

        if (result.stream().anyMatch(o -> o.name().contains("Advent"))) {
            result = result.stream().filter(o -> !o.name().contains("Trinity")).toList();
        }

        if (result.stream().anyMatch(o -> SeasonHeuristics.containsAny(o.name(), EPIPHANY_OVERRIDES))) {
            result = result.stream()
                    .filter(o -> !o.name().contains("Epiphany") || SeasonHeuristics.containsAny(o.name(), EPIPHANY_KEEPERS))
                    .toList();
        }
        return result;
    }

    // Movable observances take precedence over fixed ones.
    private static LiturgicalColor explicitColor(List<Observance> movable, List<Observance> fixed) {
        return Stream.concat(movable.stream(), fixed.stream())
                .flatMap(observance -> observance.explicitColor().stream())
                .findFirst()
                .orElse(null);
    }
}
