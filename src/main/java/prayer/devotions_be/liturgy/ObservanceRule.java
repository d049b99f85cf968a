package prayer.devotions_be.liturgy;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed-form date rule of a movable observance that is neither fixed nor a plain Easter offset.
 *
 * <p>Rule names in the registry are {@code advent_1..advent_4}, {@code sunday_after_christmas},
 * {@code epiphany_N} and {@code reformation_observed}.
 */
public record ObservanceRule(Kind kind, int ordinal) {

    public enum Kind {
        ADVENT,
        SUNDAY_AFTER_CHRISTMAS,
        EPIPHANY,
        REFORMATION_OBSERVED
    }

    public ObservanceRule {
        Objects.requireNonNull(kind, "kind");
    }

    public static Optional<ObservanceRule> parse(String rule) {
        if (rule == null) {
            return Optional.empty();
        }
        String normalized = rule.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("sunday_after_christmas")) {
            return Optional.of(new ObservanceRule(Kind.SUNDAY_AFTER_CHRISTMAS, 0));
        }
        if (normalized.equals("reformation_observed")) {
            return Optional.of(new ObservanceRule(Kind.REFORMATION_OBSERVED, 0));
        }
        if (normalized.startsWith("advent_")) {
            return ordinal(normalized, "advent_")
                    .filter(n -> n >= 1 && n <= 4)
                    .map(n -> new ObservanceRule(Kind.ADVENT, n));
        }
        if (normalized.startsWith("epiphany_")) {
            return ordinal(normalized, "epiphany_")
                    .filter(n -> n >= 1)
                    .map(n -> new ObservanceRule(Kind.EPIPHANY, n));
        }
        return Optional.empty();
    }

    public boolean matches(LocalDate day) {
        return day.equals(targetDate(day.getYear()));
    }

    /**
     * The single date in {@code year} this rule selects.
     */
    public LocalDate targetDate(int year) {
        return switch (kind) {
            case ADVENT -> ChurchYearAnchors.advent1(year).plusWeeks(ordinal - 1L);
            case SUNDAY_AFTER_CHRISTMAS ->
                    LocalDate.of(year, Month.DECEMBER, 25).with(TemporalAdjusters.next(DayOfWeek.SUNDAY));
            case EPIPHANY -> LocalDate.of(year, Month.JANUARY, 6)
                    .with(TemporalAdjusters.next(DayOfWeek.SUNDAY))
                    .plusWeeks(ordinal - 1L);
            case REFORMATION_OBSERVED ->
                    LocalDate.of(year, Month.OCTOBER, 31).with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
        };
    }

    private static Optional<Integer> ordinal(String rule, String prefix) {
        try {
            return Optional.of(Integer.parseInt(rule.substring(prefix.length())));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
