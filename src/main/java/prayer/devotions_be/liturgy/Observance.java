package prayer.devotions_be.liturgy;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Objects;
import java.util.Optional;

/**
 * A named feast or commemoration from the observance registry.
 *
 * <p>Exactly one of {@code absoluteDate}, {@code relativeToEaster} or {@code rule} is set. A missing
 * {@code color} means the colour is derived from the season.
 */
public record Observance(
        String name,
        MonthDay absoluteDate,
        Integer relativeToEaster,
        ObservanceRule rule,
        LiturgicalColor color) {

    public Observance {
        Objects.requireNonNull(name, "name");
        int matchers = (absoluteDate != null ? 1 : 0) + (relativeToEaster != null ? 1 : 0) + (rule != null ? 1 : 0);
        if (matchers != 1) {
            throw new IllegalArgumentException("Observance '" + name + "' must define exactly one date matcher");
        }
    }

    public static Observance fixed(String name, MonthDay date, LiturgicalColor color) {
        return new Observance(name, date, null, null, color);
    }

    public static Observance easterOffset(String name, int days, LiturgicalColor color) {
        return new Observance(name, null, days, null, color);
    }

    public static Observance ruled(String name, ObservanceRule rule, LiturgicalColor color) {
        return new Observance(name, null, null, rule, color);
    }

    public boolean isFixed() {
        return absoluteDate != null;
    }

    public Optional<LiturgicalColor> explicitColor() {
        return Optional.ofNullable(color);
    }

    /**
     * @param anchors anchors of {@code day}'s own year
     */
    public boolean matches(LocalDate day, ChurchYearAnchors anchors) {
        if (absoluteDate != null) {
            return absoluteDate.getMonthValue() == day.getMonthValue()
                    && absoluteDate.getDayOfMonth() == day.getDayOfMonth();
        }
        if (relativeToEaster != null) {
            return day.equals(anchors.easterDate().plusDays(relativeToEaster));
        }
        return rule.matches(day);
    }
}
