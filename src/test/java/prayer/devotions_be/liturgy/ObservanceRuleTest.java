package prayer.devotions_be.liturgy;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObservanceRuleTest {

    @Test
    void parsesKnownRules() {
        assertThat(ObservanceRule.parse("advent_3")).contains(new ObservanceRule(ObservanceRule.Kind.ADVENT, 3));
        assertThat(ObservanceRule.parse("EPIPHANY_5")).contains(new ObservanceRule(ObservanceRule.Kind.EPIPHANY, 5));
        assertThat(ObservanceRule.parse("sunday_after_christmas"))
                .contains(new ObservanceRule(ObservanceRule.Kind.SUNDAY_AFTER_CHRISTMAS, 0));
        assertThat(ObservanceRule.parse(" reformation_observed "))
                .contains(new ObservanceRule(ObservanceRule.Kind.REFORMATION_OBSERVED, 0));
    }

    @Test
    void rejectsUnknownOrOutOfRangeRules() {
        assertThat(ObservanceRule.parse("advent_5")).isEmpty();
        assertThat(ObservanceRule.parse("advent_0")).isEmpty();
        assertThat(ObservanceRule.parse("epiphany_0")).isEmpty();
        assertThat(ObservanceRule.parse("epiphany_x")).isEmpty();
        assertThat(ObservanceRule.parse("lent_1")).isEmpty();
        assertThat(ObservanceRule.parse(null)).isEmpty();
    }

    @Test
    void adventSundaysCountFromAdventOne() {
        ObservanceRule advent3 = ObservanceRule.parse("advent_3").orElseThrow();

        assertEquals(LocalDate.of(2025, 12, 14), advent3.targetDate(2025));
        assertTrue(advent3.matches(LocalDate.of(2025, 12, 14)));
        assertFalse(advent3.matches(LocalDate.of(2025, 12, 7)));
    }

    @Test
    void epiphanySundaysStartAfterJanuarySixth() {
        ObservanceRule epiphany1 = ObservanceRule.parse("epiphany_1").orElseThrow();
        ObservanceRule epiphany2 = ObservanceRule.parse("epiphany_2").orElseThrow();

        assertEquals(LocalDate.of(2025, 1, 12), epiphany1.targetDate(2025));
        assertEquals(LocalDate.of(2026, 1, 18), epiphany2.targetDate(2026));
        // Jan 6 2008 is a Sunday; the first Sunday after it is a week later
        assertEquals(LocalDate.of(2008, 1, 13), epiphany1.targetDate(2008));
    }

    @Test
    void sundayAfterChristmas() {
        ObservanceRule rule = ObservanceRule.parse("sunday_after_christmas").orElseThrow();

        assertEquals(LocalDate.of(2025, 12, 28), rule.targetDate(2025));
        assertEquals(LocalDate.of(2027, 12, 26), rule.targetDate(2027));
    }

    @Test
    void reformationObservedIsTheSundayOnOrBeforeOctober31() {
        ObservanceRule rule = ObservanceRule.parse("reformation_observed").orElseThrow();

        assertEquals(LocalDate.of(2025, 10, 26), rule.targetDate(2025));
        assertEquals(LocalDate.of(2026, 10, 25), rule.targetDate(2026));
        assertEquals(LocalDate.of(2027, 10, 31), rule.targetDate(2027));
    }
}
