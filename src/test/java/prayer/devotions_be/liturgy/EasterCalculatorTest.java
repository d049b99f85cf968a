package prayer.devotions_be.liturgy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.DayOfWeek;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class EasterCalculatorTest {

    @ParameterizedTest
    @CsvSource({
            "1818, 1818-03-22",
            "2000, 2000-04-23",
            "2008, 2008-03-23",
            "2019, 2019-04-21",
            "2024, 2024-03-31",
            "2025, 2025-04-20",
            "2026, 2026-04-05",
            "2038, 2038-04-25"
    })
    void knownEasterDates(int year, LocalDate expected) {
        assertEquals(expected, EasterCalculator.calculateEaster(year));
    }

    @Test
    void easterIsAlwaysASundayBetweenMarch22AndApril25() {
        for (int year = 1583; year <= 3000; year++) {
            LocalDate easter = EasterCalculator.calculateEaster(year);
            assertThat(easter.getDayOfWeek()).as("Easter %d", year).isEqualTo(DayOfWeek.SUNDAY);
            assertThat(easter).isBetween(LocalDate.of(year, 3, 22), LocalDate.of(year, 4, 25));
        }
    }
}
