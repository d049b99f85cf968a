package prayer.devotions_be.calendar;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import prayer.devotions_be.config.DevotionsProperties;
import prayer.devotions_be.liturgy.ChurchYearCalendar;
import prayer.devotions_be.liturgy.ObservanceRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiturgicalCalendarServiceTest {

    private LiturgicalCalendarService service;

    @BeforeEach
    void setUp() {
        ChurchYearCalendar calendar = new ChurchYearCalendar(
                ObservanceRegistry.fromClasspath("liturgy/liturgical_year.json", new ObjectMapper()));
        Clock clock = Clock.fixed(Instant.parse("2025-12-14T15:00:00Z"), ZoneOffset.UTC);
        service = new LiturgicalCalendarService(calendar, new DevotionsProperties(), clock);
    }

    @Test
    void monthGridStartsOnSundayAndEndsOnSaturday() {
        CalendarMonth month = service.month(YearMonth.of(2025, 12));

        assertEquals("December", month.monthName());
        assertEquals(2025, month.prevYear());
        assertEquals(11, month.prevMonth());
        assertEquals(2026, month.nextYear());
        assertEquals(1, month.nextMonth());
        assertThat(month.weeks()).hasSize(5).allSatisfy(week -> assertThat(week).hasSize(7));

        CalendarMonth.Day first = month.weeks().get(0).get(0);
        assertEquals(LocalDate.of(2025, 11, 30), first.date());
        assertFalse(first.currentMonth());
        assertEquals("First Sunday in Advent (Ad Te Levavi) / St. Andrew, Apostle", first.displayName());
        assertEquals("violet", first.color());

        CalendarMonth.Day last = month.weeks().get(4).get(6);
        assertEquals(LocalDate.of(2026, 1, 3), last.date());
    }

    @Test
    void marksTodayAndGaudeteSunday() {
        CalendarMonth month = service.month(YearMonth.of(2025, 12));

        CalendarMonth.Day gaudete = month.weeks().get(2).get(0);
        assertEquals(LocalDate.of(2025, 12, 14), gaudete.date());
        assertTrue(gaudete.today());
        assertEquals("rose", gaudete.color());
        assertEquals("Rose", gaudete.colorName());
        assertEquals("Advent", gaudete.season());

        List<CalendarMonth.Day> todays = month.weeks().stream()
                .flatMap(List::stream)
                .filter(CalendarMonth.Day::today)
                .toList();
        assertThat(todays).hasSize(1);
    }

    @Test
    void januaryWrapsToThePreviousYear() {
        CalendarMonth month = service.month("2026", "1");

        assertEquals(2025, month.prevYear());
        assertEquals(12, month.prevMonth());
        assertEquals(2026, month.year());
    }

    @Test
    void invalidParametersFallBackToTheCurrentMonth() {
        YearMonth current = YearMonth.of(2025, 12);

        assertEquals(YearMonth.of(2024, 2), service.parseYearMonth("2024", "2"));
        assertEquals(current, service.parseYearMonth(null, null));
        assertEquals(current, service.parseYearMonth("abc", "3"));
        assertEquals(current, service.parseYearMonth("2025", "13"));
        assertEquals(current, service.parseYearMonth("1500", "1"));
        assertEquals(YearMonth.of(2025, 3), service.parseYearMonth("", "3"));
    }
}
