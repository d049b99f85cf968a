package prayer.devotions_be.liturgy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChurchYearCalendarTest {

    private static ChurchYearCalendar calendar;

    @BeforeAll
    static void setUp() {
        calendar = new ChurchYearCalendar(
                ObservanceRegistry.fromClasspath("liturgy/liturgical_year.json", new ObjectMapper()));
    }

    @Test
    void anchorsAreCachedPerYear() {
        assertSame(calendar.anchorsFor(2025), calendar.anchorsFor(2025));
    }

    @Test
    void describesEasterSunday() {
        LiturgicalDay day = calendar.describe(LocalDate.of(2025, 4, 20));

        assertEquals("Easter Sunday", day.key());
        assertEquals("The Resurrection of Our Lord", day.displayName());
        assertEquals(LiturgicalColor.WHITE, day.color());
        assertEquals(SeasonHeuristics.SEASON_EASTER, day.season());
        assertEquals(21, day.weekOfChurchYear());
    }

    @Test
    void seasonalWeekdaysHaveNoDisplayName() {
        LiturgicalDay ashThursday = calendar.describe(LocalDate.of(2025, 3, 6));
        LiturgicalDay easterMonday = calendar.describe(LocalDate.of(2025, 4, 21));
        LiturgicalDay pentecostMonday = calendar.describe(LocalDate.of(2025, 6, 9));

        assertEquals("", ashThursday.displayName());
        assertEquals("Ash Thursday", ashThursday.fullName());
        assertEquals(LiturgicalColor.VIOLET, ashThursday.color());
        assertEquals("", easterMonday.displayName());
        assertEquals("", pentecostMonday.displayName());
        assertEquals(LiturgicalColor.RED, pentecostMonday.color());
    }

    @Test
    void holyWeekWeekdaysUseThePositionalFallback() {
        LiturgicalDay monday = calendar.describe(LocalDate.of(2025, 4, 14));
        LiturgicalDay wednesday = calendar.describe(LocalDate.of(2025, 4, 16));

        assertEquals("Holy Week Monday", monday.key());
        assertEquals(LiturgicalColor.GREEN, monday.color());
        assertEquals(SeasonHeuristics.SEASON_ORDINARY, monday.season());
        assertEquals("Holy Week Wednesday", wednesday.key());
        assertEquals(LiturgicalColor.GREEN, wednesday.color());
    }

    @Test
    void ascensionDayKeepsItsRegistryColour() {
        LiturgicalDay day = calendar.describe(LocalDate.of(2025, 5, 29));

        assertEquals("Ascension Day", day.key());
        assertEquals(LiturgicalColor.WHITE, day.color());
        assertEquals(SeasonHeuristics.SEASON_ORDINARY, day.season());
    }

    @Test
    void ordinaryDayIsLabelledWithItsKey() {
        LiturgicalDay day = calendar.describe(LocalDate.of(2025, 7, 4));

        assertEquals("04 Jul", day.displayName());
        assertEquals(LiturgicalColor.GREEN, day.color());
    }

    @Test
    void plainDayLabels() {
        assertEquals("", ChurchYearCalendar.plainDayLabel("Pentecost Saturday"));
        assertEquals("", ChurchYearCalendar.plainDayLabel("Lent 3 Tuesday"));
        assertEquals("", ChurchYearCalendar.plainDayLabel("Easter 4 Friday"));
        assertEquals("Lent 3 Sunday", ChurchYearCalendar.plainDayLabel("Lent 3 Sunday"));
        assertEquals("Good Friday", ChurchYearCalendar.plainDayLabel("Good Friday"));
        assertEquals("14 Sep", ChurchYearCalendar.plainDayLabel("14 Sep"));
    }

    @Test
    void lentAndKeysDelegateToTheAnchorsOfTheDatesYear() {
        assertTrue(calendar.isLent(LocalDate.of(2026, 3, 1)));
        assertFalse(calendar.isLent(LocalDate.of(2026, 4, 6)));
        assertThat(calendar.keyFor(LocalDate.of(2026, 4, 5))).isEqualTo("Easter Sunday");
    }
}
