package prayer.devotions_be.calendar;

import prayer.devotions_be.config.DevotionsProperties;
import prayer.devotions_be.liturgy.ChurchYearCalendar;
import prayer.devotions_be.liturgy.LiturgicalDay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
public class LiturgicalCalendarService {
    private static final Logger log = LoggerFactory.getLogger(LiturgicalCalendarService.class);

    private static final int MIN_YEAR = 1583;
    private static final int MAX_YEAR = 9999;

    private final ChurchYearCalendar calendar;
    private final DevotionsProperties props;
    private final Clock clock;

    public LiturgicalCalendarService(ChurchYearCalendar calendar, DevotionsProperties props, Clock clock) {
        this.calendar = calendar;
        this.props = props;
        this.clock = clock;
    }

    public LiturgicalDay day(LocalDate date) {
        return calendar.describe(date);
    }

    /**
     * Month page for raw query values; anything unparseable or out of range shows the current month.
     */
    public CalendarMonth month(String year, String month) {
        return month(parseYearMonth(year, month));
    }

    public CalendarMonth month(YearMonth yearMonth) {
        LocalDate today = today();
        LocalDate first = yearMonth.atDay(1).with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
        LocalDate last = yearMonth.atEndOfMonth().with(TemporalAdjusters.nextOrSame(DayOfWeek.SATURDAY));

        List<List<CalendarMonth.Day>> weeks = new ArrayList<>();
        List<CalendarMonth.Day> week = new ArrayList<>(7);
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            week.add(toDay(calendar.describe(day), today, yearMonth));
            if (week.size() == 7) {
                weeks.add(week);
                week = new ArrayList<>(7);
            }
        }

        YearMonth prev = yearMonth.minusMonths(1);
        YearMonth next = yearMonth.plusMonths(1);
        return new CalendarMonth(
                yearMonth.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                yearMonth.getYear(),
                yearMonth.getMonthValue(),
                prev.getYear(),
                prev.getMonthValue(),
                next.getYear(),
                next.getMonthValue(),
                weeks);
    }

    YearMonth parseYearMonth(String year, String month) {
        YearMonth current = YearMonth.from(today());
        try {
            int y = year == null || year.isBlank() ? current.getYear() : Integer.parseInt(year.trim());
            int m = month == null || month.isBlank() ? current.getMonthValue() : Integer.parseInt(month.trim());
            if (y < MIN_YEAR || y > MAX_YEAR || m < 1 || m > 12) {
                log.debug("Calendar request out of range (year={}, month={}), showing {}", year, month, current);
                return current;
            }
            return YearMonth.of(y, m);
        } catch (NumberFormatException ex) {
            log.debug("Unparseable calendar request (year={}, month={}), showing {}", year, month, current);
            return current;
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneId.of(props.getHomeTimezone())));
    }

    private static CalendarMonth.Day toDay(LiturgicalDay day, LocalDate today, YearMonth shown) {
        return new CalendarMonth.Day(
                day.date().getDayOfMonth(),
                day.date(),
                day.displayName(),
                day.fullName(),
                day.color().cssName(),
                day.color().displayName(),
                day.season(),
                day.date().equals(today),
                YearMonth.from(day.date()).equals(shown));
    }
}
