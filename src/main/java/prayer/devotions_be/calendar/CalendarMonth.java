package prayer.devotions_be.calendar;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * One month of the liturgical calendar page, as Sunday-first weeks.
 */
public record CalendarMonth(
        @JsonProperty("month_name") String monthName,
        @JsonProperty("year") int year,
        @JsonProperty("month") int month,
        @JsonProperty("prev_year") int prevYear,
        @JsonProperty("prev_month") int prevMonth,
        @JsonProperty("next_year") int nextYear,
        @JsonProperty("next_month") int nextMonth,
        @JsonProperty("weeks") List<List<Day>> weeks) {

    public CalendarMonth {
        weeks = weeks.stream().map(List::copyOf).toList();
    }

    public record Day(
            @JsonProperty("day") int day,
            @JsonProperty("date") LocalDate date,
            @JsonProperty("key") String displayName,
            @JsonProperty("full_name") String fullName,
            @JsonProperty("color") String color,
            @JsonProperty("color_name") String colorName,
            @JsonProperty("season") String season,
            @JsonProperty("is_today") boolean today,
            @JsonProperty("is_current_month") boolean currentMonth) {
    }
}
