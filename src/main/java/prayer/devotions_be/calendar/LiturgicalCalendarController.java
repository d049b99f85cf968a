package prayer.devotions_be.calendar;

import prayer.devotions_be.liturgy.LiturgicalDay;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api")
@Tag(name = "Liturgical calendar", description = "Church year days, colours and seasons")
public class LiturgicalCalendarController {

    private final LiturgicalCalendarService service;

    public LiturgicalCalendarController(LiturgicalCalendarService service) {
        this.service = service;
    }

    /**
     * Year and month are taken as raw strings so that malformed values fall back to the current month
     * instead of failing the request.
     */
    @GetMapping("/liturgical-calendar")
    @Operation(summary = "Calendar month", description = "Returns the Sunday-first month grid with names, colours and seasons.")
    public CalendarMonth month(
            @Parameter(description = "Year; defaults to the current year")
            @RequestParam(value = "year", required = false) String year,
            @Parameter(description = "Month 1-12; defaults to the current month")
            @RequestParam(value = "month", required = false) String month) {
        return service.month(year, month);
    }

    @GetMapping("/liturgical-days/{date}")
    @Operation(summary = "Single day", description = "Resolves the liturgical key, observance name, colour and season of a date.")
    public LiturgicalDay day(@PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return service.day(date);
    }
}
