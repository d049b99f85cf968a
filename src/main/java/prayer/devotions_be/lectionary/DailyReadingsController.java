package prayer.devotions_be.lectionary;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/daily-readings")
@Tag(name = "Daily readings", description = "Lectionary references for the daily offices")
public class DailyReadingsController {

    private final DailyReadingsService service;

    public DailyReadingsController(DailyReadingsService service) {
        this.service = service;
    }

    @GetMapping
    @Operation(summary = "Readings of a day",
            description = "Returns the liturgical key, Old and New Testament references and the psalm of the day. "
                    + "Days missing from the lectionary are reported with found=false.")
    public DailyReadings readings(
            @Parameter(description = "Date (yyyy-MM-dd); defaults to today")
            @RequestParam(value = "date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return date == null ? service.today() : service.readingsFor(date);
    }
}
