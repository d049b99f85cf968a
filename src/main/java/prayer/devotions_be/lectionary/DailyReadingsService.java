package prayer.devotions_be.lectionary;

import prayer.devotions_be.config.DevotionsProperties;
import prayer.devotions_be.liturgy.ChurchYearCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Lectionary readings and psalm of the day for the daily offices.
 */
@Service
public class DailyReadingsService {
    private static final Logger log = LoggerFactory.getLogger(DailyReadingsService.class);

    private static final int PSALM_COUNT = 150;

    private final ChurchYearCalendar calendar;
    private final LectionaryStore lectionary;
    private final DevotionsProperties props;
    private final Clock clock;

    public DailyReadingsService(ChurchYearCalendar calendar,
            LectionaryStore lectionary,
            DevotionsProperties props,
            Clock clock) {
        this.calendar = calendar;
        this.lectionary = lectionary;
        this.props = props;
        this.clock = clock;
    }

    public DailyReadings today() {
        return readingsFor(LocalDate.now(clock.withZone(ZoneId.of(props.getHomeTimezone()))));
    }

    public DailyReadings readingsFor(LocalDate date) {
        String key = calendar.keyFor(date);
        Readings readings = lectionary.lookup(key);
        if (!readings.isFound()) {
            log.warn("Lectionary has no entry for key '{}' ({})", key, date);
        }
        return new DailyReadings(date, key, readings.ot(), readings.nt(), psalmFor(date), readings.isFound());
    }

    /** Walks the psalter once every 150 days of the year. */
    static String psalmFor(LocalDate date) {
        int psalm = (date.getDayOfYear() - 1) % PSALM_COUNT + 1;
        return "Psalm " + psalm;
    }
}
