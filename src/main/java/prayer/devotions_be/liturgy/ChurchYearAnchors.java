package prayer.devotions_be.liturgy;

import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Easter-derived anchor dates of one calendar year.
 *
 * <p>Instances are pure arithmetic over {@link EasterCalculator} and never change, so callers may
 * cache them per year indefinitely (see {@link ChurchYearCalendar}).
 */
public record ChurchYearAnchors(
        int year,
        LocalDate easterDate,
        LocalDate ashWednesday,
        LocalDate pentecost,
        LocalDate holyTrinity,
        LocalDate septuagesima,
        LocalDate sexagesima,
        LocalDate quinquagesima) {

    public ChurchYearAnchors {
        Objects.requireNonNull(easterDate, "easterDate");
        Objects.requireNonNull(ashWednesday, "ashWednesday");
        Objects.requireNonNull(pentecost, "pentecost");
        Objects.requireNonNull(holyTrinity, "holyTrinity");
        Objects.requireNonNull(septuagesima, "septuagesima");
        Objects.requireNonNull(sexagesima, "sexagesima");
        Objects.requireNonNull(quinquagesima, "quinquagesima");
    }

    public static ChurchYearAnchors build(int year) {
        LocalDate easter = EasterCalculator.calculateEaster(year);
        LocalDate pentecost = easter.plusDays(49);
        return new ChurchYearAnchors(
                year,
                easter,
                easter.minusDays(46),
                pentecost,
                pentecost.plusDays(7),
                easter.minusDays(63),
                easter.minusDays(56),
                easter.minusDays(49));
    }

    /**
     * First Sunday of Advent: the Sunday between Nov 27 and Dec 3 inclusive.
     */
    public static LocalDate advent1(int year) {
        LocalDate dec3 = LocalDate.of(year, Month.DECEMBER, 3);
        // getValue(): Monday=1 .. Sunday=7, so this is (weekday + 1) mod 7 with Monday=0
        return dec3.minusDays(dec3.getDayOfWeek().getValue() % 7);
    }

    /**
     * Week number (1..53) inside the church year that began on the most recent Advent 1.
     */
    public int weekOfChurchYear(LocalDate date) {
        LocalDate adventThisYear = advent1(date.getYear());
        LocalDate start = date.isBefore(adventThisYear) ? advent1(date.getYear() - 1) : adventThisYear;
        return (int) (ChronoUnit.DAYS.between(start, date) / 7) + 1;
    }

    /**
     * Ash Wednesday through Easter Sunday, both inclusive.
     */
    public boolean isLent(LocalDate date) {
        return !date.isBefore(ashWednesday) && !date.isAfter(easterDate);
    }

    public boolean isInMovableSeason(LocalDate date) {
        return !date.isBefore(ashWednesday) && !date.isAfter(holyTrinity);
    }
}
