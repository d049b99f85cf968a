package prayer.devotions_be.lectionary;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record DailyReadings(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("key") String key,
        @JsonProperty("ot_reading_ref") String otReference,
        @JsonProperty("nt_reading_ref") String ntReference,
        @JsonProperty("psalm_ref") String psalmReference,
        @JsonProperty("found") boolean found) {
}
