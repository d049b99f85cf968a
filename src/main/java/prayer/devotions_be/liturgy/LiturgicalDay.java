package prayer.devotions_be.liturgy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One resolved day of the church calendar.
 *
 * @param key         lectionary lookup key
 * @param displayName observance name(s), the key, or empty for suppressed ferias
 */
public record LiturgicalDay(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("key") String key,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("color") LiturgicalColor color,
        @JsonProperty("season") String season,
        @JsonProperty("week_of_church_year") int weekOfChurchYear) {

    /** Display name, or the key when the display name is suppressed. */
    @JsonProperty("full_name")
    public String fullName() {
        return displayName.isEmpty() ? key : displayName;
    }
}
