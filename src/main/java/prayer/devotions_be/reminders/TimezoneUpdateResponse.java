package prayer.devotions_be.reminders;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of moving all of a user's reminders to another zone.
 */
public record TimezoneUpdateResponse(
        @JsonProperty("timezone") String timezone,
        @JsonProperty("updated") int updated,
        @JsonProperty("failed") int failed) {
}
