package prayer.devotions_be.reminders;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TimezoneUpdateRequest(@JsonProperty("timezone") String timezone) {
}
