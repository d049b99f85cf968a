package prayer.devotions_be.reminders;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of a create-reminder request. Values are validated by {@link ReminderService}.
 */
public record ReminderRequest(
        @JsonProperty("time") String time,
        @JsonProperty("devotion") String devotion,
        @JsonProperty("methods") List<String> methods,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("reading_type") String readingType) {
}
