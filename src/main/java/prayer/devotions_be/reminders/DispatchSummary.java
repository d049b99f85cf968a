package prayer.devotions_be.reminders;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters of one dispatch run. {@code sent} and {@code failed} count channel sends,
 * the others count reminders.
 */
public record DispatchSummary(
        @JsonProperty("due") int due,
        @JsonProperty("sent") int sent,
        @JsonProperty("failed") int failed,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("rescheduled") int rescheduled) {

    public static final DispatchSummary EMPTY = new DispatchSummary(0, 0, 0, 0, 0);
}
