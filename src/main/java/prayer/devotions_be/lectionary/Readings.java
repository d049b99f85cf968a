package prayer.devotions_be.lectionary;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Old and New Testament references for one lectionary day.
 */
public record Readings(@JsonProperty("OT") String ot, @JsonProperty("NT") String nt) {

    public static final String NOT_FOUND_TEXT = "Reading not found";

    public static final Readings NOT_FOUND = new Readings(NOT_FOUND_TEXT, NOT_FOUND_TEXT);

    public boolean isFound() {
        return !NOT_FOUND_TEXT.equals(ot);
    }
}
