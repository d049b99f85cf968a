package prayer.devotions_be.liturgy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum LiturgicalColor {
    WHITE("White"),
    RED("Red"),
    VIOLET("Violet"),
    BLACK("Black"),
    ROSE("Rose"),
    GREEN("Green");

    private final String displayName;

    LiturgicalColor(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    /** Lower-case form used as a CSS class by the calendar page. */
    public String cssName() {
        return displayName.toLowerCase(Locale.ROOT);
    }

    public static Optional<LiturgicalColor> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (LiturgicalColor color : values()) {
            if (color.displayName.equalsIgnoreCase(name.trim())) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }
}
