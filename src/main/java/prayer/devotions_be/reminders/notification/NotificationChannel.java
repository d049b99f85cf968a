package prayer.devotions_be.reminders.notification;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum NotificationChannel {
    PUSH("push"),
    EMAIL("email"),
    SMS("sms");

    private final String code;

    NotificationChannel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Push links stay relative to the web app scope; other channels need an absolute URL. */
    public boolean usesRelativeLinks() {
        return this == PUSH;
    }

    public static Optional<NotificationChannel> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (NotificationChannel channel : values()) {
            if (channel.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
