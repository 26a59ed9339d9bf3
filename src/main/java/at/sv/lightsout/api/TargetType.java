package at.sv.lightsout.api;

import java.util.Arrays;
import java.util.Locale;

/**
 * The kind of resource a command is sent to. Rooms are addressed as bridge groups.
 */
public enum TargetType {
    LIGHT("light"),
    ROOM("room");

    private final String value;

    TargetType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TargetType fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ENGLISH);
        if ("group".equals(normalized)) {
            return ROOM;
        }
        return Arrays.stream(values())
                     .filter(type -> type.value.equals(normalized))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException("Unknown target type '" + value + "'"));
    }
}
