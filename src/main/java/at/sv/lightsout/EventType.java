package at.sv.lightsout;

import java.util.Arrays;
import java.util.Locale;

public enum EventType {
    ON("on"),
    OFF("off"),
    BRIGHTNESS("brightness"),
    HUE("hue"),
    COLOR_TEMP("color_temp");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EventType fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ENGLISH);
        return Arrays.stream(values())
                     .filter(type -> type.value.equals(normalized))
                     .findFirst()
                     .orElseThrow(() -> new InvalidPropertyValue("Unknown event type '" + value + "'. Supported: " +
                                                                 "[on, off, brightness, hue, color_temp]"));
    }

    @Override
    public String toString() {
        return value;
    }
}
