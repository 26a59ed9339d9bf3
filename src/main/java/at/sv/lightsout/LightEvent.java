package at.sv.lightsout;

import lombok.Builder;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;

/**
 * A detected state transition of a single light. Old and new values are kept as display strings.
 */
@Builder
public record LightEvent(String lightId, String lightName, ZonedDateTime timestamp, EventType eventType,
                         String oldValue, String newValue) {

    public DayOfWeek weekday() {
        return timestamp.getDayOfWeek();
    }

    public int hour() {
        return timestamp.getHour();
    }

    public int minute() {
        return timestamp.getMinute();
    }

    @Override
    public String toString() {
        return "LightEvent{" +
               "light=" + lightId +
               (lightName != null ? " (" + lightName + ")" : "") +
               ", " + eventType +
               ", " + oldValue + " -> " + newValue +
               ", at=" + timestamp +
               '}';
    }
}
