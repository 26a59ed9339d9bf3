package at.sv.lightsout.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Snapshot of a single light as reported by the gateway.
 */
@Data
@AllArgsConstructor
@Builder(toBuilder = true)
public final class LightState {
    private final String id;
    private final String name;
    private final boolean on;
    /**
     * [0-254]
     */
    private final Integer brightness;
    /**
     * [0-65535]
     */
    private final Integer hue;
    private final Integer saturation;
    /**
     * Mired [153-500]
     */
    private final Integer colorTemperature;
    @Builder.Default
    private final boolean reachable = true;

    public boolean isOff() {
        return !on;
    }

    public String getDisplayName() {
        if (name == null) {
            return "Light " + id;
        }
        return name;
    }
}
