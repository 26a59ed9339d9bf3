package at.sv.lightsout.adaptive;

import at.sv.lightsout.InvalidPropertyValue;

import java.util.List;

/**
 * @param targetLux     the illuminance to reach, in lux
 * @param minBrightness lower brightness bound [1-254]
 * @param maxBrightness upper brightness bound [1-254]
 * @param maxStep       the maximum brightness change per iteration
 */
public record AdaptiveSettings(String sensorId, List<String> lightIds, double targetLux, int minBrightness,
                               int maxBrightness, int maxStep) {

    public static final int DEFAULT_MIN_BRIGHTNESS = 1;
    public static final int DEFAULT_MAX_BRIGHTNESS = 254;
    public static final int DEFAULT_MAX_STEP = 25;

    public AdaptiveSettings {
        lightIds = List.copyOf(lightIds);
        if (sensorId == null || sensorId.isBlank()) {
            throw new InvalidPropertyValue("Missing sensor id");
        }
        if (lightIds.isEmpty()) {
            throw new InvalidPropertyValue("At least one light is required for sensor '" + sensorId + "'");
        }
        if (targetLux < 0) {
            throw new InvalidPropertyValue("Invalid target lux '" + targetLux + "'. Must not be negative.");
        }
        if (minBrightness < 1 || maxBrightness > 254 || minBrightness > maxBrightness) {
            throw new InvalidPropertyValue("Invalid brightness range [" + minBrightness + ", " + maxBrightness +
                                           "]. Expected 1 <= min <= max <= 254.");
        }
        if (maxStep < 1) {
            throw new InvalidPropertyValue("Invalid step '" + maxStep + "'. Must be positive.");
        }
    }

    public static AdaptiveSettings withDefaults(String sensorId, List<String> lightIds, double targetLux) {
        return new AdaptiveSettings(sensorId, lightIds, targetLux, DEFAULT_MIN_BRIGHTNESS, DEFAULT_MAX_BRIGHTNESS,
                DEFAULT_MAX_STEP);
    }
}
