package at.sv.lightsout.adaptive;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * @param currentLux        null until the first successful reading
 * @param currentBrightness null until the first successful reading
 * @param lastError         null if the last iteration succeeded
 */
public record AdaptiveSessionStatus(String sensorId, List<String> lightIds, double targetLux, AdaptiveState state,
                                    Double currentLux, Integer currentBrightness, String lastError,
                                    ZonedDateTime lastUpdate, int adjustments) {
}
