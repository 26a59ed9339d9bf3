package at.sv.lightsout;

import at.sv.lightsout.api.LightState;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns consecutive light snapshots into {@link LightEvent}s. The reference snapshot of a light is only replaced once
 * a meaningful change has been detected, so slow drifts below the thresholds eventually produce an event as well.
 */
@Slf4j
public final class LightChangeDetector {

    static final int BRIGHTNESS_THRESHOLD = 5;
    static final int HUE_THRESHOLD = 1000;
    static final int COLOR_TEMPERATURE_THRESHOLD = 10;

    private final Map<String, LightState> previousStates;

    public LightChangeDetector() {
        previousStates = new ConcurrentHashMap<>();
    }

    /**
     * @return the events detected since the previous call, empty for lights seen for the first time
     */
    public List<LightEvent> detectChanges(Map<String, LightState> currentStates, ZonedDateTime now) {
        List<LightEvent> events = new ArrayList<>();
        currentStates.forEach((lightId, current) -> {
            LightState previous = previousStates.putIfAbsent(lightId, current);
            if (previous == null) {
                return;
            }
            List<LightEvent> lightEvents = compare(lightId, previous, current, now);
            if (!lightEvents.isEmpty()) {
                previousStates.put(lightId, current);
                events.addAll(lightEvents);
            }
        });
        return events;
    }

    private List<LightEvent> compare(String lightId, LightState previous, LightState current, ZonedDateTime now) {
        List<LightEvent> events = new ArrayList<>();
        if (previous.isOn() != current.isOn()) {
            EventType type = current.isOn() ? EventType.ON : EventType.OFF;
            events.add(createEvent(lightId, current, type, String.valueOf(previous.isOn()),
                    String.valueOf(current.isOn()), now));
            log.info("{}: turned {}", current.getDisplayName(), type);
        }
        if (current.isOff()) {
            return events;
        }
        int previousBrightness = Objects.requireNonNullElse(previous.getBrightness(), 0);
        int currentBrightness = Objects.requireNonNullElse(current.getBrightness(), 0);
        if (Math.abs(previousBrightness - currentBrightness) > BRIGHTNESS_THRESHOLD) {
            String oldValue = FormatUtil.formatBrightnessPercent(previousBrightness);
            String newValue = FormatUtil.formatBrightnessPercent(currentBrightness);
            events.add(createEvent(lightId, current, EventType.BRIGHTNESS, oldValue, newValue, now));
            log.info("{}: brightness {}% -> {}%", current.getDisplayName(), oldValue, newValue);
        }
        if (exceedsThreshold(previous.getHue(), current.getHue(), HUE_THRESHOLD)) {
            events.add(createEvent(lightId, current, EventType.HUE, String.valueOf(previous.getHue()),
                    String.valueOf(current.getHue()), now));
            log.info("{}: color changed", current.getDisplayName());
        }
        if (exceedsThreshold(previous.getColorTemperature(), current.getColorTemperature(),
                COLOR_TEMPERATURE_THRESHOLD)) {
            events.add(createEvent(lightId, current, EventType.COLOR_TEMP,
                    String.valueOf(previous.getColorTemperature()), String.valueOf(current.getColorTemperature()), now));
            log.info("{}: color temperature changed", current.getDisplayName());
        }
        return events;
    }

    private static boolean exceedsThreshold(Integer previous, Integer current, int threshold) {
        return previous != null && current != null && Math.abs(previous - current) > threshold;
    }

    private static LightEvent createEvent(String lightId, LightState state, EventType type, String oldValue,
                                          String newValue, ZonedDateTime now) {
        return LightEvent.builder()
                         .lightId(lightId)
                         .lightName(state.getName())
                         .timestamp(now)
                         .eventType(type)
                         .oldValue(oldValue)
                         .newValue(newValue)
                         .build();
    }
}
