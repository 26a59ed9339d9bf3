package at.sv.lightsout.pattern;

import at.sv.lightsout.EventType;

/**
 * The response a sequence pattern predicts for an observed trigger event.
 */
public record ReactiveAction(long patternId, String lightId, EventType eventType, int delaySeconds,
                             double confidence) {
}
