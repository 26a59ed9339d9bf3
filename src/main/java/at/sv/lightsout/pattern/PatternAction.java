package at.sv.lightsout.pattern;

import at.sv.lightsout.EventType;

import java.util.List;

/**
 * The behavior a pattern describes, one variant per {@link PatternType}.
 */
public sealed interface PatternAction {

    PatternType type();

    record TimeBasedAction(String lightId, EventType eventType) implements PatternAction {
        @Override
        public PatternType type() {
            return PatternType.TIME_BASED;
        }
    }

    record SequenceAction(LightEventKey trigger, LightEventKey response, int delaySeconds) implements PatternAction {
        @Override
        public PatternType type() {
            return PatternType.SEQUENCE;
        }
    }

    /**
     * @param lights the two correlated lights, in ascending id order
     */
    record CorrelationAction(EventType eventType, List<String> lights) implements PatternAction {
        public CorrelationAction {
            lights = List.copyOf(lights);
        }

        @Override
        public PatternType type() {
            return PatternType.CORRELATION;
        }
    }
}
