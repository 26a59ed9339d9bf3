package at.sv.lightsout.pattern;

import java.time.ZonedDateTime;

public record Prediction(long patternId, PatternType patternType, String description, PatternAction action,
                         double confidence, ZonedDateTime triggerTime) {
}
