package at.sv.lightsout.pattern;

/**
 * A prediction worded for display. Never executed automatically.
 */
public record Recommendation(long patternId, String message, double confidence, PatternAction action) {
}
