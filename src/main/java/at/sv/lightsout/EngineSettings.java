package at.sv.lightsout;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

@Getter
@Builder(toBuilder = true)
public final class EngineSettings {
    @Builder.Default
    private final int minOccurrences = 3;
    @Builder.Default
    private final int timeWindowMinutes = 15;
    @Builder.Default
    private final double confidenceThreshold = 0.7;
    @Builder.Default
    private final double minConfidence = 0.7;
    @Builder.Default
    private final int lookaheadMinutes = 5;
    @Builder.Default
    private final int analysisWindowDays = 30;
    @Builder.Default
    private final int retentionDays = 90;
    @Builder.Default
    private final Duration pollInterval = Duration.ofSeconds(10);
    @Builder.Default
    private final Duration patternCacheDuration = Duration.ofSeconds(30);
    /**
     * If enabled, detected events trigger the responses of matching sequence patterns.
     */
    @Builder.Default
    private final boolean enableReactions = false;
    /**
     * Only log triggered reactions instead of sending them to the lights.
     */
    @Builder.Default
    private final boolean dryRun = true;
    @Builder.Default
    private final Duration adaptivePollInterval = Duration.ofSeconds(3);
    @Builder.Default
    private final Duration adaptiveErrorBackoff = Duration.ofSeconds(5);
}
