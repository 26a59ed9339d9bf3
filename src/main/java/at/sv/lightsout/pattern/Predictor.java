package at.sv.lightsout.pattern;

import at.sv.lightsout.EventType;
import at.sv.lightsout.pattern.PatternAction.SequenceAction;
import at.sv.lightsout.store.EventStore;
import at.sv.lightsout.store.StoreUnavailableException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Matches the active patterns against the current time and incoming events, and adjusts pattern confidence based on
 * user feedback.
 * <p>
 * Active patterns are cached for a short time, as {@link #shouldTriggerSequence} is evaluated for every detected event.
 * If the store is unavailable, the last loaded patterns are used.
 */
@Slf4j
public final class Predictor {

    static final double RECOMMENDATION_CONFIDENCE = 0.8;
    static final double POSITIVE_FEEDBACK_STEP = 0.05;
    static final double NEGATIVE_FEEDBACK_STEP = 0.1;
    static final double DEACTIVATION_THRESHOLD = 0.3;

    private static final String ACTIVE_PATTERNS_KEY = "active";
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("H:mm");

    private final EventStore store;
    private final double minConfidence;
    private final int lookaheadMinutes;
    private final int minOccurrences;
    private final Cache<String, List<Pattern>> activePatterns;
    private final AtomicLong cacheGeneration;
    private volatile List<Pattern> lastKnownPatterns;

    public Predictor(EventStore store, double minConfidence, int lookaheadMinutes, int minOccurrences, Ticker ticker,
                     Duration cacheDuration) {
        this.store = store;
        this.minConfidence = minConfidence;
        this.lookaheadMinutes = lookaheadMinutes;
        this.minOccurrences = minOccurrences;
        activePatterns = Caffeine.newBuilder()
                                 .ticker(ticker)
                                 .expireAfterWrite(cacheDuration)
                                 .build();
        cacheGeneration = new AtomicLong();
        lastKnownPatterns = List.of();
    }

    public List<Prediction> getPredictions(ZonedDateTime now) {
        List<Prediction> predictions = new ArrayList<>();
        for (Pattern pattern : getSurfaceablePatterns()) {
            if (matches(pattern, now)) {
                predictions.add(new Prediction(pattern.getId(), pattern.getType(), pattern.getDescription(),
                        pattern.getAction(), pattern.getConfidence(), now));
            }
        }
        return predictions;
    }

    private boolean matches(Pattern pattern, ZonedDateTime now) {
        if (!pattern.appliesOn(now.getDayOfWeek())) {
            return false;
        }
        if (pattern.getTimeStart() == null) {
            return true;
        }
        Optional<LocalTime> start = parseTime(pattern);
        if (start.isEmpty()) {
            return true;
        }
        // resolved on the current date only, so the lookahead does not reach past midnight
        ZonedDateTime patternTime = now.with(start.get());
        long millisAhead = Duration.between(now, patternTime).toMillis();
        return millisAhead >= 0 && millisAhead <= Duration.ofMinutes(lookaheadMinutes).toMillis();
    }

    private static Optional<LocalTime> parseTime(Pattern pattern) {
        try {
            return Optional.of(LocalTime.parse(pattern.getTimeStart().trim(), TIME_FORMATTER));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring malformed start time '{}' of pattern {}", pattern.getTimeStart(), pattern.getId());
            return Optional.empty();
        }
    }

    /**
     * @return the subset of predictions with high confidence, worded for display
     */
    public List<Recommendation> getRecommendations(ZonedDateTime now) {
        return getPredictions(now).stream()
                                  .filter(prediction -> prediction.confidence() >= RECOMMENDATION_CONFIDENCE)
                                  .map(prediction -> new Recommendation(prediction.patternId(),
                                          "Based on your habits: " + prediction.description(),
                                          prediction.confidence(), prediction.action()))
                                  .toList();
    }

    public List<ReactiveAction> shouldTriggerSequence(String lightId, EventType eventType) {
        List<ReactiveAction> actions = new ArrayList<>();
        for (Pattern pattern : getSurfaceablePatterns()) {
            if (!(pattern.getAction() instanceof SequenceAction sequence)) {
                continue;
            }
            if (sequence.trigger().matches(lightId, eventType)) {
                actions.add(new ReactiveAction(pattern.getId(), sequence.response().lightId(),
                        sequence.response().eventType(), sequence.delaySeconds(), pattern.getConfidence()));
            }
        }
        return actions;
    }

    /**
     * Raises the confidence of the pattern by 0.05 on positive, or lowers it by 0.1 on negative feedback. Patterns
     * dropping below a confidence of 0.3 are deactivated.
     *
     * @return true, if the pattern exists
     * @throws StoreUnavailableException if the store could not be accessed
     */
    public boolean updatePatternFromFeedback(long patternId, boolean wasCorrect) {
        Optional<Pattern> updated = store.updatePattern(patternId, pattern -> applyFeedback(pattern, wasCorrect));
        invalidateCache();
        updated.ifPresentOrElse(
                pattern -> log.info("Feedback for pattern {} ({}): confidence now {}{}", patternId,
                        wasCorrect ? "correct" : "wrong", pattern.getConfidence(),
                        pattern.isActive() ? "" : ", deactivated"),
                () -> log.warn("Feedback for unknown pattern {}", patternId));
        return updated.isPresent();
    }

    static Pattern applyFeedback(Pattern pattern, boolean wasCorrect) {
        double confidence;
        if (wasCorrect) {
            confidence = Math.min(1.0, pattern.getConfidence() + POSITIVE_FEEDBACK_STEP);
        } else {
            confidence = Math.max(0.0, pattern.getConfidence() - NEGATIVE_FEEDBACK_STEP);
        }
        boolean active = pattern.isActive() && confidence >= DEACTIVATION_THRESHOLD;
        return pattern.toBuilder().confidence(confidence).active(active).build();
    }

    public void invalidateCache() {
        cacheGeneration.incrementAndGet();
        activePatterns.invalidateAll();
    }

    private List<Pattern> getSurfaceablePatterns() {
        return getActivePatterns().stream()
                                  .filter(pattern -> pattern.getConfidence() >= minConfidence)
                                  .filter(pattern -> pattern.getOccurrenceCount() >= minOccurrences)
                                  .toList();
    }

    private List<Pattern> getActivePatterns() {
        long generation = cacheGeneration.get();
        List<Pattern> patterns;
        try {
            patterns = activePatterns.get(ACTIVE_PATTERNS_KEY, key -> loadActivePatterns());
        } catch (StoreUnavailableException e) {
            log.warn("Failed to load active patterns, using {} last known: {}", lastKnownPatterns.size(),
                    e.getLocalizedMessage());
            return lastKnownPatterns;
        }
        if (cacheGeneration.get() != generation) {
            // invalidated while loading, the loaded list may predate the change
            activePatterns.invalidate(ACTIVE_PATTERNS_KEY);
        }
        return patterns;
    }

    private List<Pattern> loadActivePatterns() {
        List<Pattern> loaded = List.copyOf(store.loadActivePatterns());
        lastKnownPatterns = loaded;
        return loaded;
    }
}
