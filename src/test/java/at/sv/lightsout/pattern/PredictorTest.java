package at.sv.lightsout.pattern;

import at.sv.lightsout.EventType;
import at.sv.lightsout.pattern.PatternAction.CorrelationAction;
import at.sv.lightsout.pattern.PatternAction.SequenceAction;
import at.sv.lightsout.pattern.PatternAction.TimeBasedAction;
import at.sv.lightsout.store.EventStore;
import at.sv.lightsout.store.InMemoryEventStore;
import at.sv.lightsout.store.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PredictorTest {

    private InMemoryEventStore store;
    private Predictor predictor;
    private ZonedDateTime now;
    private long nanos;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        predictor = createPredictor(store);
        // a Monday
        now = ZonedDateTime.of(2024, 6, 3, 6, 57, 0, 0, ZoneId.of("Europe/Stockholm"));
    }

    private Predictor createPredictor(EventStore eventStore) {
        return new Predictor(eventStore, 0.7, 5, 3, () -> nanos, Duration.ofSeconds(30));
    }

    private void advanceCacheTime(Duration duration) {
        nanos += duration.toNanos();
    }

    private static Pattern.PatternBuilder timeBased(String lightId, String timeStart, double confidence) {
        return Pattern.builder()
                      .type(PatternType.TIME_BASED)
                      .description("Light " + lightId + " turns on at " + timeStart + " on Mondays")
                      .lightIds(List.of(lightId))
                      .weekdays(EnumSet.of(DayOfWeek.MONDAY))
                      .timeStart(timeStart)
                      .action(new TimeBasedAction(lightId, EventType.ON))
                      .confidence(confidence)
                      .occurrenceCount(4);
    }

    private static Pattern.PatternBuilder sequence(String trigger, String response, double confidence) {
        return Pattern.builder()
                      .type(PatternType.SEQUENCE)
                      .description("When " + trigger + " turns on, " + response + " turns on within 30s")
                      .lightIds(List.of(trigger, response))
                      .action(new SequenceAction(new LightEventKey(trigger, EventType.ON),
                              new LightEventKey(response, EventType.ON), 30))
                      .confidence(confidence)
                      .occurrenceCount(6);
    }

    private Pattern save(Pattern.PatternBuilder builder) {
        return store.savePattern(builder.build());
    }

    @Test
    void getPredictions_startWithinLookahead_returned() {
        Pattern pattern = save(timeBased("1", "07:00", 0.9));

        List<Prediction> predictions = predictor.getPredictions(now);

        assertThat(predictions).containsExactly(new Prediction(pattern.getId(), PatternType.TIME_BASED,
                pattern.getDescription(), pattern.getAction(), 0.9, now));
    }

    @Test
    void getPredictions_startThirtyMinutesAhead_notReturned() {
        save(timeBased("1", "07:27", 0.9));

        assertThat(predictor.getPredictions(now)).isEmpty();
    }

    @Test
    void getPredictions_startExactlyNowOrAtEndOfLookahead_returned() {
        save(timeBased("1", "06:57", 0.9));
        save(timeBased("2", "07:02", 0.9));

        assertThat(predictor.getPredictions(now)).hasSize(2);
    }

    @Test
    void getPredictions_startAlreadyPassed_notReturned() {
        save(timeBased("1", "06:56", 0.9));

        assertThat(predictor.getPredictions(now)).isEmpty();
    }

    @Test
    void getPredictions_startAfterMidnight_notPredictedBeforeMidnight() {
        save(timeBased("1", "00:02", 0.9).weekdays(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY)));

        assertThat(predictor.getPredictions(now.with(LocalTime.of(23, 58)))).isEmpty();
        assertThat(predictor.getPredictions(now.plusDays(1).with(LocalTime.MIDNIGHT))).hasSize(1);
    }

    @Test
    void getPredictions_otherWeekday_notReturned() {
        save(timeBased("1", "07:00", 0.9).weekdays(EnumSet.of(DayOfWeek.TUESDAY)));

        assertThat(predictor.getPredictions(now)).isEmpty();
    }

    @Test
    void getPredictions_malformedTime_timeCheckSkipped() {
        save(timeBased("1", "7 o'clock", 0.9));

        assertThat(predictor.getPredictions(now)).hasSize(1);
    }

    @Test
    void getPredictions_singleDigitHour_parsed() {
        save(timeBased("1", "7:00", 0.9));

        assertThat(predictor.getPredictions(now)).hasSize(1);
        assertThat(predictor.getPredictions(now.with(LocalTime.of(6, 30)))).isEmpty();
    }

    @Test
    void getPredictions_withoutTime_alwaysReturned() {
        save(sequence("1", "2", 0.9));

        assertThat(predictor.getPredictions(now)).hasSize(1);
        assertThat(predictor.getPredictions(now.plusDays(3).withHour(22))).hasSize(1);
    }

    @Test
    void getPredictions_belowMinConfidence_orTooFewOccurrences_notReturned() {
        save(timeBased("1", "07:00", 0.69));
        save(timeBased("2", "07:00", 0.9).occurrenceCount(2));

        assertThat(predictor.getPredictions(now)).isEmpty();
    }

    @Test
    void getPredictions_inactivePattern_notReturned() {
        Pattern pattern = save(timeBased("1", "07:00", 0.9));
        store.updatePattern(pattern.getId(), p -> p.toBuilder().active(false).build());

        assertThat(predictor.getPredictions(now)).isEmpty();
    }

    @Test
    void getRecommendations_onlyHighConfidence_withMessage() {
        save(timeBased("1", "07:00", 0.75));
        Pattern confident = save(timeBased("2", "07:00", 0.8));

        List<Recommendation> recommendations = predictor.getRecommendations(now);

        assertThat(recommendations).containsExactly(new Recommendation(confident.getId(),
                "Based on your habits: Light 2 turns on at 07:00 on Mondays", 0.8, confident.getAction()));
    }

    @Test
    void shouldTriggerSequence_matchingTrigger_returnsResponse() {
        Pattern pattern = save(sequence("1", "2", 0.8));
        save(sequence("3", "4", 0.8));
        save(Pattern.builder()
                    .type(PatternType.CORRELATION)
                    .description("Light 1 and Light 5 often turn on together")
                    .lightIds(List.of("1", "5"))
                    .action(new CorrelationAction(EventType.ON, List.of("1", "5")))
                    .confidence(1.0)
                    .occurrenceCount(9));

        List<ReactiveAction> actions = predictor.shouldTriggerSequence("1", EventType.ON);

        assertThat(actions).containsExactly(new ReactiveAction(pattern.getId(), "2", EventType.ON, 30, 0.8));
        assertThat(predictor.shouldTriggerSequence("1", EventType.OFF)).isEmpty();
    }

    @Test
    void shouldTriggerSequence_belowMinConfidence_empty() {
        save(sequence("1", "2", 0.5));

        assertThat(predictor.shouldTriggerSequence("1", EventType.ON)).isEmpty();
    }

    @Test
    void feedback_negative_belowDeactivationThreshold_deactivated() {
        Pattern pattern = save(timeBased("1", "07:00", 0.32));

        assertThat(predictor.updatePatternFromFeedback(pattern.getId(), false)).isTrue();

        Pattern updated = store.findPattern(pattern.getId()).orElseThrow();
        assertThat(updated.getConfidence()).isCloseTo(0.22, within(1e-9));
        assertThat(updated.isActive()).isFalse();
    }

    @Test
    void feedback_negative_floorAtZero() {
        Pattern updated = Predictor.applyFeedback(timeBased("1", "07:00", 0.05).build(), false);

        assertThat(updated.getConfidence()).isEqualTo(0.0);
        assertThat(updated.isActive()).isFalse();
    }

    @Test
    void feedback_positive_raisesConfidence_cappedAtOne() {
        Pattern pattern = save(timeBased("1", "07:00", 0.9));

        predictor.updatePatternFromFeedback(pattern.getId(), true);
        assertThat(store.findPattern(pattern.getId()).orElseThrow().getConfidence()).isCloseTo(0.95, within(1e-9));

        predictor.updatePatternFromFeedback(pattern.getId(), true);
        predictor.updatePatternFromFeedback(pattern.getId(), true);
        Pattern updated = store.findPattern(pattern.getId()).orElseThrow();
        assertThat(updated.getConfidence()).isEqualTo(1.0);
        assertThat(updated.isActive()).isTrue();
    }

    @Test
    void feedback_positive_doesNotReactivate() {
        Pattern inactive = timeBased("1", "07:00", 0.29).active(false).build();

        assertThat(Predictor.applyFeedback(inactive, true).isActive()).isFalse();
    }

    @Test
    void feedback_unknownPattern_false() {
        assertThat(predictor.updatePatternFromFeedback(42, true)).isFalse();
    }

    @Test
    void feedback_invalidatesCache() {
        Pattern pattern = save(timeBased("1", "07:00", 0.72));
        assertThat(predictor.getPredictions(now)).hasSize(1);

        predictor.updatePatternFromFeedback(pattern.getId(), false);

        assertThat(predictor.getPredictions(now)).isEmpty();
    }

    @Test
    void activePatterns_cached_untilExpired() {
        assertThat(predictor.getPredictions(now)).isEmpty();
        save(timeBased("1", "07:00", 0.9));

        assertThat(predictor.getPredictions(now)).isEmpty();

        advanceCacheTime(Duration.ofSeconds(31));

        assertThat(predictor.getPredictions(now)).hasSize(1);
    }

    @Test
    void storeUnavailable_usesLastKnownPatterns() {
        EventStore storeMock = mock(EventStore.class);
        Pattern pattern = timeBased("1", "07:00", 0.9).id(1L).build();
        when(storeMock.loadActivePatterns()).thenReturn(List.of(pattern))
                                            .thenThrow(new StoreUnavailableException("Disk full"));
        predictor = createPredictor(storeMock);

        assertThat(predictor.getPredictions(now)).hasSize(1);
        advanceCacheTime(Duration.ofMinutes(1));

        assertThat(predictor.getPredictions(now)).hasSize(1);
        verify(storeMock, times(2)).loadActivePatterns();
    }

    @Test
    void storeUnavailable_noPatternsLoadedYet_empty() {
        EventStore storeMock = mock(EventStore.class);
        when(storeMock.loadActivePatterns()).thenThrow(new StoreUnavailableException("Disk full"));
        predictor = createPredictor(storeMock);

        assertThat(predictor.getPredictions(now)).isEmpty();
        assertThat(predictor.shouldTriggerSequence("1", EventType.ON)).isEmpty();
    }

    @Test
    void invalidateCache_duringLoad_loadedPatternsNotCached() throws InterruptedException {
        EventStore storeMock = mock(EventStore.class);
        Pattern pattern = timeBased("1", "07:00", 0.9).id(1L).build();
        AtomicInteger loads = new AtomicInteger();
        Thread[] invalidation = new Thread[1];
        when(storeMock.loadActivePatterns()).thenAnswer(invocation -> {
            if (loads.incrementAndGet() == 1) {
                invalidation[0] = new Thread(predictor::invalidateCache);
                invalidation[0].start();
                invalidation[0].join(500);
            }
            return List.of(pattern);
        });
        predictor = createPredictor(storeMock);

        assertThat(predictor.getPredictions(now)).hasSize(1);
        invalidation[0].join(5000);
        assertThat(predictor.getPredictions(now)).hasSize(1);

        verify(storeMock, times(2)).loadActivePatterns();
        assertThat(predictor.getPredictions(now)).hasSize(1);
        verify(storeMock, times(2)).loadActivePatterns();
    }
}
