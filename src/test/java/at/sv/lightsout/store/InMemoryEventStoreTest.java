package at.sv.lightsout.store;

import at.sv.lightsout.EventType;
import at.sv.lightsout.LightEvent;
import at.sv.lightsout.automation.Automation;
import at.sv.lightsout.automation.AutomationAction.SingleAction;
import at.sv.lightsout.automation.AutomationTarget;
import at.sv.lightsout.automation.AutomationTrigger.ManualTrigger;
import at.sv.lightsout.api.LightCommand;
import at.sv.lightsout.pattern.Pattern;
import at.sv.lightsout.pattern.PatternAction.TimeBasedAction;
import at.sv.lightsout.pattern.PatternType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InMemoryEventStoreTest {

    private InMemoryEventStore store;
    private ZonedDateTime now;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        now = ZonedDateTime.of(2024, 6, 3, 7, 0, 0, 0, ZoneId.of("Europe/Stockholm"));
    }

    private LightEvent event(String lightId, EventType type, ZonedDateTime timestamp) {
        return LightEvent.builder()
                         .lightId(lightId)
                         .timestamp(timestamp)
                         .eventType(type)
                         .oldValue("false")
                         .newValue("true")
                         .build();
    }

    private static Pattern.PatternBuilder pattern(String lightId, double confidence) {
        return Pattern.builder()
                      .type(PatternType.TIME_BASED)
                      .description("Light " + lightId + " turns on at 07:00 on Mondays")
                      .lightIds(List.of(lightId))
                      .weekdays(EnumSet.of(DayOfWeek.MONDAY))
                      .timeStart("07:00")
                      .timeEnd("07:59")
                      .action(new TimeBasedAction(lightId, EventType.ON))
                      .confidence(confidence)
                      .occurrenceCount(4);
    }

    @Test
    void queryEvents_newestFirst_filtersAndLimit() {
        store.appendEvent(event("1", EventType.ON, now));
        store.appendEvent(event("2", EventType.ON, now.plusMinutes(1)));
        store.appendEvent(event("1", EventType.OFF, now.plusMinutes(2)));
        store.appendEvent(event("1", EventType.ON, now.plusMinutes(3)));

        assertThat(store.queryEvents(null, null, now, now.plusMinutes(3), 10))
                .extracting(LightEvent::timestamp)
                .containsExactly(now.plusMinutes(3), now.plusMinutes(2), now.plusMinutes(1), now);
        assertThat(store.queryEvents("1", EventType.ON, now, now.plusHours(1), 10))
                .extracting(LightEvent::timestamp)
                .containsExactly(now.plusMinutes(3), now);
        assertThat(store.queryEvents(null, null, now, now.plusHours(1), 2)).hasSize(2);
        assertThat(store.queryEvents(null, null, now.plusMinutes(1), now.plusMinutes(2), 10)).hasSize(2);
    }

    @Test
    void appendEvent_sameTimestamp_bothKept() {
        store.appendEvent(event("1", EventType.OFF, now));
        store.appendEvent(event("2", EventType.OFF, now));

        assertThat(store.queryEvents(null, null, now, now, 10)).extracting(LightEvent::lightId)
                                                              .containsExactly("2", "1");
    }

    @Test
    void deleteEventsBefore_returnsCount_keepsCutoff() {
        store.appendEvent(event("1", EventType.ON, now.minusDays(100)));
        store.appendEvent(event("1", EventType.ON, now.minusDays(91)));
        store.appendEvent(event("1", EventType.ON, now.minusDays(90)));
        store.appendEvent(event("1", EventType.ON, now));

        int deleted = store.deleteEventsBefore(now.minusDays(90));

        assertThat(deleted).isEqualTo(2);
        assertThat(store.getStatistics().totalEvents()).isEqualTo(2);
        assertThat(store.getStatistics().oldestEvent()).isEqualTo(now.minusDays(90));
    }

    @Test
    void savePattern_assignsId() {
        Pattern saved = store.savePattern(pattern("1", 0.8).build());

        assertThat(saved.getId()).isEqualTo(1L);
        assertThat(store.findPattern(1)).contains(saved);
        assertThat(store.loadActivePatterns()).containsExactly(saved);
    }

    @Test
    void savePattern_sameBehavior_updatesStatistics_keepsIdAndActiveFlag() {
        Pattern first = store.savePattern(pattern("1", 0.8).build());
        store.updatePattern(first.getId(), pattern -> pattern.toBuilder().active(false).build());

        Pattern second = store.savePattern(pattern("1", 1.0).occurrenceCount(6).lastSeen(now).build());

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.isActive()).isFalse();
        assertThat(second.getOccurrenceCount()).isEqualTo(6);
        assertThat(second.getLastSeen()).isEqualTo(now);
        assertThat(second.getConfidence()).isEqualTo(0.8);
        assertThat(store.getStatistics().totalPatterns()).isEqualTo(1);
        assertThat(store.loadActivePatterns()).isEmpty();
    }

    @Test
    void savePattern_sameBehavior_keepsConfidenceFromFeedback() {
        Pattern mined = pattern("1", 1.0).build();
        Pattern saved = store.savePattern(mined);
        store.updatePattern(saved.getId(), pattern -> pattern.toBuilder().confidence(0.9).build());
        store.updatePattern(saved.getId(), pattern -> pattern.toBuilder().confidence(0.8).build());

        Pattern remined = store.savePattern(mined.toBuilder().occurrenceCount(5).build());

        assertThat(remined.getConfidence()).isEqualTo(0.8);
        assertThat(store.findPattern(saved.getId()).orElseThrow().getConfidence()).isEqualTo(0.8);
        assertThat(store.findPattern(saved.getId()).orElseThrow().getOccurrenceCount()).isEqualTo(5);
    }

    @Test
    void savePattern_differentBehavior_newId() {
        store.savePattern(pattern("1", 0.8).build());
        Pattern other = store.savePattern(pattern("2", 0.8).build());

        assertThat(other.getId()).isEqualTo(2L);
        assertThat(store.loadActivePatterns()).hasSize(2);
    }

    @Test
    void updatePattern_unknownId_empty() {
        assertThat(store.updatePattern(42, pattern -> pattern)).isEmpty();
    }

    @Test
    void updatePattern_concurrentUpdates_noneLost() throws InterruptedException {
        Pattern saved = store.savePattern(pattern("1", 0.0).build());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 100; i++) {
            executor.execute(() -> store.updatePattern(saved.getId(),
                    pattern -> pattern.toBuilder().confidence(pattern.getConfidence() + 0.01).build()));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(store.findPattern(saved.getId()).orElseThrow().getConfidence()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void savePattern_concurrentWithDeactivation_deactivationKept() throws Exception {
        Pattern mined = pattern("1", 1.0).build();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 500; i++) {
                store = new InMemoryEventStore();
                long id = store.savePattern(mined).getId();
                CyclicBarrier barrier = new CyclicBarrier(2);
                Future<?> remining = executor.submit(() -> {
                    barrier.await();
                    return store.savePattern(mined);
                });
                Future<?> deactivation = executor.submit(() -> {
                    barrier.await();
                    return store.updatePattern(id, pattern -> pattern.toBuilder().active(false).build());
                });
                remining.get(5, TimeUnit.SECONDS);
                deactivation.get(5, TimeUnit.SECONDS);

                assertThat(store.findPattern(id).orElseThrow().isActive()).as("run %d", i).isFalse();
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void automations_enabledOnly_recordTrigger_delete() {
        Automation enabled = automation(1, true);
        store.saveAutomation(automation(2, false));
        store.saveAutomation(enabled);

        assertThat(store.loadEnabledAutomations()).containsExactly(enabled);

        store.recordTrigger(1, now);
        store.recordTrigger(1, now.plusHours(1));

        Automation triggered = store.findAutomation(1).orElseThrow();
        assertThat(triggered.getTriggerCount()).isEqualTo(2);
        assertThat(triggered.getLastTriggered()).isEqualTo(now.plusHours(1));

        assertThat(store.deleteAutomation(1)).isTrue();
        assertThat(store.deleteAutomation(1)).isFalse();
        assertThat(store.getStatistics().automations()).isEqualTo(1);
    }

    @Test
    void getStatistics_empty() {
        StoreStatistics statistics = store.getStatistics();

        assertThat(statistics).isEqualTo(new StoreStatistics(0, 0, 0, 0, null, null));
    }

    private static Automation automation(long id, boolean enabled) {
        return Automation.builder()
                         .id(id)
                         .name("Automation " + id)
                         .trigger(new ManualTrigger())
                         .target(AutomationTarget.lights("1"))
                         .action(new SingleAction(LightCommand.turnOn()))
                         .enabled(enabled)
                         .build();
    }
}
