package at.sv.lightsout.store;

import at.sv.lightsout.EventType;
import at.sv.lightsout.LightEvent;
import at.sv.lightsout.automation.Automation;
import at.sv.lightsout.pattern.Pattern;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Thread safe {@link EventStore} keeping everything in memory. Events are kept ordered by timestamp.
 */
@Slf4j
public final class InMemoryEventStore implements EventStore {

    private final ConcurrentSkipListMap<EventKey, LightEvent> events;
    private final Map<Long, Pattern> patterns;
    private final Map<Long, Automation> automations;
    private final AtomicLong eventSequence;
    private final AtomicLong patternSequence;

    public InMemoryEventStore() {
        events = new ConcurrentSkipListMap<>();
        patterns = new ConcurrentHashMap<>();
        automations = new ConcurrentHashMap<>();
        eventSequence = new AtomicLong();
        patternSequence = new AtomicLong();
    }

    @Override
    public void appendEvent(LightEvent event) {
        events.put(new EventKey(event.timestamp().toInstant().toEpochMilli(), eventSequence.incrementAndGet()), event);
    }

    @Override
    public List<LightEvent> queryEvents(String lightId, EventType eventType, ZonedDateTime start, ZonedDateTime end,
                                        int limit) {
        EventKey from = new EventKey(start.toInstant().toEpochMilli(), Long.MIN_VALUE);
        EventKey to = new EventKey(end.toInstant().toEpochMilli(), Long.MAX_VALUE);
        return events.subMap(from, true, to, true)
                     .descendingMap()
                     .values()
                     .stream()
                     .filter(event -> lightId == null || lightId.equals(event.lightId()))
                     .filter(event -> eventType == null || eventType == event.eventType())
                     .limit(limit)
                     .toList();
    }

    @Override
    public int deleteEventsBefore(ZonedDateTime cutoff) {
        Map<EventKey, LightEvent> expired = events.headMap(new EventKey(cutoff.toInstant().toEpochMilli(),
                Long.MIN_VALUE));
        int count = expired.size();
        expired.clear();
        return count;
    }

    @Override
    public synchronized Pattern savePattern(Pattern pattern) {
        Optional<Long> existingId = patterns.values()
                                            .stream()
                                            .filter(stored -> stored.isSameBehavior(pattern))
                                            .map(Pattern::getId)
                                            .findFirst();
        if (existingId.isPresent()) {
            Pattern updated = patterns.computeIfPresent(existingId.get(),
                    (id, stored) -> refreshStatistics(stored, pattern));
            if (updated != null) {
                log.debug("Updated pattern {}: {}", updated.getId(), updated.getDescription());
                return updated;
            }
        }
        Pattern created = pattern.toBuilder().id(patternSequence.incrementAndGet()).build();
        patterns.put(created.getId(), created);
        log.info("Saved pattern {}: {}", created.getId(), created.getDescription());
        return created;
    }

    /**
     * Confidence and active flag of a stored pattern are only changed by feedback.
     */
    private static Pattern refreshStatistics(Pattern stored, Pattern mined) {
        return stored.toBuilder()
                     .description(mined.getDescription())
                     .lightIds(mined.getLightIds())
                     .timeEnd(mined.getTimeEnd())
                     .occurrenceCount(mined.getOccurrenceCount())
                     .lastSeen(mined.getLastSeen())
                     .build();
    }

    @Override
    public List<Pattern> loadActivePatterns() {
        return patterns.values()
                       .stream()
                       .filter(Pattern::isActive)
                       .sorted(Comparator.comparing(Pattern::getId))
                       .toList();
    }

    @Override
    public Optional<Pattern> findPattern(long id) {
        return Optional.ofNullable(patterns.get(id));
    }

    @Override
    public Optional<Pattern> updatePattern(long id, UnaryOperator<Pattern> update) {
        return Optional.ofNullable(patterns.computeIfPresent(id, (key, pattern) -> update.apply(pattern)));
    }

    @Override
    public List<Automation> loadEnabledAutomations() {
        return automations.values()
                          .stream()
                          .filter(Automation::isEnabled)
                          .sorted(Comparator.comparingLong(Automation::getId))
                          .toList();
    }

    @Override
    public Optional<Automation> findAutomation(long id) {
        return Optional.ofNullable(automations.get(id));
    }

    @Override
    public void saveAutomation(Automation automation) {
        automations.put(automation.getId(), automation);
    }

    @Override
    public boolean deleteAutomation(long id) {
        return automations.remove(id) != null;
    }

    @Override
    public void recordTrigger(long automationId, ZonedDateTime when) {
        automations.computeIfPresent(automationId, (id, automation) -> automation.toBuilder()
                                                                                 .triggerCount(automation.getTriggerCount() + 1)
                                                                                 .lastTriggered(when)
                                                                                 .build());
    }

    @Override
    public StoreStatistics getStatistics() {
        List<Pattern> allPatterns = new ArrayList<>(patterns.values());
        Map.Entry<EventKey, LightEvent> oldest = events.firstEntry();
        Map.Entry<EventKey, LightEvent> newest = events.lastEntry();
        return new StoreStatistics(events.size(),
                allPatterns.size(),
                (int) allPatterns.stream().filter(Pattern::isActive).count(),
                automations.size(),
                oldest != null ? oldest.getValue().timestamp() : null,
                newest != null ? newest.getValue().timestamp() : null);
    }

    private record EventKey(long epochMillis, long sequence) implements Comparable<EventKey> {
        @Override
        public int compareTo(EventKey other) {
            int result = Long.compare(epochMillis, other.epochMillis);
            if (result != 0) {
                return result;
            }
            return Long.compare(sequence, other.sequence);
        }
    }
}
