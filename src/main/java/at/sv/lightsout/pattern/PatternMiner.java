package at.sv.lightsout.pattern;

import at.sv.lightsout.EventType;
import at.sv.lightsout.LightEvent;
import at.sv.lightsout.pattern.PatternAction.CorrelationAction;
import at.sv.lightsout.pattern.PatternAction.SequenceAction;
import at.sv.lightsout.pattern.PatternAction.TimeBasedAction;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mines time based, sequence and correlation patterns from a window of light events.
 */
@Slf4j
public final class PatternMiner {

    static final double CORRELATION_WINDOW_SECONDS = 5.0;
    static final int CORRELATION_LOOKAHEAD_EVENTS = 4;

    private final int minOccurrences;
    private final int timeWindowMinutes;
    private final double confidenceThreshold;

    /**
     * @param minOccurrences      minimum number of observations for a pattern
     * @param timeWindowMinutes   maximum delay between the two events of a sequence
     * @param confidenceThreshold minimum confidence of a reported pattern
     */
    public PatternMiner(int minOccurrences, int timeWindowMinutes, double confidenceThreshold) {
        this.minOccurrences = minOccurrences;
        this.timeWindowMinutes = timeWindowMinutes;
        this.confidenceThreshold = confidenceThreshold;
    }

    /**
     * @param events the events to analyze, in any order
     * @return the mined patterns with a confidence of at least the configured threshold, not yet stored
     */
    public List<Pattern> analyze(List<LightEvent> events) {
        if (events.isEmpty()) {
            log.warn("No events found to analyze");
            return List.of();
        }
        List<LightEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(LightEvent::timestamp));
        Map<String, String> lightNames = getLatestLightNames(sorted);

        List<Pattern> candidates = new ArrayList<>();
        candidates.addAll(detectTimeBasedPatterns(sorted, lightNames));
        candidates.addAll(detectSequencePatterns(sorted, lightNames));
        candidates.addAll(detectCorrelationPatterns(sorted, lightNames));

        List<Pattern> patterns = candidates.stream()
                                           .filter(pattern -> pattern.getConfidence() >= confidenceThreshold)
                                           .toList();
        log.info("Detected {} patterns in {} events ({} candidates)", patterns.size(), events.size(),
                candidates.size());
        return patterns;
    }

    private static Map<String, String> getLatestLightNames(List<LightEvent> sorted) {
        Map<String, String> names = new HashMap<>();
        sorted.forEach(event -> {
            if (event.lightName() != null) {
                names.put(event.lightId(), event.lightName());
            }
        });
        return names;
    }

    private List<Pattern> detectTimeBasedPatterns(List<LightEvent> sorted, Map<String, String> lightNames) {
        Map<TimeSlot, List<LightEvent>> groups = new LinkedHashMap<>();
        sorted.forEach(event -> groups.computeIfAbsent(TimeSlot.of(event), key -> new ArrayList<>()).add(event));
        long distinctDays = sorted.stream().map(event -> event.timestamp().toLocalDate()).distinct().count();
        double expectedOccurrences = Math.max(1.0, distinctDays / 7.0);

        List<Pattern> patterns = new ArrayList<>();
        groups.forEach((slot, group) -> {
            int occurrences = group.size();
            if (occurrences < minOccurrences) {
                return;
            }
            String time = String.format(Locale.ROOT, "%02d:00", slot.hour());
            patterns.add(Pattern.builder()
                                .type(PatternType.TIME_BASED)
                                .description(getName(lightNames, slot.lightId()) + " " +
                                             describe(slot.eventType(), false) + " at " + time + " on " +
                                             slot.weekday().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + "s")
                                .lightIds(List.of(slot.lightId()))
                                .weekdays(EnumSet.of(slot.weekday()))
                                .timeStart(time)
                                .timeEnd(String.format(Locale.ROOT, "%02d:59", slot.hour()))
                                .action(new TimeBasedAction(slot.lightId(), slot.eventType()))
                                .confidence(Math.min(1.0, occurrences / expectedOccurrences))
                                .occurrenceCount(occurrences)
                                .lastSeen(getLast(group).timestamp())
                                .build());
        });
        return patterns;
    }

    private List<Pattern> detectSequencePatterns(List<LightEvent> sorted, Map<String, String> lightNames) {
        Map<SequenceKey, List<Double>> delays = new LinkedHashMap<>();
        Map<SequenceKey, ZonedDateTime> lastSeen = new HashMap<>();
        double maxDelaySeconds = timeWindowMinutes * 60.0;
        for (int i = 0; i < sorted.size() - 1; i++) {
            LightEvent current = sorted.get(i);
            LightEvent next = sorted.get(i + 1);
            double delaySeconds = secondsBetween(current, next);
            if (delaySeconds <= 0 || delaySeconds > maxDelaySeconds || current.lightId().equals(next.lightId())) {
                continue;
            }
            SequenceKey key = new SequenceKey(new LightEventKey(current.lightId(), current.eventType()),
                    new LightEventKey(next.lightId(), next.eventType()));
            delays.computeIfAbsent(key, k -> new ArrayList<>()).add(delaySeconds);
            lastSeen.put(key, next.timestamp());
        }

        List<Pattern> patterns = new ArrayList<>();
        delays.forEach((key, observedDelays) -> {
            int count = observedDelays.size();
            if (count < minOccurrences) {
                return;
            }
            int averageDelay = (int) (observedDelays.stream().mapToDouble(Double::doubleValue).sum() / count);
            LightEventKey trigger = key.trigger();
            LightEventKey response = key.response();
            patterns.add(Pattern.builder()
                                .type(PatternType.SEQUENCE)
                                .description("When " + getName(lightNames, trigger.lightId()) + " " +
                                             describe(trigger.eventType(), false) + ", " +
                                             getName(lightNames, response.lightId()) + " " +
                                             describe(response.eventType(), false) + " within " + averageDelay + "s")
                                .lightIds(List.of(trigger.lightId(), response.lightId()))
                                .action(new SequenceAction(trigger, response, averageDelay))
                                .confidence(Math.min(1.0, count / (2.0 * minOccurrences)))
                                .occurrenceCount(count)
                                .lastSeen(lastSeen.get(key))
                                .build());
        });
        return patterns;
    }

    private List<Pattern> detectCorrelationPatterns(List<LightEvent> sorted, Map<String, String> lightNames) {
        Map<CorrelationKey, Integer> counts = new LinkedHashMap<>();
        Map<CorrelationKey, ZonedDateTime> lastSeen = new HashMap<>();
        for (int i = 0; i < sorted.size() - 1; i++) {
            LightEvent current = sorted.get(i);
            int end = Math.min(i + 1 + CORRELATION_LOOKAHEAD_EVENTS, sorted.size());
            for (int j = i + 1; j < end; j++) {
                LightEvent next = sorted.get(j);
                if (secondsBetween(current, next) > CORRELATION_WINDOW_SECONDS) {
                    break;
                }
                if (current.lightId().equals(next.lightId()) || current.eventType() != next.eventType()) {
                    continue;
                }
                CorrelationKey key = CorrelationKey.of(current.lightId(), next.lightId(), current.eventType());
                counts.merge(key, 1, Integer::sum);
                lastSeen.put(key, next.timestamp());
            }
        }

        List<Pattern> patterns = new ArrayList<>();
        counts.forEach((key, count) -> {
            if (count < minOccurrences) {
                return;
            }
            patterns.add(Pattern.builder()
                                .type(PatternType.CORRELATION)
                                .description(getName(lightNames, key.firstLight()) + " and " +
                                             getName(lightNames, key.secondLight()) + " often " +
                                             describe(key.eventType(), true) + " together")
                                .lightIds(List.of(key.firstLight(), key.secondLight()))
                                .action(new CorrelationAction(key.eventType(),
                                        List.of(key.firstLight(), key.secondLight())))
                                .confidence(Math.min(1.0, count / (3.0 * minOccurrences)))
                                .occurrenceCount(count)
                                .lastSeen(lastSeen.get(key))
                                .build());
        });
        return patterns;
    }

    private static double secondsBetween(LightEvent first, LightEvent second) {
        return Duration.between(first.timestamp(), second.timestamp()).toMillis() / 1000.0;
    }

    private static LightEvent getLast(List<LightEvent> events) {
        return events.get(events.size() - 1);
    }

    private static String getName(Map<String, String> lightNames, String lightId) {
        return lightNames.getOrDefault(lightId, "Light " + lightId);
    }

    private static String describe(EventType eventType, boolean plural) {
        String verb = switch (eventType) {
            case ON -> "turn on";
            case OFF -> "turn off";
            case BRIGHTNESS -> "change brightness";
            case HUE -> "change color";
            case COLOR_TEMP -> "change color temperature";
        };
        if (plural) {
            return verb;
        }
        int space = verb.indexOf(' ');
        return verb.substring(0, space) + "s" + verb.substring(space);
    }

    private record TimeSlot(String lightId, DayOfWeek weekday, int hour, EventType eventType) {
        static TimeSlot of(LightEvent event) {
            return new TimeSlot(event.lightId(), event.weekday(), event.hour(), event.eventType());
        }
    }

    private record SequenceKey(LightEventKey trigger, LightEventKey response) {
    }

    /**
     * Unordered light pair, normalized to ascending id order.
     */
    private record CorrelationKey(String firstLight, String secondLight, EventType eventType) {
        static CorrelationKey of(String lightA, String lightB, EventType eventType) {
            if (lightA.compareTo(lightB) <= 0) {
                return new CorrelationKey(lightA, lightB, eventType);
            }
            return new CorrelationKey(lightB, lightA, eventType);
        }
    }
}
