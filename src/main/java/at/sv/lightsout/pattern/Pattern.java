package at.sv.lightsout.pattern;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A mined, confidence scored recurring behavior. Only the feedback path changes the confidence of a stored pattern.
 */
@Data
@AllArgsConstructor
@Builder(toBuilder = true)
public final class Pattern {
    /**
     * Assigned by the store, null for patterns that have not been saved yet.
     */
    private final Long id;
    private final PatternType type;
    private final String description;
    private final List<String> lightIds;
    /**
     * Empty means every day.
     */
    @Builder.Default
    private final Set<DayOfWeek> weekdays = EnumSet.noneOf(DayOfWeek.class);
    /**
     * HH:mm, may be null.
     */
    private final String timeStart;
    private final String timeEnd;
    private final PatternAction action;
    /**
     * [0.0 - 1.0], kept at full precision.
     */
    private final double confidence;
    private final int occurrenceCount;
    private final ZonedDateTime lastSeen;
    @Builder.Default
    private final boolean active = true;

    public boolean appliesOn(DayOfWeek day) {
        return weekdays.isEmpty() || weekdays.contains(day);
    }

    /**
     * @return true, if both patterns describe the same behavior, ignoring the mined statistics
     */
    public boolean isSameBehavior(Pattern other) {
        return type == other.type &&
               action.equals(other.action) &&
               weekdays.equals(other.weekdays) &&
               Objects.equals(timeStart, other.timeStart);
    }
}
