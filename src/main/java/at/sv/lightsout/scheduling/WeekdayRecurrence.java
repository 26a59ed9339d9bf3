package at.sv.lightsout.scheduling;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Fires once per day on the given weekdays, at a time of day resolved separately for every date.
 */
public final class WeekdayRecurrence implements RecurrenceRule {

    private final EnumSet<DayOfWeek> days;
    private final Function<ZonedDateTime, ZonedDateTime> timeOfDayResolver;
    private final String description;

    /**
     * @param days              the days to fire on, empty means every day
     * @param timeOfDayResolver maps the start of a day to the fire time on that day
     */
    public WeekdayRecurrence(Set<DayOfWeek> days, Function<ZonedDateTime, ZonedDateTime> timeOfDayResolver,
                             String description) {
        this.days = days.isEmpty() ? EnumSet.allOf(DayOfWeek.class) : EnumSet.copyOf(days);
        this.timeOfDayResolver = timeOfDayResolver;
        this.description = description;
    }

    public static WeekdayRecurrence at(LocalTime time, Set<DayOfWeek> days) {
        return new WeekdayRecurrence(days, day -> day.with(time), time + " " + days);
    }

    @Override
    public Optional<ZonedDateTime> nextFireTime(ZonedDateTime after) {
        ZonedDateTime dayStart = after.toLocalDate().atStartOfDay(after.getZone());
        for (int i = 0; i <= 7; i++) {
            ZonedDateTime day = dayStart.plusDays(i);
            if (!days.contains(day.getDayOfWeek())) {
                continue;
            }
            ZonedDateTime candidate = timeOfDayResolver.apply(day);
            if (candidate != null && candidate.isAfter(after)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return description;
    }
}
