package at.sv.lightsout.automation;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

public sealed interface AutomationTrigger {

    /**
     * @param weekdays the days to fire on, empty means every day
     */
    record TimeTrigger(LocalTime time, Set<DayOfWeek> weekdays) implements AutomationTrigger {
        public TimeTrigger {
            weekdays = weekdays.isEmpty() ? EnumSet.allOf(DayOfWeek.class) : EnumSet.copyOf(weekdays);
        }
    }

    record SunTrigger(SunEvent event, int offsetMinutes, Set<DayOfWeek> weekdays) implements AutomationTrigger {
        public SunTrigger {
            weekdays = weekdays.isEmpty() ? EnumSet.allOf(DayOfWeek.class) : EnumSet.copyOf(weekdays);
        }
    }

    /**
     * Never scheduled, only executed on request.
     */
    record ManualTrigger() implements AutomationTrigger {
    }
}
