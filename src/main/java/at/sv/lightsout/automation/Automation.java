package at.sv.lightsout.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.ZonedDateTime;

/**
 * A user declared trigger to action rule. Only the trigger bookkeeping is modified by the scheduler.
 */
@Data
@AllArgsConstructor
@Builder(toBuilder = true)
public final class Automation {
    private final long id;
    private final String name;
    private final AutomationTrigger trigger;
    private final AutomationTarget target;
    private final AutomationAction action;
    @Builder.Default
    private final boolean enabled = true;
    private final int triggerCount;
    private final ZonedDateTime lastTriggered;

    public String getDisplayName() {
        if (name == null) {
            return "automation " + id;
        }
        return name + " (" + id + ")";
    }
}
