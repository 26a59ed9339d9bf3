package at.sv.lightsout.automation;

import at.sv.lightsout.api.LightCommand;

import java.util.List;

public sealed interface AutomationAction {

    record SingleAction(LightCommand command) implements AutomationAction {
    }

    record ActionSequence(List<SequenceStep> steps) implements AutomationAction {
        public ActionSequence {
            steps = List.copyOf(steps);
        }
    }

    /**
     * @param delaySeconds relative to the start of the automation, 0 runs the step immediately
     */
    record SequenceStep(int delaySeconds, LightCommand command) {
    }
}
