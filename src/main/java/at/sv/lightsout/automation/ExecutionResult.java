package at.sv.lightsout.automation;

/**
 * @param updatedTargets the number of targets that accepted all immediately applied commands
 * @param deferredSteps  the number of sequence steps scheduled for later
 */
public record ExecutionResult(boolean success, String reason, int updatedTargets, int totalTargets,
                              int deferredSteps) {

    public static ExecutionResult failed(String reason) {
        return new ExecutionResult(false, reason, 0, 0, 0);
    }
}
