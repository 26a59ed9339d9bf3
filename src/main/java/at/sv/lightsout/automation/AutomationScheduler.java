package at.sv.lightsout.automation;

import at.sv.lightsout.api.LightCommand;
import at.sv.lightsout.api.LightGateway;
import at.sv.lightsout.automation.AutomationAction.ActionSequence;
import at.sv.lightsout.automation.AutomationAction.SequenceStep;
import at.sv.lightsout.automation.AutomationAction.SingleAction;
import at.sv.lightsout.automation.AutomationTrigger.SunTrigger;
import at.sv.lightsout.automation.AutomationTrigger.TimeTrigger;
import at.sv.lightsout.scheduling.JobScheduler;
import at.sv.lightsout.scheduling.RecurrenceRule;
import at.sv.lightsout.scheduling.WeekdayRecurrence;
import at.sv.lightsout.store.EventStore;
import at.sv.lightsout.store.StoreUnavailableException;
import at.sv.lightsout.time.SunTimesProvider;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Turns the enabled automations of the store into timed jobs and executes them.
 * <p>
 * Sun based triggers are resolved for the date of every occurrence, so their fire time follows the seasons.
 */
@Slf4j
public final class AutomationScheduler {

    private final EventStore store;
    private final LightGateway gateway;
    private final JobScheduler jobScheduler;
    private final SunTimesProvider sunTimesProvider;
    private final Supplier<ZonedDateTime> currentTime;
    private final Map<Long, String> scheduledJobs;

    public AutomationScheduler(EventStore store, LightGateway gateway, JobScheduler jobScheduler,
                               SunTimesProvider sunTimesProvider, Supplier<ZonedDateTime> currentTime) {
        this.store = store;
        this.gateway = gateway;
        this.jobScheduler = jobScheduler;
        this.sunTimesProvider = sunTimesProvider;
        this.currentTime = currentTime;
        scheduledJobs = new HashMap<>();
    }

    /**
     * Replaces all automation jobs with jobs for the currently enabled automations. If the automations can't be
     * loaded, the existing jobs are kept.
     */
    public synchronized ReloadResult reload() {
        List<Automation> automations;
        try {
            automations = store.loadEnabledAutomations();
        } catch (StoreUnavailableException e) {
            log.error("Failed to load automations, keeping {} scheduled: {}", scheduledJobs.size(),
                    e.getLocalizedMessage());
            return new ReloadResult(false, "Failed to load automations: " + e.getLocalizedMessage(), 0,
                    scheduledJobs.size());
        }
        scheduledJobs.values().forEach(jobScheduler::cancel);
        scheduledJobs.clear();
        automations.forEach(this::schedule);
        log.info("Loaded {} automations, {} scheduled", automations.size(), scheduledJobs.size());
        return new ReloadResult(true, "Loaded " + automations.size() + " automations", automations.size(),
                scheduledJobs.size());
    }

    private void schedule(Automation automation) {
        RecurrenceRule rule = createRecurrenceRule(automation.getTrigger());
        if (rule == null) {
            log.debug("'{}' is only executed on request", automation.getDisplayName());
            return;
        }
        String jobId = getJobId(automation.getId());
        long automationId = automation.getId();
        jobScheduler.scheduleRecurring(jobId, rule, () -> {
            MDC.put("context", "automation " + automationId);
            execute(automationId);
        });
        scheduledJobs.put(automationId, jobId);
        log.debug("Scheduled '{}' at {}, next: {}", automation.getDisplayName(), rule,
                jobScheduler.getNextFireTime(jobId).map(ZonedDateTime::toString).orElse("never"));
    }

    private RecurrenceRule createRecurrenceRule(AutomationTrigger trigger) {
        if (trigger instanceof TimeTrigger timeTrigger) {
            return WeekdayRecurrence.at(timeTrigger.time(), timeTrigger.weekdays());
        }
        if (trigger instanceof SunTrigger sunTrigger) {
            return new WeekdayRecurrence(sunTrigger.weekdays(),
                    day -> getSunTime(sunTrigger.event(), day).plusMinutes(sunTrigger.offsetMinutes()),
                    sunTrigger.event().name().toLowerCase(Locale.ROOT) + formatOffset(sunTrigger.offsetMinutes()) + " " +
                    sunTrigger.weekdays());
        }
        return null;
    }

    private ZonedDateTime getSunTime(SunEvent event, ZonedDateTime day) {
        if (event == SunEvent.SUNRISE) {
            return sunTimesProvider.getSunrise(day);
        }
        return sunTimesProvider.getSunset(day);
    }

    private static String formatOffset(int offsetMinutes) {
        if (offsetMinutes == 0) {
            return "";
        }
        return (offsetMinutes > 0 ? "+" : "") + offsetMinutes + "min";
    }

    static String getJobId(long automationId) {
        return "automation-" + automationId;
    }

    public synchronized Optional<ZonedDateTime> getNextFireTime(long automationId) {
        String jobId = scheduledJobs.get(automationId);
        if (jobId == null) {
            return Optional.empty();
        }
        return jobScheduler.getNextFireTime(jobId);
    }

    /**
     * Executes the given automation now, regardless of its trigger. Sequence steps with a delay are scheduled as
     * separate jobs. The trigger is recorded even if some targets failed.
     */
    public ExecutionResult execute(long automationId) {
        Optional<Automation> found;
        try {
            found = store.findAutomation(automationId);
        } catch (StoreUnavailableException e) {
            log.error("Failed to load automation {}: {}", automationId, e.getLocalizedMessage());
            return ExecutionResult.failed("Failed to load automation: " + e.getLocalizedMessage());
        }
        if (found.isEmpty()) {
            log.warn("Automation {} not found", automationId);
            return ExecutionResult.failed("Automation not found");
        }
        Automation automation = found.get();
        if (!automation.isEnabled()) {
            log.warn("'{}' is disabled, skipping", automation.getDisplayName());
            return ExecutionResult.failed("Automation is disabled");
        }
        log.info("Executing '{}'", automation.getDisplayName());
        ExecutionResult result;
        if (automation.getAction() instanceof ActionSequence sequence) {
            result = executeSequence(automation, sequence);
        } else {
            result = executeSingle(automation, ((SingleAction) automation.getAction()).command());
        }
        recordTrigger(automationId);
        return result;
    }

    private ExecutionResult executeSingle(Automation automation, LightCommand command) {
        int total = automation.getTarget().ids().size();
        int updated = apply(automation.getTarget(), command);
        return new ExecutionResult(updated == total, "Updated " + updated + " of " + total + " targets", updated,
                total, 0);
    }

    private ExecutionResult executeSequence(Automation automation, ActionSequence sequence) {
        AutomationTarget target = automation.getTarget();
        int total = target.ids().size();
        int[] failuresPerTarget = new int[total];
        int deferred = 0;
        boolean appliedImmediately = false;
        ZonedDateTime now = currentTime.get();
        List<SequenceStep> steps = sequence.steps();
        for (int i = 0; i < steps.size(); i++) {
            SequenceStep step = steps.get(i);
            if (step.delaySeconds() > 0) {
                String jobId = getJobId(automation.getId()) + "-step-" + i;
                jobScheduler.scheduleOnce(jobId, now.plusSeconds(step.delaySeconds()), () -> {
                    MDC.put("context", "automation " + automation.getId());
                    apply(target, step.command());
                });
                deferred++;
            } else {
                appliedImmediately = true;
                for (int t = 0; t < total; t++) {
                    if (!apply(target, target.ids().get(t), step.command())) {
                        failuresPerTarget[t]++;
                    }
                }
            }
        }
        log.info("Scheduled {} of {} steps of '{}'", deferred, steps.size(), automation.getDisplayName());
        if (!appliedImmediately) {
            return new ExecutionResult(true, "Scheduled " + deferred + " steps", 0, total, deferred);
        }
        int updated = 0;
        for (int failures : failuresPerTarget) {
            if (failures == 0) {
                updated++;
            }
        }
        return new ExecutionResult(updated == total,
                "Updated " + updated + " of " + total + " targets, scheduled " + deferred + " steps", updated, total,
                deferred);
    }

    /**
     * @return the number of targets that accepted the command
     */
    private int apply(AutomationTarget target, LightCommand command) {
        int updated = 0;
        for (String targetId : target.ids()) {
            if (apply(target, targetId, command)) {
                updated++;
            }
        }
        return updated;
    }

    private boolean apply(AutomationTarget target, String targetId, LightCommand command) {
        boolean success;
        try {
            success = gateway.setState(target.type(), targetId, command);
        } catch (Exception e) {
            log.error("Unexpected error applying {} to {} {}: {}", command, target.type().getValue(), targetId,
                    e.getLocalizedMessage(), e);
            return false;
        }
        if (success) {
            log.debug("Applied {} to {} {}", command, target.type().getValue(), targetId);
        } else {
            log.warn("Failed to apply {} to {} {}", command, target.type().getValue(), targetId);
        }
        return success;
    }

    private void recordTrigger(long automationId) {
        try {
            store.recordTrigger(automationId, currentTime.get());
        } catch (StoreUnavailableException e) {
            log.warn("Failed to record trigger of automation {}: {}", automationId, e.getLocalizedMessage());
        }
    }
}
