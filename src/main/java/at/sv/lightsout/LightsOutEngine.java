package at.sv.lightsout;

import at.sv.lightsout.adaptive.AdaptiveController;
import at.sv.lightsout.adaptive.AdaptiveSessionStatus;
import at.sv.lightsout.adaptive.AdaptiveSettings;
import at.sv.lightsout.api.ApiFailure;
import at.sv.lightsout.api.BridgeAuthenticationFailure;
import at.sv.lightsout.api.BridgeConnectionFailure;
import at.sv.lightsout.api.LightCommand;
import at.sv.lightsout.api.LightGateway;
import at.sv.lightsout.api.LightState;
import at.sv.lightsout.api.TargetType;
import at.sv.lightsout.automation.Automation;
import at.sv.lightsout.automation.AutomationScheduler;
import at.sv.lightsout.automation.ExecutionResult;
import at.sv.lightsout.automation.ReloadResult;
import at.sv.lightsout.pattern.Pattern;
import at.sv.lightsout.pattern.PatternMiner;
import at.sv.lightsout.pattern.PatternSummaryFormatter;
import at.sv.lightsout.pattern.Prediction;
import at.sv.lightsout.pattern.Predictor;
import at.sv.lightsout.pattern.ReactiveAction;
import at.sv.lightsout.pattern.Recommendation;
import at.sv.lightsout.scheduling.JobScheduler;
import at.sv.lightsout.scheduling.WeekdayRecurrence;
import at.sv.lightsout.store.EventStore;
import at.sv.lightsout.store.StoreStatistics;
import at.sv.lightsout.store.StoreUnavailableException;
import at.sv.lightsout.time.DailySunTimes;
import at.sv.lightsout.time.SunTimesProvider;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Wires change detection, pattern mining, prediction, automations and the adaptive brightness loops, and offers their
 * operations to callers.
 */
@Slf4j
public final class LightsOutEngine {

    static final int MAX_ANALYZED_EVENTS = 10_000;
    static final String POLL_JOB = "poll-lights";
    static final String ANALYSIS_JOB = "daily-analysis";
    static final String CLEANUP_JOB = "weekly-cleanup";
    static final LocalTime ANALYSIS_TIME = LocalTime.of(3, 0);
    static final LocalTime CLEANUP_TIME = LocalTime.of(4, 0);

    private final LightGateway gateway;
    private final EventStore store;
    private final SunTimesProvider sunTimesProvider;
    private final JobScheduler jobScheduler;
    private final Supplier<ZonedDateTime> currentTime;
    private final EngineSettings settings;
    private final LightChangeDetector changeDetector;
    private final PatternMiner patternMiner;
    private final Predictor predictor;
    private final AutomationScheduler automationScheduler;
    private final AdaptiveController adaptiveController;

    public LightsOutEngine(LightGateway gateway, EventStore store, SunTimesProvider sunTimesProvider,
                           JobScheduler jobScheduler, Supplier<ZonedDateTime> currentTime, Ticker ticker,
                           EngineSettings settings) {
        this.gateway = gateway;
        this.store = store;
        this.sunTimesProvider = sunTimesProvider;
        this.jobScheduler = jobScheduler;
        this.currentTime = currentTime;
        this.settings = settings;
        changeDetector = new LightChangeDetector();
        patternMiner = new PatternMiner(settings.getMinOccurrences(), settings.getTimeWindowMinutes(),
                settings.getConfidenceThreshold());
        predictor = new Predictor(store, settings.getMinConfidence(), settings.getLookaheadMinutes(),
                settings.getMinOccurrences(), ticker, settings.getPatternCacheDuration());
        automationScheduler = new AutomationScheduler(store, gateway, jobScheduler, sunTimesProvider, currentTime);
        adaptiveController = new AdaptiveController(gateway, jobScheduler, currentTime,
                settings.getAdaptivePollInterval(), settings.getAdaptiveErrorBackoff());
    }

    /**
     * Schedules light polling, the daily pattern analysis and the weekly event cleanup, and all enabled automations.
     */
    public void start() {
        MDC.put("context", "init");
        jobScheduler.scheduleAtFixedRate(POLL_JOB, Duration.ZERO, settings.getPollInterval(), this::pollLights);
        jobScheduler.scheduleRecurring(ANALYSIS_JOB, WeekdayRecurrence.at(ANALYSIS_TIME, EnumSet.allOf(DayOfWeek.class)),
                () -> minePatterns(settings.getAnalysisWindowDays()));
        jobScheduler.scheduleRecurring(CLEANUP_JOB, WeekdayRecurrence.at(CLEANUP_TIME, EnumSet.of(DayOfWeek.SUNDAY)),
                this::cleanupOldEvents);
        reloadAutomations();
        MDC.put("context", "init");
        log.info("Started. Polling every {}, {}", settings.getPollInterval(), getSunTimes(currentTime.get()));
    }

    public void stop() {
        jobScheduler.cancel(POLL_JOB);
        jobScheduler.cancel(ANALYSIS_JOB);
        jobScheduler.cancel(CLEANUP_JOB);
        int stopped = adaptiveController.stop(null);
        log.info("Stopped, {} adaptive sessions ended", stopped);
    }

    /**
     * Reads the current light states, and stores every detected change as event. If reactions are enabled, every
     * event is checked against the sequence patterns.
     *
     * @return the detected events
     */
    public List<LightEvent> pollLights() {
        MDC.put("context", "poll");
        Map<String, LightState> states;
        try {
            states = gateway.readStates();
        } catch (BridgeConnectionFailure | ApiFailure e) {
            log.warn("Failed to read light states: {}", e.getLocalizedMessage());
            return List.of();
        } catch (BridgeAuthenticationFailure e) {
            log.error("Failed to read light states: {}. Please check the configured username.",
                    e.getLocalizedMessage());
            return List.of();
        }
        List<LightEvent> events = changeDetector.detectChanges(states, currentTime.get());
        for (LightEvent event : events) {
            try {
                store.appendEvent(event);
            } catch (StoreUnavailableException e) {
                log.warn("Failed to store {}: {}", event, e.getLocalizedMessage());
            }
            if (settings.isEnableReactions()) {
                react(event);
            }
        }
        return events;
    }

    private void react(LightEvent event) {
        for (ReactiveAction action : predictor.shouldTriggerSequence(event.lightId(), event.eventType())) {
            LightCommand command = toCommand(action);
            if (command == null) {
                log.debug("Ignoring reaction {}, only on and off are supported", action);
                continue;
            }
            if (settings.isDryRun()) {
                log.info("[dry run] Would trigger {} on light {} in {}s (pattern {}, confidence {})",
                        action.eventType(), action.lightId(), action.delaySeconds(), action.patternId(),
                        FormatUtil.formatConfidencePercent(action.confidence()));
                continue;
            }
            String jobId = "reaction-" + action.patternId() + "-" + action.lightId();
            jobScheduler.scheduleOnce(jobId, currentTime.get().plusSeconds(action.delaySeconds()), () -> {
                MDC.put("context", "reaction " + action.patternId());
                if (gateway.setState(TargetType.LIGHT, action.lightId(), command)) {
                    log.info("Triggered {} on light {} (pattern {})", action.eventType(), action.lightId(),
                            action.patternId());
                }
            });
        }
    }

    private static LightCommand toCommand(ReactiveAction action) {
        return switch (action.eventType()) {
            case ON -> LightCommand.turnOn();
            case OFF -> LightCommand.turnOff();
            default -> null;
        };
    }

    /**
     * Mines patterns from the events of the given number of days and stores them.
     *
     * @return the stored patterns
     */
    public List<Pattern> minePatterns(int daysBack) {
        MDC.put("context", "mining");
        ZonedDateTime now = currentTime.get();
        log.info("Analyzing {} days of light events", daysBack);
        List<LightEvent> events;
        try {
            events = store.queryEvents(null, null, now.minusDays(daysBack), now, MAX_ANALYZED_EVENTS);
        } catch (StoreUnavailableException e) {
            log.error("Failed to load events for analysis: {}", e.getLocalizedMessage());
            return List.of();
        }
        List<Pattern> saved = new ArrayList<>();
        try {
            for (Pattern pattern : patternMiner.analyze(events)) {
                saved.add(store.savePattern(pattern));
            }
        } catch (StoreUnavailableException e) {
            log.error("Failed to store mined patterns, {} saved: {}", saved.size(), e.getLocalizedMessage());
        }
        predictor.invalidateCache();
        log.info("{}", PatternSummaryFormatter.format(saved));
        return saved;
    }

    public List<Prediction> getPredictions(ZonedDateTime now) {
        return predictor.getPredictions(now);
    }

    public List<Recommendation> getRecommendations(ZonedDateTime now) {
        return predictor.getRecommendations(now);
    }

    public List<ReactiveAction> shouldTriggerSequence(String lightId, EventType eventType) {
        return predictor.shouldTriggerSequence(lightId, eventType);
    }

    /**
     * @return false, if the pattern does not exist or the store is unavailable
     */
    public boolean submitFeedback(long patternId, boolean wasCorrect) {
        try {
            return predictor.updatePatternFromFeedback(patternId, wasCorrect);
        } catch (StoreUnavailableException e) {
            log.error("Failed to store feedback for pattern {}: {}", patternId, e.getLocalizedMessage());
            return false;
        }
    }

    public ReloadResult reloadAutomations() {
        MDC.put("context", "automations");
        return automationScheduler.reload();
    }

    public ExecutionResult executeAutomation(long automationId) {
        MDC.put("context", "automation " + automationId);
        return automationScheduler.execute(automationId);
    }

    /**
     * Stores the given automations, replacing existing ones with the same id, and reschedules.
     */
    public ReloadResult registerAutomations(List<Automation> automations) {
        try {
            automations.forEach(store::saveAutomation);
        } catch (StoreUnavailableException e) {
            log.error("Failed to store automations: {}", e.getLocalizedMessage());
            return new ReloadResult(false, "Failed to store automations: " + e.getLocalizedMessage(), 0, 0);
        }
        return reloadAutomations();
    }

    /**
     * @return false, if the automation does not exist or the store is unavailable
     */
    public boolean setAutomationEnabled(long automationId, boolean enabled) {
        try {
            Optional<Automation> automation = store.findAutomation(automationId);
            if (automation.isEmpty()) {
                return false;
            }
            store.saveAutomation(automation.get().toBuilder().enabled(enabled).build());
        } catch (StoreUnavailableException e) {
            log.error("Failed to update automation {}: {}", automationId, e.getLocalizedMessage());
            return false;
        }
        reloadAutomations();
        return true;
    }

    public boolean deleteAutomation(long automationId) {
        boolean deleted;
        try {
            deleted = store.deleteAutomation(automationId);
        } catch (StoreUnavailableException e) {
            log.error("Failed to delete automation {}: {}", automationId, e.getLocalizedMessage());
            return false;
        }
        if (deleted) {
            reloadAutomations();
        }
        return deleted;
    }

    public Optional<ZonedDateTime> getNextAutomationRun(long automationId) {
        return automationScheduler.getNextFireTime(automationId);
    }

    public AdaptiveSessionStatus startAdaptive(AdaptiveSettings adaptiveSettings) {
        return adaptiveController.start(adaptiveSettings);
    }

    /**
     * @param sensorId the session to stop, or null for all sessions
     * @return the number of stopped sessions
     */
    public int stopAdaptive(String sensorId) {
        return adaptiveController.stop(sensorId);
    }

    public List<AdaptiveSessionStatus> getAdaptiveStatus() {
        return adaptiveController.getStatus();
    }

    public DailySunTimes getSunTimes(ZonedDateTime date) {
        return sunTimesProvider.getSunTimes(date);
    }

    /**
     * Deletes all events older than the configured retention period.
     *
     * @return the number of deleted events, or -1 if the store is unavailable
     */
    public int cleanupOldEvents() {
        MDC.put("context", "cleanup");
        int retentionDays = settings.getRetentionDays();
        log.info("Cleaning up events older than {} days", retentionDays);
        try {
            int deleted = store.deleteEventsBefore(currentTime.get().minusDays(retentionDays));
            if (deleted > 0) {
                log.info("Deleted {} old events", deleted);
            }
            return deleted;
        } catch (StoreUnavailableException e) {
            log.error("Failed to clean up events: {}", e.getLocalizedMessage());
            return -1;
        }
    }

    public StoreStatistics getStatistics() {
        return store.getStatistics();
    }
}
