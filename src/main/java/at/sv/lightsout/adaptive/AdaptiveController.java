package at.sv.lightsout.adaptive;

import at.sv.lightsout.api.BridgeConnectionFailure;
import at.sv.lightsout.api.LightCommand;
import at.sv.lightsout.api.LightGateway;
import at.sv.lightsout.api.LightState;
import at.sv.lightsout.api.ResourceNotFoundException;
import at.sv.lightsout.api.TargetType;
import at.sv.lightsout.scheduling.JobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs one closed brightness control loop per light sensor. Every iteration reads the sensor, and moves the
 * brightness of the session lights half way towards the target illuminance, bounded by the maximum step.
 */
@Slf4j
public final class AdaptiveController {

    static final double LUX_TOLERANCE = 5.0;
    static final long REPLACE_TIMEOUT_MILLIS = 2000;

    private final LightGateway gateway;
    private final JobScheduler jobScheduler;
    private final Supplier<ZonedDateTime> currentTime;
    private final Duration pollInterval;
    private final Duration errorBackoff;
    private final Map<String, AdaptiveSession> sessions;
    private final AtomicLong sessionSequence;

    public AdaptiveController(LightGateway gateway, JobScheduler jobScheduler, Supplier<ZonedDateTime> currentTime,
                              Duration pollInterval, Duration errorBackoff) {
        this.gateway = gateway;
        this.jobScheduler = jobScheduler;
        this.currentTime = currentTime;
        this.pollInterval = pollInterval;
        this.errorBackoff = errorBackoff;
        sessions = new HashMap<>();
        sessionSequence = new AtomicLong();
    }

    /**
     * Converts a raw light level sensor reading to lux.
     */
    public static double toLux(int reading) {
        if (reading <= 0) {
            return 0.0;
        }
        return Math.pow(10, (reading - 1) / 10000.0);
    }

    /**
     * Starts a control loop for the sensor of the given settings. A running loop for the same sensor is stopped
     * first, and its iteration in progress is awaited before the new loop starts.
     */
    public AdaptiveSessionStatus start(AdaptiveSettings settings) {
        AdaptiveSession session;
        AdaptiveSession previous;
        synchronized (this) {
            String jobId = "adaptive-" + settings.sensorId() + "-" + sessionSequence.incrementAndGet();
            session = new AdaptiveSession(settings, jobId);
            previous = sessions.put(settings.sensorId(), session);
            if (previous != null) {
                cancel(previous);
            }
        }
        if (previous != null) {
            log.info("Replacing adaptive session for sensor {}", settings.sensorId());
            awaitStopped(previous);
        }
        if (!session.isCancelled()) {
            scheduleIteration(session, currentTime.get());
        }
        log.info("Started adaptive session for sensor {}: lights {}, target {} lux, brightness [{}, {}], step {}",
                settings.sensorId(), settings.lightIds(), settings.targetLux(), settings.minBrightness(),
                settings.maxBrightness(), settings.maxStep());
        return session.toStatus();
    }

    /**
     * Waits for the iterations in progress of the stopped sessions, without blocking other sessions.
     *
     * @param sensorId the session to stop, or null to stop all sessions
     * @return the number of stopped sessions
     */
    public int stop(String sensorId) {
        List<AdaptiveSession> stopped = new ArrayList<>();
        synchronized (this) {
            if (sensorId == null) {
                stopped.addAll(sessions.values());
                sessions.clear();
            } else {
                AdaptiveSession session = sessions.remove(sensorId);
                if (session != null) {
                    stopped.add(session);
                }
            }
            stopped.forEach(this::cancel);
        }
        stopped.forEach(this::awaitStopped);
        return stopped.size();
    }

    private void cancel(AdaptiveSession session) {
        session.cancel();
        jobScheduler.cancel(session.getJobId());
    }

    private void awaitStopped(AdaptiveSession session) {
        try {
            if (!session.awaitIdle(REPLACE_TIMEOUT_MILLIS)) {
                log.warn("Adaptive session for sensor {} did not finish its iteration in time",
                        session.getSettings().sensorId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Stopped adaptive session for sensor {}", session.getSettings().sensorId());
    }

    public synchronized List<AdaptiveSessionStatus> getStatus() {
        return sessions.values().stream().map(AdaptiveSession::toStatus).toList();
    }

    private void scheduleIteration(AdaptiveSession session, ZonedDateTime when) {
        jobScheduler.scheduleOnce(session.getJobId(), when, () -> runIteration(session));
    }

    void runIteration(AdaptiveSession session) {
        if (session.isCancelled()) {
            return;
        }
        MDC.put("context", "adaptive " + session.getSettings().sensorId());
        Duration delay = pollInterval;
        try {
            if (!session.runExclusively(() -> adjust(session))) {
                log.debug("Previous iteration still in progress");
            }
        } catch (Exception e) {
            log.warn("Adaptive iteration failed, retrying in {}: {}", errorBackoff, e.getLocalizedMessage());
            session.markError(e.getLocalizedMessage(), currentTime.get());
            delay = errorBackoff;
        }
        if (!session.isCancelled()) {
            scheduleIteration(session, currentTime.get().plus(delay));
        }
    }

    private void adjust(AdaptiveSession session) {
        if (session.isCancelled()) {
            return;
        }
        AdaptiveSettings settings = session.getSettings();
        double lux = toLux(gateway.readLightLevel(settings.sensorId()));
        int brightness = getCurrentBrightness(settings);
        double diff = settings.targetLux() - lux;
        if (Math.abs(diff) < LUX_TOLERANCE) {
            log.trace("Target reached: {} lux (target {})", lux, settings.targetLux());
            session.update(AdaptiveState.TARGET_REACHED, lux, brightness, currentTime.get());
            return;
        }
        int adjustment = (int) Math.round(clamp(diff / 2, -settings.maxStep(), settings.maxStep()));
        int newBrightness = (int) clamp(brightness + adjustment, settings.minBrightness(), settings.maxBrightness());
        if (newBrightness != brightness && !session.isCancelled()) {
            log.debug("{} lux (target {}): brightness {} -> {}", Math.round(lux), settings.targetLux(), brightness,
                    newBrightness);
            LightCommand command = LightCommand.brightness(newBrightness);
            int updated = 0;
            for (String lightId : settings.lightIds()) {
                if (gateway.setState(TargetType.LIGHT, lightId, command)) {
                    updated++;
                }
            }
            if (updated == 0) {
                throw new BridgeConnectionFailure("No light accepted brightness " + newBrightness + " for lights " +
                                                  settings.lightIds());
            }
            if (updated < settings.lightIds().size()) {
                log.warn("Only {} of {} lights accepted brightness {}", updated, settings.lightIds().size(),
                        newBrightness);
            }
            session.markAdjusted();
        }
        session.update(AdaptiveState.ADJUSTING, lux, newBrightness, currentTime.get());
    }

    private int getCurrentBrightness(AdaptiveSettings settings) {
        Map<String, LightState> states = gateway.readStates();
        return settings.lightIds()
                       .stream()
                       .map(states::get)
                       .filter(state -> state != null && state.getBrightness() != null)
                       .map(LightState::getBrightness)
                       .findFirst()
                       .orElseThrow(() -> new ResourceNotFoundException("No brightness reported for lights " +
                                                                        settings.lightIds()));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
