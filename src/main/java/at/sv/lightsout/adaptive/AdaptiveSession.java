package at.sv.lightsout.adaptive;

import lombok.Getter;

import java.time.ZonedDateTime;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The state of one running control loop. Owned by its loop, only the cancellation flag is set from outside.
 */
final class AdaptiveSession {

    @Getter
    private final AdaptiveSettings settings;
    @Getter
    private final String jobId;
    private final AtomicBoolean cancelled;
    private final ReentrantLock iterationLock;

    private volatile AdaptiveState state;
    private volatile Double currentLux;
    private volatile Integer currentBrightness;
    private volatile String lastError;
    private volatile ZonedDateTime lastUpdate;
    private volatile int adjustments;

    AdaptiveSession(AdaptiveSettings settings, String jobId) {
        this.settings = settings;
        this.jobId = jobId;
        cancelled = new AtomicBoolean();
        iterationLock = new ReentrantLock();
        state = AdaptiveState.STARTING;
    }

    void cancel() {
        cancelled.set(true);
        state = AdaptiveState.STOPPED;
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs the given iteration, unless another one is still in progress.
     *
     * @return false, if the iteration was skipped
     */
    boolean runExclusively(Runnable iteration) {
        if (!iterationLock.tryLock()) {
            return false;
        }
        try {
            iteration.run();
            return true;
        } finally {
            iterationLock.unlock();
        }
    }

    /**
     * @return true, if no iteration was in progress within the given timeout
     */
    boolean awaitIdle(long timeoutMillis) throws InterruptedException {
        if (!iterationLock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS)) {
            return false;
        }
        iterationLock.unlock();
        return true;
    }

    void update(AdaptiveState state, double lux, int brightness, ZonedDateTime now) {
        if (isCancelled()) {
            return;
        }
        this.state = state;
        currentLux = lux;
        currentBrightness = brightness;
        lastError = null;
        lastUpdate = now;
    }

    void markAdjusted() {
        adjustments++;
    }

    void markError(String error, ZonedDateTime now) {
        if (isCancelled()) {
            return;
        }
        state = AdaptiveState.ERROR;
        lastError = error;
        lastUpdate = now;
    }

    AdaptiveSessionStatus toStatus() {
        return new AdaptiveSessionStatus(settings.sensorId(), settings.lightIds(), settings.targetLux(), state,
                currentLux, currentBrightness, lastError, lastUpdate, adjustments);
    }
}
