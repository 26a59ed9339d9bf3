package at.sv.lightsout.scheduling;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A runnable captured by {@link DummyScheduledExecutorService}, doubling as its own future.
 */
@RequiredArgsConstructor
@Getter
final class ScheduledRunnable implements Runnable, ScheduledFuture<Object> {
    private final Runnable runnable;
    private final long delayMillis;
    /**
     * Zero for one-shot tasks.
     */
    private final long periodMillis;
    private boolean cancelled;

    @Override
    public void run() {
        runnable.run();
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(delayMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        return Long.compare(getDelay(TimeUnit.MILLISECONDS), o.getDelay(TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        cancelled = true;
        return true;
    }

    @Override
    public boolean isDone() {
        return cancelled;
    }

    @Override
    public Object get() {
        return null;
    }

    @Override
    public Object get(long timeout, TimeUnit unit) {
        return null;
    }

    @Override
    public String toString() {
        return "ScheduledRunnable{" +
               "delayMillis=" + delayMillis +
               ", periodMillis=" + periodMillis +
               ", cancelled=" + cancelled +
               '}';
    }
}
