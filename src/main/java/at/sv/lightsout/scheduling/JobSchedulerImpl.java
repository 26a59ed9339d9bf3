package at.sv.lightsout.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Uses a single scheduling thread that hands every due job to the worker executor, so long-running jobs do not
 * delay each other.
 */
@Slf4j
public final class JobSchedulerImpl implements JobScheduler {

    private final ScheduledExecutorService scheduler;
    private final Executor executor;
    private final Supplier<ZonedDateTime> currentTime;
    private final Map<String, JobHandle> jobs;

    public JobSchedulerImpl(ScheduledExecutorService scheduler, Executor executor,
                            Supplier<ZonedDateTime> currentTime) {
        this.scheduler = scheduler;
        this.executor = executor;
        this.currentTime = currentTime;
        jobs = new HashMap<>();
    }

    @Override
    public synchronized void scheduleOnce(String jobId, ZonedDateTime when, Runnable job) {
        JobHandle handle = register(jobId);
        handle.nextFireTime = when;
        handle.future = scheduler.schedule(() -> fireOnce(handle, job), millisUntil(when), TimeUnit.MILLISECONDS);
        log.debug("Scheduled '{}' at {}", jobId, when);
    }

    private void fireOnce(JobHandle handle, Runnable job) {
        synchronized (this) {
            if (!jobs.remove(handle.jobId, handle)) {
                return;
            }
        }
        executor.execute(logUncaughtException(handle.jobId, job));
    }

    @Override
    public synchronized void scheduleRecurring(String jobId, RecurrenceRule rule, Runnable job) {
        JobHandle handle = register(jobId);
        scheduleNextOccurrence(handle, rule, job, currentTime.get());
    }

    private void scheduleNextOccurrence(JobHandle handle, RecurrenceRule rule, Runnable job, ZonedDateTime after) {
        Optional<ZonedDateTime> next = rule.nextFireTime(after);
        if (next.isEmpty()) {
            log.warn("'{}' does not fire again after {}, removing it", handle.jobId, after);
            jobs.remove(handle.jobId, handle);
            return;
        }
        ZonedDateTime when = next.get();
        handle.nextFireTime = when;
        handle.future = scheduler.schedule(() -> fireRecurring(handle, rule, job), millisUntil(when),
                TimeUnit.MILLISECONDS);
        log.debug("Scheduled '{}' ({}) at {}", handle.jobId, rule, when);
    }

    private void fireRecurring(JobHandle handle, RecurrenceRule rule, Runnable job) {
        synchronized (this) {
            if (jobs.get(handle.jobId) != handle) {
                return;
            }
            ZonedDateTime now = currentTime.get();
            ZonedDateTime fireTime = handle.nextFireTime;
            scheduleNextOccurrence(handle, rule, job, now.isAfter(fireTime) ? now : fireTime);
        }
        executor.execute(logUncaughtException(handle.jobId, job));
    }

    @Override
    public synchronized void scheduleAtFixedRate(String jobId, Duration initialDelay, Duration period, Runnable job) {
        JobHandle handle = register(jobId);
        AtomicBoolean running = new AtomicBoolean();
        Runnable guarded = () -> {
            try {
                job.run();
            } finally {
                running.set(false);
            }
        };
        handle.future = scheduler.scheduleAtFixedRate(() -> {
            if (!running.compareAndSet(false, true)) {
                log.debug("Skipping '{}', previous run still in progress", jobId);
                return;
            }
            executor.execute(logUncaughtException(jobId, guarded));
        }, initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Scheduled '{}' every {}", jobId, period);
    }

    @Override
    public synchronized boolean cancel(String jobId) {
        JobHandle handle = jobs.remove(jobId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        log.debug("Cancelled '{}'", jobId);
        return true;
    }

    @Override
    public synchronized Set<String> getScheduledJobIds() {
        return new TreeSet<>(jobs.keySet());
    }

    @Override
    public synchronized Optional<ZonedDateTime> getNextFireTime(String jobId) {
        JobHandle handle = jobs.get(jobId);
        if (handle == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handle.nextFireTime);
    }

    private JobHandle register(String jobId) {
        JobHandle handle = new JobHandle(jobId);
        JobHandle previous = jobs.put(jobId, handle);
        if (previous != null) {
            log.debug("Replacing existing job '{}'", jobId);
            previous.cancel();
        }
        return handle;
    }

    private long millisUntil(ZonedDateTime when) {
        return Math.max(0, Duration.between(currentTime.get(), when).toMillis());
    }

    private Runnable logUncaughtException(String jobId, Runnable runnable) {
        return () -> {
            try {
                runnable.run();
            } catch (Exception e) {
                log.error("Uncaught exception in '{}': {}", jobId, e.getLocalizedMessage(), e);
            } finally {
                MDC.remove("context");
            }
        };
    }

    private static final class JobHandle {
        private final String jobId;
        private ScheduledFuture<?> future;
        private ZonedDateTime nextFireTime;

        private JobHandle(String jobId) {
            this.jobId = jobId;
        }

        private void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
