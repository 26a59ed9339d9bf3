package at.sv.lightsout.scheduling;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Records scheduled jobs instead of running them. Tests trigger jobs explicitly with {@link #run(String)}.
 */
public final class TestJobScheduler implements JobScheduler {

    private final Supplier<ZonedDateTime> currentTime;
    private final Map<String, ScheduledJob> jobs;

    public TestJobScheduler(Supplier<ZonedDateTime> currentTime) {
        this.currentTime = currentTime;
        jobs = new LinkedHashMap<>();
    }

    @Override
    public void scheduleOnce(String jobId, ZonedDateTime when, Runnable job) {
        jobs.put(jobId, new ScheduledJob(jobId, when, null, null, job));
    }

    @Override
    public void scheduleRecurring(String jobId, RecurrenceRule rule, Runnable job) {
        jobs.put(jobId, new ScheduledJob(jobId, rule.nextFireTime(currentTime.get()).orElse(null), rule, null, job));
    }

    @Override
    public void scheduleAtFixedRate(String jobId, Duration initialDelay, Duration period, Runnable job) {
        jobs.put(jobId, new ScheduledJob(jobId, null, null, period, job));
    }

    @Override
    public boolean cancel(String jobId) {
        return jobs.remove(jobId) != null;
    }

    @Override
    public Set<String> getScheduledJobIds() {
        return new TreeSet<>(jobs.keySet());
    }

    @Override
    public Optional<ZonedDateTime> getNextFireTime(String jobId) {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(job.getStart());
    }

    public ScheduledJob getJob(String jobId) {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            throw new IllegalStateException("No job '" + jobId + "' scheduled. Scheduled: " + jobs.keySet());
        }
        return job;
    }

    /**
     * Runs the job. One-shot jobs are removed, recurring jobs move on to their next fire time.
     */
    public void run(String jobId) {
        ScheduledJob job = getJob(jobId);
        if (job.getRule() != null) {
            jobs.put(jobId, new ScheduledJob(jobId, job.getRule().nextFireTime(job.getStart()).orElse(null),
                    job.getRule(), null, job.getRunnable()));
        } else if (job.getPeriod() == null) {
            jobs.remove(jobId);
        }
        job.getRunnable().run();
    }

    public List<ScheduledJob> getScheduledJobs() {
        List<ScheduledJob> result = new ArrayList<>(jobs.values());
        result.sort(Comparator.comparing(ScheduledJob::getStart, Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }

    public void clear() {
        jobs.clear();
    }

    @RequiredArgsConstructor
    @Getter
    public static final class ScheduledJob {
        private final String jobId;
        private final ZonedDateTime start;
        private final RecurrenceRule rule;
        private final Duration period;
        private final Runnable runnable;

        @Override
        public String toString() {
            return "ScheduledJob{" +
                   "jobId='" + jobId + '\'' +
                   ", start=" + start +
                   ", period=" + period +
                   '}';
        }
    }
}
