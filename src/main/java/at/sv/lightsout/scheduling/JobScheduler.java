package at.sv.lightsout.scheduling;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.Set;

/**
 * Runs jobs at given times on a worker pool. Scheduling a job with an id already in use replaces the existing job.
 */
public interface JobScheduler {

    void scheduleOnce(String jobId, ZonedDateTime when, Runnable job);

    void scheduleRecurring(String jobId, RecurrenceRule rule, Runnable job);

    /**
     * Runs the job every period. An execution is skipped if the previous one is still running.
     */
    void scheduleAtFixedRate(String jobId, Duration initialDelay, Duration period, Runnable job);

    /**
     * @return true, if a job with the given id was scheduled
     */
    boolean cancel(String jobId);

    Set<String> getScheduledJobIds();

    /**
     * @return the next fire time of a one-shot or recurring job, empty for unknown ids and fixed rate jobs
     */
    Optional<ZonedDateTime> getNextFireTime(String jobId);
}
