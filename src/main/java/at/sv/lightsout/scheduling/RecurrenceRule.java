package at.sv.lightsout.scheduling;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes the fire times of a recurring job. Evaluated again after every occurrence, so rules may depend on the date
 * (e.g. sun times).
 */
public interface RecurrenceRule {
    /**
     * @return the first fire time strictly after the given time, or empty if the rule never fires again
     */
    Optional<ZonedDateTime> nextFireTime(ZonedDateTime after);
}
