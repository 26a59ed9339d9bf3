package at.sv.lightsout.store;

import at.sv.lightsout.EventType;
import at.sv.lightsout.LightEvent;
import at.sv.lightsout.automation.Automation;
import at.sv.lightsout.pattern.Pattern;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence of light events, mined patterns and automation definitions.
 * <p>
 * All methods throw {@link StoreUnavailableException} if the underlying storage cannot be accessed.
 */
public interface EventStore {

    void appendEvent(LightEvent event);

    /**
     * @param lightId   optional filter, null for all lights
     * @param eventType optional filter, null for all types
     * @param start     inclusive
     * @param end       inclusive
     * @return the most recent matching events, newest first, at most {@code limit}
     */
    List<LightEvent> queryEvents(String lightId, EventType eventType, ZonedDateTime start, ZonedDateTime end,
                                 int limit);

    /**
     * @return the number of deleted events
     */
    int deleteEventsBefore(ZonedDateTime cutoff);

    /**
     * Stores a mined pattern. If a stored pattern already describes the same behavior, only its description,
     * occurrence count and last seen time are updated, atomically with respect to {@link #updatePattern}. Id,
     * confidence and active flag are kept.
     *
     * @return the stored pattern, with id
     */
    Pattern savePattern(Pattern pattern);

    List<Pattern> loadActivePatterns();

    Optional<Pattern> findPattern(long id);

    /**
     * Atomically replaces the pattern with the given id with the result of the update function.
     *
     * @return the updated pattern, or empty if no pattern with the given id exists
     */
    Optional<Pattern> updatePattern(long id, UnaryOperator<Pattern> update);

    List<Automation> loadEnabledAutomations();

    Optional<Automation> findAutomation(long id);

    void saveAutomation(Automation automation);

    /**
     * @return true, if the automation existed
     */
    boolean deleteAutomation(long id);

    /**
     * Increments the trigger count and sets the last triggered time of the given automation.
     */
    void recordTrigger(long automationId, ZonedDateTime when);

    StoreStatistics getStatistics();
}
