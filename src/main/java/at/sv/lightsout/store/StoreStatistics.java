package at.sv.lightsout.store;

import java.time.ZonedDateTime;

/**
 * @param oldestEvent null if there are no events
 * @param newestEvent null if there are no events
 */
public record StoreStatistics(long totalEvents, int totalPatterns, int activePatterns, int automations,
                              ZonedDateTime oldestEvent, ZonedDateTime newestEvent) {
}
