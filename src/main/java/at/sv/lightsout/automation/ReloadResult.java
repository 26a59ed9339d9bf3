package at.sv.lightsout.automation;

/**
 * @param loaded    the number of enabled automations read from the store
 * @param scheduled the number of automations with an active timer after the reload
 */
public record ReloadResult(boolean success, String reason, int loaded, int scheduled) {
}
