package at.sv.lightsout.automation;

public final class InvalidAutomationDefinition extends RuntimeException {
    public InvalidAutomationDefinition(String message) {
        super(message);
    }

    public InvalidAutomationDefinition(String message, Throwable cause) {
        super(message, cause);
    }
}
