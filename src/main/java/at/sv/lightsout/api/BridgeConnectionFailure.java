package at.sv.lightsout.api;

/**
 * Exception to signal that the bridge could not be reached.
 */
public final class BridgeConnectionFailure extends RuntimeException {

    public BridgeConnectionFailure(String message) {
        super(message);
    }

    public BridgeConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
