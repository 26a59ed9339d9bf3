package at.sv.lightsout.api;

/**
 * Exception to signal a backend error of the bridge API (5xx, 429), an error entry inside a successful response, or
 * a response that could not be parsed.
 */
public class ApiFailure extends RuntimeException {
    public ApiFailure(String message) {
        super(message);
    }

    public ApiFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
