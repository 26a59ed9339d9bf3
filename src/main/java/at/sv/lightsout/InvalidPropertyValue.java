package at.sv.lightsout;

public final class InvalidPropertyValue extends RuntimeException {
    public InvalidPropertyValue(String message) {
        super(message);
    }
}
