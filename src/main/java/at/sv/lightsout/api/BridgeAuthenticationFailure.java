package at.sv.lightsout.api;

public final class BridgeAuthenticationFailure extends RuntimeException {
    public BridgeAuthenticationFailure() {
        super("Username was rejected by bridge");
    }
}
