package at.sv.lightsout.adaptive;

public enum AdaptiveState {
    STARTING,
    ADJUSTING,
    TARGET_REACHED,
    ERROR,
    STOPPED
}
