package at.sv.lightsout.automation;

public enum SunEvent {
    SUNRISE,
    SUNSET
}
