package at.sv.lightsout.pattern;

import at.sv.lightsout.EventType;

public record LightEventKey(String lightId, EventType eventType) {

    public boolean matches(String lightId, EventType eventType) {
        return this.lightId.equals(lightId) && this.eventType == eventType;
    }

    @Override
    public String toString() {
        return lightId + ":" + eventType;
    }
}
