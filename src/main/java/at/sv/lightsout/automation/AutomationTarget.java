package at.sv.lightsout.automation;

import at.sv.lightsout.api.TargetType;

import java.util.LinkedHashSet;
import java.util.List;

public record AutomationTarget(TargetType type, List<String> ids) {
    public AutomationTarget {
        ids = List.copyOf(new LinkedHashSet<>(ids));
    }

    public static AutomationTarget lights(String... ids) {
        return new AutomationTarget(TargetType.LIGHT, List.of(ids));
    }

    public static AutomationTarget rooms(String... ids) {
        return new AutomationTarget(TargetType.ROOM, List.of(ids));
    }
}
