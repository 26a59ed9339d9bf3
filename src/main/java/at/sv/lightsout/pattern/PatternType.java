package at.sv.lightsout.pattern;

public enum PatternType {
    TIME_BASED("time_based"),
    SEQUENCE("sequence"),
    CORRELATION("correlation");

    private final String value;

    PatternType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
