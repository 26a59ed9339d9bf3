package at.sv.lightsout.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A partially populated light or group command. Unset properties are left untouched by the bridge.
 * <p>
 * The json property names match the Hue bridge keys, the aliases accept the long names used in automation
 * definitions.
 */
@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = LightCommand.LightCommandBuilder.class)
public final class LightCommand {
    Boolean on;
    Integer bri;
    Integer hue;
    Integer sat;
    Integer ct;
    /**
     * As a multiple of 100ms.
     */
    @JsonProperty("transitiontime")
    Integer transitionTime;
    String alert;
    String effect;
    List<Double> xy;
    String scene;

    public static LightCommand turnOn() {
        return LightCommand.builder().on(true).build();
    }

    public static LightCommand turnOff() {
        return LightCommand.builder().on(false).build();
    }

    public static LightCommand brightness(int bri) {
        return LightCommand.builder().bri(bri).build();
    }

    @JsonIgnore
    public boolean isNullCall() {
        return Stream.of(on, bri, hue, sat, ct, alert, effect, xy, scene).allMatch(Objects::isNull);
    }

    @Override
    public String toString() {
        String properties = getFormattedPropertyIfSet("on", on) +
                            getFormattedPropertyIfSet("bri", bri) +
                            getFormattedPropertyIfSet("hue", hue) +
                            getFormattedPropertyIfSet("sat", sat) +
                            getFormattedCtIfSet() +
                            getFormattedPropertyIfSet("xy", xy) +
                            getFormattedPropertyIfSet("alert", alert) +
                            getFormattedPropertyIfSet("effect", effect) +
                            getFormattedPropertyIfSet("scene", scene) +
                            getFormattedTransitionTimeIfSet();
        return "{" + properties.replaceFirst("^, ", "") + "}";
    }

    private String getFormattedPropertyIfSet(String name, Object property) {
        if (property == null) return "";
        return formatPropertyName(name) + property;
    }

    private String getFormattedCtIfSet() {
        if (ct == null || ct <= 0) return getFormattedPropertyIfSet("ct", ct);
        long kelvin = Math.round(1_000_000.0 / ct);
        return formatPropertyName("ct") + ct + " (" + kelvin + "K)";
    }

    private String formatPropertyName(String name) {
        return ", " + name + "=";
    }

    private String getFormattedTransitionTimeIfSet() {
        if (transitionTime == null) return "";
        return formatPropertyName("tr") + transitionTime + " (" + Duration.ofMillis(transitionTime * 100L) + ")";
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class LightCommandBuilder {
        @JsonAlias("brightness")
        public LightCommandBuilder bri(Integer bri) {
            this.bri = bri;
            return this;
        }

        @JsonAlias("saturation")
        public LightCommandBuilder sat(Integer sat) {
            this.sat = sat;
            return this;
        }

        @JsonAlias("color_temp")
        public LightCommandBuilder ct(Integer ct) {
            this.ct = ct;
            return this;
        }

        @JsonProperty("transitiontime")
        @JsonAlias("transition_time")
        public LightCommandBuilder transitionTime(Integer transitionTime) {
            this.transitionTime = transitionTime;
            return this;
        }
    }
}
