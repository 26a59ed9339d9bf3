package at.sv.lightsout.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LightCommandTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Test
    void serialize_onlySetProperties_usesBridgeKeys() throws Exception {
        LightCommand command = LightCommand.builder().on(true).bri(200).ct(370).transitionTime(10).build();

        String json = mapper.writeValueAsString(command);

        assertThat(mapper.readTree(json)).isEqualTo(mapper.readTree("""
                {"on": true, "bri": 200, "ct": 370, "transitiontime": 10}
                """));
    }

    @Test
    void deserialize_bridgeKeys() throws Exception {
        LightCommand command = mapper.readValue("""
                {"on": false, "bri": 10, "hue": 1000, "sat": 200, "ct": 400, "transitiontime": 4,
                 "alert": "select", "effect": "colorloop", "xy": [0.3, 0.4], "scene": "abc"}
                """, LightCommand.class);

        assertThat(command).isEqualTo(LightCommand.builder()
                                                  .on(false)
                                                  .bri(10)
                                                  .hue(1000)
                                                  .sat(200)
                                                  .ct(400)
                                                  .transitionTime(4)
                                                  .alert("select")
                                                  .effect("colorloop")
                                                  .xy(List.of(0.3, 0.4))
                                                  .scene("abc")
                                                  .build());
    }

    @Test
    void deserialize_longNames_areAccepted() throws Exception {
        LightCommand command = mapper.readValue("""
                {"brightness": 120, "saturation": 50, "color_temp": 250, "transition_time": 20, "unknown": 1}
                """, LightCommand.class);

        assertThat(command.getBri()).isEqualTo(120);
        assertThat(command.getSat()).isEqualTo(50);
        assertThat(command.getCt()).isEqualTo(250);
        assertThat(command.getTransitionTime()).isEqualTo(20);
    }

    @Test
    void isNullCall_onlyTransitionTime_true() {
        assertThat(LightCommand.builder().transitionTime(5).build().isNullCall()).isTrue();
        assertThat(LightCommand.turnOff().isNullCall()).isFalse();
    }

    @Test
    void toString_formatsSetProperties() {
        LightCommand command = LightCommand.builder().on(true).bri(254).ct(250).transitionTime(10).build();

        assertThat(command.toString()).isEqualTo("{on=true, bri=254, ct=250 (4000K), tr=10 (PT1S)}");
    }
}
