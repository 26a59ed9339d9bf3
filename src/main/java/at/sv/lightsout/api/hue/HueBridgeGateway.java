package at.sv.lightsout.api.hue;

import at.sv.lightsout.api.ApiFailure;
import at.sv.lightsout.api.BridgeAuthenticationFailure;
import at.sv.lightsout.api.BridgeConnectionFailure;
import at.sv.lightsout.api.HttpResourceProvider;
import at.sv.lightsout.api.LightCommand;
import at.sv.lightsout.api.LightGateway;
import at.sv.lightsout.api.LightState;
import at.sv.lightsout.api.ResourceNotFoundException;
import at.sv.lightsout.api.TargetType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@link LightGateway} on top of the Hue bridge REST API v1.
 */
@Slf4j
public final class HueBridgeGateway implements LightGateway {

    private static final int UNAUTHORIZED_USER_ERROR = 1;

    private final HttpResourceProvider resourceProvider;
    private final ObjectMapper mapper;
    private final String baseApi;

    public HueBridgeGateway(HttpResourceProvider resourceProvider, String host, String username) {
        this.resourceProvider = resourceProvider;
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        baseApi = getOrigin(host) + "/api/" + username;
    }

    private static String getOrigin(String host) {
        String trimmed = host.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("http")) {
            return trimmed;
        }
        return "http://" + trimmed;
    }

    @Override
    public Map<String, LightState> readStates() {
        JsonNode lights = readTree(resourceProvider.getResource(createUrl("/lights")));
        assertNoErrors(lights);
        Map<String, LightState> states = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = lights.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Light light = treeToValue(entry.getValue(), Light.class);
            states.put(entry.getKey(), light.toLightState(entry.getKey()));
        }
        return states;
    }

    @Override
    public boolean setState(TargetType targetType, String targetId, LightCommand command) {
        try {
            String response = resourceProvider.putResource(createUrl(getStatePath(targetType, targetId)),
                    writeValueAsString(command));
            assertNoErrors(readTree(response));
            log.debug("Set {} {}: {}", targetType.getValue(), targetId, command);
            return true;
        } catch (BridgeConnectionFailure | BridgeAuthenticationFailure | ApiFailure | ResourceNotFoundException e) {
            log.error("Failed to set {} {} to {}: '{}'", targetType.getValue(), targetId, command,
                    e.getLocalizedMessage());
            return false;
        }
    }

    private static String getStatePath(TargetType targetType, String targetId) {
        if (targetType == TargetType.ROOM) {
            return "/groups/" + targetId + "/action";
        }
        return "/lights/" + targetId + "/state";
    }

    @Override
    public int readLightLevel(String sensorId) {
        JsonNode sensor = readTree(resourceProvider.getResource(createUrl("/sensors/" + sensorId)));
        assertNoErrors(sensor);
        JsonNode lightLevel = sensor.path("state").path("lightlevel");
        if (!lightLevel.isNumber()) {
            throw new ResourceNotFoundException("Sensor '" + sensorId + "' does not report a light level");
        }
        return lightLevel.asInt();
    }

    /**
     * The v1 api reports errors as an array of error objects, even with status code 200.
     */
    private void assertNoErrors(JsonNode response) {
        if (!response.isArray()) {
            return;
        }
        for (JsonNode entry : response) {
            JsonNode error = entry.get("error");
            if (error == null) {
                continue;
            }
            if (error.path("type").asInt() == UNAUTHORIZED_USER_ERROR) {
                throw new BridgeAuthenticationFailure();
            }
            String description = error.path("description").asText("unknown error");
            if (description.contains("not available")) {
                throw new ResourceNotFoundException(description);
            }
            throw new ApiFailure(description);
        }
    }

    private URL createUrl(String path) {
        try {
            return new URI(baseApi + path).toURL();
        } catch (MalformedURLException | URISyntaxException e) {
            throw new IllegalArgumentException("Failed to construct url for '" + path + "'", e);
        }
    }

    private JsonNode readTree(String response) {
        try {
            return mapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new ApiFailure("Failed to parse bridge response: " + e.getLocalizedMessage(), e);
        }
    }

    private <T> T treeToValue(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ApiFailure("Failed to parse bridge resource: " + e.getLocalizedMessage(), e);
        }
    }

    private String writeValueAsString(Object object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize '" + object + "'", e);
        }
    }

    @Data
    private static final class Light {
        private String name;
        private State state;

        LightState toLightState(String id) {
            State current = state != null ? state : new State();
            return LightState.builder()
                             .id(id)
                             .name(name)
                             .on(Boolean.TRUE.equals(current.on))
                             .brightness(current.bri)
                             .hue(current.hue)
                             .saturation(current.sat)
                             .colorTemperature(current.ct)
                             .reachable(!Boolean.FALSE.equals(current.reachable))
                             .build();
        }
    }

    @Data
    private static final class State {
        private Boolean on;
        private Integer bri;
        private Integer hue;
        private Integer sat;
        private Integer ct;
        private Boolean reachable;
    }
}
