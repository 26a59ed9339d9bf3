package at.sv.lightsout.api;

import java.util.Map;

/**
 * Read and control access to the physical light fixtures.
 */
public interface LightGateway {
    /**
     * @return the current state of all known lights, keyed by light id. Not null.
     * @throws BridgeConnectionFailure     if the bridge could not be reached
     * @throws BridgeAuthenticationFailure if the bridge rejected the configured username
     * @throws ApiFailure                  if another api error occurs
     */
    Map<String, LightState> readStates();

    /**
     * Sends the given command to a single light or a room. Failures are logged and reported through the return
     * value, this method does not throw for bridge or connection errors.
     *
     * @return true, iff the bridge accepted the command
     */
    boolean setState(TargetType targetType, String targetId, LightCommand command);

    /**
     * @return the raw light level reading of the given sensor, where {@code lux = 10^((reading - 1) / 10000)}
     * @throws ResourceNotFoundException if no sensor with the given id exists, or it does not report a light level
     * @throws BridgeConnectionFailure   if the bridge could not be reached
     * @throws ApiFailure                if another api error occurs
     */
    int readLightLevel(String sensorId);
}
