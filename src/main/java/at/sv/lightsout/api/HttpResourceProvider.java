package at.sv.lightsout.api;

import java.net.URL;

/**
 * Blocking access to the json resources of the bridge.
 */
public interface HttpResourceProvider {

    /**
     * @return the response body, never null
     * @throws BridgeAuthenticationFailure if the server rejected the response as unauthorized (401, 403)
     * @throws BridgeConnectionFailure     if an IOException occurred
     * @throws ResourceNotFoundException   if the response code is 404
     * @throws ApiFailure                  if the response code is 5xx or 429
     */
    String getResource(URL url);

    /**
     * @param body the json payload of the put request
     * @return the response body, never null
     * @throws BridgeAuthenticationFailure if the server rejected the response as unauthorized (401, 403)
     * @throws BridgeConnectionFailure     if an IOException occurred
     * @throws ResourceNotFoundException   if the response code is 404
     * @throws ApiFailure                  if the response code is 5xx or 429
     */
    String putResource(URL url, String body);
}
