package at.sv.lightsout.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.URL;

@Slf4j
public class HttpResourceProviderImpl implements HttpResourceProvider {

    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;

    public HttpResourceProviderImpl(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String getResource(URL url) {
        log.trace("Get: {}", url);
        return performCall(new Request.Builder().url(url).build());
    }

    @Override
    public String putResource(URL url, String body) {
        log.trace("Put: {}: {}", url, getTruncatedBody(body));
        RequestBody requestBody = RequestBody.create(body, JSON);
        return performCall(new Request.Builder().url(url).put(requestBody).build());
    }

    private static String getTruncatedBody(String body) {
        return body.length() > 150 ? body.substring(0, 150) + "..." : body;
    }

    private String performCall(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            assertSuccessful(response);
            return getBody(response);
        } catch (IOException e) {
            throw new BridgeConnectionFailure("Failed '" + request.method() + " " + request.url() + "'", e);
        }
    }

    private static void assertSuccessful(Response response) throws IOException {
        int code = response.code();
        if (code == 401 || code == 403) {
            throw new BridgeAuthenticationFailure();
        }
        if (code == 404) {
            throw new ResourceNotFoundException("Resource not found: " + getBody(response));
        }
        if (code == 429) {
            throw new ApiFailure("Rate limit exceeded: " + getBody(response));
        }
        if (code >= 500) {
            throw new ApiFailure("Server error: " + getBody(response));
        }
        if (!response.isSuccessful()) {
            throw new IOException("Unexpected return code " + code + ". " + getBody(response));
        }
    }

    private static String getBody(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return "";
        }
        return body.string();
    }
}
