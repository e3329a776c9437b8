package com.phillippitts.aerodefect.service.detection.secondary;

import com.phillippitts.aerodefect.config.properties.SecondaryDetectorProperties;
import com.phillippitts.aerodefect.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Objects;

/**
 * {@link VisionClient} for OpenAI-compatible chat-completions endpoints.
 *
 * <p>Sends the prompt and the image as a base64 data URL in one user message and returns
 * {@code choices[0].message.content}. Timeouts come from the {@link RestClient}'s request factory.
 */
public class OpenAiVisionClient implements VisionClient {

    private static final Logger LOG = LogManager.getLogger(OpenAiVisionClient.class);

    private static final int PREVIEW_CHARS = 200;
    private static final int TOO_MANY_REQUESTS = 429;

    private final RestClient restClient;
    private final SecondaryDetectorProperties props;

    public OpenAiVisionClient(RestClient restClient, SecondaryDetectorProperties props) {
        this.restClient = Objects.requireNonNull(restClient);
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public boolean isConfigured() {
        return props.hasApiKey();
    }

    @Override
    public VisionCallResult call(VisionRequest request) {
        if (!isConfigured()) {
            return VisionCallResult.failure(VisionCallResult.Status.NOT_CONFIGURED, "API key not configured");
        }
        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri(props.endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.apiKey())
                    .body(buildBody(request).toString())
                    .retrieve()
                    .body(String.class);
        } catch (HttpServerErrorException e) {
            return VisionCallResult.httpFailure(VisionCallResult.Status.SERVER_ERROR,
                    e.getStatusCode().value(), e.getStatusText());
        } catch (HttpClientErrorException e) {
            int code = e.getStatusCode().value();
            VisionCallResult.Status status = code == TOO_MANY_REQUESTS
                    ? VisionCallResult.Status.RATE_LIMITED
                    : VisionCallResult.Status.CLIENT_ERROR;
            return VisionCallResult.httpFailure(status, code, e.getStatusText());
        } catch (RestClientResponseException e) {
            return VisionCallResult.httpFailure(VisionCallResult.Status.SERVER_ERROR,
                    e.getStatusCode().value(), e.getStatusText());
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                return VisionCallResult.failure(VisionCallResult.Status.TIMEOUT,
                        "no response within " + props.requestTimeoutMs() + " ms");
            }
            return VisionCallResult.failure(VisionCallResult.Status.TRANSPORT_ERROR, rootMessage(e));
        } catch (RestClientException e) {
            return VisionCallResult.failure(VisionCallResult.Status.TRANSPORT_ERROR, rootMessage(e));
        }
        return extractContent(responseBody);
    }

    JSONObject buildBody(VisionRequest request) {
        JSONArray content = new JSONArray()
                .put(new JSONObject().put("type", "text").put("text", request.prompt()))
                .put(new JSONObject()
                        .put("type", "image_url")
                        .put("image_url", new JSONObject().put("url", request.imageDataUrl())));
        return new JSONObject()
                .put("model", props.model())
                .put("max_tokens", props.maxTokens())
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", content)));
    }

    static VisionCallResult extractContent(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return VisionCallResult.failure(VisionCallResult.Status.EMPTY_RESPONSE, "empty response body");
        }
        try {
            JSONObject root = new JSONObject(responseBody);
            JSONArray choices = root.optJSONArray("choices");
            if (choices == null || choices.isEmpty()) {
                return VisionCallResult.failure(VisionCallResult.Status.MALFORMED_RESPONSE, "no choices in response");
            }
            JSONObject message = choices.getJSONObject(0).optJSONObject("message");
            String text = message == null ? null : message.optString("content", null);
            if (text == null || text.isBlank()) {
                return VisionCallResult.failure(VisionCallResult.Status.EMPTY_RESPONSE, "empty message content");
            }
            LOG.debug("Vision response preview: {}", LogSanitizer.preview(text, PREVIEW_CHARS));
            return VisionCallResult.success(text);
        } catch (JSONException e) {
            LOG.debug("Unparseable completion envelope: {}", LogSanitizer.preview(responseBody, PREVIEW_CHARS));
            return VisionCallResult.failure(VisionCallResult.Status.MALFORMED_RESPONSE,
                    "response is not a chat-completion object");
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = root.getMessage();
        return root.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }
}
