package io.gridsweep.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsweep.config.SweepSettings;
import io.gridsweep.param.ConfigurationException;
import io.gridsweep.util.Jsons;
import io.gridsweep.util.Sleeper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * HTTP client for the Replicate predictions API. Submits a prediction,
 * waits for it to reach a terminal status and returns the first output URL.
 */
public final class ReplicateClient implements RemoteJobService, ArtifactFetcher {
    private static final int MAX_ERROR_CHARS = 512;
    private static final int MAX_CONSECUTIVE_POLL_FAILURES = 3;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(120);
    private static final Duration DEFAULT_PREDICTION_TIMEOUT = Duration.ofMinutes(30);

    private final URI apiBase;
    private final String apiToken;
    private final HttpClient http;
    private final Duration pollInterval;
    private final Duration predictionTimeout;
    private final Sleeper sleeper;

    public ReplicateClient(URI apiBase, String apiToken, HttpClient http, Duration pollInterval,
                           Duration predictionTimeout, Sleeper sleeper) {
        if (apiToken == null || apiToken.isBlank()) {
            throw new ConfigurationException(SweepSettings.API_TOKEN_ENV + " environment variable is not set");
        }
        this.apiBase = stripTrailingSlash(apiBase);
        this.apiToken = apiToken.trim();
        this.http = http;
        this.pollInterval = pollInterval;
        this.predictionTimeout = predictionTimeout;
        this.sleeper = sleeper;
    }

    public static ReplicateClient fromEnvironment(Map<String, String> env) {
        String base = env.getOrDefault(SweepSettings.API_BASE_ENV, SweepSettings.DEFAULT_API_BASE);
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new ReplicateClient(URI.create(base), env.get(SweepSettings.API_TOKEN_ENV), http,
                SweepSettings.DEFAULT_POLL_INTERVAL, DEFAULT_PREDICTION_TIMEOUT, Sleeper.SYSTEM);
    }

    @Override
    public ArtifactReference submit(String modelId, Map<String, Object> input)
            throws RemoteServiceException, InterruptedException {
        if (modelId == null || modelId.isBlank()) {
            throw new RemoteServiceException(RemoteErrorCategory.INVALID_INPUT, "model id cannot be empty");
        }
        ObjectNode body = Jsons.mapper().createObjectNode();
        String path;
        int colon = modelId.indexOf(':');
        if (colon >= 0) {
            body.put("version", modelId.substring(colon + 1));
            path = "/v1/predictions";
        } else {
            path = "/v1/models/" + modelId.trim() + "/predictions";
        }
        body.set("input", Jsons.mapper().valueToTree(input));

        HttpRequest request = authorized(HttpRequest.newBuilder(apiBase.resolve(path)))
                .header("Content-Type", "application/json")
                .header("Prefer", "wait")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body)))
                .build();
        HttpResponse<String> response = send(request);
        requireSuccess(response, "create prediction");
        JsonNode prediction;
        try {
            prediction = parse(response.body());
        } catch (RemoteServiceException e) {
            throw new RemoteServiceException(RemoteErrorCategory.ABANDONED,
                    "prediction was created but its response was unreadable: " + e.getMessage(), null, e);
        }
        return awaitCompletion(prediction);
    }

    @Override
    public byte[] fetch(ArtifactReference reference) throws RemoteServiceException, InterruptedException {
        URI uri;
        try {
            uri = URI.create(reference.location());
        } catch (IllegalArgumentException e) {
            throw new RemoteServiceException(RemoteErrorCategory.INVALID_INPUT,
                    "artifact location is not a valid URI: " + reference.location(), e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(REQUEST_TIMEOUT).GET();
        if (sameHost(uri)) {
            authorized(builder);
        }
        try {
            HttpResponse<byte[]> response = http.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() / 100 != 2) {
                throw new RemoteServiceException(RemoteErrorCategory.fromHttpStatus(response.statusCode()),
                        "download failed with HTTP " + response.statusCode() + ": " + reference.location());
            }
            return response.body();
        } catch (IOException e) {
            throw new RemoteServiceException(RemoteErrorCategory.TRANSIENT_TRANSPORT,
                    "download failed: " + e.getMessage(), e);
        }
    }

    /**
     * Waits for a created prediction. Once created it is billed, so every failure past this
     * point is non-retryable and names the prediction id for reconciliation.
     */
    private ArtifactReference awaitCompletion(JsonNode prediction) throws RemoteServiceException, InterruptedException {
        String id = prediction.path("id").asText("?");
        Instant deadline = Instant.now().plus(predictionTimeout);
        int pollFailures = 0;
        JsonNode current = prediction;
        while (true) {
            String status = current.path("status").asText("");
            switch (status) {
                case "succeeded":
                    return firstOutput(current);
                case "failed":
                    throw new RemoteServiceException(RemoteErrorCategory.INVALID_INPUT,
                            "prediction " + id + " failed: " + truncate(current.path("error").asText("unknown error")),
                            id, null);
                case "canceled":
                    throw new RemoteServiceException(RemoteErrorCategory.ABANDONED,
                            "prediction " + id + " was canceled", id, null);
                default:
                    break;
            }
            if (Instant.now().isAfter(deadline)) {
                throw new RemoteServiceException(RemoteErrorCategory.ABANDONED,
                        "prediction " + id + " did not finish within " + predictionTimeout, id, null);
            }
            sleeper.sleep(pollInterval);
            try {
                current = poll(current);
                pollFailures = 0;
            } catch (RemoteServiceException e) {
                pollFailures++;
                if (!e.retryable() || pollFailures >= MAX_CONSECUTIVE_POLL_FAILURES) {
                    RemoteErrorCategory category = e.retryable() ? RemoteErrorCategory.ABANDONED : e.category();
                    throw new RemoteServiceException(category,
                            "prediction " + id + " could not be polled: " + e.getMessage(), id, e);
                }
            }
        }
    }

    private JsonNode poll(JsonNode prediction) throws RemoteServiceException, InterruptedException {
        String getUrl = prediction.path("urls").path("get").asText("");
        URI uri = getUrl.isBlank()
                ? apiBase.resolve("/v1/predictions/" + prediction.path("id").asText(""))
                : URI.create(getUrl);
        HttpRequest request = authorized(HttpRequest.newBuilder(uri)).GET().build();
        HttpResponse<String> response = send(request);
        requireSuccess(response, "poll prediction");
        return parse(response.body());
    }

    private static ArtifactReference firstOutput(JsonNode prediction) throws RemoteServiceException {
        JsonNode output = prediction.path("output");
        if (output.isArray() && output.size() > 0 && output.get(0).isTextual()) {
            return new ArtifactReference(output.get(0).asText());
        }
        if (output.isTextual() && !output.asText().isBlank()) {
            return new ArtifactReference(output.asText());
        }
        String id = prediction.path("id").asText("?");
        throw new RemoteServiceException(RemoteErrorCategory.INVALID_INPUT,
                "prediction " + id + " returned no output", id, null);
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        return builder.timeout(REQUEST_TIMEOUT).header("Authorization", "Bearer " + apiToken);
    }

    private HttpResponse<String> send(HttpRequest request) throws RemoteServiceException, InterruptedException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteServiceException(RemoteErrorCategory.TRANSIENT_TRANSPORT,
                    request.method() + " " + request.uri().getPath() + " failed: " + e.getMessage(), e);
        }
    }

    private static void requireSuccess(HttpResponse<String> response, String operation) throws RemoteServiceException {
        int status = response.statusCode();
        if (status / 100 == 2) {
            return;
        }
        throw new RemoteServiceException(RemoteErrorCategory.fromHttpStatus(status),
                operation + " failed with HTTP " + status + ": " + errorDetail(response.body()));
    }

    private static String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        try {
            JsonNode node = Jsons.mapper().readTree(body);
            String detail = node.path("detail").asText("");
            if (!detail.isBlank()) {
                return truncate(detail);
            }
        } catch (JsonProcessingException ignored) {
            // Not JSON; fall through to the raw body.
        }
        return truncate(body);
    }

    private static JsonNode parse(String body) throws RemoteServiceException {
        try {
            JsonNode node = Jsons.mapper().readTree(body);
            if (node == null || !node.isObject()) {
                throw new RemoteServiceException(RemoteErrorCategory.SERVER_FAULT, "unexpected prediction payload");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException(RemoteErrorCategory.SERVER_FAULT,
                    "malformed prediction payload: " + truncate(body), e);
        }
    }

    private boolean sameHost(URI uri) {
        return uri.getHost() != null && uri.getHost().equalsIgnoreCase(apiBase.getHost())
                && uri.getPort() == apiBase.getPort();
    }

    private static URI stripTrailingSlash(URI uri) {
        String raw = uri.toString();
        return raw.endsWith("/") ? URI.create(raw.substring(0, raw.length() - 1)) : uri;
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
