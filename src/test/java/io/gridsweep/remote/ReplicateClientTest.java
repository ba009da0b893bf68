package io.gridsweep.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.gridsweep.combo.Combination;
import io.gridsweep.dispatch.Dispatcher;
import io.gridsweep.dispatch.Retrier;
import io.gridsweep.dispatch.RetryPolicy;
import io.gridsweep.dispatch.SubmissionPayloads;
import io.gridsweep.model.JobResult;
import io.gridsweep.model.JobStatus;
import io.gridsweep.observability.EventSink;
import io.gridsweep.param.ConfigurationException;
import io.gridsweep.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

final class ReplicateClientTest {
    private HttpServer server;
    private URI base;
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private final List<JsonNode> bodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void versionedModelPostsToPredictionsAndPollsUntilDone() throws Exception {
        AtomicInteger polls = new AtomicInteger();
        server.createContext("/v1/predictions", exchange -> {
            capture(exchange);
            if ("POST".equals(exchange.getRequestMethod())) {
                respond(exchange, 201, """
                        {"id": "p1", "status": "starting", "urls": {"get": "%s/v1/predictions/p1"}}
                        """.formatted(base));
                return;
            }
            if (polls.incrementAndGet() < 2) {
                respond(exchange, 200, "{\"id\": \"p1\", \"status\": \"processing\"}");
            } else {
                respond(exchange, 200, """
                        {"id": "p1", "status": "succeeded", "output": ["https://cdn.example/p1/out-0.webp"]}
                        """);
            }
        });

        ArtifactReference reference = client("r8_secret")
                .submit("owner/model:abc123", Map.of("prompt", "a cat", "steps", 20));

        Assertions.assertEquals("https://cdn.example/p1/out-0.webp", reference.location());
        Assertions.assertEquals("webp", reference.extension());
        Assertions.assertEquals(2, polls.get());
        JsonNode body = bodies.get(0);
        Assertions.assertEquals("abc123", body.path("version").asText());
        Assertions.assertEquals("a cat", body.path("input").path("prompt").asText());
        Assertions.assertEquals(20, body.path("input").path("steps").asInt());
        Assertions.assertTrue(authHeaders.stream().allMatch("Bearer r8_secret"::equals), authHeaders.toString());
    }

    @Test
    void unversionedModelUsesModelEndpointAndStringOutput() throws Exception {
        server.createContext("/v1/models/owner/model/predictions", exchange -> {
            capture(exchange);
            respond(exchange, 201, "{\"id\": \"p2\", \"status\": \"succeeded\", \"output\": \"https://cdn.example/p2.png\"}");
        });

        ArtifactReference reference = client("tok").submit("owner/model", Map.of("prompt", "x"));

        Assertions.assertEquals("https://cdn.example/p2.png", reference.location());
        Assertions.assertFalse(bodies.get(0).has("version"));
    }

    @Test
    void httpErrorsCarryTheirCategory() {
        server.createContext("/v1/models/owner/limited/predictions",
                exchange -> respond(exchange, 429, "{\"detail\": \"Request was throttled\"}"));
        server.createContext("/v1/models/owner/invalid/predictions",
                exchange -> respond(exchange, 422, "{\"detail\": \"- input.steps: Must be less than 500\"}"));
        server.createContext("/v1/models/owner/locked/predictions",
                exchange -> respond(exchange, 401, "{\"detail\": \"Unauthenticated\"}"));

        ReplicateClient client = client("tok");
        RemoteServiceException limited = Assertions.assertThrows(RemoteServiceException.class,
                () -> client.submit("owner/limited", Map.of()));
        Assertions.assertEquals(RemoteErrorCategory.RATE_LIMITED, limited.category());
        Assertions.assertTrue(limited.retryable());

        RemoteServiceException invalid = Assertions.assertThrows(RemoteServiceException.class,
                () -> client.submit("owner/invalid", Map.of()));
        Assertions.assertEquals(RemoteErrorCategory.INVALID_INPUT, invalid.category());
        Assertions.assertTrue(invalid.getMessage().contains("Must be less than 500"), invalid.getMessage());

        RemoteServiceException auth = Assertions.assertThrows(RemoteServiceException.class,
                () -> client.submit("owner/locked", Map.of()));
        Assertions.assertEquals(RemoteErrorCategory.AUTH, auth.category());
        Assertions.assertFalse(auth.retryable());
    }

    @Test
    void failedAndCanceledPredictionsAreClassified() {
        server.createContext("/v1/models/owner/failing/predictions", exchange ->
                respond(exchange, 201, "{\"id\": \"p3\", \"status\": \"failed\", \"error\": \"NSFW content detected\"}"));
        server.createContext("/v1/models/owner/canceled/predictions", exchange ->
                respond(exchange, 201, "{\"id\": \"p4\", \"status\": \"canceled\"}"));

        ReplicateClient client = client("tok");
        RemoteServiceException failed = Assertions.assertThrows(RemoteServiceException.class,
                () -> client.submit("owner/failing", Map.of()));
        Assertions.assertEquals(RemoteErrorCategory.INVALID_INPUT, failed.category());
        Assertions.assertTrue(failed.getMessage().contains("NSFW"));

        RemoteServiceException canceled = Assertions.assertThrows(RemoteServiceException.class,
                () -> client.submit("owner/canceled", Map.of()));
        Assertions.assertEquals(RemoteErrorCategory.ABANDONED, canceled.category());
        Assertions.assertFalse(canceled.retryable());
        Assertions.assertEquals("p4", canceled.predictionId());
    }

    @Test
    void createdPredictionIsNeverResubmittedWhenPollingFails() throws Exception {
        AtomicInteger posts = new AtomicInteger();
        AtomicInteger polls = new AtomicInteger();
        server.createContext("/v1/models/owner/model/predictions", exchange -> {
            capture(exchange);
            posts.incrementAndGet();
            respond(exchange, 201, """
                    {"id": "p5", "status": "starting", "urls": {"get": "%s/v1/predictions/p5"}}
                    """.formatted(base));
        });
        server.createContext("/v1/predictions/p5", exchange -> {
            polls.incrementAndGet();
            respond(exchange, 503, "{\"detail\": \"unavailable\"}");
        });
        ReplicateClient client = client("tok");
        Retrier retrier = new Retrier(new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(1)),
                duration -> {
                }, () -> 0.0, EventSink.NOOP);
        Dispatcher dispatcher = new Dispatcher(new SubmissionPayloads(), retrier, Clock.systemUTC(), EventSink.NOOP);

        List<JobResult> results = dispatcher.dispatch(List.of(Combination.of(Map.of("prompt", "a cat"))), 1,
                payload -> client.submit("owner/model", payload));

        Assertions.assertEquals(1, posts.get());
        Assertions.assertEquals(3, polls.get());
        JobResult result = results.get(0);
        Assertions.assertEquals(JobStatus.FAILED, result.status());
        Assertions.assertEquals(1, result.attempts());
        Assertions.assertTrue(result.error().startsWith("ABANDONED: prediction p5"), result.error());
    }

    @Test
    void predictionDeadlineIsNotRetryable() {
        server.createContext("/v1/models/owner/slow/predictions", exchange ->
                respond(exchange, 201, "{\"id\": \"p6\", \"status\": \"processing\"}"));
        ReplicateClient client = new ReplicateClient(base, "tok", HttpClient.newHttpClient(), Duration.ofMillis(1),
                Duration.ofMillis(-1), duration -> {
                });

        RemoteServiceException late = Assertions.assertThrows(RemoteServiceException.class,
                () -> client.submit("owner/slow", Map.of()));
        Assertions.assertEquals(RemoteErrorCategory.ABANDONED, late.category());
        Assertions.assertEquals("p6", late.predictionId());
    }

    @Test
    void fetchReturnsBytesAndClassifiesStatus() throws Exception {
        byte[] payload = {1, 2, 3, 4, 5};
        server.createContext("/files/out.png", exchange -> {
            capture(exchange);
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        });
        server.createContext("/files/missing.png", exchange -> respond(exchange, 404, "not found"));
        server.createContext("/files/busy.png", exchange -> respond(exchange, 503, "busy"));

        ReplicateClient client = client("tok");
        Assertions.assertArrayEquals(payload, client.fetch(new ArtifactReference(base + "/files/out.png")));
        Assertions.assertEquals("Bearer tok", authHeaders.get(0));

        RemoteServiceException missing = Assertions.assertThrows(RemoteServiceException.class,
                () -> client.fetch(new ArtifactReference(base + "/files/missing.png")));
        Assertions.assertEquals(RemoteErrorCategory.INVALID_INPUT, missing.category());
        RemoteServiceException busy = Assertions.assertThrows(RemoteServiceException.class,
                () -> client.fetch(new ArtifactReference(base + "/files/busy.png")));
        Assertions.assertTrue(busy.retryable());
    }

    @Test
    void missingTokenIsAStartupError() {
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> ReplicateClient.fromEnvironment(Map.of()));
        Assertions.assertTrue(e.getMessage().contains("REPLICATE_API_TOKEN"));
    }

    @Test
    void artifactExtensionFallsBackToPng() {
        Assertions.assertEquals("png", new ArtifactReference("https://cdn.example/output").extension());
        Assertions.assertEquals("jpg", new ArtifactReference("https://cdn.example/a/b.JPG?sig=1").extension());
        Assertions.assertEquals("png", new ArtifactReference("https://cdn.example/a.b/c").extension());
    }

    private ReplicateClient client(String token) {
        return new ReplicateClient(base, token, HttpClient.newHttpClient(), Duration.ofMillis(1),
                Duration.ofSeconds(30), duration -> {
                });
    }

    private void capture(HttpExchange exchange) throws IOException {
        String auth = exchange.getRequestHeaders().getFirst("Authorization");
        authHeaders.add(auth == null ? "" : auth);
        byte[] raw = exchange.getRequestBody().readAllBytes();
        if (raw.length > 0) {
            bodies.add(Jsons.mapper().readTree(raw));
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
