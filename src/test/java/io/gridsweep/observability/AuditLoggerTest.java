package io.gridsweep.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridsweep.TestDirs;
import io.gridsweep.util.Hashing;
import io.gridsweep.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class AuditLoggerTest {

    @Test
    void chainsRowsAndResumesFromTheLastHash() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-audit-");
        try {
            Path file = root.resolve("audit").resolve("events.jsonl");
            Clock clock = Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC);
            AuditLogger logger = new AuditLogger(file, "cats", clock);
            logger.emit(SweepEvent.info("sweep.start", null, "2 pending", Map.of("pending", 2)));
            logger.emit(SweepEvent.warn("dispatch.retry", "abc", "retrying", Map.of("delay_ms", 2000)));

            AuditLogger reopened = new AuditLogger(file, "cats", clock);
            Assertions.assertEquals(logger.currentHash(), reopened.currentHash());
            reopened.emit(SweepEvent.error("dispatch.failed", "abc", "gave up", Map.of()));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(3, lines.size());
            String previous = "";
            for (String line : lines) {
                JsonNode row = Jsons.mapper().readTree(line);
                Assertions.assertEquals(previous, row.path("prev_hash").asText());
                Map<String, Object> unhashed = new LinkedHashMap<>(Jsons.mapper().convertValue(row, Map.class));
                unhashed.remove("hash");
                Assertions.assertEquals(Hashing.sha256Hex(Jsons.toCompactJson(unhashed)), row.path("hash").asText());
                previous = row.path("hash").asText();
            }
            JsonNode second = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("WARN", second.path("level").asText());
            Assertions.assertEquals("abc", second.path("_hash").asText());
            Assertions.assertEquals("2026-10-18T12:00:00Z", second.path("timestamp").asText());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void masksCredentialsInDetails() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-audit-");
        try {
            Path file = root.resolve("events.jsonl");
            AuditLogger logger = new AuditLogger(file, "cats");
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("api_token", "r8_abcdefghijklmnop");
            details.put("header", "Bearer r8_abcdefghijklmnop");
            details.put("url", "https://cdn.example/out.png");
            logger.emit(SweepEvent.info("remote.submit", "abc", "submitted", details));

            JsonNode row = Jsons.mapper().readTree(Files.readAllLines(file).get(0));
            Assertions.assertEquals("***", row.path("details").path("api_token").asText());
            Assertions.assertEquals("***", row.path("details").path("header").asText());
            Assertions.assertEquals("https://cdn.example/out.png", row.path("details").path("url").asText());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void consoleShowsInfoOnlyWhenVerbose() {
        ByteArrayOutputStream quietBytes = new ByteArrayOutputStream();
        ByteArrayOutputStream loudBytes = new ByteArrayOutputStream();
        EventSink sinks = EventSink.composite(
                new ConsoleEventSink(new PrintStream(quietBytes, true, StandardCharsets.UTF_8), false),
                new ConsoleEventSink(new PrintStream(loudBytes, true, StandardCharsets.UTF_8), true)
        );
        sinks.emit(SweepEvent.info("dispatch.attempt", "0123456789abcdef", "attempt 1 of 6", Map.of()));
        sinks.emit(SweepEvent.warn("builder.fallback", null, "using describe()", Map.of()));

        String quiet = quietBytes.toString(StandardCharsets.UTF_8);
        String loud = loudBytes.toString(StandardCharsets.UTF_8);
        Assertions.assertFalse(quiet.contains("dispatch.attempt"));
        Assertions.assertTrue(quiet.contains("[WARN] builder.fallback - using describe()"));
        Assertions.assertTrue(loud.contains("[INFO] dispatch.attempt hash=0123456789ab - attempt 1 of 6"));
    }
}
