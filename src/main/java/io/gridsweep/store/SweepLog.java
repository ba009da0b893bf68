package io.gridsweep.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridsweep.model.JobResult;
import io.gridsweep.model.JobStatus;
import io.gridsweep.model.RemoteStatus;
import io.gridsweep.observability.EventSink;
import io.gridsweep.observability.SweepEvent;
import io.gridsweep.param.ParameterValues;
import io.gridsweep.util.Jsons;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL record of job outcomes, one compact row per line. Rows are
 * never rewritten; readers take the last row for a hash as authoritative.
 */
public final class SweepLog {
    private final Path logFile;
    private final EventSink events;

    public SweepLog(Path logFile, EventSink events) {
        this.logFile = logFile;
        this.events = events == null ? EventSink.NOOP : events;
    }

    public Path file() {
        return logFile;
    }

    public synchronized void append(JobResult result) throws IOException {
        Files.createDirectories(logFile.getParent());
        String line = Jsons.toCompactJson(toRow(result)) + "\n";
        Files.writeString(logFile, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    /** Every readable record in append order. Unparseable lines are reported and skipped. */
    public synchronized List<JobResult> replay() throws IOException {
        if (!Files.exists(logFile)) {
            return List.of();
        }
        List<JobResult> out = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    out.add(fromRow(Jsons.mapper().readTree(line)));
                } catch (IOException | IllegalArgumentException | DateTimeParseException e) {
                    events.emit(SweepEvent.warn("log.unreadable_row", null,
                            "skipping line " + lineNumber + " of " + logFile.getFileName() + ": " + e.getMessage(),
                            Map.of("line", lineNumber)));
                }
            }
        }
        return out;
    }

    public static Map<String, Object> toRow(JobResult result) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("status", result.status().wireName());
        row.put("_hash", result.hash());
        row.put("params", result.params());
        row.put("timestamp", result.submittedAt() == null ? null : result.submittedAt().toString());
        row.put("duration", seconds(result.duration()));
        row.put("result_url", result.resultUrl());
        row.put("output_path", result.outputPath());
        row.put("thumb_path", result.thumbPath());
        row.put("error", result.error());
        row.put("remote_status", result.remoteStatus().wireName());
        row.put("attempts", result.attempts());
        return row;
    }

    @SuppressWarnings("unchecked")
    public static JobResult fromRow(JsonNode row) {
        String hash = text(row, "_hash");
        if (hash == null) {
            throw new IllegalArgumentException("row has no _hash");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        Object rawParams = ParameterValues.toJava(row.path("params"));
        if (rawParams instanceof Map) {
            params.putAll((Map<String, Object>) rawParams);
        }
        String timestamp = text(row, "timestamp");
        double duration = row.path("duration").asDouble(0.0);
        return new JobResult(
                JobStatus.fromWire(text(row, "status")),
                hash,
                timestamp == null ? null : Instant.parse(timestamp),
                Duration.ofNanos(Math.round(duration * 1_000_000_000L)),
                params,
                text(row, "result_url"),
                text(row, "output_path"),
                text(row, "thumb_path"),
                text(row, "error"),
                RemoteStatus.fromWire(text(row, "remote_status")),
                row.path("attempts").asInt(0)
        );
    }

    private static double seconds(Duration duration) {
        return BigDecimal.valueOf(duration.toNanos()).movePointLeft(9).doubleValue();
    }

    private static String text(JsonNode row, String field) {
        JsonNode node = row.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
