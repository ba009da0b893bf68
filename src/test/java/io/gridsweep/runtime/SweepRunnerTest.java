package io.gridsweep.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridsweep.TestDirs;
import io.gridsweep.config.ConfigFormat;
import io.gridsweep.config.SweepConfig;
import io.gridsweep.config.SweepConfigLoader;
import io.gridsweep.config.SweepPaths;
import io.gridsweep.config.SweepSettings;
import io.gridsweep.dispatch.RetryPolicy;
import io.gridsweep.model.JobResult;
import io.gridsweep.model.JobStatus;
import io.gridsweep.remote.ArtifactFetcher;
import io.gridsweep.remote.ArtifactReference;
import io.gridsweep.remote.RemoteErrorCategory;
import io.gridsweep.remote.RemoteJobService;
import io.gridsweep.remote.RemoteServiceException;
import io.gridsweep.store.ImageIoThumbnailGenerator;
import io.gridsweep.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

final class SweepRunnerTest {
    private static final byte[] NOT_AN_IMAGE = "artifact".getBytes(StandardCharsets.UTF_8);

    @Test
    void rerunWithoutOverwriteDispatchesNothing() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-runner-");
        try {
            SweepConfig config = config(root);
            AtomicInteger submissions = new AtomicInteger();
            RemoteJobService remote = (model, input) -> {
                submissions.incrementAndGet();
                return new ArtifactReference("https://cdn.example/" + input.get("steps") + "-" + input.get("cfg") + ".bin");
            };
            SweepRunner runner = runner(settings(), remote);

            SweepReport first = runner.run(config);
            Assertions.assertEquals(12, first.totalCombinations());
            Assertions.assertEquals(12, first.dispatched());
            Assertions.assertEquals(12, first.count(JobStatus.SUCCEEDED));
            Assertions.assertFalse(first.anyFailed());
            Assertions.assertEquals(12, submissions.get());

            SweepReport second = runner.run(config);
            Assertions.assertEquals(0, second.dispatched());
            Assertions.assertEquals(12, second.alreadyCompleted());
            Assertions.assertEquals(12, submissions.get());

            SweepPaths paths = SweepPaths.of(config.meta());
            Map<String, JobResult> state = runner.resumeState(paths);
            Assertions.assertEquals(12, state.size());
            Assertions.assertTrue(Files.exists(paths.configSnapshot("json")));
            Assertions.assertEquals(12, Files.readAllLines(paths.logFile()).size());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void failedCombinationsComeBackOnlyWithRetryFailed() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-runner-");
        try {
            SweepConfig config = config(root);
            AtomicBoolean rejectForty = new AtomicBoolean(true);
            AtomicInteger submissions = new AtomicInteger();
            RemoteJobService remote = (model, input) -> {
                submissions.incrementAndGet();
                if (rejectForty.get() && Long.valueOf(40L).equals(input.get("steps"))) {
                    throw new RemoteServiceException(RemoteErrorCategory.INVALID_INPUT, "steps rejected");
                }
                return new ArtifactReference("https://cdn.example/out.bin");
            };

            SweepReport first = runner(settings(), remote).run(config);
            Assertions.assertEquals(4, first.count(JobStatus.FAILED));
            Assertions.assertTrue(first.anyFailed());

            SweepReport plain = runner(settings(), remote).run(config);
            Assertions.assertEquals(0, plain.dispatched());

            rejectForty.set(false);
            SweepReport retried = runner(settings().withRetryFailed(true), remote).run(config);
            Assertions.assertEquals(4, retried.dispatched());
            Assertions.assertEquals(4, retried.count(JobStatus.SUCCEEDED));
            Assertions.assertEquals(16, submissions.get());
            Assertions.assertEquals(12, runner(settings(), remote).resumeState(SweepPaths.of(config.meta()))
                    .values().stream().filter(JobResult::succeeded).count());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void overwriteDispatchesEverythingAgain() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-runner-");
        try {
            SweepConfig config = config(root);
            AtomicInteger submissions = new AtomicInteger();
            RemoteJobService remote = (model, input) -> {
                submissions.incrementAndGet();
                Assertions.assertEquals("owner/model", model);
                return new ArtifactReference("https://cdn.example/out.bin");
            };
            runner(settings(), remote).run(config);

            SweepReport again = runner(settings().withOverwrite(true), remote).run(config);

            Assertions.assertEquals(12, again.dispatched());
            Assertions.assertEquals(12, again.count(JobStatus.SUCCEEDED));
            Assertions.assertEquals(24, submissions.get());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void summaryIsPlainJson() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-runner-");
        try {
            SweepConfig config = config(root);
            SweepReport report = runner(settings(), (model, input) -> new ArtifactReference("https://cdn.example/a.bin"))
                    .run(config);

            JsonNode summary = Jsons.mapper().readTree(Jsons.toJson(report.toSummary()));

            Assertions.assertEquals("cats", summary.path("sweep").asText());
            Assertions.assertEquals(12, summary.path("succeeded").asInt());
            Assertions.assertEquals(12, summary.path("results").size());
            Assertions.assertEquals("succeeded", summary.path("results").get(0).path("status").asText());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    private static SweepConfig config(Path root) throws Exception {
        String json = """
                {"meta": {"name": "cats", "base_model": "owner/model", "output_dir": "%s"},
                 "params": {
                   "prompt": "a cat",
                   "steps": {"list": [20, 40, 60]},
                   "cfg": {"range": {"start": 4, "end": 16, "step": 4}}
                 }}
                """.formatted(root.resolve("runs").toString().replace("\\", "\\\\"));
        return new SweepConfigLoader().fromTree(Jsons.mapper().readTree(json), ConfigFormat.JSON);
    }

    private static SweepSettings settings() {
        return SweepSettings.defaults()
                .withConcurrency(3)
                .withRetryPolicies(RetryPolicy.noRetry(), RetryPolicy.noRetry());
    }

    private static SweepRunner runner(SweepSettings settings, RemoteJobService remote) {
        ArtifactFetcher fetcher = reference -> NOT_AN_IMAGE;
        return new SweepRunner(settings, remote, fetcher, new ImageIoThumbnailGenerator(),
                duration -> {
                }, Clock.systemUTC(), null);
    }
}
