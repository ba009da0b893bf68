package io.gridsweep.cli;

import io.gridsweep.combo.Combination;
import io.gridsweep.combo.CombinationBuilder;
import io.gridsweep.combo.Expansion;
import io.gridsweep.combo.FallbackMode;
import io.gridsweep.config.SweepConfig;
import io.gridsweep.config.SweepConfigLoader;
import io.gridsweep.config.SweepPaths;
import io.gridsweep.config.SweepSettings;
import io.gridsweep.model.JobResult;
import io.gridsweep.observability.AuditLogger;
import io.gridsweep.observability.ConsoleEventSink;
import io.gridsweep.observability.EventSink;
import io.gridsweep.param.ConfigurationException;
import io.gridsweep.remote.ReplicateClient;
import io.gridsweep.runtime.SweepReport;
import io.gridsweep.runtime.SweepRunner;
import io.gridsweep.store.ImageIoThumbnailGenerator;
import io.gridsweep.store.SweepLog;
import io.gridsweep.util.Jsons;
import io.gridsweep.util.Sleeper;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "gridsweep",
        mixinStandardHelpOptions = true,
        description = "Resumable parameter sweeps against a remote generative compute service",
        subcommands = {
                GridSweepCommand.RunCommand.class,
                GridSweepCommand.CombinationsCommand.class,
                GridSweepCommand.StatusCommand.class,
                GridSweepCommand.TemplateCommand.class
        }
)
public final class GridSweepCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED_COMBINATIONS = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_INTERRUPTED = 130;

    @Option(names = {"-v", "--verbose"}, description = "Print INFO events as well as warnings and errors")
    boolean verbose;

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;

    public GridSweepCommand() {
        this(System.getenv(), System.out, System.err);
    }

    GridSweepCommand(Map<String, String> env, PrintStream out, PrintStream err) {
        this.env = env;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run() {
        out.println("Use subcommands: run | combinations | status | template");
    }

    EventSink console() {
        return new ConsoleEventSink(err, verbose);
    }

    int configError(ConfigurationException e) {
        err.println("error: " + e.getMessage());
        return EXIT_CONFIG_ERROR;
    }

    @Command(name = "run", description = "Run every pending combination of a sweep config")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        GridSweepCommand parent;

        @Parameters(index = "0", description = "Sweep config file (.yaml, .yml or .json)")
        Path config;

        @Option(names = {"-c", "--concurrency"}, defaultValue = "" + SweepSettings.DEFAULT_CONCURRENCY,
                description = "Maximum simultaneous remote jobs")
        int concurrency;

        @Option(names = {"-o", "--overwrite"}, description = "Rerun and rewrite combinations that already have results")
        boolean overwrite;

        @Option(names = {"-r", "--retry-failed"}, description = "Rerun combinations whose latest record failed")
        boolean retryFailed;

        @Option(names = {"--strict-params"}, description = "Abort when a parameter cannot be resolved")
        boolean strictParams;

        @Override
        public Integer call() {
            try {
                if (concurrency < 1 || concurrency > SweepSettings.MAX_CONCURRENCY) {
                    throw new ConfigurationException(
                            "--concurrency must be between 1 and " + SweepSettings.MAX_CONCURRENCY);
                }
                ReplicateClient client = ReplicateClient.fromEnvironment(parent.env);
                SweepConfig sweep = new SweepConfigLoader().load(config);
                SweepSettings settings = SweepSettings.defaults()
                        .withConcurrency(concurrency)
                        .withOverwrite(overwrite)
                        .withRetryFailed(retryFailed)
                        .withFallbackMode(strictParams ? FallbackMode.STRICT : FallbackMode.BEST_EFFORT);
                SweepPaths paths = SweepPaths.of(sweep.meta());
                EventSink events = EventSink.composite(
                        new AuditLogger(paths.auditFile(), paths.sweepName()),
                        parent.console()
                );
                SweepRunner runner = new SweepRunner(settings, client, client, new ImageIoThumbnailGenerator(),
                        Sleeper.SYSTEM, Clock.systemUTC(), events);
                SweepReport report = runner.run(sweep);
                parent.out.println(Jsons.toJson(report.toSummary()));
                return report.anyFailed() ? EXIT_FAILED_COMBINATIONS : EXIT_OK;
            } catch (ConfigurationException e) {
                return parent.configError(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                parent.err.println("interrupted; persisted results remain resumable");
                return EXIT_INTERRUPTED;
            }
        }
    }

    @Command(name = "combinations", description = "Print the combinations a config expands to without running them")
    static final class CombinationsCommand implements Callable<Integer> {
        @ParentCommand
        GridSweepCommand parent;

        @Parameters(index = "0", description = "Sweep config file")
        Path config;

        @Option(names = {"--strict-params"}, description = "Abort when a parameter cannot be resolved")
        boolean strictParams;

        @Override
        public Integer call() {
            try {
                SweepConfig sweep = new SweepConfigLoader().load(config);
                FallbackMode mode = strictParams ? FallbackMode.STRICT : FallbackMode.BEST_EFFORT;
                EventSink events = parent.console();
                Expansion expansion = CombinationBuilder.forConfig(sweep, mode, events).expand(sweep.params());
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("count", expansion.combinations().size());
                view.put("grid_axes", Map.of("rows", sweep.gridAxes().rows(), "cols", sweep.gridAxes().cols()));
                view.put("parameters", expansion.parameters());
                view.put("combinations", expansion.combinations().stream().map(Combination::toRecord).toList());
                parent.out.println(Jsons.toJson(view));
                return EXIT_OK;
            } catch (ConfigurationException e) {
                return parent.configError(e);
            }
        }
    }

    @Command(name = "status", description = "Summarize the sweep log of a config's output directory")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        GridSweepCommand parent;

        @Parameters(index = "0", description = "Sweep config file")
        Path config;

        @Override
        public Integer call() {
            try {
                SweepConfig sweep = new SweepConfigLoader().load(config);
                SweepPaths paths = SweepPaths.of(sweep.meta());
                List<JobResult> history = new SweepLog(paths.logFile(), parent.console()).replay();
                Map<String, Map<String, Object>> perHash = new LinkedHashMap<>();
                int succeeded = 0;
                int failed = 0;
                for (JobResult row : history) {
                    Map<String, Object> entry = perHash.computeIfAbsent(row.hash(), h -> {
                        Map<String, Object> fresh = new LinkedHashMap<>();
                        fresh.put("succeeded", 0);
                        fresh.put("failed", 0);
                        return fresh;
                    });
                    String key = row.status().wireName();
                    entry.merge(key, 1, (a, b) -> (Integer) a + (Integer) b);
                    entry.put("latest", key);
                    if (row.succeeded()) {
                        succeeded++;
                    } else if (row.failed()) {
                        failed++;
                    }
                }
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("sweep", paths.sweepName());
                view.put("log", paths.logFile().toString());
                view.put("records", history.size());
                view.put("succeeded_records", succeeded);
                view.put("failed_records", failed);
                view.put("hashes", perHash);
                parent.out.println(Jsons.toJson(view));
                return EXIT_OK;
            } catch (ConfigurationException e) {
                return parent.configError(e);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read sweep log", e);
            }
        }
    }

    @Command(name = "template", description = "Write an example sweep config (YAML or JSON by extension)")
    static final class TemplateCommand implements Callable<Integer> {
        @ParentCommand
        GridSweepCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Output path", defaultValue = "sweep.yaml")
        Path output;

        @Override
        public Integer call() {
            Path written = new SweepConfigLoader().writeTemplate(output);
            parent.out.println("Template written to: " + written);
            return EXIT_OK;
        }
    }
}
