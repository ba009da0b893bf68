package io.gridsweep.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * On-disk layout of one sweep:
 * {@code <output_dir>/<sweep_name>/{cfg.<ext>, sweep_log.jsonl, audit/, outputs/<hash>/}}.
 */
public final class SweepPaths {
    public static final String DEFAULT_OUTPUT_DIR = "runs";
    public static final String DEFAULT_SWEEP_NAME = "sweep";
    public static final String LOG_FILE = "sweep_log.jsonl";
    public static final String OUTPUTS_DIR = "outputs";
    public static final String PARAMS_FILE = "params.json";
    public static final String THUMB_FILE = "thumb.jpg";

    private final Path sweepDir;
    private final String sweepName;

    public SweepPaths(Path sweepDir, String sweepName) {
        this.sweepDir = sweepDir;
        this.sweepName = sweepName;
    }

    public static SweepPaths of(SweepMeta meta) {
        return of(meta.outputDir(), meta.name());
    }

    public static SweepPaths of(String outputDir, String sweepName) {
        Path base = outputDir == null || outputDir.isBlank()
                ? Paths.get(DEFAULT_OUTPUT_DIR)
                : Paths.get(outputDir);
        String safeName = sanitizeName(sweepName);
        return new SweepPaths(base.resolve(safeName).toAbsolutePath().normalize(), safeName);
    }

    static String sanitizeName(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_SWEEP_NAME : raw.trim();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '_');
        }
        String value = sb.toString();
        if (value.startsWith(".")) {
            value = "sweep" + value;
        }
        return value;
    }

    public Path sweepDir() {
        return sweepDir;
    }

    public String sweepName() {
        return sweepName;
    }

    public Path configSnapshot(String extension) {
        return sweepDir.resolve("cfg." + extension);
    }

    public Path logFile() {
        return sweepDir.resolve(LOG_FILE);
    }

    public Path auditFile() {
        return sweepDir.resolve("audit").resolve("events.jsonl");
    }

    public Path outputsDir() {
        return sweepDir.resolve(OUTPUTS_DIR);
    }

    public Path hashDir(String hash) {
        return outputsDir().resolve(hash);
    }

    public Path outputFile(String hash, String extension) {
        return hashDir(hash).resolve("output." + extension);
    }

    public Path thumbFile(String hash) {
        return hashDir(hash).resolve(THUMB_FILE);
    }

    public Path paramsFile(String hash) {
        return hashDir(hash).resolve(PARAMS_FILE);
    }
}
