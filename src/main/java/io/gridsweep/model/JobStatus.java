package io.gridsweep.model;

import java.util.Locale;

public enum JobStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Job status cannot be empty");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
