package io.gridsweep.model;

import java.util.Locale;

/** Outcome of the remote job itself, independent of local persistence. */
public enum RemoteStatus {
    SUCCEEDED,
    FAILED,
    NOT_SUBMITTED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RemoteStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return NOT_SUBMITTED;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
