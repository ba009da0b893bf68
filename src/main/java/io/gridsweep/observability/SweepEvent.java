package io.gridsweep.observability;

import java.util.Map;

public record SweepEvent(
        Level level,
        String action,
        String hash,
        String message,
        Map<String, Object> details
) {
    public enum Level {
        INFO,
        WARN,
        ERROR
    }

    public SweepEvent {
        details = details == null ? Map.of() : details;
    }

    public static SweepEvent info(String action, String hash, String message, Map<String, Object> details) {
        return new SweepEvent(Level.INFO, action, hash, message, details);
    }

    public static SweepEvent warn(String action, String hash, String message, Map<String, Object> details) {
        return new SweepEvent(Level.WARN, action, hash, message, details);
    }

    public static SweepEvent error(String action, String hash, String message, Map<String, Object> details) {
        return new SweepEvent(Level.ERROR, action, hash, message, details);
    }
}
