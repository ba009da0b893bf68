package io.gridsweep.dispatch;

import io.gridsweep.combo.Combination;
import io.gridsweep.combo.CombinationHasher;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives the remote input from a combination: drops bookkeeping keys and
 * coerces a fixed set of parameter names to the shapes the remote model
 * expects. The combination itself is never modified.
 */
public final class SubmissionPayloads {
    public enum Coercion {
        STRING,
        INTEGER,
        FLOAT
    }

    public static final Map<String, Coercion> DEFAULT_COERCIONS = Map.of(
            "sampler_name", Coercion.STRING,
            "scheduler", Coercion.STRING,
            "width", Coercion.INTEGER,
            "height", Coercion.INTEGER,
            "steps", Coercion.INTEGER,
            "seed", Coercion.INTEGER,
            "cfg", Coercion.FLOAT
    );

    private final Map<String, Coercion> coercions;

    public SubmissionPayloads() {
        this(DEFAULT_COERCIONS);
    }

    public SubmissionPayloads(Map<String, Coercion> coercions) {
        this.coercions = Map.copyOf(coercions);
    }

    public Map<String, Object> toPayload(Combination combination) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : combination.values().entrySet()) {
            String key = entry.getKey();
            if (CombinationHasher.isReserved(key)) {
                continue;
            }
            Coercion coercion = coercions.get(key);
            out.put(key, coercion == null ? entry.getValue() : coerce(key, entry.getValue(), coercion));
        }
        return out;
    }

    static Object coerce(String key, Object value, Coercion coercion) {
        if (value == null) {
            return null;
        }
        return switch (coercion) {
            case STRING -> String.valueOf(value);
            case INTEGER -> toInteger(key, value);
            case FLOAT -> toFloat(key, value);
        };
    }

    private static Object toInteger(String key, Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof BigInteger) {
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            String text = (String) value;
            String trimmed = text.trim();
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException ignored) {
                try {
                    return (long) Double.parseDouble(trimmed);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("parameter '" + key + "' expects an integer, got '" + text + "'", e);
                }
            }
        }
        throw new IllegalArgumentException("parameter '" + key + "' expects an integer, got " + value);
    }

    private static Object toFloat(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String text = (String) value;
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("parameter '" + key + "' expects a number, got '" + text + "'", e);
            }
        }
        throw new IllegalArgumentException("parameter '" + key + "' expects a number, got " + value);
    }
}
