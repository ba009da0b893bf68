package io.gridsweep.combo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One fully resolved assignment of values to every sweep parameter. The
 * content hash is computed once at construction and never changes.
 */
public final class Combination {
    public static final String HASH_KEY = "_hash";

    private final Map<String, Object> values;
    private final String hash;

    private Combination(Map<String, Object> values, String hash) {
        this.values = values;
        this.hash = hash;
    }

    public static Combination of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            copy.put(entry.getKey(), freeze(entry.getValue()));
        }
        Map<String, Object> frozen = Collections.unmodifiableMap(copy);
        return new Combination(frozen, CombinationHasher.hash(frozen));
    }

    // Nested lists and maps are copied too, so no caller can change a value after hashing.
    private static Object freeze(Object value) {
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                items.add(freeze(item));
            }
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Map) {
            Map<String, Object> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                entries.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
            }
            return Collections.unmodifiableMap(entries);
        }
        return value;
    }

    public Map<String, Object> values() {
        return values;
    }

    public Map<String, Object> visibleValues() {
        return Collections.unmodifiableMap(CombinationHasher.visible(values));
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String hash() {
        return hash;
    }

    /** Values plus the {@code _hash} bookkeeping key, as written to disk. */
    public Map<String, Object> toRecord() {
        Map<String, Object> out = new LinkedHashMap<>(values);
        out.put(HASH_KEY, hash);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Combination)) {
            return false;
        }
        Combination other = (Combination) o;
        return hash.equals(other.hash) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hash, values);
    }

    @Override
    public String toString() {
        return "Combination{" + hash + " " + values + "}";
    }
}
