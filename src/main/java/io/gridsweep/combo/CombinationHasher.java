package io.gridsweep.combo;

import io.gridsweep.util.Hashing;

import java.util.LinkedHashMap;
import java.util.Map;

public final class CombinationHasher {
    /** Keys starting with this prefix are bookkeeping and never part of a combination's identity. */
    public static final String RESERVED_PREFIX = "_";

    private CombinationHasher() {
    }

    public static String hash(Map<String, ?> params) {
        return Hashing.sha1Hex(CanonicalJson.write(visible(params)));
    }

    public static Map<String, Object> visible(Map<String, ?> params) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            if (!isReserved(entry.getKey())) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out;
    }

    public static boolean isReserved(String key) {
        return key != null && key.startsWith(RESERVED_PREFIX);
    }
}
