package io.gridsweep.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SweepMeta(
        String name,
        String baseModel,
        String outputDir,
        Long randomSeed,
        Map<String, Object> extra
) {
    public SweepMeta {
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }
}
