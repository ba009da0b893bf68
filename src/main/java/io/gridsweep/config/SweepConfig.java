package io.gridsweep.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridsweep.param.ParameterSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated sweep definition. {@code source} keeps the document as it was
 * read so the run can snapshot it unchanged.
 */
public record SweepConfig(
        SweepMeta meta,
        Map<String, ParameterSpec> params,
        GridAxes gridAxes,
        JsonNode source,
        ConfigFormat format
) {
    public SweepConfig {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        gridAxes = gridAxes == null ? defaultGridAxes(params) : gridAxes;
    }

    /** Rows and cols default to the first two parameters that are not {@code static}. */
    static GridAxes defaultGridAxes(Map<String, ParameterSpec> params) {
        List<String> varying = new ArrayList<>();
        for (Map.Entry<String, ParameterSpec> entry : params.entrySet()) {
            if (!(entry.getValue() instanceof ParameterSpec.Static)) {
                varying.add(entry.getKey());
            }
        }
        if (varying.size() >= 2) {
            return new GridAxes(varying.get(0), varying.get(1));
        }
        if (varying.size() == 1) {
            return new GridAxes(varying.get(0), "");
        }
        return GridAxes.NONE;
    }
}
