package io.gridsweep.combo;

import java.util.List;

public record ParameterMetadata(
        String name,
        String kind,
        boolean isStatic,
        List<Object> values
) {
}
