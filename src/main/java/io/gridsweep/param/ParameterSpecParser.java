package io.gridsweep.param;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw declarative parameter entries into {@link ParameterSpec} values.
 *
 * <p>A bare scalar (or array) is an implicit {@code static}. An object must
 * set exactly one of {@code static}, {@code list}, {@code range},
 * {@code random_int}; a {@code null} field counts as unset. A {@code static}
 * whose value is itself a spec is unwrapped once; a second level is rejected.
 */
public final class ParameterSpecParser {
    public static final String STATIC = "static";
    public static final String LIST = "list";
    public static final String RANGE = "range";
    public static final String RANDOM_INT = "random_int";
    private static final List<String> VARIANT_FIELDS = List.of(STATIC, LIST, RANGE, RANDOM_INT);

    public Map<String, ParameterSpec> parseAll(JsonNode params) {
        if (params == null || !params.isObject()) {
            throw new ConfigurationException("params must be a mapping of parameter name to spec");
        }
        Map<String, ParameterSpec> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = params.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            out.put(entry.getKey(), parse(entry.getKey(), entry.getValue()));
        }
        return out;
    }

    public ParameterSpec parse(String name, JsonNode raw) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("parameter name cannot be empty");
        }
        try {
            return parse(name, raw, 0);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("parameter '" + name + "': " + e.getMessage(), e);
        }
    }

    private ParameterSpec parse(String name, JsonNode raw, int depth) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            throw new ConfigurationException("exactly one of static, list, range, or random_int must be set");
        }
        if (raw.isObject() && !isSpecObject(raw)) {
            throw new ConfigurationException("exactly one of static, list, range, or random_int must be set");
        }
        if (!raw.isObject()) {
            return new ParameterSpec.Static(ParameterValues.toJava(raw));
        }
        List<String> present = presentVariants(raw);
        if (present.size() != 1) {
            throw new ConfigurationException(
                    "exactly one of static, list, range, or random_int must be set, found " + present);
        }
        String variant = present.get(0);
        JsonNode body = raw.get(variant);
        return switch (variant) {
            case STATIC -> parseStatic(name, body, depth);
            case LIST -> parseList(body);
            case RANGE -> parseRange(body);
            case RANDOM_INT -> parseRandomInt(body);
            default -> throw new IllegalStateException("unhandled variant " + variant);
        };
    }

    private ParameterSpec parseStatic(String name, JsonNode body, int depth) {
        if (!isSpecObject(body)) {
            return new ParameterSpec.Static(ParameterValues.toJava(body));
        }
        if (depth >= 1) {
            throw new ConfigurationException("spec nested more than one level inside static");
        }
        return parse(name, body, depth + 1);
    }

    private ParameterSpec parseList(JsonNode body) {
        if (!body.isArray()) {
            throw new ConfigurationException("list must be a sequence of values");
        }
        List<Object> values = new ArrayList<>(body.size());
        for (JsonNode item : body) {
            if (isSpecObject(item)) {
                throw new ConfigurationException("list entries must be concrete values, not specs");
            }
            values.add(ParameterValues.toJava(item));
        }
        return new ParameterSpec.Enumerated(values);
    }

    private ParameterSpec parseRange(JsonNode body) {
        if (!body.isObject()) {
            throw new ConfigurationException("range must be a mapping with start, end and step");
        }
        return new ParameterSpec.NumericRange(
                requiredNumber(body, "start", RANGE),
                requiredNumber(body, "end", RANGE),
                requiredNumber(body, "step", RANGE)
        );
    }

    private ParameterSpec parseRandomInt(JsonNode body) {
        if (!body.isObject()) {
            throw new ConfigurationException("random_int must be a mapping with min and max");
        }
        return new ParameterSpec.RandomDraw(
                requiredInteger(body, "min"),
                requiredInteger(body, "max")
        );
    }

    private static double requiredNumber(JsonNode body, String field, String variant) {
        JsonNode value = body.get(field);
        if (value == null || !value.isNumber()) {
            throw new ConfigurationException(variant + "." + field + " must be a number");
        }
        return value.doubleValue();
    }

    private static long requiredInteger(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new ConfigurationException(RANDOM_INT + "." + field + " must be an integer");
        }
        return value.longValue();
    }

    private static boolean isSpecObject(JsonNode node) {
        if (node == null || !node.isObject()) {
            return false;
        }
        for (String field : VARIANT_FIELDS) {
            if (node.has(field)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> presentVariants(JsonNode node) {
        List<String> present = new ArrayList<>();
        for (String field : VARIANT_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                present.add(field);
            }
        }
        return present;
    }
}
