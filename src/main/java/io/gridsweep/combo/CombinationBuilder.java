package io.gridsweep.combo;

import io.gridsweep.config.SweepConfig;
import io.gridsweep.observability.EventSink;
import io.gridsweep.observability.SweepEvent;
import io.gridsweep.param.ConfigurationException;
import io.gridsweep.param.ParameterSpec;
import io.gridsweep.param.ResolutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Expands parameter specs into the Cartesian product of all varying
 * parameters, merged with the fixed ones.
 *
 * <p>A parameter is fixed when it resolves to exactly one value, so a
 * {@code random_int} behaves like a static value within one build pass.
 * The same specs and the same {@link Random} seed always produce the same
 * combinations in the same order.
 */
public final class CombinationBuilder {
    private final Random random;
    private final FallbackMode fallbackMode;
    private final EventSink events;

    public CombinationBuilder(Random random, FallbackMode fallbackMode, EventSink events) {
        this.random = random;
        this.fallbackMode = fallbackMode == null ? FallbackMode.BEST_EFFORT : fallbackMode;
        this.events = events == null ? EventSink.NOOP : events;
    }

    public static CombinationBuilder forConfig(SweepConfig config, FallbackMode fallbackMode, EventSink events) {
        Long seed = config.meta().randomSeed();
        Random random = seed == null ? new Random() : new Random(seed);
        return new CombinationBuilder(random, fallbackMode, events);
    }

    public static List<Combination> buildCombinations(SweepConfig config, FallbackMode fallbackMode, EventSink events) {
        return forConfig(config, fallbackMode, events).build(config.params());
    }

    public List<Combination> build(Map<String, ParameterSpec> parameters) {
        return expand(parameters).combinations();
    }

    public List<ParameterMetadata> metadata(Map<String, ParameterSpec> parameters) {
        return expand(parameters).parameters();
    }

    /** Resolves every parameter once and derives both the combinations and their metadata from it. */
    public Expansion expand(Map<String, ParameterSpec> parameters) {
        Map<String, List<Object>> resolved = new LinkedHashMap<>();
        List<ParameterMetadata> metadata = new ArrayList<>(parameters.size());
        for (Map.Entry<String, ParameterSpec> entry : parameters.entrySet()) {
            List<Object> values = resolve(entry.getKey(), entry.getValue());
            resolved.put(entry.getKey(), values);
            metadata.add(new ParameterMetadata(entry.getKey(), entry.getValue().kind(), values.size() == 1, values));
        }
        return new Expansion(combine(resolved), metadata);
    }

    private List<Combination> combine(Map<String, List<Object>> resolved) {
        Map<String, Object> fixed = new LinkedHashMap<>();
        Map<String, List<Object>> varying = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : resolved.entrySet()) {
            List<Object> values = entry.getValue();
            if (values.size() == 1) {
                fixed.put(entry.getKey(), values.get(0));
            } else {
                varying.put(entry.getKey(), values);
            }
        }

        if (varying.isEmpty()) {
            events.emit(SweepEvent.info("builder.static_only", null,
                    "no varying parameters, emitting a single combination", Map.of("parameters", fixed.size())));
            return List.of(Combination.of(fixed));
        }

        List<String> names = new ArrayList<>(varying.keySet());
        List<List<Object>> axes = new ArrayList<>(varying.values());
        int total = expectedCount(names, axes);
        List<Combination> out = new ArrayList<>(total);
        int[] cursor = new int[axes.size()];
        for (int n = 0; n < total; n++) {
            Map<String, Object> values = new LinkedHashMap<>(fixed);
            for (int i = 0; i < names.size(); i++) {
                values.put(names.get(i), axes.get(i).get(cursor[i]));
            }
            out.add(Combination.of(values));
            advance(cursor, axes);
        }
        events.emit(SweepEvent.info("builder.built", null, "built " + out.size() + " combinations",
                Map.of("varying", names, "fixed", new ArrayList<>(fixed.keySet()))));
        return Collections.unmodifiableList(out);
    }

    private List<Object> resolve(String name, ParameterSpec spec) {
        try {
            return spec.resolve(name, random);
        } catch (ResolutionException e) {
            if (fallbackMode == FallbackMode.STRICT) {
                throw e;
            }
            String fallback = spec.describe();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("parameter", name);
            details.put("error", e.getMessage());
            details.put("fallback", fallback);
            events.emit(SweepEvent.warn("builder.fallback", null,
                    "could not resolve parameter '" + name + "', using " + fallback, details));
            return Collections.singletonList(fallback);
        }
    }

    // Last axis varies fastest.
    private static void advance(int[] cursor, List<List<Object>> axes) {
        for (int i = cursor.length - 1; i >= 0; i--) {
            cursor[i]++;
            if (cursor[i] < axes.get(i).size()) {
                return;
            }
            cursor[i] = 0;
        }
    }

    private static int expectedCount(List<String> names, List<List<Object>> axes) {
        long total = 1L;
        for (List<Object> axis : axes) {
            total *= axis.size();
            if (total > Integer.MAX_VALUE) {
                throw new ConfigurationException("parameters " + names + " would produce more than "
                        + Integer.MAX_VALUE + " combinations");
            }
        }
        return (int) total;
    }
}
