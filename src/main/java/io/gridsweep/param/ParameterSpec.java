package io.gridsweep.param;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * How the value(s) of one sweep parameter are specified. Exactly one variant
 * is active; invalid variants cannot be constructed.
 */
public sealed interface ParameterSpec
        permits ParameterSpec.Static, ParameterSpec.Enumerated, ParameterSpec.NumericRange, ParameterSpec.RandomDraw {

    int MAX_RANGE_VALUES = 1000;

    /** Variant name as written in config files. */
    String kind();

    /**
     * Concrete values for one build pass.
     *
     * @throws ResolutionException when the spec cannot produce any value
     */
    List<Object> resolve(String name, Random random);

    /** Deterministic textual form, used when a value cannot be resolved. */
    String describe();

    record Static(Object value) implements ParameterSpec {
        @Override
        public String kind() {
            return "static";
        }

        @Override
        public List<Object> resolve(String name, Random random) {
            return Collections.singletonList(value);
        }

        @Override
        public String describe() {
            return "static(" + value + ")";
        }
    }

    record Enumerated(List<Object> values) implements ParameterSpec {
        public Enumerated {
            if (values == null) {
                throw new ConfigurationException("list values cannot be null");
            }
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public String kind() {
            return "list";
        }

        @Override
        public List<Object> resolve(String name, Random random) {
            if (values.isEmpty()) {
                throw new ResolutionException(name, "list is empty");
            }
            return values;
        }

        @Override
        public String describe() {
            return "list(" + values + ")";
        }
    }

    record NumericRange(double start, double end, double step) implements ParameterSpec {
        private static final double EPSILON = 1e-9;

        public NumericRange {
            if (!Double.isFinite(start) || !Double.isFinite(end) || !Double.isFinite(step)) {
                throw new ConfigurationException("range bounds must be finite numbers");
            }
            if (step <= 0) {
                throw new ConfigurationException("range step must be positive, got " + step);
            }
            if (end < start) {
                throw new ConfigurationException("range end " + end + " is below start " + start);
            }
            double steps = (end - start) / step + EPSILON;
            if (steps >= MAX_RANGE_VALUES) {
                throw new ConfigurationException(
                        "range would produce more than " + MAX_RANGE_VALUES + " values (start=" + start
                                + ", end=" + end + ", step=" + step + ")");
            }
        }

        public long count() {
            return projectedCount(start, end, step);
        }

        @Override
        public String kind() {
            return "range";
        }

        /**
         * Values follow numpy {@code arange} arithmetic: {@code start}, {@code start + step}, then
         * {@code start + i * delta} with {@code delta = (start + step) - start}, so hashes of sweeps
         * written by earlier tooling stay stable.
         */
        @Override
        public List<Object> resolve(String name, Random random) {
            int count = (int) count();
            List<Object> out = new ArrayList<>(count);
            out.add(start);
            if (count > 1) {
                double second = start + step;
                double delta = second - start;
                out.add(second);
                for (int i = 2; i < count; i++) {
                    out.add(start + i * delta);
                }
            }
            return Collections.unmodifiableList(out);
        }

        @Override
        public String describe() {
            return "range(start=" + start + ", end=" + end + ", step=" + step + ")";
        }

        private static long projectedCount(double start, double end, double step) {
            return (long) Math.floor((end - start) / step + EPSILON) + 1;
        }
    }

    record RandomDraw(long min, long max) implements ParameterSpec {
        @Override
        public String kind() {
            return "random_int";
        }

        @Override
        public List<Object> resolve(String name, Random random) {
            if (min > max) {
                throw new ResolutionException(name, "random_int min " + min + " exceeds max " + max);
            }
            long span = max - min + 1;
            if (span > 0) {
                return Collections.singletonList(min + Math.floorMod(random.nextLong(), span));
            }
            // max - min + 1 overflowed, so the interval holds over half of all longs
            long drawn = random.nextLong();
            while (drawn < min || drawn > max) {
                drawn = random.nextLong();
            }
            return Collections.singletonList(drawn);
        }

        @Override
        public String describe() {
            return "random_int(min=" + min + ", max=" + max + ")";
        }
    }
}
