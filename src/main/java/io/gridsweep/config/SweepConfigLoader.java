package io.gridsweep.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsweep.param.ConfigurationException;
import io.gridsweep.param.ParameterSpec;
import io.gridsweep.param.ParameterSpecParser;
import io.gridsweep.param.ParameterValues;
import io.gridsweep.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SweepConfigLoader {
    private static final List<String> REQUIRED_META = List.of("name", "base_model", "output_dir");

    private final ParameterSpecParser parser;

    public SweepConfigLoader() {
        this(new ParameterSpecParser());
    }

    public SweepConfigLoader(ParameterSpecParser parser) {
        this.parser = parser;
    }

    public SweepConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Config file not found: " + path);
        }
        ConfigFormat format = ConfigFormat.fromPath(path);
        JsonNode root;
        try {
            root = format.mapper().readTree(path.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse config file " + path + ": " + e.getMessage(), e);
        }
        return fromTree(root, format);
    }

    public SweepConfig fromTree(JsonNode root, ConfigFormat format) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Invalid configuration: top level must be a mapping");
        }
        SweepMeta meta = parseMeta(root.get("meta"));
        Map<String, ParameterSpec> params = parser.parseAll(root.get("params"));
        GridAxes axes = parseGridAxes(root.get("grid_axes"));
        return new SweepConfig(meta, params, axes, root.deepCopy(), format);
    }

    /** Writes {@code cfg.<ext>} into the sweep directory in the format the config was read from. */
    public Path saveSnapshot(SweepConfig config, SweepPaths paths) {
        Path target = paths.configSnapshot(config.format().extension());
        try {
            Files.createDirectories(target.getParent());
            config.format().mapper().writerWithDefaultPrettyPrinter().writeValue(target.toFile(), config.source());
            return target;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write config snapshot: " + target, e);
        }
    }

    public Path writeTemplate(Path output) {
        ConfigFormat format;
        try {
            format = ConfigFormat.fromPath(output);
        } catch (ConfigurationException e) {
            format = ConfigFormat.JSON;
        }
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            format.mapper().writerWithDefaultPrettyPrinter().writeValue(output.toFile(), template());
            return output;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write template: " + output, e);
        }
    }

    static ObjectNode template() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        ObjectNode meta = root.putObject("meta");
        meta.put("name", "my_sweep");
        meta.put("base_model", "stability-ai/sdxl");
        meta.put("output_dir", "./runs");
        ObjectNode axes = root.putObject("grid_axes");
        axes.put("rows", "cfg");
        axes.put("cols", "steps");
        ObjectNode params = root.putObject("params");
        params.putObject("prompt").put("static", "A beautiful landscape with mountains and a lake");
        params.putObject("width").put("static", 1024);
        params.putObject("height").put("static", 1024);
        params.putObject("sampler_name").put("static", "euler_a");
        params.putObject("scheduler").put("static", "karras");
        params.putObject("seed").putObject("random_int").put("min", 1).put("max", 4294967295L);
        params.putObject("cfg").putObject("range").put("start", 4).put("end", 16).put("step", 4);
        params.putObject("steps").putArray("list").add(20).add(40).add(60);
        return root;
    }

    private SweepMeta parseMeta(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Invalid configuration: meta must be a mapping");
        }
        for (String field : REQUIRED_META) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull() || value.asText("").isBlank()) {
                throw new ConfigurationException("Missing required meta field: " + field);
            }
        }
        Long seed = null;
        JsonNode seedNode = node.get("random_seed");
        if (seedNode != null && !seedNode.isNull()) {
            if (!seedNode.isIntegralNumber() || !seedNode.canConvertToLong()) {
                throw new ConfigurationException("meta.random_seed must be an integer");
            }
            seed = seedNode.longValue();
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!REQUIRED_META.contains(entry.getKey()) && !"random_seed".equals(entry.getKey())) {
                extra.put(entry.getKey(), ParameterValues.toJava(entry.getValue()));
            }
        }
        return new SweepMeta(
                node.get("name").asText().trim(),
                node.get("base_model").asText().trim(),
                node.get("output_dir").asText().trim(),
                seed,
                extra
        );
    }

    private static GridAxes parseGridAxes(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new ConfigurationException("grid_axes must be a mapping with rows and cols");
        }
        return new GridAxes(node.path("rows").asText(""), node.path("cols").asText(""));
    }
}
