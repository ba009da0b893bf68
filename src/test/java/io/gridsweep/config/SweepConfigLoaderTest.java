package io.gridsweep.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridsweep.TestDirs;
import io.gridsweep.param.ConfigurationException;
import io.gridsweep.param.ParameterSpec;
import io.gridsweep.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class SweepConfigLoaderTest {
    private final SweepConfigLoader loader = new SweepConfigLoader();

    @Test
    void loadsYamlConfigAndDefaultsGridAxes() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-config-");
        try {
            Path file = root.resolve("sweep.yaml");
            Files.writeString(file, """
                    meta:
                      name: cats
                      base_model: owner/model
                      output_dir: ./runs
                      random_seed: 42
                      notes: first pass
                    params:
                      prompt: a cat
                      steps:
                        list: [20, 40, 60]
                      cfg:
                        range: {start: 4, end: 16, step: 4}
                    """, StandardCharsets.UTF_8);

            SweepConfig config = loader.load(file);

            Assertions.assertEquals("cats", config.meta().name());
            Assertions.assertEquals("owner/model", config.meta().baseModel());
            Assertions.assertEquals(42L, config.meta().randomSeed());
            Assertions.assertEquals("first pass", config.meta().extra().get("notes"));
            Assertions.assertEquals(ConfigFormat.YAML, config.format());
            Assertions.assertEquals(new ParameterSpec.Enumerated(List.of(20L, 40L, 60L)), config.params().get("steps"));
            Assertions.assertEquals(new GridAxes("steps", "cfg"), config.gridAxes());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void explicitGridAxesWin() throws Exception {
        JsonNode tree = Jsons.mapper().readTree("""
                {"meta": {"name": "n", "base_model": "m", "output_dir": "o"},
                 "params": {"a": {"list": [1, 2]}, "b": {"list": [3, 4]}},
                 "grid_axes": {"rows": "b", "cols": "a"}}
                """);
        Assertions.assertEquals(new GridAxes("b", "a"), loader.fromTree(tree, ConfigFormat.JSON).gridAxes());
    }

    @Test
    void missingMetaFieldIsAConfigurationError() throws Exception {
        JsonNode tree = Jsons.mapper().readTree("""
                {"meta": {"name": "n", "output_dir": "o"}, "params": {"a": 1}}
                """);
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> loader.fromTree(tree, ConfigFormat.JSON));
        Assertions.assertEquals("Missing required meta field: base_model", e.getMessage());
    }

    @Test
    void rejectsMissingFilesAndUnknownExtensions() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-config-");
        try {
            Assertions.assertThrows(ConfigurationException.class, () -> loader.load(root.resolve("absent.yaml")));
            Path toml = root.resolve("sweep.toml");
            Files.writeString(toml, "x = 1", StandardCharsets.UTF_8);
            Assertions.assertThrows(ConfigurationException.class, () -> loader.load(toml));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void snapshotKeepsTheInputFormat() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-config-");
        try {
            Path file = root.resolve("sweep.json");
            Files.writeString(file, """
                    {"meta": {"name": "snap", "base_model": "m", "output_dir": "%s"},
                     "params": {"steps": {"list": [1, 2]}}}
                    """.formatted(root.resolve("runs").toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
            SweepConfig config = loader.load(file);
            SweepPaths paths = SweepPaths.of(config.meta());

            Path snapshot = loader.saveSnapshot(config, paths);

            Assertions.assertEquals(root.resolve("runs").resolve("snap").resolve("cfg.json").toAbsolutePath(), snapshot);
            Assertions.assertEquals(config.source(), Jsons.mapper().readTree(snapshot.toFile()));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void templateRoundTripsThroughTheLoader() throws Exception {
        Path root = Files.createTempDirectory("gridsweep-config-");
        try {
            Path yaml = loader.writeTemplate(root.resolve("example.yaml"));
            SweepConfig config = loader.load(yaml);
            Assertions.assertEquals("my_sweep", config.meta().name());
            Assertions.assertEquals(new ParameterSpec.NumericRange(4, 16, 4), config.params().get("cfg"));
            Assertions.assertEquals(new ParameterSpec.RandomDraw(1, 4294967295L), config.params().get("seed"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void sweepPathsSanitizeTheName() {
        SweepPaths paths = SweepPaths.of("out", "../my sweep");
        Assertions.assertEquals("sweep.._my_sweep", paths.sweepName());
        Assertions.assertTrue(paths.sweepDir().endsWith(paths.sweepName()));
        Assertions.assertEquals("params.json", paths.paramsFile("abc").getFileName().toString());
        Assertions.assertEquals("output.png", paths.outputFile("abc", "png").getFileName().toString());
    }
}
