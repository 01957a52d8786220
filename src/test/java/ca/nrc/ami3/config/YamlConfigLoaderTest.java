package ca.nrc.ami3.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommon() throws Exception {
    Path file = Files.writeString(tempDir.resolve("ami3.yaml"), """
        common:
          metricsExporter: none
          analysisWorkers: 2
        ami3:
          analysisWorkers: 4
          saveAverages: true
          telemetry:
            endpoint: http://collector:4317
        inspect:
          verbose: true
        """);

    Map<String, String> values = YamlConfigLoader.load(file, DefaultsForMode.RUN_MODE).orElseThrow();

    assertEquals("none", values.get("metricsExporter"));
    assertEquals("4", values.get("analysisWorkers"));
    assertEquals("true", values.get("saveAverages"));
    assertEquals("http://collector:4317", values.get("telemetry.endpoint"));
    assertTrue(!values.containsKey("verbose"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "ami3").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path file = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Map.of(), YamlConfigLoader.load(file, "ami3").orElseThrow());
  }

  @Test
  void listsAreRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("list.yaml"), "ami3:\n  in:\n    - a\n    - b\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "ami3"));
  }

  @Test
  void malformedYamlIsRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("bad.yaml"), "ami3: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "ami3"));
  }
}
