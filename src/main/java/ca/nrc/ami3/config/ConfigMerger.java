package ca.nrc.ami3.config;

import ca.nrc.ami3.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration sources with precedence CLI &gt; YAML &gt; defaults.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration of a mode.
   *
   * @param mode mode name used in validation messages
   * @param yaml flattened YAML values, if a file was supplied
   * @param cli CLI {@code key=value} arguments; {@code null} values are ignored
   * @param defaults embedded defaults
   * @param warn receives a message for every YAML key a CLI argument overrides; may be {@code null}
   * @return immutable effective configuration
   * @throws IllegalArgumentException if a merged value is invalid
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> cliValues = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    cliValues.forEach((key, value) -> {
      if (key == null || value == null) {
        return;
      }
      if (yamlValues.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, value);
    });

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    for (String key : new String[] {"saveAverages", "allowOverwrite", "dryRun", "verbose"}) {
      String value = effective.get(key);
      if (value != null && !value.isBlank()) {
        PipelineConfig.parseBoolean(key, value);
      }
    }
    if (DefaultsForMode.RUN_MODE.equalsIgnoreCase(mode)) {
      String workers = effective.get("analysisWorkers");
      if (workers != null && !workers.isBlank()) {
        Numbers.parseIntInRange(
            "analysisWorkers", workers, 1, PipelineConfig.MAX_ANALYSIS_WORKERS);
      }
    }
  }
}
