package ca.nrc.ami3.api;

import ca.nrc.ami3.config.ConfigMerger;
import ca.nrc.ami3.config.DefaultsForMode;
import ca.nrc.ami3.config.YamlConfigLoader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared configuration steps of the CLI commands.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI arguments
   * @return configured YAML path, or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Loads the YAML file (when given) and merges it with CLI arguments and defaults.
   *
   * @param mode configuration mode and YAML section
   * @param cli CLI arguments; the {@code config} entry is consumed
   * @param log logger receiving override warnings
   * @return effective configuration
   * @throws IllegalArgumentException if the file is missing, malformed, or a value is invalid
   * @throws UncheckedIOException if the file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli, Logger log) {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IOException ex) {
        throw new UncheckedIOException("Unable to read configuration file " + yamlPath, ex);
      }
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
