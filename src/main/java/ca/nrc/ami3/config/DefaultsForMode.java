package ca.nrc.ami3.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded defaults, the lowest-precedence configuration source.
 *
 * <p>The {@code ami3} mode (the {@code run} command) and the {@code inspect} mode share the telemetry
 * defaults; only {@code ami3} carries pipeline defaults.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  /** Mode name of the pipeline run, also its YAML section. */
  public static final String RUN_MODE = "ami3";
  /** Mode name of the association inspection command. */
  public static final String INSPECT_MODE = "inspect";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the flattened defaults of a mode.
   *
   * @param mode {@value #RUN_MODE} or {@value #INSPECT_MODE}, case-insensitive
   * @return immutable defaults
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case RUN_MODE -> buildRunDefaults();
      case INSPECT_MODE -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return map;
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", defaultOutputDirectory().toString());
    map.put("saveAverages", "false");
    map.put("analysisWorkers", "1");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Path defaultOutputDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".ami3", "out");
  }
}
