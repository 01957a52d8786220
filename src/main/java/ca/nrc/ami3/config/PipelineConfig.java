package ca.nrc.ami3.config;

import ca.nrc.ami3.application.pipeline.PipelineController;
import ca.nrc.ami3.validation.Numbers;
import ca.nrc.ami3.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for one level-3 pipeline invocation.
 * <p><strong>Why:</strong> Gives the CLI and {@link CompositionRoot} one immutable view of the merged
 * CLI/YAML/default configuration.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param input association table or single exposure to process
 * @param outputDirectory directory receiving every persisted product
 * @param outputName base name for averaged and normalized products when the association product has none
 * @param saveAverages persist the reference and science averages
 * @param analysisWorkers number of members analyzed concurrently, {@code 1..}{@value #MAX_ANALYSIS_WORKERS}
 * @since 0.1.0
 */
public record PipelineConfig(
    Path input,
    Path outputDirectory,
    Optional<String> outputName,
    boolean saveAverages,
    int analysisWorkers) {

  /** Upper bound for {@code analysisWorkers}. */
  public static final int MAX_ANALYSIS_WORKERS = 64;

  public PipelineConfig {
    input = normalizePath("input", input);
    outputDirectory = normalizePath("outputDirectory", outputDirectory);
    outputName = Objects.requireNonNullElse(outputName, Optional.<String>empty())
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(s -> Strings.requireFileNameComponent("outputName", s));
    Numbers.requireRange("analysisWorkers", analysisWorkers, 1, MAX_ANALYSIS_WORKERS);
  }

  /**
   * Builds a configuration from flattened key/value pairs.
   *
   * <p>Keys: {@code in} (required), {@code out}, {@code outputName}, {@code saveAverages},
   * {@code analysisWorkers}. Missing optional keys fall back to {@link DefaultsForMode}.</p>
   *
   * @param options merged options; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or invalid; the message names the key
   */
  public static PipelineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> defaults = DefaultsForMode.asFlatMap(DefaultsForMode.RUN_MODE);

    String inRaw = firstNonBlank(options, "in", "input");
    if (inRaw == null) {
      throw new IllegalArgumentException("in is required (association table or exposure)");
    }
    String outRaw = firstNonBlank(options, "out", "outputDirectory");
    Path output = parsePath("out", outRaw == null ? defaults.get("out") : outRaw);
    Optional<String> outputName = Optional.ofNullable(firstNonBlank(options, "outputName"));
    boolean saveAverages =
        parseBoolean("saveAverages", options.getOrDefault("saveAverages", defaults.get("saveAverages")));
    String workersRaw = firstNonBlank(options, "analysisWorkers");
    int workers = Numbers.parseIntInRange(
        "analysisWorkers", workersRaw == null ? defaults.get("analysisWorkers") : workersRaw, 1, MAX_ANALYSIS_WORKERS);

    return new PipelineConfig(parsePath("in", inRaw), output, outputName, saveAverages, workers);
  }

  /**
   * Maps this configuration onto controller options.
   *
   * @return controller run options
   */
  public PipelineController.Options controllerOptions() {
    return new PipelineController.Options(saveAverages, analysisWorkers, outputName);
  }

  static boolean parseBoolean(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw.trim() + "')");
    };
  }

  private static String firstNonBlank(Map<String, String> options, String... keys) {
    for (String key : keys) {
      String value = options.get(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  private static Path parsePath(String key, String raw) {
    String value = Strings.requireNonBlank(key, raw);
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }

  private static Path normalizePath(String name, Path path) {
    return Objects.requireNonNull(path, name).toAbsolutePath().normalize();
  }
}
