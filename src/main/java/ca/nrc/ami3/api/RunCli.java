package ca.nrc.ami3.api;

import ca.nrc.ami3.application.pipeline.PhasePlan;
import ca.nrc.ami3.application.pipeline.PipelineController;
import ca.nrc.ami3.application.pipeline.RunOutcome;
import ca.nrc.ami3.application.port.AssociationLoadException;
import ca.nrc.ami3.application.port.BlendException;
import ca.nrc.ami3.application.port.PersistException;
import ca.nrc.ami3.application.port.PipelineException;
import ca.nrc.ami3.application.port.StageException;
import ca.nrc.ami3.config.CompositionRoot;
import ca.nrc.ami3.config.DefaultsForMode;
import ca.nrc.ami3.config.PipelineConfig;
import ca.nrc.ami3.domain.asn.Association;
import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.nrc.ami3.infrastructure.trace.LoggingRunTrace;
import ca.nrc.ami3.logging.LoggingConfigurator;
import ca.nrc.ami3.validation.Paths;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the level-3 AMI pipeline over one association table or exposure.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SUMMARY_USAGE =
      "usage: run in=PATH [out=DIR] [outputName=NAME] [saveAverages=true|false] [analysisWorkers=N] "
          + "[config=FILE] [--dry-run] [--allow-overwrite] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      AMI3 level-3 pipeline

      Usage:
        run in=./jw00001-a3001_ami3_asn.json out=./l3 [options]

      Required:
        in=PATH                    Association table (JSON) or a single exposure

      Optional:
        out=DIR                    Output directory (default ~/.ami3/out)
        outputName=NAME            Base name for averaged and normalized products
                                   when the association product has none
        saveAverages=true|false    Persist the reference and science averages (default false)
        analysisWorkers=N          Members analyzed concurrently, 1-64 (default 1)
        config=FILE                YAML file; the 'common' and 'ami3' sections apply
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Load the association and print the plan without processing
        --allow-overwrite          Permit writing into a non-empty output directory
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        Members tagged neither science nor psf/reference are analyzed but not aggregated.
        Without reference members the run completes with normalization skipped.
        Without science members nothing is processed and the run exits 0.
      """;

  private RunCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the pipeline and maps the result onto an exit code.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run CLI");
    }

    boolean dryRunFlag = input.hasFlag("--dry-run");
    boolean allowOverwriteFlag = input.hasFlag("--allow-overwrite");

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig(DefaultsForMode.RUN_MODE, kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (UncheckedIOException ex) {
      log.error(ex.getMessage(), ex.getCause());
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = dryRunFlag || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite = allowOverwriteFlag || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    String metricsExporter = effective.getOrDefault("metricsExporter", "otlp");
    PipelineConfig config;
    Path outputDirectory;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = PipelineConfig.fromMap(configInputs);
      Paths.requireReadableFile("in", config.input());
      outputDirectory = validateOutput(config.outputDirectory(), dryRun, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      Association association = root.associationSource().load(config.input());

      if (dryRun) {
        printDryRunPlan(config, outputDirectory, allowOverwrite, PhasePlan.of(association));
        return ExitCode.SUCCESS;
      }

      PipelineController controller = root.pipelineController();
      log.info(
          "Configured level-3 pipeline: input={}, output={}, saveAverages={}, analysisWorkers={}, metricsExporter={}",
          config.input(),
          outputDirectory,
          config.saveAverages(),
          config.analysisWorkers(),
          metricsExporter);
      RunOutcome outcome = controller.run(association, new LoggingRunTrace());
      printSummary(outcome);
      return ExitCode.SUCCESS;
    } catch (AssociationLoadException ex) {
      log.error("Unable to load association from {}: {}", config.input(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (StageException | BlendException ex) {
      log.error("Level-3 processing of {} failed: {}", config.input(), ex.getMessage(), ex);
      return ExitCode.STAGE_FAILURE;
    } catch (PersistException ex) {
      log.error("Unable to write products to {}", outputDirectory, ex);
      return ExitCode.IO_ERROR;
    } catch (PipelineException ex) {
      log.error("Level-3 processing of {} failed", config.input(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Level-3 pipeline interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Level-3 configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in level-3 pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Path validateOutput(Path output, boolean dryRun, boolean allowOverwrite) {
    if (dryRun && !Files.exists(output, LinkOption.NOFOLLOW_LINKS)) {
      return output;
    }
    return Paths.validateWritableDir(output, true, allowOverwrite);
  }

  private static void printDryRunPlan(
      PipelineConfig config, Path outputDirectory, boolean allowOverwrite, PhasePlan plan) {
    List<String> lines = new ArrayList<>();
    lines.add("AMI3 run dry-run plan:");
    lines.add("  Input: " + config.input());
    lines.add("  Output directory: " + outputDirectory
        + (Files.exists(outputDirectory) ? "" : " (will be created)"));
    lines.add("  Allow overwrite: " + allowOverwrite);
    lines.add("  Save averages: " + config.saveAverages());
    lines.add("  Analysis workers: " + config.analysisWorkers());
    lines.add("  Association: " + plan.asnId());
    lines.add("  Members: science=" + plan.partition().scienceCount()
        + ", reference=" + plan.partition().referenceCount()
        + ", other=" + plan.partition().otherCount());
    lines.add("  Phases: " + plan.phases());
    plan.abortReason().ifPresent(reason -> lines.add("  Would abort: " + reason));
    if (plan.degraded()) {
      lines.add("  Normalization: skipped (no reference members)");
    }
    CliPrinter.printLines(lines.toArray(String[]::new));
  }

  private static void printSummary(RunOutcome outcome) {
    List<String> lines = new ArrayList<>();
    lines.add("Association " + outcome.asnId() + ": " + outcome.status());
    outcome.abortReason().ifPresent(reason -> lines.add("  Reason: " + reason));
    if (!outcome.aborted()) {
      lines.add("  Output name: " + outcome.outputName());
      lines.add("  Members analyzed: " + outcome.memberArtifacts().size()
          + " (science=" + outcome.scienceArtifacts().size()
          + ", reference=" + outcome.referenceArtifacts().size() + ")");
      for (ArtifactRef artifact : outcome.writtenArtifacts()) {
        lines.add("  Wrote " + artifact);
      }
    }
    CliPrinter.printLines(lines.toArray(String[]::new));
  }
}
