package ca.nrc.ami3.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.nrc.ami3.testutil.ExposureFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
    System.clearProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
    System.clearProperty(TelemetryConfigurator.ENDPOINT_PROPERTY);
    System.clearProperty(TelemetryConfigurator.RESOURCE_PROPERTY);
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, RunCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("AMI3 level-3 pipeline"));
  }

  @Test
  void missingInputReturnsUsageAndInvalidArgs() {
    ExitCode code = RunCli.run(new String[] {"out=" + tempDir.resolve("out"), "metricsExporter=none"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: run"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("in is required"));
    assertTrue(logged);
  }

  @Test
  void malformedArgumentReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {"in"}));
  }

  @Test
  void outOfRangeWorkersReturnInvalidArgs() throws IOException {
    Path table = writeAssociation("a3001", "sci1_calints.json", "science");
    ExitCode code = RunCli.run(new String[] {
        "in=" + table, "out=" + tempDir.resolve("out"), "analysisWorkers=0", "metricsExporter=none"});
    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() throws IOException {
    Path table = writeAssociation("a3001", "sci1_calints.json", "science");
    ExitCode code = RunCli.run(new String[] {
        "in=" + table, "config=" + tempDir.resolve("absent.yaml"), "metricsExporter=none"});
    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void dryRunPrintsPlanAndDoesNotCreateOutputs() throws IOException {
    Path table = writeAssociation("a3001", "sci1_calints.json", "science", "psf1_calints.json", "psf");
    Path output = tempDir.resolve("out");

    ExitCode code = RunCli.run(new String[] {
        "in=" + table, "out=" + output, "--dry-run", "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("AMI3 run dry-run plan:"));
    assertTrue(text.contains("(will be created)"));
    assertTrue(text.contains("science=1, reference=1, other=0"));
    assertTrue(text.contains("NORMALIZE"));
    assertFalse(Files.exists(output), "dry-run should not create output directory");
  }

  @Test
  void runWritesMemberAndNormalizedProducts() throws IOException {
    Path table = writeAssociation("a3001", "sci1_calints.json", "science", "psf1_calints.json", "psf");
    Path output = tempDir.resolve("out");

    ExitCode code = RunCli.run(new String[] {
        "in=" + table, "out=" + output, "outputName=jw-nrm", "analysisWorkers=2", "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(output.resolve("sci1_ami.json")));
    assertTrue(Files.exists(output.resolve("psf1_ami.json")));
    assertTrue(Files.exists(output.resolve("jw-nrm_aminorm.json")));
    assertFalse(Files.exists(output.resolve("jw-nrm_amiavg.json")));
    String text = buffer.toString();
    assertTrue(text.contains("Association a3001: COMPLETED"));
    assertTrue(text.contains("Members analyzed: 2 (science=1, reference=1)"));
  }

  @Test
  void nonEmptyOutputRequiresAllowOverwrite() throws IOException {
    Path table = writeAssociation("a3001", "sci1_calints.json", "science");
    Path output = Files.createDirectories(tempDir.resolve("out"));
    Files.writeString(output.resolve("previous.txt"), "x", StandardCharsets.UTF_8);

    ExitCode refused = RunCli.run(new String[] {"in=" + table, "out=" + output, "metricsExporter=none"});
    ExitCode allowed = RunCli.run(new String[] {
        "in=" + table, "out=" + output, "--allow-overwrite", "metricsExporter=none"});

    assertEquals(ExitCode.INVALID_ARGS, refused);
    assertEquals(ExitCode.SUCCESS, allowed);
    assertTrue(Files.exists(output.resolve("sci1_ami.json")));
  }

  @Test
  void associationWithoutScienceAbortsWithSuccess() throws IOException {
    Path table = writeAssociation("a3002", "psf1_calints.json", "psf");
    Path output = tempDir.resolve("out");

    ExitCode code = RunCli.run(new String[] {"in=" + table, "out=" + output, "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Association a3002: ABORTED"));
    assertTrue(text.contains("No science target members found in association a3002"));
    assertFalse(Files.exists(output.resolve("psf1_ami.json")));
  }

  @Test
  void malformedAssociationReturnsIoError() throws IOException {
    Path table = Files.writeString(tempDir.resolve("broken_asn.json"), "{ not json", StandardCharsets.UTF_8);
    ExitCode code = RunCli.run(new String[] {
        "in=" + table, "out=" + tempDir.resolve("out"), "metricsExporter=none"});
    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void missingExposureReturnsStageFailure() throws IOException {
    Path table = ExposureFixtures.writeAssociation(tempDir, "a3003", null, "absent_calints.json", "science");
    ExitCode code = RunCli.run(new String[] {
        "in=" + table, "out=" + tempDir.resolve("out"), "metricsExporter=none"});
    assertEquals(ExitCode.STAGE_FAILURE, code);
  }

  private Path writeAssociation(String asnId, String... members) throws IOException {
    ExposureFixtures.writeExposure(tempDir, "sci1_calints.json", 0.6, new double[] {30.0, 30.0, 30.0});
    ExposureFixtures.writeExposure(tempDir, "psf1_calints.json", 0.8, new double[] {10.0, 10.0, 10.0});
    return ExposureFixtures.writeAssociation(tempDir, asnId, null, members);
  }
}
