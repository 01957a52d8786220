package ca.nrc.ami3.e2e;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.nrc.ami3.application.pipeline.PipelineController;
import ca.nrc.ami3.application.pipeline.RunOutcome;
import ca.nrc.ami3.config.CompositionRoot;
import ca.nrc.ami3.config.PipelineConfig;
import ca.nrc.ami3.domain.asn.Association;
import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.infrastructure.metrics.NoOpMetricsAdapter;
import ca.nrc.ami3.infrastructure.persistence.JsonProductReader;
import ca.nrc.ami3.infrastructure.trace.InMemoryRunTrace;
import ca.nrc.ami3.testutil.ExposureFixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class Level3PipelineEndToEndTest {
  private static final double EPS = 1e-9;

  @TempDir Path tempDir;

  @Test
  void processesAssociationIntoNormalizedProduct() throws Exception {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    Path out = tempDir.resolve("out");
    writeExposures(in);
    Path table = ExposureFixtures.writeAssociation(in, "a3001", "jw00001-a3001_t001_niriss_f480m-nrm",
        "sci1_calints.json", "science",
        "sci2_calints.json", "science",
        "psf1_calints.json", "psf");

    RunOutcome outcome = run(table, out, true);

    assertEquals(RunOutcome.Status.COMPLETED, outcome.status());
    assertEquals(
        List.of("jw00001-a3001_t001_niriss_f480m-nrm_amiavg.json",
            "jw00001-a3001_t001_niriss_f480m-nrm_aminorm.json",
            "jw00001-a3001_t001_niriss_f480m-nrm_psf-amiavg.json",
            "psf1_ami.json", "sci1_ami.json", "sci2_ami.json"),
        listNames(out));

    try (DataProduct normalized = new JsonProductReader().read(outcome.normalized().orElseThrow())) {
      // science amplitude 0.6 over reference 0.8; phases 30 - 10 per baseline
      assertArrayEquals(new double[] {0.75, 0.75, 0.75}, normalized.observables().amplitudes(), EPS);
      assertArrayEquals(new double[] {20.0, 20.0, 20.0}, normalized.observables().phases(), EPS);
      assertEquals("a3001", normalized.meta().asn().asnId());
      assertEquals("a3001_ami3_asn.json", normalized.meta().asn().tableName());
      assertEquals("F480M", normalized.meta().attribute("filter").orElseThrow());
      assertEquals(
          List.of("jw00001-a3001_t001_niriss_f480m-nrm_amiavg.json",
              "jw00001-a3001_t001_niriss_f480m-nrm_psf-amiavg.json"),
          normalized.meta().provenanceInputs());
    }
  }

  @Test
  void rerunWritesIdenticalProducts() throws Exception {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    Path out = tempDir.resolve("out");
    writeExposures(in);
    Path table = ExposureFixtures.writeAssociation(in, "a3001", "jw-nrm",
        "sci1_calints.json", "science", "psf1_calints.json", "psf");

    RunOutcome first = run(table, out, true);
    Map<String, byte[]> before = snapshot(first.writtenArtifacts());
    RunOutcome second = run(table, out, true);

    assertEquals(first.writtenArtifacts(), second.writtenArtifacts());
    Map<String, byte[]> after = snapshot(second.writtenArtifacts());
    for (Map.Entry<String, byte[]> entry : before.entrySet()) {
      assertArrayEquals(entry.getValue(), after.get(entry.getKey()), entry.getKey());
    }
  }

  @Test
  void normalizedProductNamesUnsavedAveragesInProvenance() throws Exception {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    Path out = tempDir.resolve("out");
    writeExposures(in);
    Path table = ExposureFixtures.writeAssociation(in, "a3001", "jw-nrm",
        "sci1_calints.json", "science", "sci2_calints.json", "science", "psf1_calints.json", "psf");

    RunOutcome outcome = run(table, out, false);

    assertEquals(List.of("jw-nrm_aminorm.json", "psf1_ami.json", "sci1_ami.json", "sci2_ami.json"),
        listNames(out));
    try (DataProduct normalized = new JsonProductReader().read(outcome.normalized().orElseThrow())) {
      assertEquals(List.of("jw-nrm_amiavg.json", "jw-nrm_psf-amiavg.json"), normalized.meta().provenanceInputs());
    }
  }

  @Test
  void rerunWithoutSavedAveragesWritesIdenticalProducts() throws Exception {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    Path out = tempDir.resolve("out");
    writeExposures(in);
    Path table = ExposureFixtures.writeAssociation(in, "a3001", "jw-nrm",
        "sci1_calints.json", "science", "sci2_calints.json", "science", "psf1_calints.json", "psf");

    RunOutcome first = run(table, out, false);
    Map<String, byte[]> before = snapshot(first.writtenArtifacts());
    RunOutcome second = run(table, out, false);

    assertEquals(4, before.size());
    assertEquals(first.writtenArtifacts(), second.writtenArtifacts());
    Map<String, byte[]> after = snapshot(second.writtenArtifacts());
    for (Map.Entry<String, byte[]> entry : before.entrySet()) {
      assertArrayEquals(entry.getValue(), after.get(entry.getKey()), entry.getKey());
    }
  }

  @Test
  void membersMappingToTheSameArtifactAbortWithoutWriting() throws Exception {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    Path out = Files.createDirectories(tempDir.resolve("out"));
    writeExposures(in);
    ExposureFixtures.writeExposure(in, "sci1_cal.json", 0.5, new double[] {40.0, 40.0, 40.0});
    Path table = ExposureFixtures.writeAssociation(in, "a3004", "jw-nrm",
        "sci1_cal.json", "science", "sci1_calints.json", "science", "psf1_calints.json", "psf");

    RunOutcome outcome = run(table, out, true);

    assertTrue(outcome.aborted());
    assertTrue(outcome.abortReason().orElseThrow().contains("sci1_ami.json"));
    assertTrue(listNames(out).isEmpty());
  }

  @Test
  void scienceOnlyAssociationSkipsNormalization() throws Exception {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    Path out = tempDir.resolve("out");
    writeExposures(in);
    Path table = ExposureFixtures.writeAssociation(in, "a3002", null,
        "sci1_calints.json", "science", "sci2_calints.json", "science");

    RunOutcome outcome = run(table, out, false);

    assertEquals(RunOutcome.Status.COMPLETED_WITHOUT_NORMALIZATION, outcome.status());
    assertEquals(List.of("sci1_ami.json", "sci2_ami.json"), listNames(out));
  }

  @Test
  void referenceOnlyAssociationWritesNothing() throws Exception {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    Path out = Files.createDirectories(tempDir.resolve("out"));
    writeExposures(in);
    Path table = ExposureFixtures.writeAssociation(in, "a3003", null, "psf1_calints.json", "psf");

    RunOutcome outcome = run(table, out, true);

    assertTrue(outcome.aborted());
    assertTrue(listNames(out).isEmpty());
  }

  @Test
  void singleExposureRunsAsSingletonAssociation() throws Exception {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    Path out = tempDir.resolve("out");
    writeExposures(in);

    RunOutcome outcome = run(in.resolve("sci1_calints.json"), out, true);

    assertEquals(RunOutcome.Status.COMPLETED_WITHOUT_NORMALIZATION, outcome.status());
    assertEquals(List.of("sci1_ami.json", "sci1_amiavg.json"), listNames(out));
  }

  private static RunOutcome run(Path table, Path out, boolean saveAverages) throws Exception {
    Map<String, String> options = new LinkedHashMap<>();
    options.put("in", table.toString());
    options.put("out", out.toString());
    options.put("saveAverages", Boolean.toString(saveAverages));
    options.put("analysisWorkers", "2");
    PipelineConfig config = PipelineConfig.fromMap(options);
    try (NoOpMetricsAdapter metrics = new NoOpMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      Association association = root.associationSource().load(config.input());
      PipelineController controller = root.pipelineController();
      assertEquals(Optional.empty(), controller.options().outputName());
      return controller.run(association, new InMemoryRunTrace());
    }
  }

  private static void writeExposures(Path in) throws Exception {
    ExposureFixtures.writeExposure(in, "sci1_calints.json", 0.6, new double[] {30.0, 30.0, 30.0});
    ExposureFixtures.writeExposure(in, "sci2_calints.json", 0.6, new double[] {30.0, 30.0, 30.0});
    ExposureFixtures.writeExposure(in, "psf1_calints.json", 0.8, new double[] {10.0, 10.0, 10.0});
  }

  private static List<String> listNames(Path dir) throws Exception {
    try (Stream<Path> files = Files.list(dir)) {
      return files.map(path -> path.getFileName().toString()).sorted().toList();
    }
  }

  private static Map<String, byte[]> snapshot(List<ArtifactRef> artifacts) throws Exception {
    Map<String, byte[]> bytes = new LinkedHashMap<>();
    for (ArtifactRef artifact : artifacts) {
      bytes.put(artifact.name(), Files.readAllBytes(artifact.path()));
    }
    return bytes;
  }
}
