package ca.nrc.ami3.infrastructure.stage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.nrc.ami3.application.port.StageException;
import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.domain.model.FringeObservables;
import ca.nrc.ami3.domain.model.ProductKind;
import ca.nrc.ami3.domain.model.ProductMeta;
import ca.nrc.ami3.infrastructure.persistence.JsonProductPersister;
import ca.nrc.ami3.testutil.Products;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FringeAveragingStageTest {
  private static final double EPS = 1e-9;

  @TempDir Path tempDir;

  private JsonProductPersister persister;
  private final FringeAveragingStage stage = new FringeAveragingStage();

  @BeforeEach
  void setUp() {
    persister = new JsonProductPersister(tempDir);
  }

  @Test
  void averagesAmplitudesArithmeticallyWithStandardError() throws Exception {
    ArtifactRef a = save("sci1", Products.product(ProductKind.FRINGE_FIT, 1.0, 20.0));
    ArtifactRef b = save("sci2", Products.product(ProductKind.FRINGE_FIT, 3.0, 40.0));

    try (DataProduct average = stage.run(List.of(a, b))) {
      FringeObservables obs = average.observables();
      assertEquals(ProductKind.FRINGE_AVERAGE, average.kind());
      assertArrayEquals(new double[] {2.0, 2.0, 2.0}, obs.amplitudes(), EPS);
      assertArrayEquals(new double[] {1.0, 1.0, 1.0}, obs.amplitudeErrors(), EPS);
      assertArrayEquals(new double[] {30.0, 30.0, 30.0}, obs.phases(), EPS);
      assertArrayEquals(new double[] {10.0, 10.0, 10.0}, obs.phaseErrors(), EPS);
      assertEquals("2", average.meta().attribute("ninputs").orElseThrow());
    }
  }

  @Test
  void phasesAverageAcrossTheWrapPoint() throws Exception {
    ArtifactRef a = save("sci1", Products.product(ProductKind.FRINGE_FIT, 1.0, 170.0));
    ArtifactRef b = save("sci2", Products.product(ProductKind.FRINGE_FIT, 1.0, -170.0));

    try (DataProduct average = stage.run(List.of(a, b))) {
      double phase = average.observables().phases()[0];
      assertEquals(0.0, Angles.wrapDegrees(phase - 180.0), EPS);
      assertEquals(10.0, average.observables().phaseErrors()[0], EPS);
      assertEquals(0.0, Angles.wrapDegrees(average.observables().closurePhases()[0] - 180.0), EPS);
    }
  }

  @Test
  void singleInputHasZeroError() throws Exception {
    ArtifactRef a = save("sci1", Products.product(ProductKind.FRINGE_FIT, 0.8, 5.0));

    try (DataProduct average = stage.run(List.of(a))) {
      assertArrayEquals(new double[] {0.8, 0.8, 0.8}, average.observables().amplitudes(), EPS);
      assertArrayEquals(new double[] {0.0, 0.0, 0.0}, average.observables().amplitudeErrors(), EPS);
    }
  }

  @Test
  void emptyInputIsAStageFailure() {
    assertThrows(StageException.class, () -> stage.run(List.of()));
  }

  @Test
  void mismatchedMaskGeometryIsAStageFailure() throws Exception {
    ArtifactRef a = save("sci1", Products.product(ProductKind.FRINGE_FIT, 1.0, 0.0));
    DataProduct fourHoles = new DataProduct(ProductKind.FRINGE_FIT, new ProductMeta(),
        new FringeObservables(4, new double[6], new double[6], new double[4]));
    ArtifactRef b = save("sci2", fourHoles);

    assertThrows(StageException.class, () -> stage.run(List.of(a, b)));
  }

  @Test
  void unreadableArtifactIsAStageFailure() {
    ArtifactRef missing = new ArtifactRef(tempDir.resolve("gone_ami.json"));

    assertThrows(StageException.class, () -> stage.run(List.of(missing)));
  }

  private ArtifactRef save(String base, DataProduct product) throws Exception {
    try (product) {
      return persister.save(product, base, "ami", "a3001");
    }
  }
}
