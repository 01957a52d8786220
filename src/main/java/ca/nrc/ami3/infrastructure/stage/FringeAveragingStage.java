package ca.nrc.ami3.infrastructure.stage;

import ca.nrc.ami3.application.port.AggregationStage;
import ca.nrc.ami3.application.port.StageException;
import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.domain.model.FringeObservables;
import ca.nrc.ami3.domain.model.ProductKind;
import ca.nrc.ami3.domain.model.ProductMeta;
import ca.nrc.ami3.infrastructure.persistence.JsonProductReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Averages persisted fringe fits of one role.
 *
 * <p>Amplitudes use the arithmetic mean; phases and closure phases use the circular mean. Each mean carries
 * its standard error (sample scatter over {@code sqrt(n)}, zero for a single input). The output is a
 * {@link ProductKind#FRINGE_AVERAGE} product with an {@code ninputs} attribute; provenance is left to the
 * metadata blender.</p>
 *
 * @since 0.1.0
 */
public final class FringeAveragingStage implements AggregationStage {
  private final JsonProductReader reader;

  public FringeAveragingStage() {
    this(new JsonProductReader());
  }

  public FringeAveragingStage(JsonProductReader reader) {
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  @Override
  public DataProduct run(List<ArtifactRef> artifacts) throws StageException {
    Objects.requireNonNull(artifacts, "artifacts");
    if (artifacts.isEmpty()) {
      throw new StageException("Nothing to average: no artifacts supplied");
    }
    List<FringeObservables> inputs = new ArrayList<>(artifacts.size());
    for (ArtifactRef artifact : artifacts) {
      try (DataProduct product = reader.read(artifact)) {
        FringeObservables obs = product.observables();
        if (!inputs.isEmpty() && !inputs.get(0).sameShape(obs)) {
          throw new StageException(
              "Cannot average " + artifact.name() + ": " + obs.holes() + " holes, expected " + inputs.get(0).holes());
        }
        inputs.add(obs);
      } catch (IOException ex) {
        throw new StageException("Unable to read " + artifact, ex);
      }
    }

    int holes = inputs.get(0).holes();
    int baselines = FringeObservables.baselineCount(holes);
    int triangles = FringeObservables.triangleCount(holes);
    double[] amplitudes = new double[baselines];
    double[] amplitudeErrors = new double[baselines];
    double[] phases = new double[baselines];
    double[] phaseErrors = new double[baselines];
    double[] closurePhases = new double[triangles];
    double[] closurePhaseErrors = new double[triangles];

    for (int b = 0; b < baselines; b++) {
      double[] amps = column(inputs, b, Column.AMPLITUDE);
      amplitudes[b] = mean(amps);
      amplitudeErrors[b] = standardError(amps, amplitudes[b], false);
      double[] phs = column(inputs, b, Column.PHASE);
      phases[b] = Angles.circularMean(phs);
      phaseErrors[b] = standardError(phs, phases[b], true);
    }
    for (int t = 0; t < triangles; t++) {
      double[] cps = column(inputs, t, Column.CLOSURE_PHASE);
      closurePhases[t] = Angles.circularMean(cps);
      closurePhaseErrors[t] = standardError(cps, closurePhases[t], true);
    }

    ProductMeta meta = new ProductMeta();
    meta.putAttribute("ninputs", Integer.toString(inputs.size()));
    return new DataProduct(
        ProductKind.FRINGE_AVERAGE,
        meta,
        new FringeObservables(
            holes, amplitudes, phases, closurePhases, amplitudeErrors, phaseErrors, closurePhaseErrors));
  }

  private enum Column { AMPLITUDE, PHASE, CLOSURE_PHASE }

  private static double[] column(List<FringeObservables> inputs, int index, Column column) {
    double[] out = new double[inputs.size()];
    for (int n = 0; n < out.length; n++) {
      FringeObservables obs = inputs.get(n);
      out[n] = switch (column) {
        case AMPLITUDE -> obs.amplitudes()[index];
        case PHASE -> obs.phases()[index];
        case CLOSURE_PHASE -> obs.closurePhases()[index];
      };
    }
    return out;
  }

  private static double mean(double[] values) {
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return sum / values.length;
  }

  private static double standardError(double[] values, double center, boolean angular) {
    int n = values.length;
    if (n < 2) {
      return 0.0;
    }
    double sumSquares = 0.0;
    for (double value : values) {
      double delta = angular ? Angles.wrapDegrees(value - center) : value - center;
      sumSquares += delta * delta;
    }
    return Math.sqrt(sumSquares / (n - 1)) / Math.sqrt(n);
  }
}
