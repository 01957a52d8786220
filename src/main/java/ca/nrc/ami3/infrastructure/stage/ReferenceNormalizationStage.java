package ca.nrc.ami3.infrastructure.stage;

import ca.nrc.ami3.application.port.NormalizationStage;
import ca.nrc.ami3.application.port.StageException;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.domain.model.FringeObservables;
import ca.nrc.ami3.domain.model.ProductKind;
import ca.nrc.ami3.domain.model.ProductMeta;
import java.util.Objects;

/**
 * Calibrates the science average against the reference (PSF) average.
 *
 * <p>Amplitudes become ratios {@code science / reference}; phases and closure phases become differences
 * {@code science - reference} wrapped to {@code (-180, 180]}. Errors are propagated in quadrature when both
 * inputs carry them, otherwise the result has none.</p>
 *
 * @since 0.1.0
 */
public final class ReferenceNormalizationStage implements NormalizationStage {

  @Override
  public DataProduct run(DataProduct science, DataProduct reference) throws StageException {
    Objects.requireNonNull(science, "science");
    Objects.requireNonNull(reference, "reference");
    FringeObservables sci = science.observables();
    FringeObservables ref = reference.observables();
    if (!sci.sameShape(ref)) {
      throw new StageException(
          "Science (" + sci.holes() + " holes) and reference (" + ref.holes() + " holes) do not match");
    }
    double[] sciAmp = sci.amplitudes();
    double[] refAmp = ref.amplitudes();
    double[] sciPh = sci.phases();
    double[] refPh = ref.phases();
    double[] sciCp = sci.closurePhases();
    double[] refCp = ref.closurePhases();
    boolean errors = sci.hasErrors() && ref.hasErrors();
    double[] sciAmpErr = sci.amplitudeErrors();
    double[] refAmpErr = ref.amplitudeErrors();
    double[] sciPhErr = sci.phaseErrors();
    double[] refPhErr = ref.phaseErrors();
    double[] sciCpErr = sci.closurePhaseErrors();
    double[] refCpErr = ref.closurePhaseErrors();

    int baselines = sciAmp.length;
    double[] amplitudes = new double[baselines];
    double[] phases = new double[baselines];
    double[] amplitudeErrors = new double[errors ? baselines : 0];
    double[] phaseErrors = new double[errors ? baselines : 0];
    for (int b = 0; b < baselines; b++) {
      if (refAmp[b] == 0.0) {
        throw new StageException("Reference amplitude is zero on baseline " + b);
      }
      amplitudes[b] = sciAmp[b] / refAmp[b];
      phases[b] = Angles.wrapDegrees(sciPh[b] - refPh[b]);
      if (errors) {
        double relSci = sciAmp[b] == 0.0 ? 0.0 : sciAmpErr[b] / sciAmp[b];
        double relRef = refAmpErr[b] / refAmp[b];
        amplitudeErrors[b] = Math.abs(amplitudes[b]) * Math.hypot(relSci, relRef);
        phaseErrors[b] = Math.hypot(sciPhErr[b], refPhErr[b]);
      }
    }
    int triangles = sciCp.length;
    double[] closurePhases = new double[triangles];
    double[] closurePhaseErrors = new double[errors ? triangles : 0];
    for (int t = 0; t < triangles; t++) {
      closurePhases[t] = Angles.wrapDegrees(sciCp[t] - refCp[t]);
      if (errors) {
        closurePhaseErrors[t] = Math.hypot(sciCpErr[t], refCpErr[t]);
      }
    }
    return new DataProduct(
        ProductKind.FRINGE_NORMALIZED,
        new ProductMeta(),
        new FringeObservables(
            sci.holes(), amplitudes, phases, closurePhases, amplitudeErrors, phaseErrors, closurePhaseErrors));
  }
}
