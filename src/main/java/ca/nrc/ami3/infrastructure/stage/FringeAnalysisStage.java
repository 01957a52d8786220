package ca.nrc.ami3.infrastructure.stage;

import ca.nrc.ami3.application.port.AnalysisStage;
import ca.nrc.ami3.application.port.StageException;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.domain.model.FringeObservables;
import ca.nrc.ami3.domain.model.ProductKind;
import ca.nrc.ami3.domain.model.ProductMeta;
import ca.nrc.ami3.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Fringe analysis of one calibrated exposure.
 * <p><strong>Input:</strong> an exposure document
 * <pre>{@code
 * {"meta": {"target": "...", "filter": "..."},
 *  "holes": 7,
 *  "integrations": [[[re, im], ...one pair per baseline...], ...]}
 * }</pre>
 * <p><strong>Output:</strong> a {@link ProductKind#FRINGE_FIT} product whose attributes are the exposure's
 * scalar {@code meta} entries plus {@code source} (exposure file name) and {@code nints}. Each baseline's
 * complex visibility is averaged over integrations; amplitudes are its modulus, phases its argument in degrees,
 * and closure phases are formed for every hole triangle.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use by the analysis pool.</p>
 *
 * @since 0.1.0
 */
public final class FringeAnalysisStage implements AnalysisStage {
  private final JsonSupport json;

  public FringeAnalysisStage() {
    this(new JsonSupport());
  }

  public FringeAnalysisStage(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public DataProduct run(String exposure) throws StageException {
    Objects.requireNonNull(exposure, "exposure");
    Path file = Path.of(exposure);
    try {
      Map<String, Object> root = JsonSupport.asObject(json.parse(file), "exposure");
      int holes = (int) JsonSupport.doubleValue(root.get("holes"), "holes");
      if (holes < 3) {
        throw new IllegalArgumentException("holes must be at least 3 (was " + holes + ")");
      }
      List<Object> integrations = JsonSupport.asArray(root.get("integrations"), "integrations");
      if (integrations.isEmpty()) {
        throw new IllegalArgumentException("exposure has no integrations");
      }
      int baselines = FringeObservables.baselineCount(holes);
      double[] re = new double[baselines];
      double[] im = new double[baselines];
      for (int n = 0; n < integrations.size(); n++) {
        List<Object> visibilities = JsonSupport.asArray(integrations.get(n), "integrations[" + n + "]");
        if (visibilities.size() != baselines) {
          throw new IllegalArgumentException(
              "integration " + n + " has " + visibilities.size() + " baselines, expected " + baselines);
        }
        for (int b = 0; b < baselines; b++) {
          double[] pair = JsonSupport.doubleArray(visibilities.get(b), "integrations[" + n + "][" + b + "]");
          if (pair.length != 2) {
            throw new IllegalArgumentException("visibility must be [re, im]");
          }
          re[b] += pair[0];
          im[b] += pair[1];
        }
      }
      int nints = integrations.size();
      double[] amplitudes = new double[baselines];
      double[] phases = new double[baselines];
      for (int b = 0; b < baselines; b++) {
        double meanRe = re[b] / nints;
        double meanIm = im[b] / nints;
        amplitudes[b] = Math.hypot(meanRe, meanIm);
        phases[b] = Angles.wrapDegrees(Math.toDegrees(Math.atan2(meanIm, meanRe)));
      }
      double[] closurePhases = MaskGeometry.closurePhases(holes, phases);

      ProductMeta meta = new ProductMeta();
      Object rawMeta = root.get("meta");
      if (rawMeta != null) {
        JsonSupport.asObject(rawMeta, "meta").forEach((key, value) -> meta.putAttribute(key, JsonSupport.scalarText(value)));
      }
      meta.putAttribute("source", String.valueOf(file.getFileName()));
      meta.putAttribute("nints", Integer.toString(nints));
      return new DataProduct(
          ProductKind.FRINGE_FIT, meta, new FringeObservables(holes, amplitudes, phases, closurePhases));
    } catch (IOException ex) {
      throw new StageException("Unable to read exposure " + exposure, ex);
    } catch (IllegalArgumentException ex) {
      throw new StageException("Malformed exposure " + exposure + ": " + ex.getMessage(), ex);
    }
  }
}
