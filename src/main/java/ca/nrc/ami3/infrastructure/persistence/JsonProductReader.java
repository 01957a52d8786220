package ca.nrc.ami3.infrastructure.persistence;

import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.AsnProvenance;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.domain.model.FringeObservables;
import ca.nrc.ami3.domain.model.ProductKind;
import ca.nrc.ami3.domain.model.ProductMeta;
import ca.nrc.ami3.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Reads products written by {@link JsonProductPersister}.
 *
 * <p>The returned product's file name is set to the artifact's file name.</p>
 *
 * @since 0.1.0
 */
public final class JsonProductReader {
  private final JsonSupport json;

  public JsonProductReader() {
    this(new JsonSupport());
  }

  public JsonProductReader(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Loads a persisted product.
   *
   * @param artifact artifact to read; must not be {@code null}
   * @return product with metadata and observables restored
   * @throws IOException if the file cannot be read or does not hold a product document
   */
  public DataProduct read(ArtifactRef artifact) throws IOException {
    Objects.requireNonNull(artifact, "artifact");
    try {
      Map<String, Object> root = JsonSupport.asObject(json.parse(artifact.path()), "product");
      ProductKind kind = ProductKind.fromWireName(JsonSupport.requireString(root, ProductJson.KIND));

      ProductMeta meta = new ProductMeta();
      Object rawAsn = root.get(ProductJson.ASN);
      if (rawAsn != null) {
        Map<String, Object> asn = JsonSupport.asObject(rawAsn, ProductJson.ASN);
        meta.asn(new AsnProvenance(
            JsonSupport.optionalString(asn, ProductJson.ASN_ID, ""),
            JsonSupport.optionalString(asn, ProductJson.POOL_NAME, ""),
            JsonSupport.optionalString(asn, ProductJson.TABLE_NAME, "")));
      }
      Object rawAttributes = root.get(ProductJson.ATTRIBUTES);
      if (rawAttributes != null) {
        JsonSupport.asObject(rawAttributes, ProductJson.ATTRIBUTES)
            .forEach((key, value) -> meta.putAttribute(key, JsonSupport.scalarText(value)));
      }
      Object rawProvenance = root.get(ProductJson.PROVENANCE);
      if (rawProvenance != null) {
        for (Object input : JsonSupport.asArray(rawProvenance, ProductJson.PROVENANCE)) {
          meta.addProvenanceInput(String.valueOf(input));
        }
      }
      meta.fileName(artifact.name());

      Map<String, Object> obs = JsonSupport.asObject(root.get(ProductJson.OBSERVABLES), ProductJson.OBSERVABLES);
      int holes = (int) JsonSupport.doubleValue(obs.get(ProductJson.HOLES), ProductJson.HOLES);
      FringeObservables observables = new FringeObservables(
          holes,
          JsonSupport.doubleArray(obs.get(ProductJson.AMPLITUDES), ProductJson.AMPLITUDES),
          JsonSupport.doubleArray(obs.get(ProductJson.PHASES), ProductJson.PHASES),
          JsonSupport.doubleArray(obs.get(ProductJson.CLOSURE_PHASES), ProductJson.CLOSURE_PHASES),
          JsonSupport.doubleArray(obs.get(ProductJson.AMPLITUDE_ERRORS), ProductJson.AMPLITUDE_ERRORS),
          JsonSupport.doubleArray(obs.get(ProductJson.PHASE_ERRORS), ProductJson.PHASE_ERRORS),
          JsonSupport.doubleArray(obs.get(ProductJson.CLOSURE_PHASE_ERRORS), ProductJson.CLOSURE_PHASE_ERRORS));
      return new DataProduct(kind, meta, observables);
    } catch (IllegalArgumentException ex) {
      throw new IOException("Malformed product " + artifact + ": " + ex.getMessage(), ex);
    }
  }
}
