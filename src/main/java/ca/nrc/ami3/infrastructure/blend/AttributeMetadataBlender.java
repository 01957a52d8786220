package ca.nrc.ami3.infrastructure.blend;

import ca.nrc.ami3.application.port.BlendException;
import ca.nrc.ami3.application.port.BlendInput;
import ca.nrc.ami3.application.port.MetadataBlender;
import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.AsnProvenance;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.domain.model.ProductMeta;
import ca.nrc.ami3.infrastructure.persistence.JsonProductReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Blends the metadata of contributing inputs into a derived product.
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>An attribute present with one value in every input is copied unless the target already sets it.</li>
 *   <li>Any other attribute is recorded as {@code blend.<key>}: its distinct values in input order, joined
 *       with {@code ","}.</li>
 *   <li>Input identities are appended to the target's provenance list in input order.</li>
 * </ul>
 * <p><strong>Failures:</strong> an empty input list, an unreadable artifact, or an input stamped with a
 * different association id raise {@link BlendException}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the target product is confined to the caller.</p>
 *
 * @since 0.1.0
 */
public final class AttributeMetadataBlender implements MetadataBlender {
  /** Prefix of attributes whose values differ across inputs. */
  public static final String BLEND_PREFIX = "blend.";

  private final JsonProductReader reader;

  public AttributeMetadataBlender() {
    this(new JsonProductReader());
  }

  public AttributeMetadataBlender(JsonProductReader reader) {
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  @Override
  public void blend(DataProduct target, List<BlendInput> inputs) throws BlendException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(inputs, "inputs");
    if (inputs.isEmpty()) {
      throw new BlendException("No inputs to blend into " + target.identity());
    }
    AsnProvenance targetAsn = target.meta().asn();
    List<ProductMeta> metas = new ArrayList<>(inputs.size());
    for (BlendInput input : inputs) {
      ProductMeta meta = metaOf(input);
      AsnProvenance inputAsn = meta.asn();
      if (targetAsn.stamped() && inputAsn.stamped() && !targetAsn.asnId().equals(inputAsn.asnId())) {
        throw new BlendException(
            "Input " + input.identity() + " belongs to association " + inputAsn.asnId()
                + ", not " + targetAsn.asnId());
      }
      metas.add(meta);
    }

    Map<String, Set<String>> values = new LinkedHashMap<>();
    Map<String, Integer> presence = new LinkedHashMap<>();
    for (ProductMeta meta : metas) {
      meta.attributes().forEach((key, value) -> {
        values.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value);
        presence.merge(key, 1, Integer::sum);
      });
    }
    ProductMeta out = target.meta();
    values.forEach((key, distinct) -> {
      boolean common = distinct.size() == 1 && presence.get(key) == metas.size();
      if (common) {
        if (out.attribute(key).isEmpty()) {
          out.putAttribute(key, distinct.iterator().next());
        }
      } else {
        out.putAttribute(BLEND_PREFIX + key, String.join(",", distinct));
      }
    });
    for (BlendInput input : inputs) {
      out.addProvenanceInput(input.identity());
    }
  }

  private ProductMeta metaOf(BlendInput input) throws BlendException {
    if (input.product().isPresent()) {
      return input.product().get().meta();
    }
    ArtifactRef artifact = input.artifact().orElseThrow();
    try (DataProduct product = reader.read(artifact)) {
      return product.meta();
    } catch (IOException ex) {
      throw new BlendException("Unable to read blend input " + artifact, ex);
    }
  }
}
