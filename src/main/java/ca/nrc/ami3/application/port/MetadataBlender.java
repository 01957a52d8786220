package ca.nrc.ami3.application.port;

import ca.nrc.ami3.domain.model.DataProduct;
import java.util.List;

/**
 * <strong>What:</strong> Port merging the metadata of contributing inputs into a derived product.
 * <p><strong>Why:</strong> Aggregates and normalized products must record exactly which inputs fed them.</p>
 * <p><strong>Role:</strong> Provenance port invoked by the controller before persisting derived products.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Mutate {@code target} in place; never replace it.</li>
 *   <li>Honor the input order so repeated runs blend identically.</li>
 * </ul>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MetadataBlender {
  /**
   * Blends {@code inputs} into {@code target}.
   *
   * @param target product receiving blended metadata
   * @param inputs ordered contributing inputs
   * @throws BlendException if the inputs are inconsistent or cannot be read
   */
  void blend(DataProduct target, List<BlendInput> inputs) throws BlendException;
}
