package ca.nrc.ami3.application.port;

import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.DataProduct;
import java.util.List;

/**
 * Port combining same-role per-exposure artifacts into one product.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AggregationStage {
  /**
   * Combines the artifacts in the given order.
   *
   * @param artifacts persisted per-exposure products sharing one role; at least one
   * @return new, unsaved aggregate
   * @throws StageException if the list is empty or the artifacts cannot be combined
   */
  DataProduct run(List<ArtifactRef> artifacts) throws StageException;
}
