package ca.nrc.ami3.application.port;

import ca.nrc.ami3.domain.model.DataProduct;

/**
 * Port normalizing a science aggregate by a reference aggregate.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface NormalizationStage {
  /**
   * Normalizes {@code science} by {@code reference}. Neither input is modified.
   *
   * @param science science aggregate
   * @param reference reference aggregate
   * @return new, unsaved normalized product
   * @throws StageException if the inputs are incompatible
   */
  DataProduct run(DataProduct science, DataProduct reference) throws StageException;
}
