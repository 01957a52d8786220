package ca.nrc.ami3.application.port;

import ca.nrc.ami3.domain.model.DataProduct;

/**
 * <strong>What:</strong> Port running fringe analysis on one exposure.
 * <p><strong>Role:</strong> Stage port invoked once per association member.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls on distinct exposures;
 * the controller may analyze members on a worker pool.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AnalysisStage {
  /**
   * Analyzes one exposure.
   *
   * @param exposure exposure reference taken from the association member
   * @return new, unsaved per-exposure product
   * @throws StageException if the exposure cannot be analyzed
   */
  DataProduct run(String exposure) throws StageException;
}
