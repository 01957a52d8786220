package ca.nrc.ami3.application.pipeline;

/**
 * Phases of a level-3 run, in the order the controller may enter them.
 *
 * <p>{@code LOAD -> VALIDATE -> (ABORTED | ANALYZE -> [AGGREGATE_REFERENCE] -> AGGREGATE_SCIENCE ->
 * [NORMALIZE] -> DONE)}</p>
 *
 * @since 0.1.0
 */
public enum RunPhase {
  /** Association accepted and the primary product selected. */
  LOAD,
  /** Member roles counted on the original member list. */
  VALIDATE,
  /** Per-member analysis and persistence. */
  ANALYZE,
  /** Reference artifacts averaged. */
  AGGREGATE_REFERENCE,
  /** Science artifacts averaged. */
  AGGREGATE_SCIENCE,
  /** Science average normalized by the reference average. */
  NORMALIZE,
  /** Terminal: run completed. */
  DONE,
  /** Terminal: run soft-aborted by a data precondition. */
  ABORTED
}
