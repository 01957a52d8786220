/**
 * Fringe analysis, averaging and reference normalization stages.
 * <p><strong>Role:</strong> Deterministic implementations of the stage ports that make the pipeline runnable
 * end to end. Phases are in degrees throughout.</p>
 * <p><strong>Concurrency:</strong> Stages are stateless; the analysis stage is invoked concurrently when
 * {@code analysisWorkers > 1}.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.infrastructure.stage;
