/**
 * Level-3 orchestration: role validation, per-member analysis, role averaging and reference normalization.
 * <p>{@link ca.nrc.ami3.application.pipeline.PipelineController} holds no state between runs; per-run
 * accumulators live in a {@code RunState} created for each call and discarded at its end.</p>
 * <p>Analysis may use a bounded worker pool whose threads follow the {@code ami3-analyze-*} naming
 * convention; results are always merged in association member order.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.application.pipeline;
