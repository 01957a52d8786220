/**
 * Metrics adapters that bridge {@link ca.nrc.ami3.application.port.MetricsPort} to OpenTelemetry or a no-op.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code ami3.*} namespace: members analyzed, analysis latency,
 * aggregates produced, normalizations, and run outcomes.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.infrastructure.metrics;
