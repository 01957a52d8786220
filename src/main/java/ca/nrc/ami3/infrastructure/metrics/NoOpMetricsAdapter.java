package ca.nrc.ami3.infrastructure.metrics;

import ca.nrc.ami3.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; used when {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}

  @Override
  public void close() {}
}
