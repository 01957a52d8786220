package ca.nrc.ami3.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize()) {
      assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
      result.forceFlush();
    }
  }

  @Test
  void noopAdapterAcceptsObservations() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      adapter.increment("ami3.run.completed");
      adapter.observe("ami3.analyze.latencyNanos", 10L);
    }
  }

  @Test
  void parsesResourceAttributesSkippingMalformedEntries() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=ops, bad, =x ,team=ami");

    assertEquals(2, attributes.size());
    assertEquals("ops", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("ami", attributes.get(AttributeKey.stringKey("team")));
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes("  ").isEmpty());
  }

  @Test
  void exporterModeDefaultsToOtlp() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(""));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(" NONE "));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from("zipkin"));
  }
}
