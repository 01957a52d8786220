package ca.nrc.ami3.config;

import ca.nrc.ami3.application.pipeline.PipelineController;
import ca.nrc.ami3.application.port.AssociationSource;
import ca.nrc.ami3.application.port.MetricsPort;
import ca.nrc.ami3.application.port.ProductPersister;
import ca.nrc.ami3.infrastructure.asn.JsonAssociationSource;
import ca.nrc.ami3.infrastructure.blend.AttributeMetadataBlender;
import ca.nrc.ami3.infrastructure.json.JsonSupport;
import ca.nrc.ami3.infrastructure.persistence.JsonProductPersister;
import ca.nrc.ami3.infrastructure.persistence.JsonProductReader;
import ca.nrc.ami3.infrastructure.stage.FringeAnalysisStage;
import ca.nrc.ami3.infrastructure.stage.FringeAveragingStage;
import ca.nrc.ami3.infrastructure.stage.ReferenceNormalizationStage;
import java.util.Objects;

/**
 * Wires the JSON adapters, fringe stages and metrics into a {@link PipelineController}.
 *
 * <p>One shared {@link JsonSupport} backs every JSON adapter.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final JsonSupport json = new JsonSupport();

  public CompositionRoot(PipelineConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public PipelineConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public AssociationSource associationSource() {
    return new JsonAssociationSource(json);
  }

  public ProductPersister productPersister() {
    return new JsonProductPersister(config.outputDirectory(), json.factory());
  }

  /**
   * Builds a controller over the configured output directory.
   *
   * @return controller ready to run associations
   */
  public PipelineController pipelineController() {
    JsonProductReader reader = new JsonProductReader(json);
    return new PipelineController(
        new FringeAnalysisStage(json),
        new FringeAveragingStage(reader),
        new ReferenceNormalizationStage(),
        new AttributeMetadataBlender(reader),
        productPersister(),
        metrics,
        config.controllerOptions());
  }
}
