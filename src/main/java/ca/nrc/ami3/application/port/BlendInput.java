package ca.nrc.ami3.application.port;

import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.DataProduct;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input to metadata blending: either a persisted artifact or an in-memory product.
 *
 * @since 0.1.0
 */
public final class BlendInput {
  private final ArtifactRef artifact;
  private final DataProduct product;
  private final String identity;

  private BlendInput(ArtifactRef artifact, DataProduct product, String identity) {
    this.artifact = artifact;
    this.product = product;
    this.identity = identity;
  }

  /**
   * Wraps a persisted artifact.
   *
   * @param artifact artifact reference; must not be {@code null}
   * @return blend input
   */
  public static BlendInput of(ArtifactRef artifact) {
    return new BlendInput(Objects.requireNonNull(artifact, "artifact"), null, null);
  }

  /**
   * Wraps an in-memory product.
   *
   * @param product product; must not be {@code null}
   * @return blend input
   */
  public static BlendInput of(DataProduct product) {
    return new BlendInput(null, Objects.requireNonNull(product, "product"), null);
  }

  /**
   * Wraps an in-memory product under the artifact name it is known by, whether or not it was written.
   *
   * @param product product; must not be {@code null}
   * @param identity name recorded in provenance; must not be blank
   * @return blend input
   */
  public static BlendInput of(DataProduct product, String identity) {
    Objects.requireNonNull(identity, "identity");
    if (identity.isBlank()) {
      throw new IllegalArgumentException("identity must not be blank");
    }
    return new BlendInput(null, Objects.requireNonNull(product, "product"), identity);
  }

  /**
   * Wraps artifacts, preserving their order.
   *
   * @param artifacts artifact references
   * @return blend inputs in the same order
   */
  public static List<BlendInput> ofArtifacts(List<ArtifactRef> artifacts) {
    return artifacts.stream().map(BlendInput::of).toList();
  }

  public Optional<ArtifactRef> artifact() {
    return Optional.ofNullable(artifact);
  }

  public Optional<DataProduct> product() {
    return Optional.ofNullable(product);
  }

  /**
   * Identity recorded in the blended provenance list.
   *
   * @return artifact file name, the explicit identity, or the product identity
   */
  public String identity() {
    if (artifact != null) {
      return artifact.name();
    }
    return identity != null ? identity : product.identity();
  }

  @Override
  public String toString() {
    return identity();
  }
}
