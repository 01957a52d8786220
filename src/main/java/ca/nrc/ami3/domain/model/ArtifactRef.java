package ca.nrc.ami3.domain.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Stable handle to a persisted product.
 *
 * <p>Carries no pipeline state; the controller tracks role membership in its own accumulators.</p>
 *
 * @param path absolute, normalized location of the persisted product
 * @since 0.1.0
 */
public record ArtifactRef(Path path) {

  /**
   * Normalizes the path.
   *
   * @throws NullPointerException if {@code path} is {@code null}
   */
  public ArtifactRef {
    path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
  }

  /**
   * Returns the artifact file name, used as its identity in provenance records.
   *
   * @return file name of the artifact
   */
  public String name() {
    Path fileName = path.getFileName();
    return fileName == null ? path.toString() : fileName.toString();
  }

  @Override
  public String toString() {
    return path.toString();
  }
}
