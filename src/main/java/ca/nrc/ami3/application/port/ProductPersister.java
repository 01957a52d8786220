package ca.nrc.ami3.application.port;

import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.DataProduct;

/**
 * <strong>What:</strong> Port writing products to durable storage.
 * <p><strong>Role:</strong> Output port on the sink side of the level-3 pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Name artifacts deterministically as {@code <baseName>_<suffix>.<ext>}.</li>
 *   <li>Write atomically so concurrent saves of distinct names never observe partial files.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent saves of distinct names.</p>
 *
 * @since 0.1.0
 */
public interface ProductPersister {
  /**
   * Persists a product.
   *
   * @param product product to write; its file name metadata is updated on success
   * @param baseName artifact base name (exposure name or association output name)
   * @param suffix product suffix such as {@code ami} or {@code amiavg}
   * @param asnId association identifier recorded with the artifact
   * @return stable reference to the written artifact
   * @throws PersistException on I/O failure
   */
  ArtifactRef save(DataProduct product, String baseName, String suffix, String asnId) throws PersistException;

  /**
   * Returns the file name {@link #save} would write for a base name and suffix, without writing anything.
   *
   * @param baseName artifact base name
   * @param suffix product suffix
   * @return artifact file name
   * @throws PersistException if the pair does not form a valid artifact name
   */
  String artifactName(String baseName, String suffix) throws PersistException;
}
