package ca.nrc.ami3.application.port;

import ca.nrc.ami3.domain.asn.Association;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port supplying the association a pipeline run processes.
 * <p><strong>Why:</strong> Keeps association table parsing out of the controller.</p>
 * <p><strong>Role:</strong> Input port on the source side of the level-3 pipeline.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be stateless.</p>
 *
 * @since 0.1.0
 */
public interface AssociationSource {
  /**
   * Loads an association.
   *
   * @param input association table or single exposure; must not be {@code null}
   * @return loaded association, immutable
   * @throws AssociationLoadException if the input is missing or malformed
   */
  Association load(Path input) throws AssociationLoadException;
}
