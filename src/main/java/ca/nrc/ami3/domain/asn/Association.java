package ca.nrc.ami3.domain.asn;

import ca.nrc.ami3.validation.Strings;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Named grouping of related exposures with its declared output products.
 * <p><strong>Why:</strong> The level-3 pipeline processes one association per run and stamps its pool/table
 * provenance on every derived product.</p>
 * <p><strong>Role:</strong> Immutable domain aggregate produced by an {@code AssociationSource} and consumed
 * read-only by the pipeline controller.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param id association identifier (e.g. {@code a3001}); never blank
 * @param poolName pool the association was generated from; never {@code null}
 * @param tableName association table (file) name; never {@code null}
 * @param products declared products in order; copied defensively
 * @since 0.1.0
 */
public record Association(String id, String poolName, String tableName, List<AssociationProduct> products) {

  /**
   * Validates identifiers and freezes the product list.
   *
   * @throws IllegalArgumentException if {@code id} is blank
   */
  public Association {
    id = Strings.requireNonBlank("id", id);
    poolName = Objects.requireNonNull(poolName, "poolName").trim();
    tableName = Objects.requireNonNull(tableName, "tableName").trim();
    products = List.copyOf(Objects.requireNonNull(products, "products"));
  }

  /**
   * Returns the product processed by a pipeline run, i.e. the first one declared.
   *
   * @return first product, or empty when the association declares none
   */
  public Optional<AssociationProduct> primaryProduct() {
    return products.isEmpty() ? Optional.empty() : Optional.of(products.get(0));
  }
}
