package ca.nrc.ami3.domain.model;

import ca.nrc.ami3.domain.asn.Association;
import java.util.Objects;

/**
 * Association provenance stamped on every product the pipeline produces.
 *
 * @param asnId association identifier; never {@code null}
 * @param poolName association pool name; never {@code null}
 * @param tableName association table name; never {@code null}
 * @since 0.1.0
 */
public record AsnProvenance(String asnId, String poolName, String tableName) {
  /** Provenance of a product that has not been stamped yet. */
  public static final AsnProvenance NONE = new AsnProvenance("", "", "");

  /**
   * Rejects {@code null} components.
   */
  public AsnProvenance {
    Objects.requireNonNull(asnId, "asnId");
    Objects.requireNonNull(poolName, "poolName");
    Objects.requireNonNull(tableName, "tableName");
  }

  /**
   * Builds the provenance of an association.
   *
   * @param association source association; must not be {@code null}
   * @return provenance carrying the association id, pool and table names
   */
  public static AsnProvenance of(Association association) {
    Objects.requireNonNull(association, "association");
    return new AsnProvenance(association.id(), association.poolName(), association.tableName());
  }

  /**
   * Indicates whether the provenance was stamped from an association.
   *
   * @return {@code true} when an association id is present
   */
  public boolean stamped() {
    return !asnId.isEmpty();
  }
}
