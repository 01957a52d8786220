package ca.nrc.ami3.domain.model;

import java.util.Locale;

/**
 * Kind of product flowing through the level-3 pipeline.
 *
 * @since 0.1.0
 */
public enum ProductKind {
  /** Per-exposure fringe fit produced by the analysis stage. */
  FRINGE_FIT("fringe-fit"),
  /** Role average of several fringe fits. */
  FRINGE_AVERAGE("fringe-average"),
  /** Science average normalized by the reference average. */
  FRINGE_NORMALIZED("fringe-normalized");

  private final String wireName;

  ProductKind(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the name written to persisted products.
   *
   * @return lowercase wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a persisted wire name.
   *
   * @param value wire name such as {@code fringe-average}
   * @return matching kind
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ProductKind fromWireName(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (ProductKind kind : values()) {
        if (kind.wireName.equals(normalized)) {
          return kind;
        }
      }
    }
    throw new IllegalArgumentException("Unknown product kind: " + value);
  }
}
