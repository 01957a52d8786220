package ca.nrc.ami3.domain.model;

/**
 * Fixed artifact suffixes used by the level-3 pipeline.
 *
 * @since 0.1.0
 */
public enum ProductSuffix {
  /** Per-member fringe analysis. */
  MEMBER("ami"),
  /** Reference (PSF) average. */
  REFERENCE_AVERAGE("psf-amiavg"),
  /** Science target average. */
  SCIENCE_AVERAGE("amiavg"),
  /** Science average normalized by the reference average. */
  NORMALIZED("aminorm");

  private final String value;

  ProductSuffix(String value) {
    this.value = value;
  }

  /**
   * Returns the suffix appended to artifact base names.
   *
   * @return suffix text without leading underscore
   */
  public String value() {
    return value;
  }
}
