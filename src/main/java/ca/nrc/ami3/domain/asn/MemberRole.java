package ca.nrc.ami3.domain.asn;

import java.util.Locale;

/**
 * <strong>What:</strong> Closed set of roles an association member can play in a level-3 run.
 * <p><strong>Why:</strong> Role decides which branch of the pipeline consumes a member's analysis artifact.</p>
 * <p><strong>Role:</strong> Domain value type shared by association loaders and the pipeline controller.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map raw association {@code exptype} tags to a role, case-insensitively.</li>
 *   <li>Expose an explicit {@link #OTHER} variant so unrecognized tags stay visible instead of falling through.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum MemberRole {
  /** Target of interest; aggregated and normalized. */
  SCIENCE,
  /** Calibration reference (PSF); aggregated and used to normalize science. */
  REFERENCE,
  /** Any other tag; analyzed but never aggregated. */
  OTHER;

  /**
   * Resolves a raw association tag to a role.
   *
   * <p>{@code "science"} maps to {@link #SCIENCE}; {@code "reference"} and {@code "psf"} map to
   * {@link #REFERENCE}; blanks, {@code null} and anything else map to {@link #OTHER}.</p>
   *
   * @param tag raw {@code exptype} value; may be {@code null}
   * @return resolved role, never {@code null}
   */
  public static MemberRole fromTag(String tag) {
    if (tag == null) {
      return OTHER;
    }
    return switch (tag.trim().toUpperCase(Locale.ROOT)) {
      case "SCIENCE" -> SCIENCE;
      case "REFERENCE", "PSF" -> REFERENCE;
      default -> OTHER;
    };
  }

  /**
   * Indicates whether members of this role feed an aggregate.
   *
   * @return {@code true} for {@link #SCIENCE} and {@link #REFERENCE}
   */
  public boolean aggregated() {
    return this != OTHER;
  }
}
