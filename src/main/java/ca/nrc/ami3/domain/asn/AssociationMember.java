package ca.nrc.ami3.domain.asn;

import ca.nrc.ami3.validation.Strings;
import java.util.Locale;
import java.util.Objects;

/**
 * One exposure entry of an association product.
 *
 * @param exposure exposure reference (path or handle) handed to the analysis stage; never blank
 * @param role resolved role; never {@code null}
 * @param rawTag original {@code exptype} text, kept for diagnostics; never {@code null}
 * @since 0.1.0
 */
public record AssociationMember(String exposure, MemberRole role, String rawTag) {

  /**
   * Validates the member.
   *
   * @throws IllegalArgumentException if {@code exposure} is blank
   * @throws NullPointerException if {@code role} is {@code null}
   */
  public AssociationMember {
    exposure = Strings.requireNonBlank("exposure", exposure);
    role = Objects.requireNonNull(role, "role");
    rawTag = rawTag == null ? role.name().toLowerCase(Locale.ROOT) : rawTag.trim();
  }

  /**
   * Creates a member from the raw association tag.
   *
   * @param exposure exposure reference
   * @param tag raw {@code exptype} value
   * @return member with its role resolved via {@link MemberRole#fromTag(String)}
   */
  public static AssociationMember of(String exposure, String tag) {
    return new AssociationMember(exposure, MemberRole.fromTag(tag), tag);
  }
}
