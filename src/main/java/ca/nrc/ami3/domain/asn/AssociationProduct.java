package ca.nrc.ami3.domain.asn;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output product declared by an association: an optional name override and its ordered members.
 *
 * @param name optional output base name override
 * @param members members in association order; copied defensively
 * @since 0.1.0
 */
public record AssociationProduct(Optional<String> name, List<AssociationMember> members) {

  /**
   * Normalizes the name and freezes the member list.
   */
  public AssociationProduct {
    name = name == null ? Optional.empty() : name.map(String::trim).filter(value -> !value.isEmpty());
    members = List.copyOf(Objects.requireNonNull(members, "members"));
  }
}
