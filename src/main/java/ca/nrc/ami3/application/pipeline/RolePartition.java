package ca.nrc.ami3.application.pipeline;

import ca.nrc.ami3.domain.asn.AssociationMember;
import java.util.List;
import java.util.Objects;

/**
 * Role counts of an association product's original member list.
 *
 * @param scienceCount members tagged science
 * @param referenceCount members tagged reference or PSF
 * @param otherCount members with any other tag
 * @since 0.1.0
 */
public record RolePartition(int scienceCount, int referenceCount, int otherCount) {

  /**
   * Counts member roles.
   *
   * @param members members in association order; must not be {@code null}
   * @return role counts
   */
  public static RolePartition of(List<AssociationMember> members) {
    Objects.requireNonNull(members, "members");
    int science = 0;
    int reference = 0;
    int other = 0;
    for (AssociationMember member : members) {
      switch (member.role()) {
        case SCIENCE -> science++;
        case REFERENCE -> reference++;
        case OTHER -> other++;
      }
    }
    return new RolePartition(science, reference, other);
  }

  public int total() {
    return scienceCount + referenceCount + otherCount;
  }

  public boolean hasScience() {
    return scienceCount > 0;
  }

  public boolean hasReference() {
    return referenceCount > 0;
  }
}
