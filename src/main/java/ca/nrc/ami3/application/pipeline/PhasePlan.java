package ca.nrc.ami3.application.pipeline;

import ca.nrc.ami3.domain.asn.Association;
import ca.nrc.ami3.domain.asn.AssociationMember;
import ca.nrc.ami3.domain.asn.AssociationProduct;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Phases a run of an association would enter, derived from its role partition without running any stage.
 *
 * <p>Used by dry runs and {@code inspect}; mirrors the gating applied by {@link PipelineController}.</p>
 *
 * @param asnId association id
 * @param partition role counts of the primary product
 * @param phases phases in execution order, ending in {@link RunPhase#DONE} or {@link RunPhase#ABORTED}
 * @param abortReason reason the run would abort, if it would
 * @since 0.1.0
 */
public record PhasePlan(String asnId, RolePartition partition, List<RunPhase> phases, Optional<String> abortReason) {

  public PhasePlan {
    Objects.requireNonNull(asnId, "asnId");
    Objects.requireNonNull(partition, "partition");
    phases = List.copyOf(phases);
    Objects.requireNonNull(abortReason, "abortReason");
  }

  /**
   * Plans a run of the association's primary product.
   *
   * @param association association to plan; must not be {@code null}
   * @return plan of the phases a run would enter
   */
  public static PhasePlan of(Association association) {
    Objects.requireNonNull(association, "association");
    String asnId = association.id();
    List<RunPhase> phases = new ArrayList<>();
    phases.add(RunPhase.LOAD);
    Optional<AssociationProduct> product = association.primaryProduct();
    List<AssociationMember> members = product.map(AssociationProduct::members).orElse(List.of());
    RolePartition partition = RolePartition.of(members);
    if (product.isEmpty()) {
      phases.add(RunPhase.ABORTED);
      return new PhasePlan(asnId, partition, phases,
          Optional.of("Association " + asnId + " declares no products"));
    }
    phases.add(RunPhase.VALIDATE);
    if (!partition.hasScience()) {
      phases.add(RunPhase.ABORTED);
      return new PhasePlan(asnId, partition, phases,
          Optional.of("No science target members found in association " + asnId));
    }
    phases.add(RunPhase.ANALYZE);
    if (partition.hasReference()) {
      phases.add(RunPhase.AGGREGATE_REFERENCE);
    }
    phases.add(RunPhase.AGGREGATE_SCIENCE);
    if (partition.hasReference()) {
      phases.add(RunPhase.NORMALIZE);
    }
    phases.add(RunPhase.DONE);
    return new PhasePlan(asnId, partition, phases, Optional.empty());
  }

  public boolean wouldAbort() {
    return abortReason.isPresent();
  }

  public boolean degraded() {
    return !wouldAbort() && !partition.hasReference();
  }
}
