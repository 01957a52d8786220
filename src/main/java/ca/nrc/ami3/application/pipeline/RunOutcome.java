package ca.nrc.ami3.application.pipeline;

import ca.nrc.ami3.domain.model.ArtifactRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of one {@link PipelineController#run} call.
 *
 * @param status how the run ended
 * @param asnId association identifier
 * @param outputName base name used for aggregate and normalized artifacts; empty when aborted during load
 * @param phases phases entered, in order
 * @param memberArtifacts per-member artifacts in member order, including members with role {@code OTHER}
 * @param scienceArtifacts science member artifacts in member order
 * @param referenceArtifacts reference member artifacts in member order
 * @param referenceAverage persisted reference average, present only when averages are saved
 * @param scienceAverage persisted science average, present only when averages are saved
 * @param normalized persisted normalized product, present when normalization ran
 * @param abortReason reason reported for an {@link Status#ABORTED} run
 * @since 0.1.0
 */
public record RunOutcome(
    Status status,
    String asnId,
    String outputName,
    List<RunPhase> phases,
    List<ArtifactRef> memberArtifacts,
    List<ArtifactRef> scienceArtifacts,
    List<ArtifactRef> referenceArtifacts,
    Optional<ArtifactRef> referenceAverage,
    Optional<ArtifactRef> scienceAverage,
    Optional<ArtifactRef> normalized,
    Optional<String> abortReason) {

  /** Terminal run status. */
  public enum Status {
    /** All applicable phases ran, including normalization. */
    COMPLETED,
    /** Completed without reference data; normalization skipped. */
    COMPLETED_WITHOUT_NORMALIZATION,
    /** Soft abort: a data precondition failed before any stage ran. */
    ABORTED
  }

  public RunOutcome {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(asnId, "asnId");
    Objects.requireNonNull(outputName, "outputName");
    phases = List.copyOf(phases);
    memberArtifacts = List.copyOf(memberArtifacts);
    scienceArtifacts = List.copyOf(scienceArtifacts);
    referenceArtifacts = List.copyOf(referenceArtifacts);
    Objects.requireNonNull(referenceAverage, "referenceAverage");
    Objects.requireNonNull(scienceAverage, "scienceAverage");
    Objects.requireNonNull(normalized, "normalized");
    Objects.requireNonNull(abortReason, "abortReason");
  }

  public boolean aborted() {
    return status == Status.ABORTED;
  }

  /**
   * Lists every artifact this run persisted, in write order.
   *
   * @return member artifacts followed by the reference average, science average and normalized product
   */
  public List<ArtifactRef> writtenArtifacts() {
    List<ArtifactRef> all = new ArrayList<>(memberArtifacts);
    referenceAverage.ifPresent(all::add);
    scienceAverage.ifPresent(all::add);
    normalized.ifPresent(all::add);
    return List.copyOf(all);
  }
}
