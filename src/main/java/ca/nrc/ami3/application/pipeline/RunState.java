package ca.nrc.ami3.application.pipeline;

import ca.nrc.ami3.application.port.RunTrace;
import ca.nrc.ami3.domain.asn.MemberRole;
import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.DataProduct;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-run accumulators owned by {@link PipelineController}.
 *
 * <p>Created empty at run start, filled during analysis, consumed by aggregation and normalization,
 * and discarded when the run ends. Not thread-safe; worker results are merged on the calling
 * thread.</p>
 *
 * @since 0.1.0
 */
final class RunState {
  private final RunTrace trace;
  private final List<RunPhase> phases = new ArrayList<>();
  private final List<ArtifactRef> memberArtifacts = new ArrayList<>();
  private final List<ArtifactRef> scienceArtifacts = new ArrayList<>();
  private final List<ArtifactRef> referenceArtifacts = new ArrayList<>();
  private String outputName = "";
  private boolean degraded;
  private DataProduct referenceAggregate;
  private DataProduct scienceAggregate;
  private ArtifactRef referenceAverage;
  private ArtifactRef scienceAverage;
  private ArtifactRef normalized;

  RunState(RunTrace trace) {
    this.trace = Objects.requireNonNull(trace, "trace");
  }

  void enter(RunPhase phase) {
    phases.add(phase);
    trace.phase(phase);
  }

  RunPhase current() {
    return phases.isEmpty() ? RunPhase.LOAD : phases.get(phases.size() - 1);
  }

  List<RunPhase> phases() {
    return Collections.unmodifiableList(phases);
  }

  String outputName() {
    return outputName;
  }

  void outputName(String outputName) {
    this.outputName = outputName;
  }

  boolean degraded() {
    return degraded;
  }

  void markDegraded() {
    degraded = true;
  }

  /**
   * Records a persisted member artifact and routes it to its role accumulator.
   *
   * @param role member role; {@link MemberRole#OTHER} is recorded but never accumulated
   * @param artifact persisted artifact
   */
  void accumulate(MemberRole role, ArtifactRef artifact) {
    memberArtifacts.add(artifact);
    switch (role) {
      case SCIENCE -> scienceArtifacts.add(artifact);
      case REFERENCE -> referenceArtifacts.add(artifact);
      case OTHER -> {
        // analyzed only
      }
    }
  }

  List<ArtifactRef> memberArtifacts() {
    return memberArtifacts;
  }

  List<ArtifactRef> scienceArtifacts() {
    return scienceArtifacts;
  }

  List<ArtifactRef> referenceArtifacts() {
    return referenceArtifacts;
  }

  Optional<DataProduct> referenceAggregate() {
    return Optional.ofNullable(referenceAggregate);
  }

  Optional<DataProduct> scienceAggregate() {
    return Optional.ofNullable(scienceAggregate);
  }

  void aggregate(MemberRole role, DataProduct product, ArtifactRef persisted) {
    if (role == MemberRole.REFERENCE) {
      referenceAggregate = product;
      referenceAverage = persisted;
    } else {
      scienceAggregate = product;
      scienceAverage = persisted;
    }
  }

  void normalized(ArtifactRef artifact) {
    normalized = artifact;
  }

  /**
   * Releases the in-memory aggregates.
   */
  void release() {
    if (referenceAggregate != null) {
      referenceAggregate.close();
    }
    if (scienceAggregate != null) {
      scienceAggregate.close();
    }
  }

  RunOutcome completed(String asnId) {
    RunOutcome.Status status =
        referenceAggregate == null
            ? RunOutcome.Status.COMPLETED_WITHOUT_NORMALIZATION
            : RunOutcome.Status.COMPLETED;
    return new RunOutcome(
        status,
        asnId,
        outputName,
        phases,
        memberArtifacts,
        scienceArtifacts,
        referenceArtifacts,
        Optional.ofNullable(referenceAverage),
        Optional.ofNullable(scienceAverage),
        Optional.ofNullable(normalized),
        Optional.empty());
  }

  RunOutcome aborted(String asnId, String reason) {
    return new RunOutcome(
        RunOutcome.Status.ABORTED,
        asnId,
        outputName,
        phases,
        List.of(),
        List.of(),
        List.of(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.of(reason));
  }
}
