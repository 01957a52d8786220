package ca.nrc.ami3.application.pipeline;

import ca.nrc.ami3.application.port.AggregationStage;
import ca.nrc.ami3.application.port.AnalysisStage;
import ca.nrc.ami3.application.port.BlendInput;
import ca.nrc.ami3.application.port.MetadataBlender;
import ca.nrc.ami3.application.port.MetricsPort;
import ca.nrc.ami3.application.port.NormalizationStage;
import ca.nrc.ami3.application.port.PersistException;
import ca.nrc.ami3.application.port.PipelineException;
import ca.nrc.ami3.application.port.ProductPersister;
import ca.nrc.ami3.application.port.RunTrace;
import ca.nrc.ami3.application.port.StageException;
import ca.nrc.ami3.application.port.ValidationException;
import ca.nrc.ami3.domain.asn.Association;
import ca.nrc.ami3.domain.asn.AssociationMember;
import ca.nrc.ami3.domain.asn.AssociationProduct;
import ca.nrc.ami3.domain.asn.MemberRole;
import ca.nrc.ami3.domain.model.ArtifactRef;
import ca.nrc.ami3.domain.model.AsnProvenance;
import ca.nrc.ami3.domain.model.DataProduct;
import ca.nrc.ami3.domain.model.ProductSuffix;
import ca.nrc.ami3.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Level-3 orchestration of an aperture-masking association.
 * <p><strong>Why:</strong> Turns an association of calibrated exposures into per-exposure fringe products,
 * role averages and a reference-normalized science product, carrying association provenance into every
 * derived product.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the stage, blending and persistence
 * ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the first association product and validate its member roles.</li>
 *   <li>Analyze and persist every member in association order.</li>
 *   <li>Average reference then science artifacts, persisting the averages when configured.</li>
 *   <li>Normalize science by reference only when a reference average exists.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds no state between runs; concurrent {@link #run} calls are safe when
 * the injected ports are. Analysis may fan out to {@link Options#analysisWorkers()} threads; results are
 * merged on the calling thread in member order.</p>
 * <p><strong>Observability:</strong> Reports phases and events to the {@link RunTrace} supplied per run and
 * emits {@code ami3.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class PipelineController {
  private static final Logger log = LoggerFactory.getLogger(PipelineController.class);
  private static final String MDC_MEMBER = "member";
  private static final long POOL_SHUTDOWN_MILLIS = 5_000L;

  private final AnalysisStage analysis;
  private final AggregationStage aggregation;
  private final NormalizationStage normalization;
  private final MetadataBlender blender;
  private final ProductPersister persister;
  private final MetricsPort metrics;
  private final Options options;

  /**
   * Run options taken from the pipeline configuration.
   *
   * @param saveAverages persist the reference and science averages
   * @param analysisWorkers number of members analyzed concurrently; {@code 1} is sequential
   * @param outputName base name for aggregate artifacts when the association product has none
   */
  public record Options(boolean saveAverages, int analysisWorkers, Optional<String> outputName) {
    public static final Options DEFAULTS = new Options(false, 1, Optional.empty());

    public Options {
      if (analysisWorkers < 1) {
        throw new IllegalArgumentException("analysisWorkers must be at least 1");
      }
      outputName = Objects.requireNonNull(outputName, "outputName").map(String::trim).filter(s -> !s.isEmpty());
    }
  }

  /**
   * Creates a controller with explicit ports.
   *
   * @param analysis per-exposure fringe analysis; must not be {@code null}
   * @param aggregation role averaging; must not be {@code null}
   * @param normalization reference normalization; must not be {@code null}
   * @param blender metadata blender; must not be {@code null}
   * @param persister product persister; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param options run options; must not be {@code null}
   */
  public PipelineController(
      AnalysisStage analysis,
      AggregationStage aggregation,
      NormalizationStage normalization,
      MetadataBlender blender,
      ProductPersister persister,
      MetricsPort metrics,
      Options options) {
    this.analysis = Objects.requireNonNull(analysis, "analysis");
    this.aggregation = Objects.requireNonNull(aggregation, "aggregation");
    this.normalization = Objects.requireNonNull(normalization, "normalization");
    this.blender = Objects.requireNonNull(blender, "blender");
    this.persister = Objects.requireNonNull(persister, "persister");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.options = Objects.requireNonNull(options, "options");
  }

  public Options options() {
    return options;
  }

  /**
   * Runs the level-3 sequence for one association.
   *
   * <p>A missing science member, an association without products, or two members whose artifacts would share
   * a file name end the run as {@link RunOutcome.Status#ABORTED} before any stage is invoked. A missing
   * reference member degrades the run: aggregation still happens, normalization does not.</p>
   *
   * @param association association to process; must not be {@code null}
   * @param trace sink for run phases and events; must not be {@code null}
   * @return terminal outcome
   * @throws PipelineException if a stage, the blender or the persister fails; the failure is traced first
   * @throws InterruptedException if interrupted while waiting for analysis workers
   */
  public RunOutcome run(Association association, RunTrace trace) throws PipelineException, InterruptedException {
    Objects.requireNonNull(association, "association");
    Objects.requireNonNull(trace, "trace");
    String asnId = association.id();
    AsnProvenance provenance = AsnProvenance.of(association);
    RunState state = new RunState(trace);
    trace.begin(asnId);
    try {
      state.enter(RunPhase.LOAD);
      List<AssociationMember> members;
      try {
        AssociationProduct product = primaryProduct(association);
        state.outputName(outputNameFor(product, association));
        members = product.members();
        state.enter(RunPhase.VALIDATE);
        checkMemberNames(members, asnId);
        validate(RolePartition.of(members), asnId, state, trace);
      } catch (ValidationException ex) {
        state.enter(RunPhase.ABORTED);
        trace.aborted(ex.getMessage());
        metrics.increment("ami3.run.aborted");
        return state.aborted(asnId, ex.getMessage());
      }

      trace.event("Processing association {} into {} from {} members", asnId, state.outputName(), members.size());
      state.enter(RunPhase.ANALYZE);
      analyze(members, provenance, state, trace);

      if (!state.referenceArtifacts().isEmpty()) {
        state.enter(RunPhase.AGGREGATE_REFERENCE);
        aggregate(MemberRole.REFERENCE, state.referenceArtifacts(), provenance, state, trace);
      }
      if (!state.scienceArtifacts().isEmpty()) {
        state.enter(RunPhase.AGGREGATE_SCIENCE);
        aggregate(MemberRole.SCIENCE, state.scienceArtifacts(), provenance, state, trace);
      }
      if (state.referenceAggregate().isPresent()) {
        state.enter(RunPhase.NORMALIZE);
        normalize(provenance, state, trace);
      }

      state.enter(RunPhase.DONE);
      trace.event("Level-3 processing of association {} complete", asnId);
      metrics.increment(state.degraded() ? "ami3.run.degraded" : "ami3.run.completed");
      return state.completed(asnId);
    } catch (PipelineException | RuntimeException ex) {
      trace.failed(state.current(), ex);
      metrics.increment("ami3.run.failed");
      throw ex;
    } catch (InterruptedException ex) {
      trace.failed(state.current(), ex);
      metrics.increment("ami3.run.failed");
      Thread.currentThread().interrupt();
      throw ex;
    } finally {
      state.release();
      trace.end();
    }
  }

  private static AssociationProduct primaryProduct(Association association) throws ValidationException {
    return association.primaryProduct()
        .orElseThrow(() -> new ValidationException(
            "Association " + association.id() + " declares no products; processing aborted"));
  }

  private String outputNameFor(AssociationProduct product, Association association) {
    return product.name().or(options::outputName).orElse(association.id());
  }

  private static void validate(RolePartition partition, String asnId, RunState state, RunTrace trace)
      throws ValidationException {
    trace.detail(
        "Association {} members: total={} science={} reference={} other={}",
        asnId,
        partition.total(),
        partition.scienceCount(),
        partition.referenceCount(),
        partition.otherCount());
    if (!partition.hasScience()) {
      throw new ValidationException(
          "No science target members found in association " + asnId + "; processing aborted");
    }
    if (!partition.hasReference()) {
      state.markDegraded();
      trace.degraded("No reference PSF members found in association " + asnId + "; normalization will be skipped");
    }
  }

  private void checkMemberNames(List<AssociationMember> members, String asnId) throws ValidationException {
    Map<String, String> owners = new HashMap<>();
    for (AssociationMember member : members) {
      String name;
      try {
        name = persister.artifactName(member.exposure(), ProductSuffix.MEMBER.value());
      } catch (PersistException ex) {
        throw new ValidationException(
            "Member " + member.exposure() + " in association " + asnId + " has no valid artifact name; "
                + "processing aborted",
            ex);
      }
      String previous = owners.putIfAbsent(name, member.exposure());
      if (previous != null) {
        throw new ValidationException(
            "Members " + previous + " and " + member.exposure() + " both map to artifact " + name
                + " in association " + asnId + "; processing aborted");
      }
    }
  }

  private void analyze(List<AssociationMember> members, AsnProvenance provenance, RunState state, RunTrace trace)
      throws PipelineException, InterruptedException {
    List<ArtifactRef> artifacts =
        options.analysisWorkers() > 1 && members.size() > 1
            ? analyzeInParallel(members, provenance, trace)
            : analyzeSequentially(members, provenance, trace);
    for (int i = 0; i < members.size(); i++) {
      AssociationMember member = members.get(i);
      if (!member.role().aggregated()) {
        trace.event("Member {} has role '{}'; analyzed but not aggregated", member.exposure(), member.rawTag());
      }
      state.accumulate(member.role(), artifacts.get(i));
    }
  }

  private List<ArtifactRef> analyzeSequentially(
      List<AssociationMember> members, AsnProvenance provenance, RunTrace trace) throws PipelineException {
    List<ArtifactRef> artifacts = new ArrayList<>(members.size());
    for (AssociationMember member : members) {
      artifacts.add(analyzeMember(member, provenance, trace));
    }
    return artifacts;
  }

  private List<ArtifactRef> analyzeInParallel(
      List<AssociationMember> members, AsnProvenance provenance, RunTrace trace)
      throws PipelineException, InterruptedException {
    int workers = Math.min(options.analysisWorkers(), members.size());
    ExecutorService pool =
        ExecutorFactories.newStagePool(
            workers, "ami3-analyze", (thread, ex) -> log.error("Analysis worker {} failed", thread.getName(), ex));
    Throwable failure = null;
    try {
      List<Callable<ArtifactRef>> tasks = new ArrayList<>(members.size());
      String asnMdc = MDC.get("asnId");
      for (AssociationMember member : members) {
        tasks.add(() -> {
          if (asnMdc != null) {
            MDC.put("asnId", asnMdc);
          }
          try {
            return analyzeMember(member, provenance, trace);
          } finally {
            MDC.remove("asnId");
          }
        });
      }
      List<Future<ArtifactRef>> futures = pool.invokeAll(tasks);
      List<ArtifactRef> artifacts = new ArrayList<>(members.size());
      for (int i = 0; i < futures.size(); i++) {
        artifacts.add(await(futures.get(i), members.get(i)));
      }
      return artifacts;
    } catch (Throwable ex) {
      failure = ex;
      throw ex;
    } finally {
      stopPool(pool, failure);
    }
  }

  /**
   * Stops an analysis pool. An interrupt while waiting is attached to {@code failure} when one is already
   * propagating, and thrown otherwise.
   */
  static void stopPool(ExecutorService pool, Throwable failure) throws InterruptedException {
    try {
      if (!ExecutorFactories.shutdown(pool, POOL_SHUTDOWN_MILLIS)) {
        log.warn("Analysis pool did not terminate within {} ms", POOL_SHUTDOWN_MILLIS);
      }
    } catch (InterruptedException ex) {
      if (failure == null) {
        throw ex;
      }
      Thread.currentThread().interrupt();
      failure.addSuppressed(ex);
    }
  }

  private static ArtifactRef await(Future<ArtifactRef> future, AssociationMember member)
      throws PipelineException, InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof PipelineException pipeline) {
        throw pipeline;
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new StageException("Analysis of " + member.exposure() + " failed", cause);
    }
  }

  private ArtifactRef analyzeMember(AssociationMember member, AsnProvenance provenance, RunTrace trace)
      throws PipelineException {
    MDC.put(MDC_MEMBER, member.exposure());
    long started = System.nanoTime();
    try {
      trace.detail("Analyzing {} member {}", member.role(), member.exposure());
      DataProduct result = requireResult(analysis.run(member.exposure()), "Analysis of " + member.exposure());
      try (result) {
        result.meta().asn(provenance);
        ArtifactRef artifact =
            persister.save(result, member.exposure(), ProductSuffix.MEMBER.value(), provenance.asnId());
        trace.event("Fringe analysis of {} saved to {}", member.exposure(), artifact);
        metrics.increment("ami3.members.analyzed");
        metrics.observe("ami3.analyze.latencyNanos", System.nanoTime() - started);
        return artifact;
      }
    } finally {
      MDC.remove(MDC_MEMBER);
    }
  }

  private void aggregate(
      MemberRole role, List<ArtifactRef> inputs, AsnProvenance provenance, RunState state, RunTrace trace)
      throws PipelineException {
    String label = role == MemberRole.REFERENCE ? "reference" : "science";
    trace.detail("Averaging {} {} results", inputs.size(), label);
    List<ArtifactRef> ordered = List.copyOf(inputs);
    DataProduct average = requireResult(aggregation.run(ordered), "Averaging of " + label + " results");
    metrics.increment("ami3.aggregates.produced");
    average.meta().asn(provenance);
    ArtifactRef persisted = null;
    try {
      if (options.saveAverages()) {
        trace.detail("Blending metadata for averaged {} product", label);
        blender.blend(average, BlendInput.ofArtifacts(ordered));
        persisted = persister.save(average, state.outputName(), averageSuffix(role).value(), provenance.asnId());
        trace.event("Averaged {} results saved to {}", label, persisted);
      }
    } catch (PipelineException | RuntimeException ex) {
      // not yet owned by the run state
      average.close();
      throw ex;
    }
    state.aggregate(role, average, persisted);
  }

  private static ProductSuffix averageSuffix(MemberRole role) {
    return role == MemberRole.REFERENCE ? ProductSuffix.REFERENCE_AVERAGE : ProductSuffix.SCIENCE_AVERAGE;
  }

  private BlendInput averageInput(DataProduct average, MemberRole role, RunState state) throws PersistException {
    Optional<String> written = average.meta().fileName();
    String identity =
        written.isPresent() ? written.get() : persister.artifactName(state.outputName(), averageSuffix(role).value());
    return BlendInput.of(average, identity);
  }

  private void normalize(AsnProvenance provenance, RunState state, RunTrace trace) throws PipelineException {
    DataProduct reference = state.referenceAggregate().orElseThrow();
    DataProduct science =
        state.scienceAggregate()
            .orElseThrow(() -> new StageException("No science average available for normalization"));
    trace.detail("Normalizing science average by reference average");
    metrics.increment("ami3.normalize.invoked");
    try (DataProduct normalized = requireResult(normalization.run(science, reference), "Normalization")) {
      normalized.meta().asn(provenance);
      trace.detail("Blending metadata for normalized product");
      blender.blend(
          normalized,
          List.of(
              averageInput(science, MemberRole.SCIENCE, state),
              averageInput(reference, MemberRole.REFERENCE, state)));
      ArtifactRef artifact =
          persister.save(normalized, state.outputName(), ProductSuffix.NORMALIZED.value(), provenance.asnId());
      state.normalized(artifact);
      trace.event("Normalized science product saved to {}", artifact);
    }
  }

  private static DataProduct requireResult(DataProduct product, String what) throws StageException {
    if (product == null) {
      throw new StageException(what + " returned no product");
    }
    return product;
  }
}
