package ca.nrc.ami3.application.port;

import ca.nrc.ami3.application.pipeline.RunPhase;

/**
 * <strong>What:</strong> Run-scoped trace sink receiving the controller's progress and terminal events.
 * <p><strong>Why:</strong> Each run reports to the sink it was handed, so repeated or concurrent runs never
 * interleave through shared logger state.</p>
 * <p><strong>Role:</strong> Observability port passed into {@code PipelineController.run}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep soft aborts ({@link #aborted(String)}) and degraded runs ({@link #degraded(String)})
 *       distinguishable from true failures ({@link #failed(RunPhase, Exception)}).</li>
 *   <li>Scope any context (MDC, spans) between {@link #begin(String)} and {@link #end()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #detail(String, Object...)} may be called from analysis workers;
 * every other method is called from the run thread.</p>
 *
 * @since 0.1.0
 */
public interface RunTrace {
  /**
   * Opens the trace for one association.
   *
   * @param asnId association identifier
   */
  void begin(String asnId);

  /**
   * Records a phase transition.
   *
   * @param phase phase being entered
   */
  void phase(RunPhase phase);

  /**
   * Records an operator-relevant event (SLF4J-style {@code {}} placeholders).
   *
   * @param message message template
   * @param args template arguments
   */
  void event(String message, Object... args);

  /**
   * Records a diagnostic detail (SLF4J-style {@code {}} placeholders).
   *
   * @param message message template
   * @param args template arguments
   */
  void detail(String message, Object... args);

  /**
   * Records that the run continues with a phase skipped.
   *
   * @param reason why the run is degraded
   */
  void degraded(String reason);

  /**
   * Records a soft abort caused by a data precondition.
   *
   * @param reason why the run was aborted
   */
  void aborted(String reason);

  /**
   * Records a fatal failure about to propagate to the caller.
   *
   * @param phase phase that failed
   * @param cause failure
   */
  void failed(RunPhase phase, Exception cause);

  /**
   * Closes the trace. Always called, also after failures.
   */
  void end();

  /**
   * Trace that ignores all events.
   */
  RunTrace NO_OP = new RunTrace() {
    @Override public void begin(String asnId) {}

    @Override public void phase(RunPhase phase) {}

    @Override public void event(String message, Object... args) {}

    @Override public void detail(String message, Object... args) {}

    @Override public void degraded(String reason) {}

    @Override public void aborted(String reason) {}

    @Override public void failed(RunPhase phase, Exception cause) {}

    @Override public void end() {}
  };
}
