package ca.nrc.ami3.api;

/**
 * Process exit codes returned by the CLI.
 *
 * <p>A soft-aborted run (no science members) exits with {@link #SUCCESS}; the abort is reported in the
 * log and the printed summary.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Completed, completed without normalization, or soft-aborted. */
  SUCCESS(0),
  /** Invalid arguments or configuration values. */
  INVALID_ARGS(2),
  /** Input could not be read or output could not be written. */
  IO_ERROR(3),
  /** Configuration rejected while wiring the pipeline. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** A processing stage or metadata blending failed. */
  STAGE_FAILURE(6),
  /** Interrupted while running. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
