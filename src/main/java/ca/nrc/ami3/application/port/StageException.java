package ca.nrc.ami3.application.port;

/**
 * Thrown when an analysis, aggregation or normalization stage cannot produce its result.
 *
 * @since 0.1.0
 */
public final class StageException extends PipelineException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public StageException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public StageException(String msg, Throwable cause) { super(msg, cause); }
}
