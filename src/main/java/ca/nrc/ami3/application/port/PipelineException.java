package ca.nrc.ami3.application.port;

/**
 * Base checked exception for failures raised while running the level-3 pipeline.
 *
 * @since 0.1.0
 */
public class PipelineException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public PipelineException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public PipelineException(String msg, Throwable cause) { super(msg, cause); }
}
