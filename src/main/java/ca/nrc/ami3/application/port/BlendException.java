package ca.nrc.ami3.application.port;

/**
 * Thrown when provenance metadata cannot be blended; propagated to the caller, never suppressed.
 *
 * @since 0.1.0
 */
public final class BlendException extends PipelineException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public BlendException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public BlendException(String msg, Throwable cause) { super(msg, cause); }
}
