package ca.nrc.ami3.application.port;

/**
 * Thrown when an association cannot be processed (no products, no science members).
 * <p>The controller absorbs it into an aborted run instead of failing the host.</p>
 *
 * @since 0.1.0
 */
public final class ValidationException extends PipelineException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public ValidationException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public ValidationException(String msg, Throwable cause) { super(msg, cause); }
}
