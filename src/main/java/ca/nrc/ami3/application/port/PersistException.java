package ca.nrc.ami3.application.port;

/**
 * Thrown when a product cannot be written to durable storage.
 *
 * @since 0.1.0
 */
public final class PersistException extends PipelineException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public PersistException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public PersistException(String msg, Throwable cause) { super(msg, cause); }
}
