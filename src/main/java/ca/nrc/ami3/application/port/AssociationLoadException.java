package ca.nrc.ami3.application.port;

/**
 * Thrown when an association input is missing or malformed; no stage has run yet.
 *
 * @since 0.1.0
 */
public final class AssociationLoadException extends PipelineException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public AssociationLoadException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public AssociationLoadException(String msg, Throwable cause) { super(msg, cause); }
}
