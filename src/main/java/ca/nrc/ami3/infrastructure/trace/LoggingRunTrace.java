package ca.nrc.ami3.infrastructure.trace;

import ca.nrc.ami3.application.pipeline.RunPhase;
import ca.nrc.ami3.application.port.RunTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * {@link RunTrace} writing run events through SLF4J with the association id in MDC under {@code asnId}.
 *
 * <p>Events log at INFO, details and phase changes at DEBUG, degraded runs at INFO, soft aborts and
 * failures at ERROR. MDC is scoped to the thread that calls {@link #begin(String)} and cleared by
 * {@link #end()}.</p>
 *
 * @since 0.1.0
 */
public final class LoggingRunTrace implements RunTrace {
  /** MDC key carrying the association id for the duration of a run. */
  public static final String MDC_ASN_ID = "asnId";

  private final Logger log;

  public LoggingRunTrace() {
    this(LoggerFactory.getLogger("ca.nrc.ami3.run"));
  }

  public LoggingRunTrace(Logger log) {
    this.log = log == null ? LoggerFactory.getLogger("ca.nrc.ami3.run") : log;
  }

  @Override
  public void begin(String asnId) {
    MDC.put(MDC_ASN_ID, asnId);
    log.info("Starting level-3 processing of association {}", asnId);
  }

  @Override
  public void phase(RunPhase phase) {
    log.debug("Entering phase {}", phase);
  }

  @Override
  public void event(String message, Object... args) {
    log.info(message, args);
  }

  @Override
  public void detail(String message, Object... args) {
    log.debug(message, args);
  }

  @Override
  public void degraded(String reason) {
    log.info(reason);
  }

  @Override
  public void aborted(String reason) {
    log.error(reason);
  }

  @Override
  public void failed(RunPhase phase, Exception cause) {
    log.error("Level-3 processing failed during {}", phase, cause);
  }

  @Override
  public void end() {
    MDC.remove(MDC_ASN_ID);
  }
}
