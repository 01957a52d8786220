package ca.nrc.ami3.infrastructure.trace;

import ca.nrc.ami3.application.pipeline.RunPhase;
import ca.nrc.ami3.application.port.RunTrace;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.helpers.MessageFormatter;

/**
 * In-memory trace used for tests and diagnostics.
 *
 * <p>Thread-safe: analysis workers may report concurrently.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryRunTrace implements RunTrace {

  /** Kind of recorded entry. */
  public enum Kind { BEGIN, PHASE, EVENT, DETAIL, DEGRADED, ABORTED, FAILED, END }

  /**
   * One recorded entry.
   *
   * @param kind entry kind
   * @param phase phase for {@link Kind#PHASE} and {@link Kind#FAILED}, otherwise {@code null}
   * @param message formatted message
   * @param cause failure for {@link Kind#FAILED}, otherwise {@code null}
   */
  public record Entry(Kind kind, RunPhase phase, String message, Exception cause) {}

  private final CopyOnWriteArrayList<Entry> entries = new CopyOnWriteArrayList<>();

  @Override
  public void begin(String asnId) {
    entries.add(new Entry(Kind.BEGIN, null, asnId, null));
  }

  @Override
  public void phase(RunPhase phase) {
    entries.add(new Entry(Kind.PHASE, Objects.requireNonNull(phase, "phase"), phase.name(), null));
  }

  @Override
  public void event(String message, Object... args) {
    entries.add(new Entry(Kind.EVENT, null, format(message, args), null));
  }

  @Override
  public void detail(String message, Object... args) {
    entries.add(new Entry(Kind.DETAIL, null, format(message, args), null));
  }

  @Override
  public void degraded(String reason) {
    entries.add(new Entry(Kind.DEGRADED, null, reason, null));
  }

  @Override
  public void aborted(String reason) {
    entries.add(new Entry(Kind.ABORTED, null, reason, null));
  }

  @Override
  public void failed(RunPhase phase, Exception cause) {
    entries.add(new Entry(Kind.FAILED, phase, String.valueOf(cause), cause));
  }

  @Override
  public void end() {
    entries.add(new Entry(Kind.END, null, "", null));
  }

  /**
   * Returns a snapshot of recorded entries.
   *
   * @return immutable list of entries
   */
  public List<Entry> snapshot() {
    return List.copyOf(entries);
  }

  /**
   * Returns the phases entered, in order.
   *
   * @return phase list
   */
  public List<RunPhase> phases() {
    return entries.stream().filter(e -> e.kind() == Kind.PHASE).map(Entry::phase).toList();
  }

  /**
   * Returns the messages recorded with the given kind.
   *
   * @param kind entry kind
   * @return messages in record order
   */
  public List<String> messages(Kind kind) {
    return entries.stream().filter(e -> e.kind() == kind).map(Entry::message).toList();
  }

  /**
   * Clears the recorded entries.
   */
  public void clear() {
    entries.clear();
  }

  private static String format(String message, Object[] args) {
    return MessageFormatter.arrayFormat(message, args).getMessage();
  }
}
