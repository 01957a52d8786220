package ca.nrc.ami3.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the bounded worker pools used by pipeline stages.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for stage workers.
   *
   * <p>Tasks beyond {@code size} queue in submission order; worker threads are named
   * {@code <prefix>-<n>} and are non-daemon.</p>
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   * @throws IllegalArgumentException if {@code size} is not positive
   */
  public static ExecutorService newStagePool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "ami3-stage" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Shuts an executor down and waits briefly for running tasks.
   *
   * @param executor executor to stop; ignored when {@code null}
   * @param timeoutMillis maximum wait in milliseconds
   * @return {@code true} when the executor terminated within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public static boolean shutdown(ExecutorService executor, long timeoutMillis) throws InterruptedException {
    if (executor == null) {
      return true;
    }
    executor.shutdownNow();
    return executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
  }
}
