package ca.gc.cra.salvage.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the worker pools that validate and repair artifacts.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for per-artifact work.
   *
   * <p>Tasks queue without bound because a batch is submitted at once through
   * {@link ExecutorService#invokeAll}; the batch size already bounds the queue.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "salvage-worker" : prefix;
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
   * Shuts a pool down, waiting briefly for running tasks.
   *
   * @param pool pool to stop
   * @param timeoutMillis how long to wait before interrupting workers
   * @return {@code true} when every worker finished within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public static boolean shutdown(ExecutorService pool, long timeoutMillis) throws InterruptedException {
    pool.shutdown();
    if (pool.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
      return true;
    }
    pool.shutdownNow();
    return false;
  }
}
