package ca.gc.cra.filedrop.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors behind the connection dispatcher.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a thread-per-connection executor: every submitted session gets a worker immediately, idle workers
   * are reclaimed after 60 seconds, and no queue holds sessions back.
   *
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newSessionExecutor(String prefix, UncaughtExceptionHandler handler) {
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        60L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        namedThreads(prefix, "filedrop-session", handler));
  }

  static ThreadFactory namedThreads(String prefix, String fallback, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
