package ca.gc.cra.diagsink.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the sink's background threads.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded scheduler for the rotation monitor.
   * <p>The thread is a daemon so a forgotten monitor never keeps the benchmark JVM alive; the sink
   * drains explicitly through its shutdown path.</p>
   *
   * @param prefix thread-name prefix used to tag the monitor thread
   * @param handler uncaught exception handler installed on the thread
   * @return configured scheduler
   */
  public static ScheduledExecutorService newMonitorScheduler(String prefix, UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(1, newThreadFactory(prefix, "diagsink-monitor", true, handler));
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    return executor;
  }

  /**
   * Builds a thread factory with indexed names.
   *
   * @param prefix thread-name prefix; blank falls back to {@code fallbackPrefix}
   * @param fallbackPrefix prefix used when {@code prefix} is blank
   * @param daemon whether created threads are daemons
   * @param handler uncaught exception handler; {@code null} keeps the thread group's handler
   * @return thread factory
   */
  public static ThreadFactory newThreadFactory(
      String prefix, String fallbackPrefix, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallbackPrefix : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    };
  }
}
