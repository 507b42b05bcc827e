package ca.gc.cra.ctscan.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;

/**
 * Factory helpers for the dedicated threads the report starts on demand.
 */
public final class WorkerThreads {
  private static final String DEFAULT_NAME = "ctscan-worker";

  private WorkerThreads() {}

  /**
   * Builds an unstarted, non-daemon thread for a single long-running task.
   * <p>Threads are non-daemon so the JVM cannot exit while a batch is being written; callers must
   * join them.</p>
   *
   * @param name thread name; blank values fall back to {@code ctscan-worker}
   * @param task work executed by the thread
   * @param handler uncaught exception handler installed on the thread; {@code null} keeps the JVM default
   * @return configured, unstarted thread
   */
  public static Thread newWorkerThread(String name, Runnable task, UncaughtExceptionHandler handler) {
    Objects.requireNonNull(task, "task");
    String threadName = (name == null || name.isBlank()) ? DEFAULT_NAME : name;
    Thread thread = new Thread(task, threadName);
    thread.setDaemon(false);
    if (handler != null) {
      thread.setUncaughtExceptionHandler(handler);
    }
    return thread;
  }
}
