package rqc.queue;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread factory for the short-lived pool of one drain batch. Threads are daemons named
 * {@code rqc-drain-<batch>-<worker>} so log lines of overlapping batches can be told apart.
 */
final class DrainWorkerThreads implements ThreadFactory {
  private static final AtomicLong BATCHES = new AtomicLong();

  private final long batch = BATCHES.incrementAndGet();
  private final AtomicInteger workers = new AtomicInteger();

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, "rqc-drain-" + batch + "-" + workers.incrementAndGet());
    thread.setDaemon(true);
    return thread;
  }

  long batch() {
    return batch;
  }
}
