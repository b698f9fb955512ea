package recurrent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cooperative cancellation signal shared between a long-running component and
 * the driver that owns it.
 *
 * <p>Callbacks registered through {@link #register(Runnable)} run once, on the
 * thread that calls {@link #cancel()}, or immediately if the token is already
 * cancelled. {@link #await(Duration)} is a cancellable sleep.
 *
 * <p>This class is thread-safe.
 */
public final class CancellationToken {
  private static final Logger logger = Logger.getLogger(CancellationToken.class.getName());

  private final CountDownLatch latch = new CountDownLatch(1);
  private final List<Runnable> callbacks = new ArrayList<>();
  private boolean cancelled;

  /**
   * Requests cancellation and runs every registered callback. Subsequent calls are no-ops.
   */
  public void cancel() {
    List<Runnable> toRun;
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      toRun = new ArrayList<>(callbacks);
      callbacks.clear();
    }
    latch.countDown();
    for (Runnable callback : toRun) {
      runCallback(callback);
    }
  }

  public synchronized boolean isCancellationRequested() {
    return cancelled;
  }

  /**
   * Registers a callback to run on cancellation. Closing the returned
   * registration unregisters the callback.
   *
   * @param callback the callback, typically cancelling an in-flight statement
   * @return the registration handle
   */
  public Registration register(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    synchronized (this) {
      if (!cancelled) {
        callbacks.add(callback);
        return () -> unregister(callback);
      }
    }
    runCallback(callback);
    return () -> { };
  }

  /**
   * Waits until the timeout elapses or cancellation is requested, whichever comes first.
   * An interrupt counts as cancellation of the wait; the interrupt flag is restored.
   *
   * @param timeout how long to wait
   * @return {@code true} if the wait ended because of cancellation or interruption
   */
  public boolean await(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    try {
      return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  private synchronized void unregister(Runnable callback) {
    callbacks.remove(callback);
  }

  private static void runCallback(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Cancellation callback failed", e);
    }
  }

  /** Handle returned by {@link #register(Runnable)}. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
