package com.aoimapper.analyzer.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal carrying an optional deadline.
 *
 * <p>Blocking stages poll {@link #throwIfCancelled()} and register callbacks with
 * {@link #onCancel(Runnable)} to abort in-flight work when {@link #cancel(String)} is called.
 * The deadline does not fire callbacks by itself: waiters bound their waits with
 * {@link #remaining()}.
 */
public final class CancellationToken {
  private static final long NO_DEADLINE = Long.MAX_VALUE;

  private final long deadlineNanos;
  private final Duration timeout;
  private final AtomicReference<String> cancelReason = new AtomicReference<>();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  private CancellationToken(long deadlineNanos, Duration timeout) {
    this.deadlineNanos = deadlineNanos;
    this.timeout = timeout;
  }

  public static CancellationToken none() {
    return new CancellationToken(NO_DEADLINE, null);
  }

  public static CancellationToken withTimeout(Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    long now = System.nanoTime();
    long nanos = timeout.toNanos();
    long deadline = now + nanos < now ? NO_DEADLINE : now + nanos;
    return new CancellationToken(deadline, timeout);
  }

  /**
   * Cancels the token and runs registered callbacks once.
   *
   * @param reason human-readable cancellation reason
   */
  public void cancel(String reason) {
    if (cancelReason.compareAndSet(null, reason == null ? "cancelled" : reason)) {
      for (Runnable callback : callbacks) {
        callback.run();
      }
    }
  }

  public boolean isCancelled() {
    return cancelReason.get() != null;
  }

  public boolean isExpired() {
    return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0;
  }

  public boolean hasDeadline() {
    return deadlineNanos != NO_DEADLINE;
  }

  /**
   * Time left before the deadline, or {@code null} when the token has none.
   *
   * @return remaining time, never negative
   */
  public Duration remaining() {
    if (deadlineNanos == NO_DEADLINE) {
      return null;
    }
    long left = deadlineNanos - System.nanoTime();
    return Duration.ofNanos(Math.max(0L, left));
  }

  /**
   * Registers a callback run on cancellation. Runs it immediately if already cancelled.
   *
   * @param callback action aborting in-flight work
   * @return handle removing the callback
   */
  public Registration onCancel(Runnable callback) {
    callbacks.add(callback);
    if (isCancelled()) {
      callback.run();
    }
    return () -> callbacks.remove(callback);
  }

  /** Throws {@link AnalysisTimeoutException} when cancelled or past the deadline. */
  public void throwIfCancelled() {
    String reason = cancelReason.get();
    if (reason != null) {
      throw new AnalysisTimeoutException("Analysis cancelled: " + reason);
    }
    if (isExpired()) {
      throw expired();
    }
  }

  /**
   * Builds the timeout failure reported when the deadline passed.
   *
   * @return timeout exception naming the configured bound
   */
  public AnalysisTimeoutException expired() {
    String bound = timeout == null ? "deadline" : timeout.toMillis() + " ms";
    return new AnalysisTimeoutException("Analysis exceeded its time limit of " + bound);
  }

  /** Handle returned by {@link #onCancel(Runnable)}. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
