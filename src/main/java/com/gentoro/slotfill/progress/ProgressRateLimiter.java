package com.gentoro.slotfill.progress;

/**
 * Time and delta based rate limiter for training progress updates.
 *
 * <p>An event passes when at least {@code minIntervalMs} elapsed since the last accepted event or
 * when the completed counter moved by at least {@code minDelta} units. The first event always
 * passes.
 */
public class ProgressRateLimiter {
  private final long minIntervalMs;
  private final long minDelta;

  private long lastAcceptedAt;
  private long lastCompleted;

  public ProgressRateLimiter(long minIntervalMs, long minDelta) {
    this.minIntervalMs = Math.max(0, minIntervalMs);
    this.minDelta = Math.max(0, minDelta);
    reset();
  }

  /** Forget previous events so that the next one is accepted. */
  public synchronized void reset() {
    this.lastAcceptedAt = Long.MIN_VALUE;
    this.lastCompleted = Long.MIN_VALUE;
  }

  /** Return true if the event should be emitted given current time and completed units. */
  public synchronized boolean tryAcquire(long nowMs, long completed) {
    boolean first = lastCompleted == Long.MIN_VALUE;
    boolean intervalOk = first || (nowMs - lastAcceptedAt) >= minIntervalMs;
    boolean deltaOk = first || Math.abs(completed - lastCompleted) >= minDelta;
    if (intervalOk || deltaOk) {
      lastAcceptedAt = nowMs;
      lastCompleted = completed;
      return true;
    }
    return false;
  }
}
