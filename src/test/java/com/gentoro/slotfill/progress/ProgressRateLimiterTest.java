package com.gentoro.slotfill.progress;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProgressRateLimiterTest {

  @Test
  void firstEventAlwaysPasses() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(60_000, 100);
    assertTrue(limiter.tryAcquire(5, 1));
  }

  @Test
  void passesOnIntervalOrDelta() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(1000, 10);
    assertTrue(limiter.tryAcquire(0, 0));
    assertFalse(limiter.tryAcquire(500, 5));
    assertTrue(limiter.tryAcquire(600, 10));
    assertTrue(limiter.tryAcquire(1600, 11));
    assertFalse(limiter.tryAcquire(1700, 12));
  }

  @Test
  void resetAcceptsNextEvent() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(1000, 10);
    assertTrue(limiter.tryAcquire(0, 0));
    assertFalse(limiter.tryAcquire(1, 1));
    limiter.reset();
    assertTrue(limiter.tryAcquire(2, 2));
  }
}
