package com.spotify.attempt;

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Mutable bookkeeping for one execution of a policy. Both the blocking and the non-blocking loop
 * feed their failures through {@link #onFailure()} and only differ in how they wait.
 *
 * <p>Not thread-safe. Attempts of one execution are sequential, so one instance is only ever
 * touched by one attempt at a time.
 */
final class RetryState {

  /** What to do after a failed attempt. */
  static final class Decision {
    private static final Decision EXHAUSTED = new Decision(true, null);
    private static final Decision IMMEDIATELY = new Decision(false, null);

    private final boolean exhausted;
    private final @Nullable Duration wait;

    private Decision(boolean exhausted, @Nullable Duration wait) {
      this.exhausted = exhausted;
      this.wait = wait;
    }

    static Decision retryAfter(Duration wait) {
      return new Decision(false, wait);
    }

    boolean isExhausted() {
      return exhausted;
    }

    /** The wait before the next attempt, empty to retry right away. */
    Optional<Duration> getWait() {
      return Optional.ofNullable(wait);
    }
  }

  private final Backoff backoff;
  private int failures = 0;
  private @Nullable Duration currentDelay;

  RetryState(Backoff backoff) {
    this.backoff = backoff;
    this.currentDelay = backoff.getBaseDelay().orElse(null);
  }

  /** Records a failed attempt and decides whether, and after how long, to try again. */
  Decision onFailure() {
    failures++;
    if (backoff.getMaxAttempts().isPresent() && failures >= backoff.getMaxAttempts().getAsInt()) {
      return Decision.EXHAUSTED;
    }
    if (currentDelay == null) {
      return Decision.IMMEDIATELY;
    }
    final Duration wait = currentDelay;
    currentDelay = grow(wait, backoff.getGrowthFactor());
    return Decision.retryAfter(wait);
  }

  /** Number of attempts that have failed so far. */
  int getFailures() {
    return failures;
  }

  String getName() {
    return backoff.getName();
  }

  /**
   * Multiplies {@code delay} by {@code factor} at nanosecond precision. The product is truncated
   * and clamped to {@code [0, Long.MAX_VALUE]} nanoseconds; NaN becomes zero. For factors of at
   * least 1 the result is never shorter than {@code delay}.
   */
  static Duration grow(Duration delay, double factor) {
    final long current = toNanosSaturated(delay);
    final double nanos = current * factor;
    if (Double.isNaN(nanos) || nanos <= 0) {
      return Duration.ZERO;
    }
    if (nanos >= Long.MAX_VALUE) {
      return Duration.ofNanos(Long.MAX_VALUE);
    }
    // Doubles lose precision above 2^53 nanoseconds.
    if (factor >= 1 && (long) nanos < current) {
      return Duration.ofNanos(current);
    }
    return Duration.ofNanos((long) nanos);
  }

  private static long toNanosSaturated(Duration delay) {
    try {
      return delay.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }
}
