package com.spotify.attempt;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.google.common.base.VerifyException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a synchronous operation until it succeeds or the attempt budget is spent, sleeping on the
 * calling thread between attempts.
 *
 * <pre>{@code
 * final Data data =
 *     RetryPolicy.to(client::fetch)
 *         .withDelay(Duration.ofMillis(200))
 *         .withMaxAttempts(5)
 *         .execute();
 * }</pre>
 *
 * <p>Instances are immutable; the configuration methods return a new policy. Any exception thrown
 * by the operation counts as a failed attempt. Only the exception of the last attempt reaches the
 * caller, and it is rethrown as is.
 *
 * @param <T> result type of the operation
 * @param <E> checked exception type the operation declares
 */
public final class RetryPolicy<T, E extends Exception> {
  private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

  private final RetryableOperation<T, E> operation;
  private final Backoff backoff;
  private final Sleeper sleeper;

  private RetryPolicy(RetryableOperation<T, E> operation, Backoff backoff, Sleeper sleeper) {
    this.operation = operation;
    this.backoff = backoff;
    this.sleeper = sleeper;
  }

  /**
   * Creates a policy for {@code operation} with {@link Backoff#defaults()}: no delay, growth
   * factor {@value Backoff#DEFAULT_GROWTH_FACTOR}, at most {@value Backoff#DEFAULT_MAX_ATTEMPTS}
   * attempts.
   */
  public static <T, E extends Exception> RetryPolicy<T, E> to(RetryableOperation<T, E> operation) {
    return new RetryPolicy<>(
        checkNotNull(operation, "operation"), Backoff.defaults(), SystemSleeper.defaultSleeper());
  }

  /**
   * Calls {@code operation} until it succeeds, without any attempt cap or delay.
   *
   * <p>Use with care: an operation that never succeeds keeps the calling thread busy forever.
   */
  public static <T, E extends Exception> T runUntilSuccess(RetryableOperation<T, E> operation) {
    return to(operation).unboundedAttempts().executeUntilSuccess();
  }

  /**
   * Executes this policy without an attempt cap and returns the first successful result.
   *
   * @throws IllegalStateException if this policy has an attempt cap
   */
  public T executeUntilSuccess() {
    if (backoff.getMaxAttempts().isPresent()) {
      throw new IllegalStateException(
          "executeUntilSuccess requires unbounded attempts, but " + backoff + " is capped");
    }
    try {
      return execute();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new VerifyException(backoff.getName() + " failed without an attempt cap", e);
    }
  }

  public RetryPolicy<T, E> unboundedAttempts() {
    return withBackoff(backoff.unboundedAttempts());
  }

  /**
   * @throws IllegalArgumentException if {@code maxAttempts} is less than 1
   * @see Backoff#withMaxAttempts(int)
   */
  public RetryPolicy<T, E> withMaxAttempts(int maxAttempts) {
    return withBackoff(backoff.withMaxAttempts(maxAttempts));
  }

  public RetryPolicy<T, E> withoutDelay() {
    return withBackoff(backoff.withoutDelay());
  }

  /** @see Backoff#withDelay(Duration) */
  public RetryPolicy<T, E> withDelay(Duration delay) {
    return withBackoff(backoff.withDelay(delay));
  }

  /** @see Backoff#withGrowthFactor(double) */
  public RetryPolicy<T, E> withGrowthFactor(double growthFactor) {
    return withBackoff(backoff.withGrowthFactor(growthFactor));
  }

  public RetryPolicy<T, E> named(String name) {
    return withBackoff(backoff.named(name));
  }

  /** Replaces the whole attempt and delay configuration. */
  public RetryPolicy<T, E> withBackoff(Backoff backoff) {
    return new RetryPolicy<>(operation, checkNotNull(backoff, "backoff"), sleeper);
  }

  @VisibleForTesting
  RetryPolicy<T, E> withSleeper(Sleeper sleeper) {
    return new RetryPolicy<>(operation, backoff, checkNotNull(sleeper, "sleeper"));
  }

  public Backoff getBackoff() {
    return backoff;
  }

  /**
   * Calls the operation until it succeeds or the attempt cap is reached.
   *
   * @return the result of the first successful attempt
   * @throws E the failure of the last attempt, unchanged, once the attempts are exhausted. An
   *     unchecked failure is rethrown as is.
   * @throws Exceptions.RetryInterruptedException if the thread is interrupted while waiting
   *     between attempts, or if the operation itself throws {@link InterruptedException}. The
   *     interrupt flag is restored and no further attempt is made.
   */
  public T execute() throws E {
    final RetryState state = backoff.newState();
    while (true) {
      final Exception failure;
      try {
        return operation.call();
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          throw new Exceptions.RetryInterruptedException(
              state.getName() + " was interrupted", (InterruptedException) e);
        }
        failure = e;
      }

      final RetryState.Decision decision = state.onFailure();
      if (decision.isExhausted()) {
        log.warn("{} failed after {} attempts", state.getName(), state.getFailures());
        throw rethrow(failure);
      }
      final Optional<Duration> wait = decision.getWait();
      log.debug(
          "{} attempt {} failed, retrying in {}: {}",
          state.getName(),
          state.getFailures(),
          wait.orElse(Duration.ZERO),
          failure.toString());
      if (wait.isPresent()) {
        sleep(state, wait.get(), failure);
      }
    }
  }

  private void sleep(RetryState state, Duration wait, Exception lastFailure) {
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      final Exceptions.RetryInterruptedException interrupted =
          new Exceptions.RetryInterruptedException(
              state.getName() + " interrupted during retry backoff", ie);
      interrupted.addSuppressed(lastFailure);
      throw interrupted;
    }
  }

  @SuppressWarnings("unchecked")
  private E rethrow(Exception failure) {
    Throwables.throwIfUnchecked(failure);
    return (E) failure;
  }

  @Override
  public String toString() {
    return "RetryPolicy{" + backoff + '}';
  }
}
