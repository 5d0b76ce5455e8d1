package com.spotify.attempt;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.VerifyException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an asynchronous operation until its stage completes normally or the attempt budget is
 * spent. Waiting between attempts is done with timers, so no thread is blocked.
 *
 * <pre>{@code
 * final CompletableFuture<Boolean> uploaded =
 *     AsyncRetryPolicy.to(() -> uploader.upload(batch))
 *         .withDelay(Duration.ofSeconds(1))
 *         .withMaxAttempts(1000)
 *         .executeAsync();
 * }</pre>
 *
 * <p>A stage completing exceptionally, the supplier throwing, or the supplier returning {@code
 * null} all count as a failed attempt. An {@link Error} is not retried and completes the returned
 * future right away. Attempts never overlap: the next one starts only after the previous stage
 * has completed and the wait has elapsed.
 *
 * @param <T> result type of the operation
 */
public final class AsyncRetryPolicy<T> {
  private static final Logger log = LoggerFactory.getLogger(AsyncRetryPolicy.class);

  private final Supplier<? extends CompletionStage<T>> operation;
  private final Backoff backoff;
  private final Sleeper sleeper;

  private AsyncRetryPolicy(
      Supplier<? extends CompletionStage<T>> operation, Backoff backoff, Sleeper sleeper) {
    this.operation = operation;
    this.backoff = backoff;
    this.sleeper = sleeper;
  }

  /** Creates a policy for {@code operation} with {@link Backoff#defaults()}. */
  public static <T> AsyncRetryPolicy<T> to(Supplier<? extends CompletionStage<T>> operation) {
    return new AsyncRetryPolicy<>(
        checkNotNull(operation, "operation"), Backoff.defaults(), SystemSleeper.defaultSleeper());
  }

  /**
   * Calls {@code operation} until one of its stages completes normally, without any attempt cap or
   * delay. The returned future never completes with a failure of the operation; cancelling it stops
   * the attempts.
   */
  public static <T> CompletableFuture<T> runUntilSuccessAsync(
      Supplier<? extends CompletionStage<T>> operation) {
    return to(operation).unboundedAttempts().executeUntilSuccessAsync();
  }

  /**
   * Executes this policy without an attempt cap. The returned future completes with the first
   * successful result; cancelling it stops the attempts.
   *
   * @throws IllegalStateException if this policy has an attempt cap
   */
  public CompletableFuture<T> executeUntilSuccessAsync() {
    if (backoff.getMaxAttempts().isPresent()) {
      throw new IllegalStateException(
          "executeUntilSuccessAsync requires unbounded attempts, but " + backoff + " is capped");
    }
    final CompletableFuture<T> attempts = executeAsync();
    final CompletableFuture<T> result = new CompletableFuture<>();
    attempts.whenComplete(
        (value, error) -> {
          if (error == null) {
            result.complete(value);
          } else if (attempts.isCancelled()) {
            result.cancel(false);
          } else {
            result.completeExceptionally(
                new VerifyException(backoff.getName() + " failed without an attempt cap", error));
          }
        });
    result.whenComplete((value, error) -> attempts.cancel(false));
    return result;
  }

  public AsyncRetryPolicy<T> unboundedAttempts() {
    return withBackoff(backoff.unboundedAttempts());
  }

  /**
   * @throws IllegalArgumentException if {@code maxAttempts} is less than 1
   * @see Backoff#withMaxAttempts(int)
   */
  public AsyncRetryPolicy<T> withMaxAttempts(int maxAttempts) {
    return withBackoff(backoff.withMaxAttempts(maxAttempts));
  }

  public AsyncRetryPolicy<T> withoutDelay() {
    return withBackoff(backoff.withoutDelay());
  }

  /** @see Backoff#withDelay(Duration) */
  public AsyncRetryPolicy<T> withDelay(Duration delay) {
    return withBackoff(backoff.withDelay(delay));
  }

  /** @see Backoff#withGrowthFactor(double) */
  public AsyncRetryPolicy<T> withGrowthFactor(double growthFactor) {
    return withBackoff(backoff.withGrowthFactor(growthFactor));
  }

  public AsyncRetryPolicy<T> named(String name) {
    return withBackoff(backoff.named(name));
  }

  /** Replaces the whole attempt and delay configuration. */
  public AsyncRetryPolicy<T> withBackoff(Backoff backoff) {
    return new AsyncRetryPolicy<>(operation, checkNotNull(backoff, "backoff"), sleeper);
  }

  /**
   * Starts the attempts that follow a wait on {@code executor}. If the executor rejects an attempt,
   * for example after it has been shut down, the returned future completes exceptionally with the
   * {@link java.util.concurrent.RejectedExecutionException}.
   */
  public AsyncRetryPolicy<T> withExecutor(Executor executor) {
    return withSleeper(new SystemSleeper(executor));
  }

  @VisibleForTesting
  AsyncRetryPolicy<T> withSleeper(Sleeper sleeper) {
    return new AsyncRetryPolicy<>(operation, backoff, checkNotNull(sleeper, "sleeper"));
  }

  public Backoff getBackoff() {
    return backoff;
  }

  /**
   * Starts the first attempt on the calling thread and returns right away.
   *
   * <p>The returned future completes with the first successful result, or exceptionally with the
   * failure of the last attempt once the attempts are exhausted. Completing or cancelling it stops
   * further attempts from being started.
   */
  public CompletableFuture<T> executeAsync() {
    final CompletableFuture<T> result = new CompletableFuture<>();
    runAttempts(backoff.newState(), result);
    return result;
  }

  private void runAttempts(RetryState state, CompletableFuture<T> result) {
    try {
      while (!result.isDone()) {
        final CompletableFuture<T> attempt = invoke();
        if (!attempt.isDone()) {
          attempt.whenComplete((value, error) -> settleAndContinue(state, result, value, error));
          return;
        }
        final CompletableFuture<Void> pause =
            attempt.handle((value, error) -> settle(state, result, value, error)).join();
        if (pause == null) {
          return;
        }
        if (!pause.isDone() || pause.isCompletedExceptionally()) {
          continueAfter(pause, state, result);
          return;
        }
      }
    } catch (Throwable t) {
      result.completeExceptionally(unwrap(t));
    }
  }

  private void settleAndContinue(
      RetryState state, CompletableFuture<T> result, T value, @Nullable Throwable error) {
    try {
      continueAfter(settle(state, result, value, error), state, result);
    } catch (Throwable t) {
      result.completeExceptionally(unwrap(t));
    }
  }

  private void continueAfter(
      @Nullable CompletableFuture<Void> pause, RetryState state, CompletableFuture<T> result) {
    if (pause == null) {
      return;
    }
    pause.whenComplete(
        (ignored, error) -> {
          if (error != null) {
            result.completeExceptionally(unwrap(error));
          } else {
            runAttempts(state, result);
          }
        });
  }

  /**
   * Completes {@code result} on success or exhaustion and returns {@code null}. Otherwise returns
   * the future to wait for before the next attempt.
   */
  private @Nullable CompletableFuture<Void> settle(
      RetryState state, CompletableFuture<T> result, T value, @Nullable Throwable error) {
    if (result.isDone()) {
      return null;
    }
    if (error == null) {
      result.complete(value);
      return null;
    }
    final Throwable failure = unwrap(error);
    if (failure instanceof Error) {
      result.completeExceptionally(failure);
      return null;
    }
    final RetryState.Decision decision = state.onFailure();
    if (decision.isExhausted()) {
      log.warn("{} failed after {} attempts", state.getName(), state.getFailures());
      result.completeExceptionally(failure);
      return null;
    }
    final Optional<Duration> wait = decision.getWait();
    log.debug(
        "{} attempt {} failed, retrying in {}: {}",
        state.getName(),
        state.getFailures(),
        wait.orElse(Duration.ZERO),
        failure.toString());
    return wait.map(sleeper::delay).orElseGet(() -> CompletableFuture.completedFuture(null));
  }

  private CompletableFuture<T> invoke() {
    final CompletionStage<T> stage;
    try {
      stage = operation.get();
    } catch (Throwable t) {
      return CompletableFuture.failedFuture(t);
    }
    if (stage == null) {
      return CompletableFuture.failedFuture(
          new NullPointerException(backoff.getName() + " returned a null stage"));
    }
    return stage.toCompletableFuture();
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  @Override
  public String toString() {
    return "AsyncRetryPolicy{" + backoff + '}';
  }
}
