package com.spotify.attempt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.base.VerifyException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class AsyncRetryPolicyTest {

  private final FakeSleeper sleeper = new FakeSleeper();
  private final ExecutorService executor = Executors.newFixedThreadPool(2);

  @AfterEach
  public void tearDown() {
    executor.shutdownNow();
  }

  /** Fails the first {@code failures} calls with {@code failure}, then succeeds with "ok". */
  private static class FlakyOperation implements Supplier<CompletionStage<String>> {
    final AtomicInteger calls = new AtomicInteger();
    private final int failures;
    private final Exception failure;

    FlakyOperation(int failures, Exception failure) {
      this.failures = failures;
      this.failure = failure;
    }

    @Override
    public CompletionStage<String> get() {
      if (calls.incrementAndGet() <= failures) {
        return CompletableFuture.failedFuture(failure);
      }
      return CompletableFuture.completedFuture("ok");
    }
  }

  @Test
  public void testDefaultsGiveUpAfterTenAttemptsWithoutWaiting() throws Exception {
    final IOException failure = new IOException("x");
    final FlakyOperation operation = new FlakyOperation(Integer.MAX_VALUE, failure);

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(operation).withSleeper(sleeper).executeAsync();

    assertThatThrownBy(result::get).isInstanceOf(ExecutionException.class).hasCause(failure);
    assertThat(operation.calls).hasValue(10);
    assertThat(sleeper.waits).isEmpty();
  }

  @Test
  public void testAlwaysFailingOperationIsCalledExactlyMaxAttemptsTimes() {
    for (int maxAttempts = 1; maxAttempts <= 6; maxAttempts++) {
      final IOException failure = new IOException("down");
      final FlakyOperation operation = new FlakyOperation(Integer.MAX_VALUE, failure);

      final CompletableFuture<String> result =
          AsyncRetryPolicy.to(operation)
              .withMaxAttempts(maxAttempts)
              .withSleeper(sleeper)
              .executeAsync();

      assertThat(result).isCompletedExceptionally();
      assertThatThrownBy(result::join).hasCause(failure);
      assertThat(operation.calls).hasValue(maxAttempts);
    }
  }

  @Test
  public void testReturnsFirstSuccessAndStopsCalling() {
    final FlakyOperation operation = new FlakyOperation(2, new IOException("down"));

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(operation).withMaxAttempts(5).withSleeper(sleeper).executeAsync();

    assertThat(result.join()).isEqualTo("ok");
    assertThat(operation.calls).hasValue(3);
  }

  @Test
  public void testWaitsGrowByGrowthFactor() {
    final FlakyOperation operation =
        new FlakyOperation(Integer.MAX_VALUE, new IOException("down"));

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(operation)
            .withDelay(Duration.ofMillis(100))
            .withGrowthFactor(1.5)
            .withMaxAttempts(4)
            .withSleeper(sleeper)
            .executeAsync();

    assertThat(result).isCompletedExceptionally();
    assertThat(sleeper.waits)
        .containsExactly(Duration.ofMillis(100), Duration.ofMillis(150), Duration.ofMillis(225));
  }

  @Test
  public void testSingleAttemptNeverWaits() {
    final FlakyOperation operation = new FlakyOperation(1, new IOException("once"));

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(operation)
            .withDelay(Duration.ofMinutes(5))
            .withMaxAttempts(1)
            .withSleeper(sleeper)
            .executeAsync();

    assertThat(result).isCompletedExceptionally();
    assertThat(operation.calls).hasValue(1);
    assertThat(sleeper.waits).isEmpty();
  }

  @Test
  public void testWaitDoesNotBlockCaller() {
    final FakeSleeper holding = new FakeSleeper().holdingDelays();
    final FlakyOperation operation = new FlakyOperation(1, new IOException("down"));

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(operation)
            .withDelay(Duration.ofSeconds(30))
            .withSleeper(holding)
            .executeAsync();

    assertThat(result).isNotDone();
    assertThat(operation.calls).hasValue(1);
    assertThat(holding.heldCount()).isEqualTo(1);

    holding.releaseAll();

    assertThat(result).isCompletedWithValue("ok");
    assertThat(operation.calls).hasValue(2);
  }

  @Test
  public void testCancellingStopsFurtherAttempts() {
    final FakeSleeper holding = new FakeSleeper().holdingDelays();
    final FlakyOperation operation =
        new FlakyOperation(Integer.MAX_VALUE, new IOException("down"));

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(operation)
            .withDelay(Duration.ofSeconds(1))
            .withSleeper(holding)
            .executeAsync();
    result.cancel(false);
    holding.releaseAll();

    assertThat(result).isCancelled();
    assertThat(operation.calls).hasValue(1);
  }

  @Test
  public void testAttemptsAreSequential() throws Exception {
    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger maxRunning = new AtomicInteger();
    final AtomicInteger calls = new AtomicInteger();

    final CompletableFuture<Integer> result =
        AsyncRetryPolicy.<Integer>to(
                () ->
                    CompletableFuture.supplyAsync(
                        () -> {
                          maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                          try {
                            Thread.sleep(20);
                          } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                          }
                          running.decrementAndGet();
                          final int call = calls.incrementAndGet();
                          if (call < 4) {
                            throw new IllegalStateException("call " + call);
                          }
                          return call;
                        },
                        executor))
            .withDelay(Duration.ofMillis(5))
            .withExecutor(executor)
            .executeAsync();

    assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(4);
    assertThat(maxRunning).hasValue(1);
  }

  @Test
  public void testExceptionalCompletionIsUnwrapped() {
    final IllegalStateException failure = new IllegalStateException("boom");

    final CompletableFuture<String> result =
        AsyncRetryPolicy.<String>to(
                () ->
                    CompletableFuture.completedFuture("ignored")
                        .<String>thenApply(
                            value -> {
                              throw failure;
                            }))
            .withMaxAttempts(2)
            .withSleeper(sleeper)
            .executeAsync();

    assertThatThrownBy(result::join).hasCause(failure);
  }

  @Test
  public void testThrowingSupplierCountsAsFailedAttempt() {
    final List<Integer> calls = new ArrayList<>();

    final CompletableFuture<String> result =
        AsyncRetryPolicy.<String>to(
                () -> {
                  calls.add(calls.size());
                  if (calls.size() < 3) {
                    throw new IllegalArgumentException("not yet");
                  }
                  return CompletableFuture.completedFuture("third");
                })
            .withSleeper(sleeper)
            .executeAsync();

    assertThat(result).isCompletedWithValue("third");
    assertThat(calls).hasSize(3);
  }

  @Test
  public void testNullStageCountsAsFailedAttempt() {
    final CompletableFuture<String> result =
        AsyncRetryPolicy.<String>to(() -> null)
            .withMaxAttempts(2)
            .named("lookup")
            .withSleeper(sleeper)
            .executeAsync();

    assertThatThrownBy(result::join)
        .hasCauseInstanceOf(NullPointerException.class)
        .hasMessageContaining("lookup");
  }

  @Test
  public void testErrorsAreNotRetried() {
    final AtomicInteger calls = new AtomicInteger();

    final CompletableFuture<String> result =
        AsyncRetryPolicy.<String>to(
                () -> {
                  calls.incrementAndGet();
                  return CompletableFuture.failedFuture(new LinkageError("boom"));
                })
            .withSleeper(sleeper)
            .executeAsync();

    assertThatThrownBy(result::join).hasCauseInstanceOf(LinkageError.class);
    assertThat(calls).hasValue(1);
    assertThat(sleeper.waits).isEmpty();
  }

  @Test
  public void testSupplierThrowingErrorCompletesResult() {
    final AtomicInteger calls = new AtomicInteger();

    final CompletableFuture<String> result =
        AsyncRetryPolicy.<String>to(
                () -> {
                  calls.incrementAndGet();
                  throw new LinkageError("boom");
                })
            .withSleeper(sleeper)
            .executeAsync();

    assertThatThrownBy(result::join).hasCauseInstanceOf(LinkageError.class);
    assertThat(calls).hasValue(1);
  }

  @Test
  public void testSupplierThrowingErrorAfterWaitCompletesResult() {
    final FakeSleeper holding = new FakeSleeper().holdingDelays();
    final AtomicInteger calls = new AtomicInteger();

    final CompletableFuture<String> result =
        AsyncRetryPolicy.<String>to(
                () -> {
                  if (calls.incrementAndGet() == 1) {
                    return CompletableFuture.failedFuture(new IOException("down"));
                  }
                  throw new AssertionError("broken");
                })
            .withDelay(Duration.ofMillis(10))
            .withSleeper(holding)
            .executeAsync();

    assertThat(result).isNotDone();
    holding.releaseAll();

    assertThat(result).isCompletedExceptionally();
    assertThatThrownBy(result::join).hasCauseInstanceOf(AssertionError.class);
    assertThat(calls).hasValue(2);
  }

  @Test
  public void testThrowingSleeperCompletesResultForPendingStage() {
    final CompletableFuture<String> pending = new CompletableFuture<>();
    final IllegalStateException broken = new IllegalStateException("no timers");
    final Sleeper throwing =
        new Sleeper() {
          @Override
          public void sleep(Duration duration) {}

          @Override
          public CompletableFuture<Void> delay(Duration duration) {
            throw broken;
          }
        };

    final CompletableFuture<String> result =
        AsyncRetryPolicy.<String>to(() -> pending)
            .withDelay(Duration.ofMillis(10))
            .withSleeper(throwing)
            .executeAsync();
    pending.completeExceptionally(new IOException("down"));

    assertThatThrownBy(result::join).hasCause(broken);
  }

  @Test
  public void testRejectingExecutorCompletesResult() {
    final ExecutorService stopped = Executors.newSingleThreadExecutor();
    stopped.shutdown();
    final FlakyOperation operation = new FlakyOperation(Integer.MAX_VALUE, new IOException("down"));

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(operation)
            .withDelay(Duration.ofMillis(10))
            .withExecutor(stopped)
            .executeAsync();

    assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(RejectedExecutionException.class);
    assertThat(operation.calls).hasValue(1);
  }

  @Test
  public void testManyImmediateFailuresDoNotOverflowStack() {
    final FlakyOperation operation = new FlakyOperation(20_000, new IOException("down"));

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(operation).unboundedAttempts().withSleeper(sleeper).executeAsync();

    assertThat(result).isCompletedWithValue("ok");
    assertThat(operation.calls).hasValue(20_001);
  }

  @Test
  public void testRunUntilSuccessAsync() throws Exception {
    final FlakyOperation operation = new FlakyOperation(25, new IOException("down"));

    assertThat(AsyncRetryPolicy.runUntilSuccessAsync(operation).get(5, TimeUnit.SECONDS))
        .isEqualTo("ok");
    assertThat(operation.calls).hasValue(26);
  }

  @Test
  public void testExecuteUntilSuccessAsyncRejectsCappedPolicy() {
    assertThatThrownBy(
            () -> AsyncRetryPolicy.to(new FlakyOperation(0, null)).executeUntilSuccessAsync())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void testExecuteUntilSuccessAsyncReportsBrokenSleeperAsDefect() {
    final Sleeper broken =
        new Sleeper() {
          @Override
          public void sleep(Duration duration) {}

          @Override
          public CompletableFuture<Void> delay(Duration duration) {
            return CompletableFuture.failedFuture(new IllegalStateException("timer gone"));
          }
        };

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(new FlakyOperation(1, new IOException("down")))
            .unboundedAttempts()
            .withDelay(Duration.ofMillis(1))
            .withSleeper(broken)
            .executeUntilSuccessAsync();

    assertThatThrownBy(result::join).hasCauseInstanceOf(VerifyException.class);
  }

  @Test
  public void testCancellingUntilSuccessStopsAttempts() {
    final FakeSleeper holding = new FakeSleeper().holdingDelays();
    final FlakyOperation operation =
        new FlakyOperation(Integer.MAX_VALUE, new IOException("down"));

    final CompletableFuture<String> result =
        AsyncRetryPolicy.to(operation)
            .unboundedAttempts()
            .withDelay(Duration.ofSeconds(1))
            .withSleeper(holding)
            .executeUntilSuccessAsync();
    result.cancel(false);
    holding.releaseAll();

    assertThat(result).isCancelled();
    assertThat(operation.calls).hasValue(1);
  }

  @Test
  public void testRealDelayCompletesOnExecutor() throws Exception {
    final FlakyOperation operation = new FlakyOperation(2, new IOException("down"));

    final long start = System.nanoTime();
    final String value =
        AsyncRetryPolicy.to(operation)
            .withDelay(Duration.ofMillis(50))
            .withGrowthFactor(1.0)
            .withExecutor(executor)
            .executeAsync()
            .get(5, TimeUnit.SECONDS);
    final long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

    assertThat(value).isEqualTo("ok");
    assertThat(elapsedMillis).isGreaterThanOrEqualTo(90);
  }
}
