package com.spotify.attempt;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link Sleeper} backed by the wall clock. Non-blocking delays complete on the given executor,
 * so the attempt that follows runs there and not on a timer thread. If the executor rejects the
 * completion, the delay completes exceptionally with the {@link RejectedExecutionException}.
 */
public class SystemSleeper implements Sleeper {

  private static final SystemSleeper DEFAULT = new SystemSleeper(ForkJoinPool.commonPool());

  private final Executor executor;

  public SystemSleeper(Executor executor) {
    this.executor = Objects.requireNonNull(executor);
  }

  /** Returns a sleeper whose delays complete on {@link ForkJoinPool#commonPool()}. */
  public static SystemSleeper defaultSleeper() {
    return DEFAULT;
  }

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    TimeUnit.NANOSECONDS.sleep(nanos(duration));
  }

  @Override
  public CompletableFuture<Void> delay(Duration duration) {
    final long nanos = nanos(duration);
    if (nanos <= 0) {
      return CompletableFuture.completedFuture(null);
    }
    final CompletableFuture<Void> pause = new CompletableFuture<>();
    final Executor delayed =
        CompletableFuture.delayedExecutor(
            nanos,
            TimeUnit.NANOSECONDS,
            task -> {
              try {
                executor.execute(task);
              } catch (RejectedExecutionException e) {
                pause.completeExceptionally(e);
              }
            });
    delayed.execute(() -> pause.complete(null));
    return pause;
  }

  private static long nanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }
}
