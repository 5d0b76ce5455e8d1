package com.spotify.attempt;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** Waits between attempts, either by blocking the current thread or by scheduling a timer. */
public interface Sleeper {

  /** Blocks the calling thread for {@code duration}. */
  void sleep(Duration duration) throws InterruptedException;

  /**
   * Returns a future that completes once {@code duration} has elapsed, without blocking the
   * calling thread.
   */
  CompletableFuture<Void> delay(Duration duration);
}
