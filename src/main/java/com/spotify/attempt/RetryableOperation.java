package com.spotify.attempt;

/**
 * A synchronous operation that may fail.
 *
 * @param <T> result of a successful call
 * @param <E> checked failure the operation declares, or {@link RuntimeException} if none
 */
@FunctionalInterface
public interface RetryableOperation<T, E extends Exception> {
  T call() throws E;
}
