package com.spotify.attempt;

public class Exceptions {

  /** Thrown when a thread is interrupted while waiting between two attempts. */
  public static class RetryInterruptedException extends RuntimeException {
    public RetryInterruptedException(String message, InterruptedException cause) {
      super(message, cause);
    }
  }
}
