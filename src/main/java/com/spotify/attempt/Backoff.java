package com.spotify.attempt;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Immutable attempt and delay configuration shared by {@link RetryPolicy} and {@link
 * AsyncRetryPolicy}.
 *
 * <p>Every {@code with*} and {@code without*} method returns a new instance and leaves the
 * receiver untouched, so a {@code Backoff} can be kept in a constant and handed to any number of
 * policies.
 *
 * <p>The wait before attempt {@code k + 1} is {@code baseDelay * growthFactor^(k - 1)}, where
 * {@code k} is the number of attempts that have failed so far. No wait happens at all when no
 * base delay is configured.
 */
public final class Backoff {

  /** Multiplier applied to the delay after every failed attempt unless configured otherwise. */
  public static final double DEFAULT_GROWTH_FACTOR = 1.25;

  /** Attempt cap used unless configured otherwise. */
  public static final int DEFAULT_MAX_ATTEMPTS = 10;

  /** Label used in log messages unless configured otherwise. */
  public static final String DEFAULT_NAME = "operation";

  static final String MAX_ATTEMPTS_SUFFIX = "_MAX_ATTEMPTS";
  static final String DELAY_MS_SUFFIX = "_DELAY_MS";
  static final String GROWTH_FACTOR_SUFFIX = "_GROWTH_FACTOR";
  static final String UNBOUNDED = "unbounded";

  private static final Backoff DEFAULTS =
      new Backoff(null, DEFAULT_GROWTH_FACTOR, DEFAULT_MAX_ATTEMPTS, DEFAULT_NAME);

  private final @Nullable Duration baseDelay;
  private final double growthFactor;
  private final @Nullable Integer maxAttempts;
  private final String name;

  private Backoff(
      @Nullable Duration baseDelay,
      double growthFactor,
      @Nullable Integer maxAttempts,
      String name) {
    this.baseDelay = baseDelay;
    this.growthFactor = growthFactor;
    this.maxAttempts = maxAttempts;
    this.name = name;
  }

  /**
   * Returns the default configuration: no delay, a growth factor of {@value
   * #DEFAULT_GROWTH_FACTOR} and at most {@value #DEFAULT_MAX_ATTEMPTS} attempts.
   */
  public static Backoff defaults() {
    return DEFAULTS;
  }

  /**
   * Reads a configuration from environment variables, starting from {@link #defaults()}.
   *
   * @see #fromEnvironment(String, Function)
   */
  public static Backoff fromEnvironment(String prefix) {
    return fromEnvironment(prefix, System::getenv);
  }

  /**
   * Reads a configuration from variables named {@code <prefix>_MAX_ATTEMPTS}, {@code
   * <prefix>_DELAY_MS} and {@code <prefix>_GROWTH_FACTOR}, resolved through {@code lookup}.
   *
   * <p>{@code _MAX_ATTEMPTS} accepts a positive integer or {@code unbounded}. {@code _DELAY_MS}
   * accepts a non-negative number of milliseconds. Missing variables keep their default.
   *
   * @param prefix variable name prefix, for example {@code "UPLOAD_RETRY"}
   * @param lookup resolves a variable name to its value, or {@code null} if it is not set
   * @return the resulting configuration
   * @throws IllegalArgumentException if a variable is set but malformed
   */
  public static Backoff fromEnvironment(String prefix, Function<String, String> lookup) {
    checkNotNull(prefix, "prefix");
    checkNotNull(lookup, "lookup");
    Backoff backoff = defaults();

    final String maxAttemptsKey = prefix + MAX_ATTEMPTS_SUFFIX;
    final Optional<String> maxAttempts = read(lookup, maxAttemptsKey);
    if (maxAttempts.isPresent()) {
      if (UNBOUNDED.equalsIgnoreCase(maxAttempts.get())) {
        backoff = backoff.unboundedAttempts();
      } else {
        final int cap = parseInt(maxAttemptsKey, maxAttempts.get());
        checkArgument(cap > 0, "%s must be positive, was %s", maxAttemptsKey, cap);
        backoff = backoff.withMaxAttempts(cap);
      }
    }

    final String delayKey = prefix + DELAY_MS_SUFFIX;
    final Optional<String> delayMs = read(lookup, delayKey);
    if (delayMs.isPresent()) {
      final long millis = parseLong(delayKey, delayMs.get());
      checkArgument(millis >= 0, "%s must not be negative, was %s", delayKey, millis);
      backoff = backoff.withDelay(Duration.ofMillis(millis));
    }

    final String growthKey = prefix + GROWTH_FACTOR_SUFFIX;
    final Optional<String> growthFactor = read(lookup, growthKey);
    if (growthFactor.isPresent()) {
      backoff = backoff.withGrowthFactor(parseDouble(growthKey, growthFactor.get()));
    }
    return backoff;
  }

  /** Removes the attempt cap. Execution then only ends when the operation succeeds. */
  public Backoff unboundedAttempts() {
    return new Backoff(baseDelay, growthFactor, null, name);
  }

  /**
   * Caps the number of attempts, including the first one.
   *
   * @throws IllegalArgumentException if {@code maxAttempts} is less than 1
   */
  public Backoff withMaxAttempts(int maxAttempts) {
    checkArgument(maxAttempts > 0, "maxAttempts must be positive, was %s", maxAttempts);
    return new Backoff(baseDelay, growthFactor, maxAttempts, name);
  }

  /** Retries immediately after a failure. */
  public Backoff withoutDelay() {
    return new Backoff(null, growthFactor, maxAttempts, name);
  }

  /**
   * Waits {@code delay} after the first failure. Later waits grow by the growth factor.
   *
   * @throws IllegalArgumentException if {@code delay} is negative
   */
  public Backoff withDelay(Duration delay) {
    checkNotNull(delay, "delay");
    checkArgument(!delay.isNegative(), "delay must not be negative, was %s", delay);
    return new Backoff(delay, growthFactor, maxAttempts, name);
  }

  /**
   * Sets the multiplier applied to the delay after every failed attempt.
   *
   * <p>The value is not validated. A factor below 1 makes the delay shrink, and a factor of 0 or
   * less makes every wait after the first one zero.
   */
  public Backoff withGrowthFactor(double growthFactor) {
    return new Backoff(baseDelay, growthFactor, maxAttempts, name);
  }

  /** Sets the label that identifies the operation in log messages. */
  public Backoff named(String name) {
    return new Backoff(baseDelay, growthFactor, maxAttempts, checkNotNull(name, "name"));
  }

  public Optional<Duration> getBaseDelay() {
    return Optional.ofNullable(baseDelay);
  }

  public double getGrowthFactor() {
    return growthFactor;
  }

  public OptionalInt getMaxAttempts() {
    return maxAttempts == null ? OptionalInt.empty() : OptionalInt.of(maxAttempts);
  }

  public String getName() {
    return name;
  }

  RetryState newState() {
    return new RetryState(this);
  }

  private static Optional<String> read(Function<String, String> lookup, String key) {
    return Optional.ofNullable(lookup.apply(key)).map(String::trim).filter(s -> !s.isEmpty());
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be an integer or '%s', was '%s'", key, UNBOUNDED, value), e);
    }
  }

  private static long parseLong(String key, String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be a number of milliseconds, was '%s'", key, value), e);
    }
  }

  private static double parseDouble(String key, String value) {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be a decimal number, was '%s'", key, value), e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final Backoff that = (Backoff) o;
    return Double.compare(that.growthFactor, growthFactor) == 0
        && Objects.equals(baseDelay, that.baseDelay)
        && Objects.equals(maxAttempts, that.maxAttempts)
        && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(baseDelay, growthFactor, maxAttempts, name);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("baseDelay", baseDelay)
        .add("growthFactor", growthFactor)
        .add("maxAttempts", maxAttempts == null ? UNBOUNDED : maxAttempts)
        .toString();
  }
}
