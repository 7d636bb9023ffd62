package storedb;

import java.time.Duration;
import java.util.Objects;

/**
 * How many times a conflicting transaction is attempted and how long to wait in between.
 *
 * <p>Backoff is linear: attempt {@code i} (0-based) waits {@code backoffUnit * i} before
 * it begins, so the first attempt never waits.
 */
public final class RetryPolicy {
  public static final int DEFAULT_MAX_ATTEMPTS = 10;
  public static final Duration DEFAULT_BACKOFF_UNIT = Duration.ofMillis(2);

  private static final RetryPolicy DEFAULT = new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_UNIT);

  private final int maxAttempts;
  private final Duration backoffUnit;

  private RetryPolicy(int maxAttempts, Duration backoffUnit) {
    this.maxAttempts = maxAttempts;
    this.backoffUnit = backoffUnit;
  }

  /**
   * @param maxAttempts total attempts including the first one (must be &ge; 1)
   * @param backoffUnit linear scaling factor for the delay (must be &ge; 0)
   */
  public static RetryPolicy of(int maxAttempts, Duration backoffUnit) {
    Objects.requireNonNull(backoffUnit, "backoffUnit");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    if (backoffUnit.isNegative()) {
      throw new IllegalArgumentException("backoffUnit must be >= 0, got: " + backoffUnit);
    }
    return new RetryPolicy(maxAttempts, backoffUnit);
  }

  /** 10 attempts, 2ms backoff unit. */
  public static RetryPolicy defaults() {
    return DEFAULT;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration backoffUnit() {
    return backoffUnit;
  }

  /**
   * Computes the wait before the given attempt.
   *
   * @param attempt 0-based attempt index
   * @return {@code backoffUnit * attempt}; {@link Duration#ZERO} for the first attempt
   */
  public Duration delayBeforeAttempt(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0, got: " + attempt);
    }
    return backoffUnit.multipliedBy(attempt);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RetryPolicy other)) return false;
    return maxAttempts == other.maxAttempts && backoffUnit.equals(other.backoffUnit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(maxAttempts, backoffUnit);
  }

  @Override
  public String toString() {
    return "RetryPolicy{maxAttempts=" + maxAttempts + ", backoffUnit=" + backoffUnit + '}';
  }
}
