package crawl.governor.core.domain.retry;

import crawl.governor.error.ErrorKind;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable retry policy shared read-only by every execution of one operation class.
 *
 * <p>Pure domain model - no external dependencies.
 *
 * @param maxAttempts total attempts including the first one (at least 1)
 * @param baseDelay delay before the second attempt
 * @param maxDelay upper bound of the un-jittered delay
 * @param backoffMultiplier growth factor for {@link BackoffStrategy#EXPONENTIAL} (at least 1)
 * @param jitterFraction symmetric jitter in [0, 1]; the delay is scaled by {@code 1 ± jitter}
 * @param strategy delay growth curve
 * @param retryableKinds failure kinds that may be retried; governor rejections are never allowed
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    double backoffMultiplier,
    double jitterFraction,
    BackoffStrategy strategy,
    Set<ErrorKind> retryableKinds) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
    }
    if (baseDelay == null || baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must be non-negative, got: " + baseDelay);
    }
    if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException(
          "maxDelay must be >= baseDelay, got: " + maxDelay + " < " + baseDelay);
    }
    if (backoffMultiplier < 1.0 || Double.isNaN(backoffMultiplier)) {
      throw new IllegalArgumentException(
          "backoffMultiplier must be >= 1.0, got: " + backoffMultiplier);
    }
    if (jitterFraction < 0.0 || jitterFraction > 1.0 || Double.isNaN(jitterFraction)) {
      throw new IllegalArgumentException(
          "jitterFraction must be between 0.0 and 1.0, got: " + jitterFraction);
    }
    if (strategy == null) {
      strategy = BackoffStrategy.EXPONENTIAL;
    }
    retryableKinds = copyRetryable(retryableKinds);
  }

  /** Exponential policy retrying the default kinds (NETWORK, TIMEOUT). */
  public static RetryPolicy of(
      int maxAttempts,
      Duration baseDelay,
      Duration maxDelay,
      double backoffMultiplier,
      double jitterFraction) {
    return new RetryPolicy(
        maxAttempts,
        baseDelay,
        maxDelay,
        backoffMultiplier,
        jitterFraction,
        BackoffStrategy.EXPONENTIAL,
        ErrorKind.defaultRetryable());
  }

  /** Single attempt, never retried. */
  public static RetryPolicy noRetry() {
    return new RetryPolicy(
        1, Duration.ZERO, Duration.ZERO, 1.0, 0.0, BackoffStrategy.FIXED, Set.of());
  }

  public boolean isRetryable(ErrorKind kind) {
    return retryableKinds.contains(kind);
  }

  public RetryPolicy withStrategy(BackoffStrategy newStrategy) {
    return new RetryPolicy(
        maxAttempts,
        baseDelay,
        maxDelay,
        backoffMultiplier,
        jitterFraction,
        newStrategy,
        retryableKinds);
  }

  public RetryPolicy withRetryableKinds(Set<ErrorKind> kinds) {
    return new RetryPolicy(
        maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitterFraction, strategy, kinds);
  }

  private static Set<ErrorKind> copyRetryable(Set<ErrorKind> kinds) {
    if (kinds == null || kinds.isEmpty()) {
      return Collections.unmodifiableSet(EnumSet.noneOf(ErrorKind.class));
    }
    EnumSet<ErrorKind> copy = EnumSet.copyOf(kinds);
    for (ErrorKind kind : copy) {
      if (!kind.isOperationFailure()) {
        throw new IllegalArgumentException(kind + " is never retried inline");
      }
    }
    return Collections.unmodifiableSet(copy);
  }
}
