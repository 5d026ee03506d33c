package crawl.governor.core.domain.retry;

/**
 * Growth curve of the un-jittered retry delay.
 *
 * <p>Every strategy is non-decreasing in the attempt number and is capped at the policy's max
 * delay.
 */
public enum BackoffStrategy {
  /** Always {@code baseDelay}. */
  FIXED,
  /** {@code baseDelay × attempt}. */
  LINEAR,
  /** {@code baseDelay × multiplier^(attempt-1)}. */
  EXPONENTIAL,
  /** {@code baseDelay × fib(attempt)} with fib(1) = fib(2) = 1. */
  FIBONACCI
}
