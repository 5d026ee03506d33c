package crawl.governor.core.domain.retry;

import crawl.governor.error.ErrorKind;
import java.time.Duration;
import java.util.EnumSet;

/** Preset policies for common operation profiles. */
public final class RetryPolicies {

  private RetryPolicies() {}

  /** Page fetches over an unreliable network: 5 attempts, 2s doubling up to 60s. */
  public static RetryPolicy networkOperations() {
    return RetryPolicy.of(5, Duration.ofSeconds(2), Duration.ofSeconds(60), 2.0, 0.1);
  }

  /** Cheap calls that should fail fast: 3 attempts, 0.5s doubling up to 10s. */
  public static RetryPolicy quickOperations() {
    return RetryPolicy.of(3, Duration.ofMillis(500), Duration.ofSeconds(10), 2.0, 0.1);
  }

  /** One fixed-delay retry on network errors only. */
  public static RetryPolicy gentle() {
    return new RetryPolicy(
        2,
        Duration.ofSeconds(1),
        Duration.ofSeconds(10),
        1.0,
        0.0,
        BackoffStrategy.FIXED,
        EnumSet.of(ErrorKind.NETWORK));
  }

  /**
   * Opt-in policy that also retries BLOCKED, with long delays so the remote side has time to lift
   * the block.
   */
  public static RetryPolicy blockingAware() {
    return new RetryPolicy(
        3,
        Duration.ofSeconds(5),
        Duration.ofSeconds(120),
        3.0,
        0.2,
        BackoffStrategy.EXPONENTIAL,
        EnumSet.of(ErrorKind.NETWORK, ErrorKind.TIMEOUT, ErrorKind.BLOCKED));
  }
}
