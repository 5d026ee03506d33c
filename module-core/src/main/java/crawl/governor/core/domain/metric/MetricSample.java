package crawl.governor.core.domain.metric;

import crawl.governor.error.ErrorKind;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One recorded attempt.
 *
 * <p>Pure domain model - no external dependencies.
 *
 * @param timestamp when the attempt finished
 * @param latency attempt duration
 * @param outcome SUCCESS, FAILURE or BLOCKED
 * @param resources resource usage observed at record time
 * @param operationClass caller-defined operation class
 * @param errorKind failure kind, {@code null} for SUCCESS
 */
public record MetricSample(
    Instant timestamp,
    Duration latency,
    Outcome outcome,
    ResourceSnapshot resources,
    String operationClass,
    ErrorKind errorKind) {

  public MetricSample {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(outcome, "outcome");
    if (latency == null || latency.isNegative()) {
      latency = Duration.ZERO;
    }
    if (resources == null) {
      resources = ResourceSnapshot.UNKNOWN;
    }
    if (outcome == Outcome.SUCCESS && errorKind != null) {
      throw new IllegalArgumentException("successful sample cannot carry an error kind");
    }
    if (outcome != Outcome.SUCCESS && errorKind == null) {
      errorKind = outcome == Outcome.BLOCKED ? ErrorKind.BLOCKED : ErrorKind.UNKNOWN;
    }
  }

  public static MetricSample success(
      Instant timestamp, Duration latency, ResourceSnapshot resources, String operationClass) {
    return new MetricSample(timestamp, latency, Outcome.SUCCESS, resources, operationClass, null);
  }

  public static MetricSample failure(
      Instant timestamp,
      Duration latency,
      ErrorKind kind,
      ResourceSnapshot resources,
      String operationClass) {
    return new MetricSample(
        timestamp, latency, Outcome.ofFailure(kind), resources, operationClass, kind);
  }

  public long latencyMillis() {
    return latency.toMillis();
  }
}
