package crawl.governor.core.domain.alert;

import java.time.Instant;
import java.util.Objects;

/**
 * Alert emitted by the health monitor.
 *
 * <p>Pure domain model - no external dependencies.
 *
 * @param severity WARNING, CRITICAL or FATAL
 * @param reason human readable reason
 * @param triggeringMetric name of the check or metric that fired
 * @param value observed value
 * @param threshold limit that was crossed
 * @param timestamp emission time
 */
public record Alert(
    AlertSeverity severity,
    String reason,
    String triggeringMetric,
    double value,
    double threshold,
    Instant timestamp) {

  public Alert {
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(triggeringMetric, "triggeringMetric");
    Objects.requireNonNull(timestamp, "timestamp");
    if (reason == null || reason.isBlank()) {
      throw new IllegalArgumentException("reason cannot be null or blank");
    }
  }

  /** Key used for throttling repeated alerts of the same kind. */
  public String throttleKey() {
    return severity + ":" + triggeringMetric;
  }
}
