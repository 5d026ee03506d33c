package crawl.governor.core.domain.health;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Output of one evaluation cycle.
 *
 * @param evaluatedAt cycle time
 * @param status worst status across all checks
 * @param checks individual verdicts in evaluation order
 * @param consecutiveCriticalCycles length of the current CRITICAL streak including this cycle
 * @param fatal whether the streak reached the fatal threshold
 */
public record HealthReport(
    Instant evaluatedAt,
    HealthStatus status,
    List<HealthCheckResult> checks,
    int consecutiveCriticalCycles,
    boolean fatal) {

  public HealthReport {
    checks = List.copyOf(checks);
  }

  public List<HealthCheckResult> failing() {
    return checks.stream().filter(c -> c.status() != HealthStatus.HEALTHY).toList();
  }

  public Optional<HealthCheckResult> check(String name) {
    return checks.stream().filter(c -> c.name().equals(name)).findFirst();
  }
}
