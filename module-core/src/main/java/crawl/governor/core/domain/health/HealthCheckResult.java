package crawl.governor.core.domain.health;

/**
 * Verdict of a single health check.
 *
 * @param name check name, also used as the alert's triggering metric
 * @param status verdict
 * @param value observed value
 * @param limit limit the value was compared with
 * @param message human readable detail
 */
public record HealthCheckResult(
    String name, HealthStatus status, double value, double limit, String message) {

  public static HealthCheckResult healthy(String name, double value, double limit) {
    return new HealthCheckResult(name, HealthStatus.HEALTHY, value, limit, "ok");
  }

  public static HealthCheckResult degraded(
      String name, double value, double limit, String message) {
    return new HealthCheckResult(name, HealthStatus.DEGRADED, value, limit, message);
  }

  public static HealthCheckResult critical(
      String name, double value, double limit, String message) {
    return new HealthCheckResult(name, HealthStatus.CRITICAL, value, limit, message);
  }

  public boolean isCritical() {
    return status == HealthStatus.CRITICAL;
  }
}
