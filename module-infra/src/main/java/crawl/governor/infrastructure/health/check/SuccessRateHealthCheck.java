package crawl.governor.infrastructure.health.check;

import crawl.governor.core.domain.health.HealthCheckResult;
import crawl.governor.infrastructure.health.HealthCheck;
import crawl.governor.infrastructure.health.HealthContext;

/**
 * 최근 구간 성공률
 *
 * <ul>
 *   <li>샘플 부족: HEALTHY (판정 보류)
 *   <li>minSuccessRate 미만: CRITICAL
 *   <li>warningSuccessRate 미만: DEGRADED
 * </ul>
 */
public class SuccessRateHealthCheck implements HealthCheck {

  public static final String NAME = "success_rate";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public HealthCheckResult evaluate(HealthContext context) {
    double rate = context.metrics().successRate();
    double floor = context.thresholds().minSuccessRate();
    if (!context.hasEnoughSamples()) {
      return HealthCheckResult.healthy(NAME, rate, floor);
    }
    if (rate < floor) {
      return HealthCheckResult.critical(
          NAME, rate, floor, String.format("success rate %.2f below floor %.2f", rate, floor));
    }
    double warning = context.thresholds().warningSuccessRate();
    if (rate < warning) {
      return HealthCheckResult.degraded(
          NAME, rate, warning, String.format("success rate %.2f below %.2f", rate, warning));
    }
    return HealthCheckResult.healthy(NAME, rate, floor);
  }
}
