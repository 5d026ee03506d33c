package crawl.governor.infrastructure.health.check;

import crawl.governor.core.domain.health.HealthCheckResult;
import crawl.governor.infrastructure.health.HealthCheck;
import crawl.governor.infrastructure.health.HealthContext;

/**
 * 리소스 한도 비교 체크의 공통 골격
 *
 * <ul>
 *   <li>value &gt; limit: CRITICAL
 *   <li>value ≥ limit × warningRatio: DEGRADED
 *   <li>그 외: HEALTHY
 * </ul>
 */
public abstract class LimitHealthCheck implements HealthCheck {

  protected abstract double observe(HealthContext context);

  protected abstract double limit(HealthContext context);

  /** 관측 불가 시 판정을 생략하려면 false */
  protected boolean isObservable(HealthContext context) {
    return true;
  }

  @Override
  public HealthCheckResult evaluate(HealthContext context) {
    double limit = limit(context);
    if (!isObservable(context)) {
      return HealthCheckResult.healthy(name(), -1, limit);
    }
    double value = observe(context);
    if (value > limit) {
      return HealthCheckResult.critical(
          name(), value, limit, String.format("%s %.1f exceeds limit %.1f", name(), value, limit));
    }
    double warningLevel = limit * context.thresholds().warningRatio();
    if (value >= warningLevel) {
      return HealthCheckResult.degraded(
          name(),
          value,
          limit,
          String.format(
              "%s %.1f reached warning level %.1f (limit %.1f)",
              name(), value, warningLevel, limit));
    }
    return HealthCheckResult.healthy(name(), value, limit);
  }
}
