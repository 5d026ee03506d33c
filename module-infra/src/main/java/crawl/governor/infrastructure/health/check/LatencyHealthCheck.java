package crawl.governor.infrastructure.health.check;

import crawl.governor.core.domain.health.HealthCheckResult;
import crawl.governor.infrastructure.health.HealthCheck;
import crawl.governor.infrastructure.health.HealthContext;

/** 최근 구간 평균 지연. 한도 초과는 DEGRADED까지만 올립니다. */
public class LatencyHealthCheck implements HealthCheck {

  public static final String NAME = "mean_latency_ms";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public HealthCheckResult evaluate(HealthContext context) {
    double mean = context.metrics().latency().meanMs();
    double limit = context.thresholds().warningMeanLatency().toMillis();
    if (context.hasEnoughSamples() && mean >= limit) {
      return HealthCheckResult.degraded(
          NAME, mean, limit, String.format("mean latency %.0fms over %.0fms", mean, limit));
    }
    return HealthCheckResult.healthy(NAME, mean, limit);
  }
}
