package crawl.governor.infrastructure.health.check;

import crawl.governor.infrastructure.health.HealthContext;

/** 실행 중 작업 수 vs {@code maxConcurrentRequests} */
public class ConcurrencyHealthCheck extends LimitHealthCheck {

  public static final String NAME = "in_flight";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected double observe(HealthContext context) {
    return context.metrics().inFlight();
  }

  @Override
  protected double limit(HealthContext context) {
    return context.limits().maxConcurrentRequests();
  }
}
