package crawl.governor.infrastructure.health.check;

import crawl.governor.infrastructure.health.HealthContext;

/** 프로세스 메모리(MB) vs {@code maxMemoryMb} */
public class MemoryHealthCheck extends LimitHealthCheck {

  public static final String NAME = "memory_mb";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected double observe(HealthContext context) {
    return context.resources().memoryMb();
  }

  @Override
  protected double limit(HealthContext context) {
    return context.limits().maxMemoryMb();
  }
}
