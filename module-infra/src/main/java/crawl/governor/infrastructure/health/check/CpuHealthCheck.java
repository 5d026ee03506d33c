package crawl.governor.infrastructure.health.check;

import crawl.governor.infrastructure.health.HealthContext;

/** CPU 사용률(%) vs {@code maxCpuPercent} */
public class CpuHealthCheck extends LimitHealthCheck {

  public static final String NAME = "cpu_percent";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected double observe(HealthContext context) {
    return context.resources().cpuPercent();
  }

  @Override
  protected double limit(HealthContext context) {
    return context.limits().maxCpuPercent();
  }
}
