package crawl.governor.infrastructure.health.check;

import crawl.governor.infrastructure.health.HealthContext;

/** 열린 파일 수 vs {@code maxOpenFiles}. 플랫폼이 값을 제공하지 않으면 HEALTHY */
public class OpenFilesHealthCheck extends LimitHealthCheck {

  public static final String NAME = "open_files";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected boolean isObservable(HealthContext context) {
    return context.resources().hasOpenFiles();
  }

  @Override
  protected double observe(HealthContext context) {
    return context.resources().openFiles();
  }

  @Override
  protected double limit(HealthContext context) {
    return context.limits().maxOpenFiles();
  }
}
