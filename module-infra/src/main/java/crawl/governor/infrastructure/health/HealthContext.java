package crawl.governor.infrastructure.health;

import crawl.governor.core.domain.health.ResourceLimits;
import crawl.governor.core.domain.metric.CurrentMetrics;
import crawl.governor.core.domain.metric.ResourceSnapshot;

/** 한 평가 주기의 입력 (리소스 스냅샷 + 최근 구간 집계 + 한도) */
public record HealthContext(
    ResourceSnapshot resources,
    CurrentMetrics metrics,
    ResourceLimits limits,
    HealthThresholds thresholds) {

  public boolean hasEnoughSamples() {
    return metrics.windowSamples() >= thresholds.minSamples();
  }
}
