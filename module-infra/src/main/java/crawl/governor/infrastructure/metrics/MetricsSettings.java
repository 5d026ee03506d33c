package crawl.governor.infrastructure.metrics;

import java.time.Duration;

/**
 * 샘플 윈도우 설정
 *
 * @param retention 보관 기간 (이보다 오래된 샘플은 기록/조회 시 제거)
 * @param maxSamples 최대 보관 샘플 수
 * @param shortWindow {@code getCurrentMetrics()}가 집계하는 최근 구간
 */
public record MetricsSettings(Duration retention, int maxSamples, Duration shortWindow) {

  public MetricsSettings {
    if (retention == null || retention.isNegative() || retention.isZero()) {
      throw new IllegalArgumentException("retention must be positive, got: " + retention);
    }
    if (maxSamples <= 0) {
      throw new IllegalArgumentException("maxSamples must be positive, got: " + maxSamples);
    }
    if (shortWindow == null || shortWindow.isNegative() || shortWindow.isZero()) {
      throw new IllegalArgumentException("shortWindow must be positive, got: " + shortWindow);
    }
    if (shortWindow.compareTo(retention) > 0) {
      throw new IllegalArgumentException("shortWindow must not exceed retention");
    }
  }

  public static MetricsSettings defaults() {
    return new MetricsSettings(Duration.ofMinutes(60), 10_000, Duration.ofMinutes(1));
  }
}
