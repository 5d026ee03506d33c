package crawl.governor.infrastructure.health;

import java.time.Duration;

/**
 * 헬스 판정 임계치
 *
 * @param warningRatio 한도 대비 이 비율 이상이면 DEGRADED (예: 0.75)
 * @param minSuccessRate 최근 성공률이 이보다 낮으면 CRITICAL
 * @param warningSuccessRate 최근 성공률이 이보다 낮으면 DEGRADED
 * @param warningMeanLatency 최근 평균 지연이 이 이상이면 DEGRADED
 * @param minSamples 성공률/지연 판정 및 ceiling 증가에 필요한 최소 샘플 수
 * @param fatalAfterCycles 연속 CRITICAL 주기가 이 수에 도달하면 치명 상태
 * @param historySize 보관할 최근 리포트 수
 * @param aggressiveMemoryRatio 메모리가 한도 × 이 비율 이상이면 메모리 해제 훅을 AGGRESSIVE 단계로 호출
 */
public record HealthThresholds(
    double warningRatio,
    double minSuccessRate,
    double warningSuccessRate,
    Duration warningMeanLatency,
    int minSamples,
    int fatalAfterCycles,
    int historySize,
    double aggressiveMemoryRatio) {

  public HealthThresholds {
    if (warningRatio <= 0.0 || warningRatio > 1.0) {
      throw new IllegalArgumentException("warningRatio must be in (0, 1], got: " + warningRatio);
    }
    if (minSuccessRate < 0.0 || minSuccessRate > 1.0) {
      throw new IllegalArgumentException(
          "minSuccessRate must be between 0.0 and 1.0, got: " + minSuccessRate);
    }
    if (warningSuccessRate < minSuccessRate || warningSuccessRate > 1.0) {
      throw new IllegalArgumentException(
          "warningSuccessRate must be in [minSuccessRate, 1.0], got: " + warningSuccessRate);
    }
    if (warningMeanLatency == null || warningMeanLatency.isNegative()) {
      throw new IllegalArgumentException("warningMeanLatency must be non-negative");
    }
    if (minSamples < 1) {
      throw new IllegalArgumentException("minSamples must be at least 1, got: " + minSamples);
    }
    if (fatalAfterCycles < 1) {
      throw new IllegalArgumentException(
          "fatalAfterCycles must be at least 1, got: " + fatalAfterCycles);
    }
    if (historySize < 1) {
      throw new IllegalArgumentException("historySize must be at least 1, got: " + historySize);
    }
    if (aggressiveMemoryRatio <= 0.0 || Double.isNaN(aggressiveMemoryRatio)) {
      throw new IllegalArgumentException(
          "aggressiveMemoryRatio must be positive, got: " + aggressiveMemoryRatio);
    }
  }

  public static HealthThresholds defaults() {
    return new HealthThresholds(0.75, 0.5, 0.8, Duration.ofSeconds(8), 5, 5, 100, 1.2);
  }
}
