package crawl.governor.infrastructure.ratelimit;

import java.time.Duration;

/**
 * 적응형 동시 실행 제한 설정
 *
 * @param initialCeiling 시작 ceiling ([min, max]로 보정)
 * @param minCeiling 하한
 * @param maxCeiling 상한
 * @param adjustmentStep 한 번의 평가 주기에서 증감하는 폭
 * @param successRateHighWaterMark HEALTHY일 때 최근 성공률이 이 값을 초과해야 증가 (경계값 미포함, 1.0이면 증가 없음)
 * @param acquireTimeout 허가 대기 한도, {@code null}이면 무기한 대기
 */
public record RateLimiterSettings(
    int initialCeiling,
    int minCeiling,
    int maxCeiling,
    int adjustmentStep,
    double successRateHighWaterMark,
    Duration acquireTimeout) {

  public RateLimiterSettings {
    if (minCeiling < 1) {
      throw new IllegalArgumentException("minCeiling must be at least 1, got: " + minCeiling);
    }
    if (maxCeiling < minCeiling) {
      throw new IllegalArgumentException(
          "maxCeiling must be >= minCeiling, got: " + maxCeiling + " < " + minCeiling);
    }
    if (adjustmentStep < 1) {
      throw new IllegalArgumentException(
          "adjustmentStep must be at least 1, got: " + adjustmentStep);
    }
    if (successRateHighWaterMark < 0.0 || successRateHighWaterMark > 1.0) {
      throw new IllegalArgumentException(
          "successRateHighWaterMark must be between 0.0 and 1.0, got: "
              + successRateHighWaterMark);
    }
    if (acquireTimeout != null && acquireTimeout.isNegative()) {
      throw new IllegalArgumentException("acquireTimeout must be non-negative");
    }
    initialCeiling = Math.max(minCeiling, Math.min(maxCeiling, initialCeiling));
  }

  public static RateLimiterSettings of(int initialCeiling, int minCeiling, int maxCeiling) {
    return new RateLimiterSettings(initialCeiling, minCeiling, maxCeiling, 1, 0.95, null);
  }
}
