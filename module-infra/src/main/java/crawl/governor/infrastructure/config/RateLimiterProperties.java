package crawl.governor.infrastructure.config;

import crawl.governor.infrastructure.ratelimit.RateLimiterSettings;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 적응형 제한기 설정
 *
 * <pre>{@code
 * governor:
 *   rate-limiter:
 *     initial-ceiling: 5
 *     min-ceiling: 1
 *     max-ceiling: 10
 *     adjustment-step: 1
 *     success-rate-high-water-mark: 0.95
 *     acquire-timeout: 30s   # 미지정 시 무기한 대기
 * }</pre>
 */
@ConfigurationProperties(prefix = "governor.rate-limiter")
public record RateLimiterProperties(
    @DefaultValue("5") int initialCeiling,
    @DefaultValue("1") int minCeiling,
    @DefaultValue("10") int maxCeiling,
    @DefaultValue("1") int adjustmentStep,
    @DefaultValue("0.95") double successRateHighWaterMark,
    Duration acquireTimeout) {

  public RateLimiterSettings toSettings() {
    return new RateLimiterSettings(
        initialCeiling,
        minCeiling,
        maxCeiling,
        adjustmentStep,
        successRateHighWaterMark,
        acquireTimeout);
  }
}
