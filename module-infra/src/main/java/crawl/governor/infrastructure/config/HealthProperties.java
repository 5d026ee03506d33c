package crawl.governor.infrastructure.config;

import crawl.governor.core.domain.health.ResourceLimits;
import crawl.governor.infrastructure.health.HealthThresholds;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 헬스 모니터 설정
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * governor:
 *   health:
 *     enabled: true
 *     period: 30s
 *     warning-ratio: 0.75
 *     min-success-rate: 0.5
 *     warning-success-rate: 0.8
 *     warning-mean-latency: 8s
 *     min-samples: 5
 *     fatal-after-cycles: 5
 *     history-size: 100
 *     alert-cooldown: 5m
 *     memory-release-enabled: true
 *     aggressive-memory-ratio: 1.2
 *     limits:
 *       max-memory-mb: 512
 *       max-cpu-percent: 80
 *       max-concurrent-requests: 10
 *       max-open-files: 100
 * }</pre>
 */
@ConfigurationProperties(prefix = "governor.health")
public record HealthProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("30s") Duration period,
    @DefaultValue("0.75") double warningRatio,
    @DefaultValue("0.5") double minSuccessRate,
    @DefaultValue("0.8") double warningSuccessRate,
    @DefaultValue("8s") Duration warningMeanLatency,
    @DefaultValue("5") int minSamples,
    @DefaultValue("5") int fatalAfterCycles,
    @DefaultValue("100") int historySize,
    @DefaultValue("5m") Duration alertCooldown,
    @DefaultValue("true") boolean memoryReleaseEnabled,
    @DefaultValue("1.2") double aggressiveMemoryRatio,
    @DefaultValue Limits limits) {

  public HealthProperties {
    if (period.isNegative() || period.isZero()) {
      throw new IllegalArgumentException("governor.health.period must be positive, got: " + period);
    }
  }

  public HealthThresholds toThresholds() {
    return new HealthThresholds(
        warningRatio,
        minSuccessRate,
        warningSuccessRate,
        warningMeanLatency,
        minSamples,
        fatalAfterCycles,
        historySize,
        aggressiveMemoryRatio);
  }

  public record Limits(
      @DefaultValue("512") long maxMemoryMb,
      @DefaultValue("80") double maxCpuPercent,
      @DefaultValue("10") int maxConcurrentRequests,
      @DefaultValue("100") int maxOpenFiles) {

    public ResourceLimits toResourceLimits() {
      return new ResourceLimits(maxMemoryMb, maxCpuPercent, maxConcurrentRequests, maxOpenFiles);
    }
  }
}
