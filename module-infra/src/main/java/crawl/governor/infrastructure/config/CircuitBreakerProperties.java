package crawl.governor.infrastructure.config;

import crawl.governor.core.domain.circuit.CircuitBreakerSettings;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 작업 클래스별 서킷 브레이커 기본 설정
 *
 * <p>{@code blocked-cooldown}을 지정하면 BLOCKED 실패로 열린 서킷은 그 시간 동안 유지됩니다 (미지정 시 {@code cooldown}).
 */
@ConfigurationProperties(prefix = "governor.circuit-breaker")
public record CircuitBreakerProperties(
    @DefaultValue("5") int failureThreshold,
    @DefaultValue("60s") Duration cooldown,
    @DefaultValue("1") int halfOpenSuccessThreshold,
    Duration blockedCooldown) {

  public CircuitBreakerSettings toSettings() {
    return new CircuitBreakerSettings(
        failureThreshold, cooldown, halfOpenSuccessThreshold, blockedCooldown);
  }
}
