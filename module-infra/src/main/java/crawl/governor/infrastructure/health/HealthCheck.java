package crawl.governor.infrastructure.health;

import crawl.governor.core.domain.health.HealthCheckResult;

/**
 * 개별 헬스 체크 전략
 *
 * <p>{@link HealthMonitor}는 등록된 모든 체크의 결과 중 가장 나쁜 상태를 주기 상태로 사용합니다. 구현은 부수 효과 없이 판정만 수행합니다.
 */
public interface HealthCheck {

  /** 체크 이름 (알림의 triggering metric으로 사용) */
  String name();

  HealthCheckResult evaluate(HealthContext context);
}
