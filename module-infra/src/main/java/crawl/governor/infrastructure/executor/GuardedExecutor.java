package crawl.governor.infrastructure.executor;

import crawl.governor.core.domain.retry.RetryPolicy;
import crawl.governor.error.exception.CircuitOpenException;
import crawl.governor.error.exception.OperationFailedException;
import crawl.governor.error.exception.RateLimitTimeoutException;
import crawl.governor.function.CheckedSupplier;
import crawl.governor.infrastructure.metrics.MetricsCollector;
import crawl.governor.infrastructure.ratelimit.AdaptiveRateLimiter;
import crawl.governor.infrastructure.ratelimit.Permit;
import crawl.governor.infrastructure.resilience.RetryManager;
import lombok.RequiredArgsConstructor;

/**
 * 보호 호출 진입점: 허가 → 재시도/서킷 → 작업
 *
 * <pre>{@code
 * String html = guardedExecutor.execute("fetch-page", () -> fetcher.fetch(url));
 * }</pre>
 *
 * <p>허가는 try-with-resources로 모든 종료 경로(정상, 실패, 타임아웃, 인터럽트)에서 반납됩니다. 허가 대기({@code acquire})와 백오프
 * 대기만이 호출 스레드를 멈추는 지점입니다.
 */
@RequiredArgsConstructor
public class GuardedExecutor {

  private final AdaptiveRateLimiter rateLimiter;
  private final RetryManager retryManager;
  private final MetricsCollector metricsCollector;

  /**
   * @throws RateLimitTimeoutException 허가 대기 한도 초과 (작업 미호출)
   * @throws CircuitOpenException 서킷 OPEN (작업 미호출)
   * @throws OperationFailedException 재시도 소진 또는 재시도 불가 실패
   * @throws InterruptedException 허가 대기, 백오프 대기 또는 작업 중 인터럽트
   */
  public <T> T execute(String operationClass, CheckedSupplier<T> operation)
      throws InterruptedException {
    return execute(operationClass, retryManager.policyFor(operationClass), operation);
  }

  public <T> T execute(String operationClass, RetryPolicy policy, CheckedSupplier<T> operation)
      throws InterruptedException {
    try (Permit permit = rateLimiter.acquire()) {
      metricsCollector.operationStarted();
      try {
        return retryManager.execute(operationClass, policy, operation);
      } finally {
        metricsCollector.operationFinished();
      }
    }
  }
}
