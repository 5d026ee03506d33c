package crawl.governor.infrastructure.resilience;

import crawl.governor.core.calculator.BackoffCalculator;
import crawl.governor.core.domain.retry.RetryPolicy;
import crawl.governor.core.port.out.Sleeper;
import crawl.governor.error.ErrorKind;
import crawl.governor.error.exception.CircuitOpenException;
import crawl.governor.error.exception.OperationFailedException;
import crawl.governor.error.exception.base.BaseException;
import crawl.governor.function.CheckedSupplier;
import crawl.governor.infrastructure.metrics.MetricsCollector;
import crawl.governor.util.Interruptions;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * 재시도 + 서킷 브레이커 실행기
 *
 * <h3>시도 루프 (attempt = 1..maxAttempts)</h3>
 *
 * <ol>
 *   <li>서킷 허가 요청. OPEN 쿨다운 중이면 작업을 호출하지 않고 {@link CircuitOpenException}
 *   <li>작업 호출 후 결과를 서킷과 {@link MetricsCollector}에 기록 (재시도 여부와 무관하게 매 시도)
 *   <li>성공 시 결과 반환
 *   <li>실패 시 재시도 불가 종류이거나 마지막 시도면 {@link OperationFailedException}, 아니면 백오프 후 재시도
 * </ol>
 *
 * <h4>재시도하지 않는 것</h4>
 *
 * <ul>
 *   <li>CIRCUIT_OPEN, RATE_LIMIT_TIMEOUT: 호출자에게 즉시 반환 (재큐잉은 호출자 결정)
 *   <li>BLOCKED, UNKNOWN: 기본 정책에서 제외 (BLOCKED는 서킷에는 집계)
 * </ul>
 *
 * <p>백오프 대기는 현재 작업 스레드만 멈춥니다. 대기 중 인터럽트는 {@link InterruptedException}으로 전파됩니다. 작업 중
 * 중단 판정은 {@link Interruptions}를 따르며, {@link java.net.SocketTimeoutException} 같은 I/O 타임아웃은 중단이 아니라
 * TIMEOUT 실패입니다.
 */
@Slf4j
public class RetryManager {

  private final RetryPolicy defaultPolicy;
  private final CircuitBreakerRegistry circuitBreakers;
  private final MetricsCollector metricsCollector;
  private final ErrorClassifier errorClassifier;
  private final BackoffCalculator backoffCalculator;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;
  private final Map<String, RetryPolicy> policies = new ConcurrentHashMap<>();
  private final RetryStatistics statistics = new RetryStatistics();

  public RetryManager(
      RetryPolicy defaultPolicy,
      CircuitBreakerRegistry circuitBreakers,
      MetricsCollector metricsCollector,
      ErrorClassifier errorClassifier,
      BackoffCalculator backoffCalculator,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.defaultPolicy = defaultPolicy;
    this.circuitBreakers = circuitBreakers;
    this.metricsCollector = metricsCollector;
    this.errorClassifier = errorClassifier;
    this.backoffCalculator = backoffCalculator;
    this.sleeper = sleeper;
    this.meterRegistry = meterRegistry;
  }

  /** 작업 클래스 전용 정책 등록 (실행 중 불변으로 공유) */
  public void registerPolicy(String operationClass, RetryPolicy policy) {
    policies.put(operationClass, policy);
  }

  public RetryPolicy policyFor(String operationClass) {
    return policies.getOrDefault(operationClass, defaultPolicy);
  }

  public <T> T execute(String operationClass, CheckedSupplier<T> operation)
      throws InterruptedException {
    return execute(operationClass, policyFor(operationClass), operation);
  }

  /**
   * 정책을 적용해 작업 실행
   *
   * @return 작업 결과
   * @throws OperationFailedException 허용된 시도를 모두 소진했거나 재시도 불가 실패
   * @throws CircuitOpenException 서킷이 호출을 거절
   * @throws InterruptedException 백오프 대기 또는 작업 중 인터럽트
   */
  public <T> T execute(String operationClass, RetryPolicy policy, CheckedSupplier<T> operation)
      throws InterruptedException {
    CircuitBreaker breaker = circuitBreakers.get(operationClass);
    statistics.recordExecution();
    Exception lastFailure = null;

    for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
      acquireOrReject(breaker, operationClass, lastFailure);
      statistics.recordAttempt();

      long startNanos = System.nanoTime();
      T result;
      try {
        result = operation.get();
      } catch (Exception e) {
        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        if (Interruptions.isInterruption(e)) {
          breaker.releasePermission();
          throw asInterrupted(e);
        }

        ErrorKind kind = errorClassifier.classify(e);
        switch (kind) {
          case NETWORK, TIMEOUT, BLOCKED, UNKNOWN -> {
            breaker.onFailure(kind);
            metricsCollector.recordAttempt(operationClass, latency, kind);
            countAttempt(operationClass, kind.name());
            lastFailure = e;
            awaitNextAttemptOrFail(operationClass, policy, attempt, kind, e);
          }
          case CIRCUIT_OPEN, RATE_LIMIT_TIMEOUT -> {
            // 중첩된 보호 호출의 거절: 이 작업의 실패가 아니므로 그대로 반환
            breaker.releasePermission();
            throw unwrapRejection(e);
          }
        }
        continue;
      } catch (Error error) {
        breaker.releasePermission();
        throw error;
      }

      Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
      breaker.onSuccess();
      metricsCollector.recordAttempt(operationClass, latency, null);
      countAttempt(operationClass, "SUCCESS");
      statistics.recordSuccess(attempt);
      if (attempt > 1) {
        log.info("[RetryManager] 재시도 후 성공. operation={}, attempt={}", operationClass, attempt);
      }
      return result;
    }

    // maxAttempts >= 1 이므로 루프는 반환 또는 예외로만 종료
    throw new IllegalStateException("retry loop exited without result: " + operationClass);
  }

  public RetryStatistics.Snapshot getStatistics() {
    return statistics.snapshot();
  }

  private void acquireOrReject(
      CircuitBreaker breaker, String operationClass, Exception lastFailure) {
    try {
      breaker.acquirePermission();
    } catch (CircuitOpenException e) {
      if (lastFailure != null) {
        e.addSuppressed(lastFailure);
      }
      statistics.recordCircuitOpenRejection();
      Counter.builder("governor_circuit_open_rejections_total")
          .description("Calls rejected by an open circuit")
          .tag("operation", operationClass)
          .register(meterRegistry)
          .increment();
      log.debug(
          "[RetryManager] 서킷 OPEN으로 호출 차단. operation={}, remaining={}ms",
          operationClass,
          e.getRemainingCooldown().toMillis());
      throw e;
    }
  }

  private void awaitNextAttemptOrFail(
      String operationClass, RetryPolicy policy, int attempt, ErrorKind kind, Exception failure)
      throws InterruptedException {
    if (!policy.isRetryable(kind)) {
      statistics.recordNonRetryable();
      log.warn(
          "[RetryManager] 재시도 불가 실패. operation={}, attempt={}, kind={}, error={}",
          operationClass,
          attempt,
          kind,
          failure.getMessage());
      throw new OperationFailedException(kind, operationClass, attempt, failure);
    }
    if (attempt >= policy.maxAttempts()) {
      statistics.recordExhausted();
      log.warn(
          "[RetryManager] 재시도 소진. operation={}, attempts={}, kind={}, error={}",
          operationClass,
          attempt,
          kind,
          failure.getMessage());
      throw new OperationFailedException(kind, operationClass, attempt, failure);
    }

    Duration delay = backoffCalculator.delayFor(policy, attempt);
    log.warn(
        "[RetryManager] 재시도 대기. operation={}, attempt={}/{}, kind={}, delay={}ms",
        operationClass,
        attempt,
        policy.maxAttempts(),
        kind,
        delay.toMillis());
    sleeper.sleep(delay);
  }

  private void countAttempt(String operationClass, String outcome) {
    Counter.builder("governor_retry_attempts_total")
        .description("Attempts of guarded operations")
        .tag("operation", operationClass)
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }

  private static RuntimeException unwrapRejection(Exception e) {
    Throwable current = e;
    while (current != null && !(current instanceof BaseException)) {
      current = current.getCause();
    }
    return current instanceof BaseException base ? base : new IllegalStateException(e);
  }

  private static InterruptedException asInterrupted(Exception e) {
    if (e instanceof InterruptedException interrupted) {
      return interrupted;
    }
    InterruptedException interrupted = new InterruptedException("guarded operation interrupted");
    interrupted.initCause(e);
    return interrupted;
  }
}
