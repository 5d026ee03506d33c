package crawl.governor.infrastructure.ratelimit;

import crawl.governor.core.domain.health.HealthStatus;
import crawl.governor.error.exception.RateLimitTimeoutException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * 적응형 동시 실행 제한기
 *
 * <h3>불변식</h3>
 *
 * <ul>
 *   <li>신규 허가는 {@code inFlight < ceiling}일 때만 발급
 *   <li>ceiling은 항상 {@code [minCeiling, maxCeiling]}
 *   <li>대기자는 FIFO 순서로 허가를 받음 (반납 시 대기열 선두에 직접 인계)
 * </ul>
 *
 * <h3>ceiling 조정</h3>
 *
 * <p>요청 경로가 아닌 헬스 평가 주기에서만 호출됩니다.
 *
 * <ul>
 *   <li>HEALTHY + 최근 성공률 ≥ high-water mark: step만큼 증가 (max 상한)
 *   <li>DEGRADED: 유지
 *   <li>CRITICAL: step만큼 감소 (min 하한). 실행 중인 작업은 취소하지 않으며 반납으로 자연 감소할 때까지 신규 허가만 막힘
 * </ul>
 */
@Slf4j
public class AdaptiveRateLimiter {

  private final RateLimiterSettings settings;
  private final ReentrantLock lock = new ReentrantLock();
  private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();

  private int ceiling;
  private int inFlight;
  private long admitted;

  public AdaptiveRateLimiter(RateLimiterSettings settings, MeterRegistry meterRegistry) {
    this.settings = settings;
    this.ceiling = settings.initialCeiling();

    Gauge.builder("governor_ratelimiter_ceiling", this, AdaptiveRateLimiter::getCeiling)
        .description("Current admission ceiling")
        .register(meterRegistry);
    Gauge.builder("governor_ratelimiter_in_flight", this, AdaptiveRateLimiter::getInFlight)
        .description("Permits currently held")
        .register(meterRegistry);
    Gauge.builder("governor_ratelimiter_waiting", this, AdaptiveRateLimiter::getWaiting)
        .description("Callers waiting for a permit")
        .register(meterRegistry);
  }

  /**
   * 허가 획득. 설정된 {@code acquireTimeout}이 있으면 그 한도까지만 대기합니다.
   *
   * @throws InterruptedException 대기 중 인터럽트
   * @throws RateLimitTimeoutException 대기 한도 초과
   */
  public Permit acquire() throws InterruptedException {
    Duration timeout = settings.acquireTimeout();
    return timeout == null ? acquireInternal(false, 0L) : acquire(timeout);
  }

  /**
   * 지정 한도까지 대기하며 허가 획득
   *
   * @throws RateLimitTimeoutException 한도 내 허가를 받지 못함
   */
  public Permit acquire(Duration timeout) throws InterruptedException {
    return acquireInternal(true, timeout.toNanos());
  }

  /** 대기 없이 즉시 획득 시도. 대기자가 있으면 새치기하지 않음 */
  public Optional<Permit> tryAcquire() {
    lock.lock();
    try {
      if (waiters.isEmpty() && inFlight < ceiling) {
        return Optional.of(admit());
      }
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  /** 허가 반납. 절대 블로킹하지 않으며 중복 반납은 무시 */
  public void release(Permit permit) {
    if (!permit.belongsTo(this)) {
      throw new IllegalArgumentException("permit was not issued by this limiter");
    }
    lock.lock();
    try {
      if (!permit.markReleased()) {
        return;
      }
      inFlight--;
      dispatch();
    } finally {
      lock.unlock();
    }
  }

  /**
   * 헬스 평가 결과에 따른 ceiling 조정
   *
   * @param status 이번 주기 상태
   * @param recentSuccessRate 최근 구간 성공률. high-water mark를 초과해야 증가 (같으면 유지, 샘플 부족 시 NaN → 증가 안 함)
   * @return 조정 후 ceiling
   */
  public int adjustCeiling(HealthStatus status, double recentSuccessRate) {
    return switch (status) {
      case HEALTHY ->
          recentSuccessRate > settings.successRateHighWaterMark()
              ? increaseCeiling()
              : getCeiling();
      case DEGRADED -> getCeiling();
      case CRITICAL -> decreaseCeiling();
    };
  }

  public int increaseCeiling() {
    lock.lock();
    try {
      int previous = ceiling;
      ceiling = Math.min(settings.maxCeiling(), ceiling + settings.adjustmentStep());
      if (ceiling != previous) {
        log.info("[RateLimiter] ceiling 증가. {} -> {}, inFlight={}", previous, ceiling, inFlight);
        dispatch();
      }
      return ceiling;
    } finally {
      lock.unlock();
    }
  }

  public int decreaseCeiling() {
    lock.lock();
    try {
      int previous = ceiling;
      ceiling = Math.max(settings.minCeiling(), ceiling - settings.adjustmentStep());
      if (ceiling != previous) {
        log.warn("[RateLimiter] ceiling 감소. {} -> {}, inFlight={}", previous, ceiling, inFlight);
      }
      return ceiling;
    } finally {
      lock.unlock();
    }
  }

  public int getCeiling() {
    lock.lock();
    try {
      return ceiling;
    } finally {
      lock.unlock();
    }
  }

  public int getInFlight() {
    lock.lock();
    try {
      return inFlight;
    } finally {
      lock.unlock();
    }
  }

  public int getWaiting() {
    lock.lock();
    try {
      return waiters.size();
    } finally {
      lock.unlock();
    }
  }

  public RateLimiterSnapshot snapshot() {
    lock.lock();
    try {
      return new RateLimiterSnapshot(
          ceiling,
          inFlight,
          waiters.size(),
          settings.minCeiling(),
          settings.maxCeiling(),
          admitted);
    } finally {
      lock.unlock();
    }
  }

  private Permit acquireInternal(boolean timed, long timeoutNanos) throws InterruptedException {
    lock.lockInterruptibly();
    try {
      if (waiters.isEmpty() && inFlight < ceiling) {
        return admit();
      }

      Waiter waiter = new Waiter(lock.newCondition());
      waiters.addLast(waiter);
      long remaining = timeoutNanos;
      try {
        while (waiter.permit == null) {
          if (!timed) {
            waiter.condition.await();
          } else if (remaining <= 0L) {
            waiters.remove(waiter);
            log.debug(
                "[RateLimiter] 허가 대기 시간 초과. timeout={}ms, ceiling={}, inFlight={}",
                Duration.ofNanos(timeoutNanos).toMillis(),
                ceiling,
                inFlight);
            throw new RateLimitTimeoutException(Duration.ofNanos(timeoutNanos), ceiling);
          } else {
            remaining = waiter.condition.awaitNanos(remaining);
          }
        }
        return waiter.permit;
      } catch (InterruptedException e) {
        if (waiter.permit != null) {
          // 인계와 인터럽트가 겹침: 허가를 받은 것으로 처리하고 플래그만 복원
          Thread.currentThread().interrupt();
          return waiter.permit;
        }
        waiters.remove(waiter);
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  /** 락 보유 상태에서 호출 */
  private Permit admit() {
    inFlight++;
    admitted++;
    return new Permit(this, admitted);
  }

  /** 락 보유 상태에서 호출: 여유가 있는 만큼 대기열 선두부터 직접 인계 */
  private void dispatch() {
    while (!waiters.isEmpty() && inFlight < ceiling) {
      Waiter next = waiters.pollFirst();
      next.permit = admit();
      next.condition.signal();
    }
  }

  private static final class Waiter {
    private final Condition condition;
    private Permit permit;

    private Waiter(Condition condition) {
      this.condition = condition;
    }
  }
}
