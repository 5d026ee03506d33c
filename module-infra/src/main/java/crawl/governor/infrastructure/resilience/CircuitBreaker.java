package crawl.governor.infrastructure.resilience;

import crawl.governor.core.domain.circuit.CircuitBreakerSettings;
import crawl.governor.core.domain.circuit.CircuitState;
import crawl.governor.error.ErrorKind;
import crawl.governor.error.exception.CircuitOpenException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 작업 클래스 단위 서킷 브레이커
 *
 * <h3>상태 전이</h3>
 *
 * <ul>
 *   <li><b>CLOSED → OPEN</b>: 연속 실패가 failureThreshold 도달
 *   <li><b>OPEN → HALF_OPEN</b>: 쿨다운 경과 후 첫 호출 시 (시험 호출 1건 허용)
 *   <li><b>HALF_OPEN → CLOSED</b>: 시험 호출 연속 성공이 halfOpenSuccessThreshold 도달
 *   <li><b>HALF_OPEN → OPEN</b>: 시험 호출 실패 즉시 (openedAt 갱신)
 * </ul>
 *
 * <h3>동시성</h3>
 *
 * <p>모든 상태 변경은 인스턴스 고유 {@link ReentrantLock} 아래에서 수행되어 한 작업 클래스 내 전이는 전순서를 가집니다. HALF_OPEN에서는
 * 시험 호출이 진행 중인 동안 다른 호출을 {@link CircuitOpenException}으로 거절합니다.
 *
 * <p>성공은 실패 카운터를, 실패는 성공 카운터를 0으로 리셋합니다.
 */
@Slf4j
public class CircuitBreaker {

  @Getter private final String operationClass;
  @Getter private final CircuitBreakerSettings settings;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  private CircuitState state = CircuitState.CLOSED;
  private int consecutiveFailures;
  private int consecutiveSuccesses;
  private Instant openedAt;
  private Duration activeCooldown = Duration.ZERO;
  private boolean trialInFlight;
  private long openCount;

  public CircuitBreaker(String operationClass, CircuitBreakerSettings settings, Clock clock) {
    this.operationClass = operationClass;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * 호출 허가 요청
   *
   * <p>허가되면 반드시 {@link #onSuccess()}, {@link #onFailure(ErrorKind)}, {@link #releasePermission()} 중 하나로
   * 결과를 알려야 합니다.
   *
   * @throws CircuitOpenException OPEN 쿨다운 중이거나 HALF_OPEN 시험 호출이 진행 중일 때
   */
  public void acquirePermission() {
    lock.lock();
    try {
      switch (state) {
        case CLOSED -> {
          // 통과
        }
        case OPEN -> {
          Duration elapsed = Duration.between(openedAt, clock.instant());
          if (elapsed.compareTo(activeCooldown) < 0) {
            throw new CircuitOpenException(operationClass, activeCooldown.minus(elapsed));
          }
          transitionTo(CircuitState.HALF_OPEN);
          consecutiveSuccesses = 0;
          trialInFlight = true;
        }
        case HALF_OPEN -> {
          if (trialInFlight) {
            throw new CircuitOpenException(operationClass, Duration.ZERO);
          }
          trialInFlight = true;
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /** 성공 기록 */
  public void onSuccess() {
    lock.lock();
    try {
      switch (state) {
        case CLOSED -> {
          consecutiveFailures = 0;
          consecutiveSuccesses++;
        }
        case HALF_OPEN -> {
          trialInFlight = false;
          consecutiveFailures = 0;
          consecutiveSuccesses++;
          if (consecutiveSuccesses >= settings.halfOpenSuccessThreshold()) {
            consecutiveSuccesses = 0;
            transitionTo(CircuitState.CLOSED);
          }
        }
        case OPEN ->
            // OPEN 이전에 허가된 호출의 늦은 결과: 쿨다운을 바꾸지 않음
            log.debug("[CircuitBreaker] OPEN 상태에서 늦은 성공 무시. operation={}", operationClass);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * 실패 기록
   *
   * @param kind 실패 종류 (BLOCKED이고 blockedCooldown이 설정되어 있으면 더 긴 쿨다운으로 OPEN)
   */
  public void onFailure(ErrorKind kind) {
    lock.lock();
    try {
      switch (state) {
        case CLOSED -> {
          consecutiveSuccesses = 0;
          consecutiveFailures++;
          if (consecutiveFailures >= settings.failureThreshold()) {
            open(kind);
          }
        }
        case HALF_OPEN -> {
          trialInFlight = false;
          consecutiveSuccesses = 0;
          consecutiveFailures++;
          open(kind);
        }
        case OPEN ->
            log.debug(
                "[CircuitBreaker] OPEN 상태에서 늦은 실패 무시. operation={}, kind={}", operationClass, kind);
      }
    } finally {
      lock.unlock();
    }
  }

  /** 결과를 기록하지 않고 허가만 반납 (인터럽트 등으로 판정 불가한 경우) */
  public void releasePermission() {
    lock.lock();
    try {
      if (state == CircuitState.HALF_OPEN) {
        trialInFlight = false;
      }
    } finally {
      lock.unlock();
    }
  }

  /** 수동 리셋: CLOSED로 되돌리고 카운터 초기화 */
  public void reset() {
    lock.lock();
    try {
      consecutiveFailures = 0;
      consecutiveSuccesses = 0;
      trialInFlight = false;
      openedAt = null;
      transitionTo(CircuitState.CLOSED);
    } finally {
      lock.unlock();
    }
  }

  public CircuitState getState() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public CircuitBreakerSnapshot snapshot() {
    lock.lock();
    try {
      return new CircuitBreakerSnapshot(
          operationClass, state, consecutiveFailures, consecutiveSuccesses, openedAt, openCount);
    } finally {
      lock.unlock();
    }
  }

  private void open(ErrorKind trigger) {
    openedAt = clock.instant();
    activeCooldown = settings.cooldownFor(trigger);
    openCount++;
    log.warn(
        "[CircuitBreaker] 서킷 OPEN. operation={}, from={}, consecutiveFailures={}, trigger={}, cooldown={}ms",
        operationClass,
        state,
        consecutiveFailures,
        trigger,
        activeCooldown.toMillis());
    state = CircuitState.OPEN;
  }

  private void transitionTo(CircuitState next) {
    if (state != next) {
      log.info("[CircuitBreaker] 상태 전이. operation={}, {} -> {}", operationClass, state, next);
      state = next;
    }
  }
}
