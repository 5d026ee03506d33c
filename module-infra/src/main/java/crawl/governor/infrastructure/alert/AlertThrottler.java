package crawl.governor.infrastructure.alert;

import crawl.governor.core.domain.alert.Alert;
import crawl.governor.core.domain.alert.AlertSeverity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 알림 스로틀러 (프로세스 내 상태)
 *
 * <ul>
 *   <li>동일 throttle key(심각도 + 트리거 지표)는 cooldown 동안 1회만 통과
 *   <li>FATAL은 스로틀링하지 않음
 *   <li>상태는 실행 범위에만 존재하며 재시작 시 초기화
 * </ul>
 */
public class AlertThrottler {

  private final Duration cooldown;
  private final Clock clock;
  private final ConcurrentHashMap<String, Instant> lastSent = new ConcurrentHashMap<>();

  public AlertThrottler(Duration cooldown, Clock clock) {
    if (cooldown == null || cooldown.isNegative()) {
      throw new IllegalArgumentException("cooldown must be non-negative, got: " + cooldown);
    }
    this.cooldown = cooldown;
    this.clock = clock;
  }

  /**
   * 전송 가능 여부 확인 및 기록 (원자적)
   *
   * @return 전송해야 하면 true
   */
  public boolean tryPass(Alert alert) {
    if (alert.severity() == AlertSeverity.FATAL) {
      return true;
    }
    Instant now = clock.instant();
    AtomicBoolean passed = new AtomicBoolean(false);
    lastSent.compute(
        alert.throttleKey(),
        (key, previous) -> {
          if (previous == null || !now.isBefore(previous.plus(cooldown))) {
            passed.set(true);
            return now;
          }
          return previous;
        });
    return passed.get();
  }

  /** 스로틀 상태 초기화 */
  public void reset() {
    lastSent.clear();
  }
}
