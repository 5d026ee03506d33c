package crawl.governor.infrastructure.executor;

import crawl.governor.function.CheckedRunnable;
import crawl.governor.util.Interruptions;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 부가 작업(advisory action) 실행기
 *
 * <p>헬스 평가 주기의 교정 조치, 호출자 훅, 알림 리스너처럼 실패가 호출 흐름으로 전파되면 안 되는 작업을 실행합니다.
 *
 * <ul>
 *   <li>Exception: WARN 로그 + {@code governor_advisory_failures_total} 집계 후 false 반환
 *   <li>중단에 의한 실패({@link Interruptions}): 플래그 복원. 소켓 타임아웃 같은 I/O 타임아웃은 해당하지 않음
 *   <li>Error: 즉시 throw (JVM 상태 이상은 삼키지 않음)
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class AdvisoryActionExecutor {

  private final MeterRegistry meterRegistry;

  /**
   * 작업 실행, 실패 시 로그만 남김
   *
   * @return 정상 완료 여부
   */
  public boolean executeOrLog(CheckedRunnable action, AdvisoryTask task) {
    Objects.requireNonNull(action, "action must not be null");
    Objects.requireNonNull(task, "task must not be null");

    try {
      action.run();
      return true;
    } catch (Exception e) {
      boolean interrupted = Interruptions.restoreIfInterruption(e);
      Counter.builder("governor_advisory_failures_total")
          .description("Advisory actions that failed and were not propagated")
          .tag("component", task.component())
          .tag("action", task.action())
          .register(meterRegistry)
          .increment();
      log.warn(
          "[AdvisoryAction] 부가 작업 실패 (전파하지 않음). task={}, interrupted={}, error={}",
          task.describe(),
          interrupted,
          e.toString(),
          e);
      return false;
    }
  }
}
