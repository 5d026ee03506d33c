package crawl.governor.infrastructure.executor;

import crawl.governor.core.domain.alert.AlertSeverity;
import crawl.governor.core.domain.health.MemoryReleaseLevel;
import java.util.Locale;
import java.util.Objects;

/**
 * 부가 작업 식별자
 *
 * <p>{@code component}, {@code action}은 {@code governor_advisory_failures_total}의 태그로 쓰이는 고정 값이고,
 * {@code detail}(훅 이름, 메모리 사용량 등)은 로그에만 남깁니다.
 *
 * <pre>
 * healthCycle()                                → "HealthMonitor:evaluate"
 * memoryRelease("GcMemoryReleaseHook", BASIC, 612.4)
 *                                              → "HealthMonitor:memoryRelease:GcMemoryReleaseHook/BASIC/612.4MB"
 * alertDelivery("SlackNotifier", CRITICAL)     → "AlertDispatcher:notify:SlackNotifier/CRITICAL"
 * </pre>
 */
public record AdvisoryTask(String component, String action, String detail) {

  public AdvisoryTask {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(action, "action");
    detail = detail == null ? "" : detail;
  }

  public static AdvisoryTask of(String component, String action) {
    return new AdvisoryTask(component, action, "");
  }

  /** 스케줄된 헬스 평가 주기 */
  public static AdvisoryTask healthCycle() {
    return of("HealthMonitor", "evaluate");
  }

  /** CRITICAL 메모리에서 실행되는 메모리 해제 훅 하나 */
  public static AdvisoryTask memoryRelease(
      String hookName, MemoryReleaseLevel level, double memoryMb) {
    return new AdvisoryTask(
        "HealthMonitor",
        "memoryRelease",
        String.format(Locale.ROOT, "%s/%s/%.1fMB", hookName, level, memoryMb));
  }

  /** 알림 리스너 하나로의 전달 */
  public static AdvisoryTask alertDelivery(String listenerName, AlertSeverity severity) {
    return new AdvisoryTask("AlertDispatcher", "notify", listenerName + "/" + severity);
  }

  public String describe() {
    return detail.isEmpty()
        ? component + ":" + action
        : component + ":" + action + ":" + detail;
  }
}
