package crawl.governor.infrastructure.health;

import crawl.governor.core.domain.alert.Alert;
import crawl.governor.core.domain.alert.AlertSeverity;
import crawl.governor.core.domain.health.HealthCheckResult;
import crawl.governor.core.domain.health.HealthReport;
import crawl.governor.core.domain.health.HealthStatus;
import crawl.governor.core.domain.health.MemoryReleaseLevel;
import crawl.governor.core.domain.health.ResourceLimits;
import crawl.governor.core.domain.metric.CurrentMetrics;
import crawl.governor.core.domain.metric.ResourceSnapshot;
import crawl.governor.core.port.out.MemoryReleaseHook;
import crawl.governor.core.port.out.ResourceProbe;
import crawl.governor.infrastructure.alert.AlertDispatcher;
import crawl.governor.infrastructure.executor.AdvisoryActionExecutor;
import crawl.governor.infrastructure.executor.AdvisoryTask;
import crawl.governor.infrastructure.health.check.MemoryHealthCheck;
import crawl.governor.infrastructure.metrics.MetricsCollector;
import crawl.governor.infrastructure.ratelimit.AdaptiveRateLimiter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

/**
 * 주기적 헬스 평가기
 *
 * <h3>평가 주기</h3>
 *
 * <ol>
 *   <li>리소스 스냅샷과 {@link MetricsCollector} 최근 구간 집계 수집
 *   <li>등록된 {@link HealthCheck} 전부 평가, 가장 나쁜 결과가 주기 상태
 *   <li>CRITICAL: 알림 발행, 제한기 ceiling 감소, 메모리 체크가 원인이면 등록된 메모리 해제 훅 전부 호출
 *   <li>DEGRADED/HEALTHY: 제한기 ceiling 조정 (DEGRADED 유지, HEALTHY + 높은 성공률이면 증가)
 * </ol>
 *
 * <h3>메모리 해제 단계</h3>
 *
 * <p>메모리가 한도를 넘으면 BASIC, {@code 한도 × aggressiveMemoryRatio} 이상이면 AGGRESSIVE 단계로 훅을 호출합니다. 훅은 등록
 * 순서대로 하나씩 격리 실행되므로 한 훅의 실패가 다른 훅을 막지 않습니다.
 *
 * <h3>치명 상태</h3>
 *
 * <p>CRITICAL이 {@code fatalAfterCycles} 주기 연속되면 FATAL 알림을 스트릭당 1회 발행하고 {@link #isFatal()}이 true가
 * 됩니다. 프로세스 종료 여부는 호출자가 결정합니다.
 *
 * <h4>예외 정책</h4>
 *
 * <p>이 컴포넌트는 예외를 던지지 않습니다. 교정 조치나 리스너 실패는 {@link AdvisoryActionExecutor}가 로그로 남기며, 스케줄된
 * 주기의 예외도 다음 주기를 막지 않습니다. 진행 중인 작업은 건드리지 않습니다.
 */
@Slf4j
public class HealthMonitor {

  private final MetricsCollector metricsCollector;
  private final AdaptiveRateLimiter rateLimiter;
  private final ResourceProbe resourceProbe;
  private final AlertDispatcher alertDispatcher;
  private final List<HealthCheck> checks;
  private final List<MemoryReleaseHook> memoryReleaseHooks;
  private final AdvisoryActionExecutor advisoryExecutor;
  private final ResourceLimits limits;
  private final HealthThresholds thresholds;
  private final Duration period;
  private final TaskScheduler scheduler;
  private final Clock clock;

  private final ArrayDeque<HealthReport> history = new ArrayDeque<>();
  private volatile HealthReport latest;
  private volatile boolean fatal;
  private int consecutiveCritical;
  private boolean fatalReported;
  private ScheduledFuture<?> scheduled;

  public HealthMonitor(
      MetricsCollector metricsCollector,
      AdaptiveRateLimiter rateLimiter,
      ResourceProbe resourceProbe,
      AlertDispatcher alertDispatcher,
      List<HealthCheck> checks,
      List<MemoryReleaseHook> memoryReleaseHooks,
      AdvisoryActionExecutor advisoryExecutor,
      ResourceLimits limits,
      HealthThresholds thresholds,
      Duration period,
      TaskScheduler scheduler,
      Clock clock,
      MeterRegistry meterRegistry) {
    if (period == null || period.isNegative() || period.isZero()) {
      throw new IllegalArgumentException("period must be positive, got: " + period);
    }
    this.metricsCollector = metricsCollector;
    this.rateLimiter = rateLimiter;
    this.resourceProbe = resourceProbe;
    this.alertDispatcher = alertDispatcher;
    this.checks = List.copyOf(checks);
    this.memoryReleaseHooks = List.copyOf(memoryReleaseHooks);
    this.advisoryExecutor = advisoryExecutor;
    this.limits = limits;
    this.thresholds = thresholds;
    this.period = period;
    this.scheduler = scheduler;
    this.clock = clock;

    Gauge.builder("governor_health_status", this, m -> m.getCurrentStatus().ordinal())
        .description("Health status (0=HEALTHY, 1=DEGRADED, 2=CRITICAL)")
        .register(meterRegistry);
  }

  /** 주기 평가 시작 (이미 실행 중이면 무시) */
  public synchronized void start() {
    if (scheduled != null && !scheduled.isDone()) {
      return;
    }
    scheduled = scheduler.scheduleWithFixedDelay(this::runScheduledCycle, period);
    log.info("[HealthMonitor] 주기 평가 시작. period={}ms, limits={}", period.toMillis(), limits);
  }

  /** 주기 평가 중지. 진행 중인 주기는 끝까지 수행됩니다. */
  public synchronized void stop() {
    if (scheduled != null) {
      scheduled.cancel(false);
      scheduled = null;
      log.info("[HealthMonitor] 주기 평가 중지");
    }
  }

  public synchronized boolean isRunning() {
    return scheduled != null && !scheduled.isDone();
  }

  /**
   * 평가 주기 1회 수행 (주기 간 직렬화)
   *
   * @return 이번 주기 리포트
   */
  public synchronized HealthReport evaluate() {
    ResourceSnapshot resources = resourceProbe.snapshot();
    CurrentMetrics metrics = metricsCollector.getCurrentMetrics();
    HealthContext context = new HealthContext(resources, metrics, limits, thresholds);

    List<HealthCheckResult> results = new ArrayList<>(checks.size());
    HealthStatus status = HealthStatus.HEALTHY;
    for (HealthCheck check : checks) {
      HealthCheckResult result = check.evaluate(context);
      results.add(result);
      status = status.worst(result.status());
    }

    consecutiveCritical = status == HealthStatus.CRITICAL ? consecutiveCritical + 1 : 0;
    boolean fatalNow = consecutiveCritical >= thresholds.fatalAfterCycles();
    Instant now = clock.instant();
    HealthReport report = new HealthReport(now, status, results, consecutiveCritical, fatalNow);

    remember(report);
    act(report, context);
    fatal = fatalNow;
    return report;
  }

  public HealthStatus getCurrentStatus() {
    HealthReport current = latest;
    return current == null ? HealthStatus.HEALTHY : current.status();
  }

  public Optional<HealthReport> getLatestReport() {
    return Optional.ofNullable(latest);
  }

  public synchronized List<HealthReport> getHistory() {
    return List.copyOf(history);
  }

  /** 연속 CRITICAL이 임계 주기 수에 도달했는지 여부 */
  public boolean isFatal() {
    return fatal;
  }

  private void runScheduledCycle() {
    advisoryExecutor.executeOrLog(this::evaluate, AdvisoryTask.healthCycle());
  }

  private void act(HealthReport report, HealthContext context) {
    switch (report.status()) {
      case CRITICAL -> onCritical(report, context);
      case DEGRADED -> {
        emit(report, AlertSeverity.WARNING);
        rateLimiter.adjustCeiling(HealthStatus.DEGRADED, recentSuccessRate(context));
      }
      case HEALTHY -> rateLimiter.adjustCeiling(HealthStatus.HEALTHY, recentSuccessRate(context));
    }

    if (report.status() != HealthStatus.CRITICAL && fatalReported) {
      log.info("[HealthMonitor] CRITICAL 스트릭 해소. status={}", report.status());
      fatalReported = false;
    }
  }

  private void onCritical(HealthReport report, HealthContext context) {
    emit(report, AlertSeverity.CRITICAL);

    int ceiling = rateLimiter.decreaseCeiling();
    log.warn(
        "[HealthMonitor] CRITICAL. failing={}, ceiling={}, streak={}",
        report.failing().stream().map(HealthCheckResult::name).toList(),
        ceiling,
        report.consecutiveCriticalCycles());

    boolean memoryCritical =
        report.check(MemoryHealthCheck.NAME).map(HealthCheckResult::isCritical).orElse(false);
    if (memoryCritical) {
      releaseMemory(context.resources());
    }

    if (report.fatal() && !fatalReported) {
      fatalReported = true;
      log.error(
          "[HealthMonitor] 치명 상태: {}주기 연속 CRITICAL. 중단 여부는 호출자가 결정합니다.",
          report.consecutiveCriticalCycles());
      alertDispatcher.dispatch(
          new Alert(
              AlertSeverity.FATAL,
              "persistent CRITICAL health for " + report.consecutiveCriticalCycles() + " cycles",
              "health_status",
              report.consecutiveCriticalCycles(),
              thresholds.fatalAfterCycles(),
              report.evaluatedAt()));
    }
  }

  private void releaseMemory(ResourceSnapshot resources) {
    MemoryReleaseLevel level =
        MemoryReleaseLevel.of(
            resources.memoryMb(), limits.maxMemoryMb(), thresholds.aggressiveMemoryRatio());
    log.warn(
        "[HealthMonitor] 메모리 해제 요청. level={}, hooks={}, memoryMb={}",
        level,
        memoryReleaseHooks.size(),
        resources.memoryMb());
    for (MemoryReleaseHook hook : memoryReleaseHooks) {
      advisoryExecutor.executeOrLog(
          () -> hook.release(resources, level),
          AdvisoryTask.memoryRelease(
              hook.getClass().getSimpleName(), level, resources.memoryMb()));
    }
  }

  private void emit(HealthReport report, AlertSeverity severity) {
    HealthStatus target =
        severity == AlertSeverity.CRITICAL ? HealthStatus.CRITICAL : HealthStatus.DEGRADED;
    for (HealthCheckResult result : report.checks()) {
      if (result.status() == target) {
        alertDispatcher.dispatch(
            new Alert(
                severity,
                result.message(),
                result.name(),
                result.value(),
                result.limit(),
                report.evaluatedAt()));
      }
    }
  }

  /** 샘플이 부족하면 NaN (ceiling 증가 안 함) */
  private double recentSuccessRate(HealthContext context) {
    return context.hasEnoughSamples() ? context.metrics().successRate() : Double.NaN;
  }

  private void remember(HealthReport report) {
    latest = report;
    history.addLast(report);
    while (history.size() > thresholds.historySize()) {
      history.removeFirst();
    }
  }
}
