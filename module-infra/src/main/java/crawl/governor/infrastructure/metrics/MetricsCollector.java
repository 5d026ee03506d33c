package crawl.governor.infrastructure.metrics;

import crawl.governor.core.calculator.PercentileCalculator;
import crawl.governor.core.domain.metric.CurrentMetrics;
import crawl.governor.core.domain.metric.LatencyStats;
import crawl.governor.core.domain.metric.MetricSample;
import crawl.governor.core.domain.metric.Outcome;
import crawl.governor.core.domain.metric.PerformanceReport;
import crawl.governor.core.domain.metric.ResourceSnapshot;
import crawl.governor.core.domain.metric.ResourceStats;
import crawl.governor.core.port.out.ResourceProbe;
import crawl.governor.error.ErrorKind;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.ToDoubleFunction;

/**
 * 시도 결과 수집기
 *
 * <h3>윈도우</h3>
 *
 * <ul>
 *   <li>기록은 {@link ConcurrentLinkedDeque}에 O(1) append, 리더/라이터 간 전체 직렬화 없음
 *   <li>샘플은 불변 record이므로 리포트가 부분 기록된 샘플을 관찰하지 않음
 *   <li>보관 기간 초과 샘플은 기록/조회 시점에 지연 제거 (백그라운드 스윕 없음)
 *   <li>최대 샘플 수 초과 시 가장 오래된 샘플부터 제거 → 실행 시간과 무관하게 메모리 상한 유지
 * </ul>
 *
 * <p>기록 순서가 시간 순서와 다를 수 있으므로 리포트는 항상 샘플 timestamp로 구간을 필터링합니다.
 */
public class MetricsCollector {

  private final MetricsSettings settings;
  private final ResourceProbe resourceProbe;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  private final ConcurrentLinkedDeque<MetricSample> window = new ConcurrentLinkedDeque<>();
  private final AtomicInteger windowSize = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final LongAdder totalRecorded = new LongAdder();
  private final LongAdder evicted = new LongAdder();

  public MetricsCollector(
      MetricsSettings settings,
      ResourceProbe resourceProbe,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.settings = settings;
    this.resourceProbe = resourceProbe;
    this.clock = clock;
    this.meterRegistry = meterRegistry;

    Gauge.builder("governor_operations_in_flight", inFlight, AtomicInteger::get)
        .description("Guarded operations currently executing")
        .register(meterRegistry);
    Gauge.builder("governor_metric_window_size", windowSize, AtomicInteger::get)
        .description("Samples retained in the metrics window")
        .register(meterRegistry);
  }

  /** 샘플 기록 (O(1) amortized) */
  public void record(MetricSample sample) {
    window.offerLast(sample);
    windowSize.incrementAndGet();
    totalRecorded.increment();
    publish(sample);
    evict(clock.instant());
  }

  /**
   * 현재 시각과 리소스 스냅샷으로 샘플을 만들어 기록
   *
   * @param kind 실패 종류, 성공이면 {@code null}
   */
  public void recordAttempt(String operationClass, Duration latency, ErrorKind kind) {
    Instant now = clock.instant();
    ResourceSnapshot resources = resourceProbe.snapshot();
    MetricSample sample =
        kind == null
            ? MetricSample.success(now, latency, resources, operationClass)
            : MetricSample.failure(now, latency, kind, resources, operationClass);
    record(sample);
  }

  public void operationStarted() {
    inFlight.incrementAndGet();
  }

  public void operationFinished() {
    inFlight.decrementAndGet();
  }

  public int getInFlight() {
    return inFlight.get();
  }

  /**
   * 최근 구간(기본 1분) 집계
   *
   * <p>중간에 기록이 없으면 연속 호출 결과가 동일합니다.
   */
  public CurrentMetrics getCurrentMetrics() {
    Instant now = clock.instant();
    evict(now);
    List<MetricSample> samples = samplesSince(now.minus(settings.shortWindow()));

    int successes = 0;
    MetricSample latest = null;
    long[] latencies = new long[samples.size()];
    for (int i = 0; i < samples.size(); i++) {
      MetricSample s = samples.get(i);
      latencies[i] = s.latencyMillis();
      if (s.outcome() == Outcome.SUCCESS) {
        successes++;
      }
      if (latest == null || s.timestamp().isAfter(latest.timestamp())) {
        latest = s;
      }
    }

    return new CurrentMetrics(
        inFlight.get(),
        samples.size(),
        samples.isEmpty() ? 0.0 : (double) successes / samples.size(),
        PercentileCalculator.summarize(latencies),
        latest == null ? ResourceSnapshot.UNKNOWN : latest.resources(),
        totalRecorded.sum());
  }

  /**
   * 지정 구간 성능 리포트
   *
   * @param windowMinutes 1 이상
   * @return 구간에 샘플이 없으면 {@link PerformanceReport#empty(int)}
   */
  public PerformanceReport getPerformanceReport(int windowMinutes) {
    if (windowMinutes < 1) {
      throw new IllegalArgumentException("windowMinutes must be at least 1, got: " + windowMinutes);
    }
    Instant now = clock.instant();
    evict(now);
    List<MetricSample> samples = samplesSince(now.minus(Duration.ofMinutes(windowMinutes)));
    if (samples.isEmpty()) {
      return PerformanceReport.empty(windowMinutes);
    }

    int success = 0;
    int failure = 0;
    int blocked = 0;
    Map<ErrorKind, Long> breakdown = new EnumMap<>(ErrorKind.class);
    long[] latencies = new long[samples.size()];
    for (int i = 0; i < samples.size(); i++) {
      MetricSample s = samples.get(i);
      latencies[i] = s.latencyMillis();
      switch (s.outcome()) {
        case SUCCESS -> success++;
        case FAILURE -> failure++;
        case BLOCKED -> blocked++;
      }
      if (s.errorKind() != null) {
        breakdown.merge(s.errorKind(), 1L, Long::sum);
      }
    }

    int count = samples.size();
    LatencyStats latency = PercentileCalculator.summarize(latencies);
    return PerformanceReport.builder()
        .windowMinutes(windowMinutes)
        .hasData(true)
        .sampleCount(count)
        .successCount(success)
        .failureCount(failure)
        .blockedCount(blocked)
        .successRate((double) success / count)
        .blockedRate((double) blocked / count)
        .throughputPerMinute((double) count / windowMinutes)
        .latency(latency)
        .errorBreakdown(breakdown)
        .resources(resourceStats(samples))
        .build();
  }

  /** 생성 이후 기록된 전체 샘플 수 (제거된 샘플 포함) */
  public long getTotalRecorded() {
    return totalRecorded.sum();
  }

  /** 현재 윈도우에 남은 샘플 수 */
  public int getWindowSize() {
    return windowSize.get();
  }

  /** 보관 기간 또는 최대 개수 초과로 제거된 샘플 수 */
  public long getEvictedCount() {
    return evicted.sum();
  }

  private List<MetricSample> samplesSince(Instant cutoff) {
    List<MetricSample> result = new ArrayList<>();
    for (MetricSample s : window) {
      if (!s.timestamp().isBefore(cutoff)) {
        result.add(s);
      }
    }
    return result;
  }

  private void evict(Instant now) {
    // 초과분 한 칸을 CAS로 선점한 스레드만 poll
    int size;
    while ((size = windowSize.get()) > settings.maxSamples()) {
      if (!windowSize.compareAndSet(size, size - 1)) {
        continue;
      }
      if (window.pollFirst() == null) {
        windowSize.incrementAndGet();
        break;
      }
      evicted.increment();
    }

    Instant horizon = now.minus(settings.retention());
    MetricSample head;
    while ((head = window.peekFirst()) != null && head.timestamp().isBefore(horizon)) {
      if (window.removeFirstOccurrence(head)) {
        windowSize.decrementAndGet();
        evicted.increment();
      }
    }
  }

  private void publish(MetricSample sample) {
    Timer.builder("governor_operation_latency")
        .description("Latency of guarded operation attempts")
        .tag("outcome", sample.outcome().name())
        .register(meterRegistry)
        .record(sample.latency());
  }

  private static ResourceStats resourceStats(List<MetricSample> samples) {
    List<ResourceSnapshot> withFiles =
        samples.stream().map(MetricSample::resources).filter(ResourceSnapshot::hasOpenFiles).toList();
    List<ResourceSnapshot> all = samples.stream().map(MetricSample::resources).toList();
    return new ResourceStats(
        range(all, ResourceSnapshot::memoryMb),
        range(all, ResourceSnapshot::cpuPercent),
        range(withFiles, r -> (double) r.openFiles()));
  }

  private static ResourceStats.Range range(
      List<ResourceSnapshot> snapshots, ToDoubleFunction<ResourceSnapshot> metric) {
    if (snapshots.isEmpty()) {
      return ResourceStats.Range.EMPTY;
    }
    double min = Double.MAX_VALUE;
    double max = -Double.MAX_VALUE;
    double sum = 0;
    for (ResourceSnapshot snapshot : snapshots) {
      double v = metric.applyAsDouble(snapshot);
      min = Math.min(min, v);
      max = Math.max(max, v);
      sum += v;
    }
    return new ResourceStats.Range(min, sum / snapshots.size(), max);
  }
}
