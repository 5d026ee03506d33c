package crawl.governor.infrastructure.metrics;

import crawl.governor.core.domain.metric.ResourceSnapshot;
import crawl.governor.core.port.out.ResourceProbe;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.FileDescriptorMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

/**
 * Micrometer JVM/프로세스 바인더 기반 리소스 프로브
 *
 * <h3>수집 항목</h3>
 *
 * <ul>
 *   <li>memoryMb: 모든 메모리 풀의 {@code jvm.memory.used} 합 (heap + nonheap)
 *   <li>cpuPercent: {@code process.cpu.usage} × 100, 없으면 {@code system.cpu.usage}
 *   <li>openFiles: {@code process.files.open}, 플랫폼 미지원 시 -1
 * </ul>
 *
 * <p>바인더는 생성 시 한 번 등록합니다. 이미 등록된 경우 Micrometer가 기존 미터를 재사용합니다.
 */
public class MeterRegistryResourceProbe implements ResourceProbe {

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  private final MeterRegistry meterRegistry;

  public MeterRegistryResourceProbe(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    new JvmMemoryMetrics().bindTo(meterRegistry);
    new ProcessorMetrics().bindTo(meterRegistry);
    new FileDescriptorMetrics().bindTo(meterRegistry);
  }

  @Override
  public ResourceSnapshot snapshot() {
    return new ResourceSnapshot(memoryMb(), cpuPercent(), openFiles());
  }

  private double memoryMb() {
    double used = 0;
    for (Gauge gauge : meterRegistry.find("jvm.memory.used").gauges()) {
      double value = gauge.value();
      if (!Double.isNaN(value)) {
        used += value;
      }
    }
    return used / BYTES_PER_MB;
  }

  private double cpuPercent() {
    double usage = gaugeValue("process.cpu.usage");
    if (Double.isNaN(usage) || usage < 0) {
      usage = gaugeValue("system.cpu.usage");
    }
    return Double.isNaN(usage) || usage < 0 ? 0.0 : usage * 100.0;
  }

  private long openFiles() {
    double value = gaugeValue("process.files.open");
    return Double.isNaN(value) || value < 0 ? -1 : (long) value;
  }

  private double gaugeValue(String name) {
    Gauge gauge = meterRegistry.find(name).gauge();
    return gauge == null ? Double.NaN : gauge.value();
  }
}
