package crawl.governor.infrastructure.health;

import crawl.governor.core.domain.health.MemoryReleaseLevel;
import crawl.governor.core.domain.metric.ResourceSnapshot;
import crawl.governor.core.port.out.MemoryReleaseHook;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;

/**
 * 기본 메모리 해제 훅: JVM에 GC를 요청합니다 (보장되지 않는 힌트).
 *
 * <ul>
 *   <li>BASIC: GC 1회 요청
 *   <li>AGGRESSIVE: 첫 GC에서 참조 처리로 풀린 객체까지 회수하도록 한 번 더 요청하고 힙 변화를 WARN으로 기록
 * </ul>
 *
 * <p>애플리케이션 훅(캐시 비우기 등)이 먼저 실행된 뒤 GC가 돌도록 가장 낮은 우선순위로 등록됩니다.
 */
@Slf4j
public class GcMemoryReleaseHook implements MemoryReleaseHook, Ordered {

  private static final long BYTES_PER_MB = 1024L * 1024L;

  private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

  @Override
  public void release(ResourceSnapshot current, MemoryReleaseLevel level) {
    long heapBeforeMb = heapUsedMb();
    System.gc();
    if (level == MemoryReleaseLevel.BASIC) {
      log.info(
          "[HealthMonitor] GC 요청. memoryMb={}, heapBeforeMb={}", current.memoryMb(), heapBeforeMb);
      return;
    }
    System.gc();
    log.warn(
        "[HealthMonitor] 강한 GC 요청. memoryMb={}, heapMb={} -> {}",
        current.memoryMb(),
        heapBeforeMb,
        heapUsedMb());
  }

  @Override
  public int getOrder() {
    return Ordered.LOWEST_PRECEDENCE;
  }

  private long heapUsedMb() {
    return memory.getHeapMemoryUsage().getUsed() / BYTES_PER_MB;
  }
}
