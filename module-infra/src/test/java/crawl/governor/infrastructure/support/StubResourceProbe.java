package crawl.governor.infrastructure.support;

import crawl.governor.core.domain.metric.ResourceSnapshot;
import crawl.governor.core.port.out.ResourceProbe;

/** 지정한 스냅샷을 돌려주는 프로브 */
public class StubResourceProbe implements ResourceProbe {

  private volatile ResourceSnapshot current;

  public StubResourceProbe(ResourceSnapshot initial) {
    this.current = initial;
  }

  public static StubResourceProbe of(double memoryMb, double cpuPercent, long openFiles) {
    return new StubResourceProbe(new ResourceSnapshot(memoryMb, cpuPercent, openFiles));
  }

  public void set(double memoryMb, double cpuPercent, long openFiles) {
    current = new ResourceSnapshot(memoryMb, cpuPercent, openFiles);
  }

  @Override
  public ResourceSnapshot snapshot() {
    return current;
  }
}
