package crawl.governor.core.port.out;

import crawl.governor.core.domain.metric.ResourceSnapshot;

/** Reads the current process resource usage. Implementations must not block. */
@FunctionalInterface
public interface ResourceProbe {
  ResourceSnapshot snapshot();
}
