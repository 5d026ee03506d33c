package crawl.governor.core.port.out;

import crawl.governor.core.domain.health.MemoryReleaseLevel;
import crawl.governor.core.domain.metric.ResourceSnapshot;

/**
 * Caller-provided corrective action invoked when memory is CRITICAL.
 *
 * <p>Any number of hooks may be registered; all of them run in every CRITICAL memory cycle, each
 * isolated from the others. Failures are logged by the caller of the hook and never propagated.
 */
@FunctionalInterface
public interface MemoryReleaseHook {
  void release(ResourceSnapshot current, MemoryReleaseLevel level) throws Exception;
}
