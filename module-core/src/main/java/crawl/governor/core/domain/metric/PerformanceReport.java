package crawl.governor.core.domain.metric;

import crawl.governor.error.ErrorKind;
import java.util.Map;
import lombok.Builder;

/**
 * Aggregates over the samples inside a requested window.
 *
 * <p>An empty window is not an error: {@link #empty(int)} returns the "no data" report with every
 * rate and latency at zero.
 *
 * @param windowMinutes requested window length
 * @param hasData whether at least one sample fell inside the window
 * @param sampleCount samples inside the window
 * @param successCount SUCCESS samples
 * @param failureCount FAILURE samples
 * @param blockedCount BLOCKED samples
 * @param successRate successCount / sampleCount
 * @param blockedRate blockedCount / sampleCount
 * @param throughputPerMinute sampleCount / windowMinutes
 * @param latency latency aggregate
 * @param errorBreakdown failure count per error kind
 * @param resources resource min / mean / max
 */
@Builder
public record PerformanceReport(
    int windowMinutes,
    boolean hasData,
    int sampleCount,
    int successCount,
    int failureCount,
    int blockedCount,
    double successRate,
    double blockedRate,
    double throughputPerMinute,
    LatencyStats latency,
    Map<ErrorKind, Long> errorBreakdown,
    ResourceStats resources) {

  public PerformanceReport {
    errorBreakdown = errorBreakdown == null ? Map.of() : Map.copyOf(errorBreakdown);
    if (latency == null) {
      latency = LatencyStats.EMPTY;
    }
    if (resources == null) {
      resources = ResourceStats.EMPTY;
    }
  }

  public static PerformanceReport empty(int windowMinutes) {
    return PerformanceReport.builder().windowMinutes(windowMinutes).hasData(false).build();
  }
}
