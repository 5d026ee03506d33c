package crawl.governor.core.domain.metric;

/**
 * Instantaneous view over the short window (default: last minute).
 *
 * <p>Contains no timestamp of its own so that two reads without an intervening record compare
 * equal.
 *
 * @param inFlight operations currently executing
 * @param windowSamples samples inside the short window
 * @param successRate successes / samples in the short window, 0 when empty
 * @param latency latency aggregate of the short window
 * @param latestResources resource snapshot of the newest sample in the window
 * @param totalRecorded samples recorded since construction (including evicted ones)
 */
public record CurrentMetrics(
    int inFlight,
    int windowSamples,
    double successRate,
    LatencyStats latency,
    ResourceSnapshot latestResources,
    long totalRecorded) {

  public boolean hasData() {
    return windowSamples > 0;
  }
}
