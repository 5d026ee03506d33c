package crawl.governor.core.domain.metric;

/** Latency aggregate in milliseconds. */
public record LatencyStats(double meanMs, long minMs, long maxMs, long p50Ms, long p95Ms, long p99Ms) {

  public static final LatencyStats EMPTY = new LatencyStats(0.0, 0, 0, 0, 0, 0);
}
