package crawl.governor.core.calculator;

import crawl.governor.core.domain.metric.LatencyStats;
import java.util.Arrays;

/** 지연 시간 백분위 계산 (nearest-rank, index = floor(n × q)) */
public final class PercentileCalculator {

  private PercentileCalculator() {}

  /**
   * @param sortedAsc 오름차순 정렬된 값
   * @param quantile 0.0 ~ 1.0
   * @return 해당 백분위 값, 빈 배열이면 0
   */
  public static long percentile(long[] sortedAsc, double quantile) {
    if (sortedAsc.length == 0) {
      return 0L;
    }
    int index = (int) Math.floor(sortedAsc.length * quantile);
    return sortedAsc[Math.min(Math.max(index, 0), sortedAsc.length - 1)];
  }

  /** 정렬되지 않은 지연 시간(ms) 배열로부터 집계 생성. 입력 배열은 정렬됩니다. */
  public static LatencyStats summarize(long[] latenciesMs) {
    if (latenciesMs.length == 0) {
      return LatencyStats.EMPTY;
    }
    Arrays.sort(latenciesMs);
    long sum = 0;
    for (long v : latenciesMs) {
      sum += v;
    }
    return new LatencyStats(
        (double) sum / latenciesMs.length,
        latenciesMs[0],
        latenciesMs[latenciesMs.length - 1],
        percentile(latenciesMs, 0.50),
        percentile(latenciesMs, 0.95),
        percentile(latenciesMs, 0.99));
  }
}
