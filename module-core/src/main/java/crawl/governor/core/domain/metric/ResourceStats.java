package crawl.governor.core.domain.metric;

/** Min / mean / max of each resource over a window. */
public record ResourceStats(Range memoryMb, Range cpuPercent, Range openFiles) {

  public static final ResourceStats EMPTY =
      new ResourceStats(Range.EMPTY, Range.EMPTY, Range.EMPTY);

  public record Range(double min, double mean, double max) {
    public static final Range EMPTY = new Range(0.0, 0.0, 0.0);
  }
}
