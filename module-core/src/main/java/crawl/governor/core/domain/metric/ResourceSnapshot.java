package crawl.governor.core.domain.metric;

/**
 * Process resource usage at one instant.
 *
 * @param memoryMb used memory in megabytes
 * @param cpuPercent CPU usage in percent (0-100)
 * @param openFiles open file descriptors, or -1 when the platform does not expose them
 */
public record ResourceSnapshot(double memoryMb, double cpuPercent, long openFiles) {

  public static final ResourceSnapshot UNKNOWN = new ResourceSnapshot(0.0, 0.0, -1);

  public ResourceSnapshot {
    if (memoryMb < 0 || Double.isNaN(memoryMb)) {
      memoryMb = 0.0;
    }
    if (cpuPercent < 0 || Double.isNaN(cpuPercent)) {
      cpuPercent = 0.0;
    }
  }

  public boolean hasOpenFiles() {
    return openFiles >= 0;
  }
}
