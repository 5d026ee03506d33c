package crawl.governor.core.domain.health;

/**
 * Resource bounds supplied by the caller, immutable for one run.
 *
 * @param maxMemoryMb memory ceiling in megabytes
 * @param maxCpuPercent CPU ceiling in percent
 * @param maxConcurrentRequests in-flight operation ceiling
 * @param maxOpenFiles open file descriptor ceiling
 */
public record ResourceLimits(
    long maxMemoryMb, double maxCpuPercent, int maxConcurrentRequests, int maxOpenFiles) {

  public ResourceLimits {
    if (maxMemoryMb <= 0) {
      throw new IllegalArgumentException("maxMemoryMb must be positive, got: " + maxMemoryMb);
    }
    if (maxCpuPercent <= 0 || maxCpuPercent > 100) {
      throw new IllegalArgumentException(
          "maxCpuPercent must be in (0, 100], got: " + maxCpuPercent);
    }
    if (maxConcurrentRequests <= 0) {
      throw new IllegalArgumentException(
          "maxConcurrentRequests must be positive, got: " + maxConcurrentRequests);
    }
    if (maxOpenFiles <= 0) {
      throw new IllegalArgumentException("maxOpenFiles must be positive, got: " + maxOpenFiles);
    }
  }

  public static ResourceLimits defaults() {
    return new ResourceLimits(512, 80.0, 10, 100);
  }
}
