package crawl.governor.core.domain.health;

/**
 * How hard the memory release hooks should work in one CRITICAL cycle.
 *
 * <p>BASIC when usage is over the memory limit, AGGRESSIVE once usage reaches {@code
 * aggressiveRatio × limit}.
 */
public enum MemoryReleaseLevel {
  BASIC,
  AGGRESSIVE;

  public static MemoryReleaseLevel of(double memoryMb, long maxMemoryMb, double aggressiveRatio) {
    return memoryMb >= maxMemoryMb * aggressiveRatio ? AGGRESSIVE : BASIC;
  }
}
