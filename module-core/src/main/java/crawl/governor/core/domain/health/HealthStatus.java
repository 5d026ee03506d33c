package crawl.governor.core.domain.health;

/** Result of one evaluation cycle, ordered from best to worst. */
public enum HealthStatus {
  HEALTHY,
  DEGRADED,
  CRITICAL;

  public HealthStatus worst(HealthStatus other) {
    return other.ordinal() > ordinal() ? other : this;
  }
}
