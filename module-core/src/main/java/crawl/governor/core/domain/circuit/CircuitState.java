package crawl.governor.core.domain.circuit;

/**
 * Circuit breaker state of one operation class.
 *
 * <ul>
 *   <li>CLOSED: calls pass, consecutive failures are counted
 *   <li>OPEN: calls are rejected until the cooldown elapses
 *   <li>HALF_OPEN: one trial call at a time decides between CLOSED and OPEN
 * </ul>
 */
public enum CircuitState {
  CLOSED(0),
  OPEN(1),
  HALF_OPEN(2);

  private final int gaugeValue;

  CircuitState(int gaugeValue) {
    this.gaugeValue = gaugeValue;
  }

  /** Numeric value exported to metric gauges. */
  public int gaugeValue() {
    return gaugeValue;
  }
}
