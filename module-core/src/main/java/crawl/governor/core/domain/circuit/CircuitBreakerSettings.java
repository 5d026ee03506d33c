package crawl.governor.core.domain.circuit;

import crawl.governor.error.ErrorKind;
import java.time.Duration;

/**
 * Circuit breaker thresholds, one instance per operation class.
 *
 * @param failureThreshold consecutive failures that open a CLOSED circuit
 * @param cooldown time an OPEN circuit waits before allowing a trial
 * @param halfOpenSuccessThreshold consecutive trial successes needed to close again
 * @param blockedCooldown optional longer cooldown used when a BLOCKED failure opens the circuit;
 *     {@code null} means {@code cooldown} is used for every kind
 */
public record CircuitBreakerSettings(
    int failureThreshold, Duration cooldown, int halfOpenSuccessThreshold, Duration blockedCooldown) {

  public CircuitBreakerSettings {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException(
          "failureThreshold must be at least 1, got: " + failureThreshold);
    }
    if (cooldown == null || cooldown.isNegative()) {
      throw new IllegalArgumentException("cooldown must be non-negative, got: " + cooldown);
    }
    if (halfOpenSuccessThreshold < 1) {
      throw new IllegalArgumentException(
          "halfOpenSuccessThreshold must be at least 1, got: " + halfOpenSuccessThreshold);
    }
    if (blockedCooldown != null && blockedCooldown.isNegative()) {
      throw new IllegalArgumentException("blockedCooldown must be non-negative");
    }
  }

  public static CircuitBreakerSettings of(int failureThreshold, Duration cooldown) {
    return new CircuitBreakerSettings(failureThreshold, cooldown, 1, null);
  }

  public static CircuitBreakerSettings defaults() {
    return of(5, Duration.ofSeconds(60));
  }

  /** Cooldown applied when a failure of the given kind opens the circuit. */
  public Duration cooldownFor(ErrorKind trigger) {
    if (trigger == ErrorKind.BLOCKED && blockedCooldown != null) {
      return blockedCooldown;
    }
    return cooldown;
  }
}
