package crawl.governor.core.port.out;

import crawl.governor.core.domain.alert.Alert;

/**
 * Receives the alert stream.
 *
 * <p>Called on the health monitor's thread; a listener that throws does not affect other listeners
 * or the evaluation cycle.
 */
@FunctionalInterface
public interface AlertListener {
  void onAlert(Alert alert);
}
