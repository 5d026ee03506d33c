package crawl.governor.infrastructure.alert;

import crawl.governor.core.domain.alert.Alert;
import crawl.governor.core.port.out.AlertListener;
import crawl.governor.infrastructure.executor.AdvisoryActionExecutor;
import crawl.governor.infrastructure.executor.AdvisoryTask;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * 알림 스트림 분배기
 *
 * <p>스로틀을 통과한 알림을 등록된 모든 리스너에 순서대로 전달합니다. 한 리스너의 실패는 다른 리스너나 헬스 평가 주기에 영향을 주지 않습니다.
 */
@Slf4j
public class AlertDispatcher {

  private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();
  private final AlertThrottler throttler;
  private final AdvisoryActionExecutor advisoryExecutor;
  private final MeterRegistry meterRegistry;

  public AlertDispatcher(
      List<AlertListener> listeners,
      AlertThrottler throttler,
      AdvisoryActionExecutor advisoryExecutor,
      MeterRegistry meterRegistry) {
    this.listeners.addAll(listeners);
    this.throttler = throttler;
    this.advisoryExecutor = advisoryExecutor;
    this.meterRegistry = meterRegistry;
  }

  public void subscribe(AlertListener listener) {
    listeners.add(listener);
  }

  public void unsubscribe(AlertListener listener) {
    listeners.remove(listener);
  }

  /**
   * 알림 전달
   *
   * @return 스로틀을 통과해 전달되었으면 true
   */
  public boolean dispatch(Alert alert) {
    if (!throttler.tryPass(alert)) {
      log.debug(
          "[AlertDispatcher] 스로틀링으로 알림 생략. key={}, reason={}",
          alert.throttleKey(),
          alert.reason());
      return false;
    }

    Counter.builder("governor_alerts_total")
        .description("Alerts emitted by the health monitor")
        .tag("severity", alert.severity().name())
        .register(meterRegistry)
        .increment();

    for (AlertListener listener : listeners) {
      advisoryExecutor.executeOrLog(
          () -> listener.onAlert(alert),
          AdvisoryTask.alertDelivery(listener.getClass().getSimpleName(), alert.severity()));
    }
    return true;
  }
}
