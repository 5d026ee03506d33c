package crawl.governor.infrastructure.alert;

import crawl.governor.core.domain.alert.Alert;
import crawl.governor.core.port.out.AlertListener;
import lombok.extern.slf4j.Slf4j;

/** 알림을 구조화 로그로 남기는 기본 리스너. 로그 적재 위치는 호출자의 Logback 설정이 결정합니다. */
@Slf4j
public class LoggingAlertListener implements AlertListener {

  @Override
  public void onAlert(Alert alert) {
    switch (alert.severity()) {
      case WARNING ->
          log.warn(
              "[Alert] severity={}, metric={}, value={}, threshold={}, reason={}",
              alert.severity(),
              alert.triggeringMetric(),
              alert.value(),
              alert.threshold(),
              alert.reason());
      case CRITICAL, FATAL ->
          log.error(
              "[Alert] severity={}, metric={}, value={}, threshold={}, reason={}",
              alert.severity(),
              alert.triggeringMetric(),
              alert.value(),
              alert.threshold(),
              alert.reason());
    }
  }
}
