package crawl.governor.infrastructure.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import crawl.governor.core.domain.alert.Alert;
import crawl.governor.core.domain.alert.AlertSeverity;
import crawl.governor.core.port.out.AlertListener;
import crawl.governor.infrastructure.executor.AdvisoryActionExecutor;
import crawl.governor.infrastructure.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AlertDispatcher 테스트")
class AlertDispatcherTest {

  private final MutableClock clock = MutableClock.startingAt("2024-05-01T00:00:00Z");
  private SimpleMeterRegistry meterRegistry;
  private AlertListener first;
  private AlertListener second;
  private AlertDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    first = mock(AlertListener.class);
    second = mock(AlertListener.class);
    dispatcher =
        new AlertDispatcher(
            List.of(first, second),
            new AlertThrottler(Duration.ofMinutes(5), clock),
            new AdvisoryActionExecutor(meterRegistry),
            meterRegistry);
  }

  private Alert critical() {
    return new Alert(
        AlertSeverity.CRITICAL, "memory 600MB over 512MB", "memory_mb", 600, 512, clock.instant());
  }

  @Test
  @DisplayName("한 리스너가 실패해도 다음 리스너는 알림을 받는다")
  void listenerFailureIsIsolated() {
    doThrow(new IllegalStateException("slack down")).when(first).onAlert(any());
    Alert alert = critical();

    boolean delivered = dispatcher.dispatch(alert);

    assertThat(delivered).isTrue();
    verify(second).onAlert(alert);
    assertThat(
            meterRegistry
                .get("governor_advisory_failures_total")
                .tag("component", "AlertDispatcher")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("스로틀된 알림은 리스너에 전달되지 않는다")
  void throttledAlertIsDropped() {
    dispatcher.dispatch(critical());
    AlertListener late = mock(AlertListener.class);
    dispatcher.subscribe(late);

    boolean delivered = dispatcher.dispatch(critical());

    assertThat(delivered).isFalse();
    verify(late, never()).onAlert(any());
    assertThat(
            meterRegistry.get("governor_alerts_total").tag("severity", "CRITICAL").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("구독 해제된 리스너는 더 이상 알림을 받지 않는다")
  void unsubscribe() {
    dispatcher.unsubscribe(first);

    dispatcher.dispatch(critical());

    verify(first, never()).onAlert(any());
    verify(second).onAlert(any());
  }
}
