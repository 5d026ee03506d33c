package crawl.governor.infrastructure.alert;

import static org.assertj.core.api.Assertions.assertThat;

import crawl.governor.core.domain.alert.Alert;
import crawl.governor.core.domain.alert.AlertSeverity;
import crawl.governor.infrastructure.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AlertThrottler 테스트")
class AlertThrottlerTest {

  private final MutableClock clock = MutableClock.startingAt("2024-05-01T00:00:00Z");
  private final AlertThrottler throttler = new AlertThrottler(Duration.ofMinutes(5), clock);

  private Alert alert(AlertSeverity severity, String metric) {
    return new Alert(severity, metric + " over limit", metric, 600, 512, clock.instant());
  }

  @Test
  @DisplayName("같은 심각도와 지표의 알림은 쿨다운 동안 1회만 통과한다")
  void throttlesSameKeyWithinCooldown() {
    assertThat(throttler.tryPass(alert(AlertSeverity.CRITICAL, "memory_mb"))).isTrue();

    clock.advance(Duration.ofMinutes(4));
    assertThat(throttler.tryPass(alert(AlertSeverity.CRITICAL, "memory_mb"))).isFalse();

    clock.advance(Duration.ofMinutes(1));
    assertThat(throttler.tryPass(alert(AlertSeverity.CRITICAL, "memory_mb"))).isTrue();
  }

  @Test
  @DisplayName("지표나 심각도가 다르면 독립적으로 통과한다")
  void keysAreIndependent() {
    assertThat(throttler.tryPass(alert(AlertSeverity.CRITICAL, "memory_mb"))).isTrue();
    assertThat(throttler.tryPass(alert(AlertSeverity.WARNING, "memory_mb"))).isTrue();
    assertThat(throttler.tryPass(alert(AlertSeverity.CRITICAL, "cpu_percent"))).isTrue();
  }

  @Test
  @DisplayName("FATAL은 스로틀링하지 않는다")
  void fatalAlwaysPasses() {
    assertThat(throttler.tryPass(alert(AlertSeverity.FATAL, "health_status"))).isTrue();
    assertThat(throttler.tryPass(alert(AlertSeverity.FATAL, "health_status"))).isTrue();
  }

  @Test
  @DisplayName("reset 후에는 다시 통과한다")
  void resetClearsState() {
    throttler.tryPass(alert(AlertSeverity.WARNING, "open_files"));

    throttler.reset();

    assertThat(throttler.tryPass(alert(AlertSeverity.WARNING, "open_files"))).isTrue();
  }
}
