package crawl.governor.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import crawl.governor.core.domain.alert.AlertSeverity;
import crawl.governor.core.domain.health.MemoryReleaseLevel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AdvisoryActionExecutor 테스트")
class AdvisoryActionExecutorTest {

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final AdvisoryActionExecutor executor = new AdvisoryActionExecutor(meterRegistry);

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  @DisplayName("정상 완료면 true")
  void returnsTrueOnSuccess() {
    AtomicBoolean ran = new AtomicBoolean();

    boolean completed = executor.executeOrLog(() -> ran.set(true), AdvisoryTask.healthCycle());

    assertThat(completed).isTrue();
    assertThat(ran).isTrue();
  }

  @Test
  @DisplayName("Exception은 삼키고 false를 반환하며 component/action 태그로 집계한다")
  void swallowsExceptions() {
    boolean completed =
        executor.executeOrLog(
            () -> {
              throw new IllegalStateException("boom");
            },
            AdvisoryTask.memoryRelease("CacheEvictionHook", MemoryReleaseLevel.BASIC, 612.4));

    assertThat(completed).isFalse();
    assertThat(
            meterRegistry
                .get("governor_advisory_failures_total")
                .tag("component", "HealthMonitor")
                .tag("action", "memoryRelease")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("중단에 의한 실패는 인터럽트 플래그를 복원한다")
  void restoresInterruptFlag() {
    executor.executeOrLog(
        () -> {
          throw new InterruptedIOException("pipe read interrupted");
        },
        AdvisoryTask.alertDelivery("WebhookListener", AlertSeverity.CRITICAL));

    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  @DisplayName("훅의 소켓 타임아웃은 실패로만 집계하고 인터럽트 플래그를 세우지 않는다")
  void socketTimeoutIsNotAnInterrupt() {
    boolean completed =
        executor.executeOrLog(
            () -> {
              throw new SocketTimeoutException("webhook read timed out");
            },
            AdvisoryTask.alertDelivery("WebhookListener", AlertSeverity.WARNING));

    assertThat(completed).isFalse();
    assertThat(Thread.currentThread().isInterrupted()).isFalse();
  }

  @Test
  @DisplayName("Error는 전파한다")
  void propagatesErrors() {
    assertThatThrownBy(
            () ->
                executor.executeOrLog(
                    () -> {
                      throw new OutOfMemoryError("simulated");
                    },
                    AdvisoryTask.healthCycle()))
        .isInstanceOf(OutOfMemoryError.class);
  }

  @Test
  @DisplayName("작업 이름은 component:action:detail 형식")
  void describesTask() {
    assertThat(AdvisoryTask.healthCycle().describe()).isEqualTo("HealthMonitor:evaluate");
    assertThat(
            AdvisoryTask.memoryRelease("GcMemoryReleaseHook", MemoryReleaseLevel.AGGRESSIVE, 700)
                .describe())
        .isEqualTo("HealthMonitor:memoryRelease:GcMemoryReleaseHook/AGGRESSIVE/700.0MB");
  }
}
