package crawl.governor.core.calculator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import crawl.governor.core.domain.retry.BackoffStrategy;
import crawl.governor.core.domain.retry.RetryPolicy;
import java.time.Duration;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BackoffCalculatorTest {

  private static final RetryPolicy EXPONENTIAL =
      RetryPolicy.of(10, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0, 0.0);

  private final BackoffCalculator calculator = new BackoffCalculator();

  @Nested
  @DisplayName("지터 없는 지수 백오프")
  class Exponential {

    @Test
    @DisplayName("1s, 2s, 4s, 8s 후 maxDelay 10s에서 상한")
    void doublesUntilCapped() {
      assertThat(calculator.delayFor(EXPONENTIAL, 1)).isEqualTo(Duration.ofSeconds(1));
      assertThat(calculator.delayFor(EXPONENTIAL, 2)).isEqualTo(Duration.ofSeconds(2));
      assertThat(calculator.delayFor(EXPONENTIAL, 3)).isEqualTo(Duration.ofSeconds(4));
      assertThat(calculator.delayFor(EXPONENTIAL, 4)).isEqualTo(Duration.ofSeconds(8));
      assertThat(calculator.delayFor(EXPONENTIAL, 5)).isEqualTo(Duration.ofSeconds(10));
      assertThat(calculator.delayFor(EXPONENTIAL, 9)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("매우 큰 attempt에서도 오버플로 없이 maxDelay")
    void hugeAttemptIsCapped() {
      assertThat(calculator.delayFor(EXPONENTIAL, 5_000)).isEqualTo(Duration.ofSeconds(10));
    }
  }

  @Nested
  @DisplayName("지터")
  class Jitter {

    private final RetryPolicy jittered =
        RetryPolicy.of(5, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0, 0.25);

    @Test
    @DisplayName("첫 대기 시간은 1s × (1 ± 0.25) 범위")
    void firstDelayWithinJitterRange() {
      IntStream.range(0, 200)
          .forEach(
              i ->
                  assertThat(calculator.delayFor(jittered, 1))
                      .isBetween(Duration.ofMillis(750), Duration.ofMillis(1250)));
    }

    @Test
    @DisplayName("상한 값에도 (1 ± j) 범위의 지터가 적용된다")
    void jitterAppliesAtCap() {
      IntStream.range(0, 200)
          .forEach(
              i ->
                  assertThat(calculator.delayFor(jittered, 8))
                      .isBetween(Duration.ofMillis(7_500), Duration.ofMillis(12_500)));
    }

    @Test
    @DisplayName("jitter 1.0도 허용되며 0 ~ 2배 범위")
    void fullJitterIsAccepted() {
      RetryPolicy full = RetryPolicy.of(3, Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, 1.0);

      assertThat(calculator.delayFor(full, 2))
          .isBetween(Duration.ZERO, Duration.ofMillis(4_000));
    }
  }

  @Test
  @DisplayName("전략별 지터 전 대기 시간")
  void strategies() {
    RetryPolicy base = RetryPolicy.of(10, Duration.ofSeconds(1), Duration.ofSeconds(30), 3.0, 0.0);

    RetryPolicy fixed = base.withStrategy(BackoffStrategy.FIXED);
    RetryPolicy linear = base.withStrategy(BackoffStrategy.LINEAR);
    RetryPolicy fibonacci = base.withStrategy(BackoffStrategy.FIBONACCI);

    assertThat(calculator.baseDelayFor(fixed, 6)).isEqualTo(Duration.ofSeconds(1));
    assertThat(calculator.baseDelayFor(linear, 6)).isEqualTo(Duration.ofSeconds(6));
    assertThat(calculator.baseDelayFor(linear, 1_000)).isEqualTo(Duration.ofSeconds(30));
    assertThat(calculator.baseDelayFor(fibonacci, 1)).isEqualTo(Duration.ofSeconds(1));
    assertThat(calculator.baseDelayFor(fibonacci, 2)).isEqualTo(Duration.ofSeconds(1));
    assertThat(calculator.baseDelayFor(fibonacci, 6)).isEqualTo(Duration.ofSeconds(8));
    assertThat(calculator.baseDelayFor(fibonacci, 40)).isEqualTo(Duration.ofSeconds(30));
    assertThat(calculator.baseDelayFor(base, 3)).isEqualTo(Duration.ofSeconds(9));
  }

  @Test
  @DisplayName("baseDelay 0이면 즉시 재시도")
  void zeroBaseDelayMeansNoWait() {
    RetryPolicy immediate = RetryPolicy.of(3, Duration.ZERO, Duration.ofSeconds(1), 2.0, 0.5);

    assertThat(calculator.delayFor(immediate, 2)).isEqualTo(Duration.ZERO);
  }

  @Test
  @DisplayName("attempt는 1 이상이어야 한다")
  void rejectsZeroAttempt() {
    assertThatThrownBy(() -> calculator.delayFor(EXPONENTIAL, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
