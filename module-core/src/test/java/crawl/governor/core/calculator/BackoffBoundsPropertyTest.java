package crawl.governor.core.calculator;

import static org.assertj.core.api.Assertions.assertThat;

import crawl.governor.core.domain.retry.BackoffStrategy;
import crawl.governor.core.domain.retry.RetryPolicy;
import crawl.governor.error.ErrorKind;
import java.time.Duration;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

/**
 * 백오프 불변식 (Property-Based)
 *
 * <ul>
 *   <li>지터 전 대기 시간은 attempt에 대해 단조 비감소
 *   <li>지터 후 대기 시간은 항상 지터 전 값의 {@code (1 ± j)} 범위이며 {@code [base × (1-j), max × (1+j)]} 안
 * </ul>
 */
class BackoffBoundsPropertyTest {

  /** 밀리초 절삭 허용 오차 */
  private static final long TOLERANCE_MILLIS = 1;

  private final BackoffCalculator calculator = new BackoffCalculator();

  @Property
  void rawDelayIsMonotonic(
      @ForAll("policies") RetryPolicy policy, @ForAll @IntRange(min = 1, max = 60) int attempt) {
    Duration current = calculator.baseDelayFor(policy, attempt);
    Duration next = calculator.baseDelayFor(policy, attempt + 1);

    assertThat(next).isGreaterThanOrEqualTo(current);
    assertThat(current).isLessThanOrEqualTo(policy.maxDelay());
  }

  @Property
  void jitteredDelayStaysWithinBounds(
      @ForAll("policies") RetryPolicy policy, @ForAll @IntRange(min = 1, max = 60) int attempt) {
    double j = policy.jitterFraction();

    long delay = calculator.delayFor(policy, attempt).toMillis();
    long lower = (long) (policy.baseDelay().toMillis() * (1.0 - j));
    long upper = (long) (policy.maxDelay().toMillis() * (1.0 + j));

    assertThat(delay).isBetween(lower - TOLERANCE_MILLIS, upper + TOLERANCE_MILLIS);
  }

  @Property
  void jitterIsSymmetricAroundRawDelay(
      @ForAll("policies") RetryPolicy policy, @ForAll @IntRange(min = 1, max = 30) int attempt) {
    double j = policy.jitterFraction();
    long raw = calculator.baseDelayFor(policy, attempt).toMillis();

    long delay = calculator.delayFor(policy, attempt).toMillis();

    long lower = (long) (raw * (1.0 - j)) - TOLERANCE_MILLIS;
    long upper = (long) (raw * (1.0 + j)) + TOLERANCE_MILLIS;

    assertThat(delay).isBetween(lower, upper);
  }

  @Provide
  Arbitrary<RetryPolicy> policies() {
    Arbitrary<Long> baseMillis = Arbitraries.longs().between(0, 5_000);
    Arbitrary<Long> extraMillis = Arbitraries.longs().between(0, 120_000);
    Arbitrary<Double> multiplier = Arbitraries.doubles().between(1.0, 5.0);
    Arbitrary<Double> jitter = Arbitraries.doubles().between(0.0, 1.0);
    Arbitrary<BackoffStrategy> strategy = Arbitraries.of(BackoffStrategy.class);

    return Combinators.combine(baseMillis, extraMillis, multiplier, jitter, strategy)
        .as(
            (base, extra, mult, j, s) ->
                new RetryPolicy(
                    5,
                    Duration.ofMillis(base),
                    Duration.ofMillis(base + extra),
                    mult,
                    j,
                    s,
                    ErrorKind.defaultRetryable()));
  }
}
