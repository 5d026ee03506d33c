package crawl.governor.core.calculator;

import crawl.governor.core.domain.retry.RetryPolicy;
import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;

/**
 * 재시도 대기 시간 계산기 (Pure Business Logic)
 *
 * <p>{@code attempt}는 방금 실패한 시도 번호(1부터)이며, 반환값은 다음 시도 전 대기 시간입니다. 증가 곡선과 지터는 Resilience4j
 * {@link IntervalFunction}으로 계산합니다 (밀리초 단위).
 *
 * <ul>
 *   <li>지터 적용 전 값은 attempt에 대해 단조 비감소이며 {@code [baseDelay, maxDelay]} 안에 있습니다.
 *   <li>지터 적용 후 값은 {@code [baseDelay × (1-j), maxDelay × (1+j)]} 안에 있습니다.
 * </ul>
 */
public class BackoffCalculator {

  /** IntervalFunction.ofRandomized가 허용하는 최대 지터 (1.0 미만) */
  private static final double MAX_RANDOMIZATION_FACTOR = Math.nextDown(1.0);

  /** 지터를 적용한 대기 시간 */
  public Duration delayFor(RetryPolicy policy, int attempt) {
    long raw = rawDelayMillis(policy, attempt);
    double jitter = Math.min(policy.jitterFraction(), MAX_RANDOMIZATION_FACTOR);
    if (raw == 0 || jitter == 0.0) {
      return Duration.ofMillis(raw);
    }
    return Duration.ofMillis(IntervalFunction.ofRandomized(raw, jitter).apply(1));
  }

  /** 지터 적용 전 대기 시간 (maxDelay로 상한) */
  public Duration baseDelayFor(RetryPolicy policy, int attempt) {
    return Duration.ofMillis(rawDelayMillis(policy, attempt));
  }

  private long rawDelayMillis(RetryPolicy policy, int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be at least 1, got: " + attempt);
    }
    long base = policy.baseDelay().toMillis();
    if (base == 0) {
      return 0;
    }
    long max = policy.maxDelay().toMillis();
    return Math.min(growth(policy, base, max).apply(attempt), max);
  }

  private static IntervalFunction growth(RetryPolicy policy, long base, long max) {
    return switch (policy.strategy()) {
      case FIXED -> IntervalFunction.of(base);
      case LINEAR -> IntervalFunction.of(base, previous -> saturatingAdd(previous, base, max));
      case EXPONENTIAL ->
          IntervalFunction.ofExponentialBackoff(base, policy.backoffMultiplier(), max);
      case FIBONACCI -> attempt -> base * fibonacci(attempt, max / base);
    };
  }

  /** 상한에 도달하면 더 더하지 않음 (attempt가 매우 커도 오버플로 없음) */
  private static long saturatingAdd(long previous, long step, long max) {
    return previous >= max ? previous : previous + step;
  }

  /** fib(n) (fib(1)=fib(2)=1), 상한을 넘으면 더 계산하지 않음 */
  private static long fibonacci(int n, long cap) {
    long prev = 0;
    long curr = 1;
    for (int i = 1; i < n && curr <= cap; i++) {
      long next = prev + curr;
      prev = curr;
      curr = next;
    }
    return curr;
  }
}
