package crawl.governor.infrastructure.config;

import crawl.governor.core.domain.retry.BackoffStrategy;
import crawl.governor.core.domain.retry.RetryPolicy;
import crawl.governor.error.ErrorKind;
import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 기본 재시도 정책 설정
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * governor:
 *   retry:
 *     max-attempts: 3
 *     base-delay: 1s
 *     max-delay: 60s
 *     backoff-multiplier: 2.0
 *     jitter-fraction: 0.1
 *     strategy: EXPONENTIAL
 *     retryable-kinds: NETWORK,TIMEOUT
 * }</pre>
 */
@ConfigurationProperties(prefix = "governor.retry")
public record RetryProperties(
    @DefaultValue("3") int maxAttempts,
    @DefaultValue("1s") Duration baseDelay,
    @DefaultValue("60s") Duration maxDelay,
    @DefaultValue("2.0") double backoffMultiplier,
    @DefaultValue("0.1") double jitterFraction,
    @DefaultValue("EXPONENTIAL") BackoffStrategy strategy,
    @DefaultValue({"NETWORK", "TIMEOUT"}) Set<ErrorKind> retryableKinds) {

  public RetryProperties {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException(
          "governor.retry.max-attempts must be at least 1, got: " + maxAttempts);
    }
  }

  public RetryPolicy toPolicy() {
    return new RetryPolicy(
        maxAttempts,
        baseDelay,
        maxDelay,
        backoffMultiplier,
        jitterFraction,
        strategy,
        retryableKinds);
  }
}
