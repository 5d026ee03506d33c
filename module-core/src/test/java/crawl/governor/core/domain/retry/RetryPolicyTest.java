package crawl.governor.core.domain.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import crawl.governor.error.ErrorKind;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  @DisplayName("기본 팩토리는 EXPONENTIAL, NETWORK/TIMEOUT 재시도")
  void defaults() {
    RetryPolicy policy = RetryPolicy.of(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.1);

    assertThat(policy.strategy()).isEqualTo(BackoffStrategy.EXPONENTIAL);
    assertThat(policy.isRetryable(ErrorKind.NETWORK)).isTrue();
    assertThat(policy.isRetryable(ErrorKind.TIMEOUT)).isTrue();
    assertThat(policy.isRetryable(ErrorKind.BLOCKED)).isFalse();
    assertThat(policy.isRetryable(ErrorKind.UNKNOWN)).isFalse();
  }

  @Test
  @DisplayName("거버너 거절 종류는 재시도 대상으로 지정할 수 없다")
  void rejectsGovernorKinds() {
    RetryPolicy policy = RetryPolicies.quickOperations();

    assertThatThrownBy(() -> policy.withRetryableKinds(Set.of(ErrorKind.CIRCUIT_OPEN)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("CIRCUIT_OPEN");
  }

  @Test
  @DisplayName("재시도 집합은 방어적으로 복사된다")
  void retryableKindsAreCopied() {
    EnumSet<ErrorKind> kinds = EnumSet.of(ErrorKind.NETWORK);
    RetryPolicy policy = RetryPolicy.noRetry().withRetryableKinds(kinds);

    kinds.add(ErrorKind.UNKNOWN);

    assertThat(policy.retryableKinds()).containsExactly(ErrorKind.NETWORK);
    assertThatThrownBy(() -> policy.retryableKinds().add(ErrorKind.TIMEOUT))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("잘못된 값은 생성 시점에 거부된다")
  void validation() {
    assertThatThrownBy(() -> RetryPolicy.of(0, Duration.ZERO, Duration.ZERO, 1.0, 0.0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> RetryPolicy.of(3, Duration.ofSeconds(5), Duration.ofSeconds(1), 2.0, 0.0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> RetryPolicy.of(3, Duration.ofSeconds(1), Duration.ofSeconds(5), 0.5, 0.0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> RetryPolicy.of(3, Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, 1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("프리셋 정책")
  void presets() {
    assertThat(RetryPolicies.networkOperations().maxAttempts()).isEqualTo(5);
    assertThat(RetryPolicies.gentle().strategy()).isEqualTo(BackoffStrategy.FIXED);
    assertThat(RetryPolicies.gentle().retryableKinds()).containsExactly(ErrorKind.NETWORK);
    assertThat(RetryPolicies.blockingAware().isRetryable(ErrorKind.BLOCKED)).isTrue();
    assertThat(RetryPolicy.noRetry().maxAttempts()).isEqualTo(1);
  }
}
