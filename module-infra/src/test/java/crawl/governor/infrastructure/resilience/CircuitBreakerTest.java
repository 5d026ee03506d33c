package crawl.governor.infrastructure.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import crawl.governor.core.domain.circuit.CircuitBreakerSettings;
import crawl.governor.core.domain.circuit.CircuitState;
import crawl.governor.error.ErrorKind;
import crawl.governor.error.exception.CircuitOpenException;
import crawl.governor.infrastructure.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CircuitBreaker 테스트")
class CircuitBreakerTest {

  private MutableClock clock;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-05-01T00:00:00Z");
  }

  private CircuitBreaker breaker(CircuitBreakerSettings settings) {
    return new CircuitBreaker("fetch", settings, clock);
  }

  private static void fail(CircuitBreaker breaker, int times, ErrorKind kind) {
    for (int i = 0; i < times; i++) {
      breaker.acquirePermission();
      breaker.onFailure(kind);
    }
  }

  @Nested
  @DisplayName("CLOSED → OPEN")
  class Opening {

    @Test
    @DisplayName("임계치 3에서 세 번 연속 실패하면 OPEN이 되고 쿨다운 동안 거절한다")
    void opensAtThreshold() {
      CircuitBreaker breaker = breaker(CircuitBreakerSettings.of(3, Duration.ofSeconds(10)));

      fail(breaker, 3, ErrorKind.NETWORK);

      assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
      clock.advance(Duration.ofSeconds(4));
      assertThatThrownBy(breaker::acquirePermission)
          .isInstanceOfSatisfying(
              CircuitOpenException.class,
              e -> {
                assertThat(e.getOperationClass()).isEqualTo("fetch");
                assertThat(e.getRemainingCooldown()).isEqualTo(Duration.ofSeconds(6));
              });
    }

    @Test
    @DisplayName("임계치 5에서 네 번 실패는 CLOSED를 유지한다")
    void staysClosedBelowThreshold() {
      CircuitBreaker breaker = breaker(CircuitBreakerSettings.of(5, Duration.ofSeconds(60)));

      fail(breaker, 4, ErrorKind.TIMEOUT);

      assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
      assertThat(breaker.snapshot().consecutiveFailures()).isEqualTo(4);

      fail(breaker, 1, ErrorKind.TIMEOUT);
      assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    @DisplayName("중간의 성공은 연속 실패 카운터를 리셋한다")
    void successResetsFailureStreak() {
      CircuitBreaker breaker = breaker(CircuitBreakerSettings.of(3, Duration.ofSeconds(10)));

      fail(breaker, 2, ErrorKind.NETWORK);
      breaker.acquirePermission();
      breaker.onSuccess();
      fail(breaker, 2, ErrorKind.NETWORK);

      assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("BLOCKED로 열린 서킷은 blockedCooldown을 사용한다")
    void blockedUsesLongerCooldown() {
      CircuitBreaker breaker =
          breaker(
              new CircuitBreakerSettings(
                  2, Duration.ofSeconds(10), 1, Duration.ofMinutes(5)));

      breaker.acquirePermission();
      breaker.onFailure(ErrorKind.NETWORK);
      breaker.acquirePermission();
      breaker.onFailure(ErrorKind.BLOCKED);

      clock.advance(Duration.ofSeconds(30));
      assertThatThrownBy(breaker::acquirePermission).isInstanceOf(CircuitOpenException.class);

      clock.advance(Duration.ofMinutes(5));
      breaker.acquirePermission();
      assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }
  }

  @Nested
  @DisplayName("HALF_OPEN")
  class HalfOpen {

    @Test
    @DisplayName("쿨다운 경과 후 시험 호출은 1건만 허용한다")
    void allowsSingleTrial() {
      CircuitBreaker breaker = breaker(CircuitBreakerSettings.of(3, Duration.ofSeconds(10)));
      fail(breaker, 3, ErrorKind.NETWORK);
      clock.advance(Duration.ofSeconds(10));

      breaker.acquirePermission();

      assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
      assertThatThrownBy(breaker::acquirePermission)
          .isInstanceOfSatisfying(
              CircuitOpenException.class,
              e -> assertThat(e.getRemainingCooldown()).isZero());
    }

    @Test
    @DisplayName("시험 호출 성공이 halfOpenSuccessThreshold에 도달하면 CLOSED로 돌아간다")
    void closesAfterRequiredSuccesses() {
      CircuitBreaker breaker =
          breaker(new CircuitBreakerSettings(3, Duration.ofSeconds(10), 2, null));
      fail(breaker, 3, ErrorKind.NETWORK);
      clock.advance(Duration.ofSeconds(10));

      breaker.acquirePermission();
      breaker.onSuccess();
      assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

      breaker.acquirePermission();
      breaker.onSuccess();
      assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
      assertThat(breaker.snapshot().consecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("시험 호출 실패는 즉시 OPEN으로 돌아가고 쿨다운을 다시 시작한다")
    void failureReopens() {
      CircuitBreaker breaker = breaker(CircuitBreakerSettings.of(3, Duration.ofSeconds(10)));
      fail(breaker, 3, ErrorKind.NETWORK);
      clock.advance(Duration.ofSeconds(10));

      breaker.acquirePermission();
      breaker.onFailure(ErrorKind.TIMEOUT);

      assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
      assertThat(breaker.snapshot().openCount()).isEqualTo(2);
      assertThat(breaker.snapshot().openedAt()).isEqualTo(clock.instant());
      clock.advance(Duration.ofSeconds(9));
      assertThatThrownBy(breaker::acquirePermission).isInstanceOf(CircuitOpenException.class);
    }

    @Test
    @DisplayName("결과 없이 반납된 시험 허가는 다음 호출에 다시 허용된다")
    void releasedTrialCanBeRetaken() {
      CircuitBreaker breaker = breaker(CircuitBreakerSettings.of(1, Duration.ofSeconds(1)));
      fail(breaker, 1, ErrorKind.NETWORK);
      clock.advance(Duration.ofSeconds(1));

      breaker.acquirePermission();
      breaker.releasePermission();
      breaker.acquirePermission();

      assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }
  }

  @Test
  @DisplayName("OPEN 상태에 도착한 늦은 결과는 상태를 바꾸지 않는다")
  void lateResultsWhileOpenAreIgnored() {
    CircuitBreaker breaker = breaker(CircuitBreakerSettings.of(1, Duration.ofSeconds(30)));
    fail(breaker, 1, ErrorKind.NETWORK);

    breaker.onSuccess();
    breaker.onFailure(ErrorKind.NETWORK);

    assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    assertThat(breaker.snapshot().openCount()).isEqualTo(1);
  }

  @Nested
  @DisplayName("동시성")
  class Concurrency {

    private static final int THREADS = 32;

    private ExecutorService pool;

    @BeforeEach
    void startPool() {
      pool = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void stopPool() {
      pool.shutdownNow();
    }

    /** 모든 작업을 출발선에 세운 뒤 동시에 출발시키고 끝날 때까지 대기 */
    private void raceAll(Runnable task) throws Exception {
      CountDownLatch ready = new CountDownLatch(THREADS);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < THREADS; i++) {
        futures.add(
            pool.submit(
                () -> {
                  ready.countDown();
                  start.await();
                  task.run();
                  return null;
                }));
      }
      assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
      start.countDown();
      for (Future<?> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    }

    @Test
    @DisplayName("여러 스레드가 동시에 실패를 기록해도 서킷은 정확히 한 번 열린다")
    void concurrentFailuresOpenExactlyOnce() throws Exception {
      CircuitBreaker breaker = breaker(CircuitBreakerSettings.of(5, Duration.ofSeconds(30)));

      raceAll(() -> breaker.onFailure(ErrorKind.NETWORK));

      CircuitBreakerSnapshot snapshot = breaker.snapshot();
      assertThat(snapshot.state()).isEqualTo(CircuitState.OPEN);
      assertThat(snapshot.openCount()).isEqualTo(1);
      assertThat(snapshot.consecutiveFailures()).isEqualTo(5);
    }

    @Test
    @DisplayName("쿨다운 후 동시에 허가를 요청하면 HALF_OPEN 시험 호출은 하나만 허용된다")
    void halfOpenAdmitsSingleTrialUnderRace() throws Exception {
      CircuitBreaker breaker = breaker(CircuitBreakerSettings.of(1, Duration.ofSeconds(10)));
      fail(breaker, 1, ErrorKind.TIMEOUT);
      clock.advance(Duration.ofSeconds(10));
      AtomicInteger admitted = new AtomicInteger();
      AtomicInteger rejected = new AtomicInteger();

      raceAll(
          () -> {
            try {
              breaker.acquirePermission();
              admitted.incrementAndGet();
            } catch (CircuitOpenException e) {
              rejected.incrementAndGet();
            }
          });

      assertThat(admitted).hasValue(1);
      assertThat(rejected).hasValue(THREADS - 1);
      assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }
  }

  @Nested
  @DisplayName("CircuitBreakerRegistry")
  class Registry {

    @Test
    @DisplayName("작업 클래스마다 독립된 서킷을 가진다")
    void breakersAreIndependent() {
      CircuitBreakerRegistry registry =
          new CircuitBreakerRegistry(
              CircuitBreakerSettings.of(2, Duration.ofSeconds(10)),
              clock,
              new SimpleMeterRegistry());

      fail(registry.get("fetch-page"), 2, ErrorKind.NETWORK);

      assertThat(registry.get("fetch-page").getState()).isEqualTo(CircuitState.OPEN);
      assertThat(registry.get("fetch-image").getState()).isEqualTo(CircuitState.CLOSED);
      assertThat(registry.get("fetch-page")).isSameAs(registry.get("fetch-page"));
      assertThat(registry.snapshots())
          .extracting(CircuitBreakerSnapshot::operationClass)
          .containsExactly("fetch-image", "fetch-page");
    }

    @Test
    @DisplayName("작업별 설정 재정의와 수동 리셋")
    void overridesAndReset() {
      SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
      CircuitBreakerRegistry registry =
          new CircuitBreakerRegistry(
              CircuitBreakerSettings.defaults(),
              Map.of("login", CircuitBreakerSettings.of(1, Duration.ofMinutes(1))),
              clock,
              meterRegistry);

      fail(registry.get("login"), 1, ErrorKind.BLOCKED);
      assertThat(registry.get("login").getState()).isEqualTo(CircuitState.OPEN);
      assertThat(
              meterRegistry.get("governor_circuit_state").tag("operation", "login").gauge().value())
          .isEqualTo(1.0);

      assertThat(registry.reset("login")).isTrue();
      assertThat(registry.reset("unknown")).isFalse();
      assertThat(registry.get("login").getState()).isEqualTo(CircuitState.CLOSED);
    }
  }
}
