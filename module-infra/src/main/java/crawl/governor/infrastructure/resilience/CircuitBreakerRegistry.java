package crawl.governor.infrastructure.resilience;

import crawl.governor.core.domain.circuit.CircuitBreakerSettings;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 작업 클래스별 서킷 브레이커 보관소
 *
 * <p>작업 클래스 간 서킷은 완전히 독립적입니다. 처음 조회될 때 생성되며 작업 클래스별 설정 오버라이드가 없으면 기본 설정을 사용합니다.
 */
public class CircuitBreakerRegistry {

  private final CircuitBreakerSettings defaultSettings;
  private final Map<String, CircuitBreakerSettings> overrides;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

  public CircuitBreakerRegistry(
      CircuitBreakerSettings defaultSettings,
      Map<String, CircuitBreakerSettings> overrides,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.defaultSettings = defaultSettings;
    this.overrides = Map.copyOf(overrides);
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  public CircuitBreakerRegistry(
      CircuitBreakerSettings defaultSettings, Clock clock, MeterRegistry meterRegistry) {
    this(defaultSettings, Map.of(), clock, meterRegistry);
  }

  public CircuitBreaker get(String operationClass) {
    return breakers.computeIfAbsent(operationClass, this::create);
  }

  public List<CircuitBreakerSnapshot> snapshots() {
    return breakers.values().stream()
        .map(CircuitBreaker::snapshot)
        .sorted(Comparator.comparing(CircuitBreakerSnapshot::operationClass))
        .toList();
  }

  /**
   * 특정 작업 클래스의 서킷을 CLOSED로 리셋
   *
   * @return 해당 서킷이 존재했으면 true
   */
  public boolean reset(String operationClass) {
    CircuitBreaker breaker = breakers.get(operationClass);
    if (breaker == null) {
      return false;
    }
    breaker.reset();
    return true;
  }

  private CircuitBreaker create(String operationClass) {
    CircuitBreakerSettings settings = overrides.getOrDefault(operationClass, defaultSettings);
    CircuitBreaker breaker = new CircuitBreaker(operationClass, settings, clock);
    Gauge.builder("governor_circuit_state", breaker, b -> b.getState().gaugeValue())
        .description("Circuit state (0=CLOSED, 1=OPEN, 2=HALF_OPEN)")
        .tag("operation", operationClass)
        .register(meterRegistry);
    return breaker;
  }
}
