package crawl.governor.infrastructure.resilience;

import crawl.governor.core.domain.circuit.CircuitState;
import java.time.Instant;

/** 서킷 브레이커 상태 조회용 불변 스냅샷 */
public record CircuitBreakerSnapshot(
    String operationClass,
    CircuitState state,
    int consecutiveFailures,
    int consecutiveSuccesses,
    Instant openedAt,
    long openCount) {}
