package crawl.governor.error;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 보호 대상 작업 실패의 닫힌 분류 체계
 *
 * <p>모든 분기는 예외 타입 계층이 아닌 이 enum에 대한 exhaustive {@code switch}로 처리합니다.
 *
 * <h3>분류</h3>
 *
 * <ul>
 *   <li><b>작업 실패</b> (실제로 시도했으나 실패): NETWORK, TIMEOUT, BLOCKED, UNKNOWN
 *   <li><b>거버너 거절</b> (시도하지 않음): CIRCUIT_OPEN, RATE_LIMIT_TIMEOUT
 * </ul>
 *
 * <p>거버너 거절은 서킷 브레이커 카운트에 반영되지 않으며 내부에서 재시도하지 않습니다.
 */
public enum ErrorKind {

  /** 일시적 네트워크 오류 (재시도 대상) */
  NETWORK,

  /** 작업 자체의 타임아웃 (재시도 대상, 시도 횟수 제한) */
  TIMEOUT,

  /** 원격 측 차단 감지 (기본 재시도 제외, 서킷 브레이커에는 집계) */
  BLOCKED,

  /** 분류되지 않은 실패 (보수적으로 재시도 제외) */
  UNKNOWN,

  /** 서킷 OPEN으로 호출하지 않음 */
  CIRCUIT_OPEN,

  /** 허가 대기 시간 초과로 호출하지 않음 */
  RATE_LIMIT_TIMEOUT;

  private static final Set<ErrorKind> DEFAULT_RETRYABLE =
      Collections.unmodifiableSet(EnumSet.of(NETWORK, TIMEOUT));

  /**
   * 실제 작업 시도의 결과인지 여부
   *
   * @return 작업을 호출한 뒤 발생한 실패면 true
   */
  public boolean isOperationFailure() {
    return switch (this) {
      case NETWORK, TIMEOUT, BLOCKED, UNKNOWN -> true;
      case CIRCUIT_OPEN, RATE_LIMIT_TIMEOUT -> false;
    };
  }

  /** 기본 재시도 대상 (NETWORK, TIMEOUT) */
  public static Set<ErrorKind> defaultRetryable() {
    return DEFAULT_RETRYABLE;
  }
}
