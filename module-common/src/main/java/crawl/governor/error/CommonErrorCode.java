package crawl.governor.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Operation Failures ===
  NETWORK_FAILURE("G001", "네트워크 오류로 작업 실패 (%s)", ErrorKind.NETWORK),
  OPERATION_TIMEOUT("G002", "작업 시간 초과 (%s)", ErrorKind.TIMEOUT),
  BLOCKED_BY_REMOTE("G003", "원격 측 차단 감지 (%s)", ErrorKind.BLOCKED),
  UNCLASSIFIED_FAILURE("G004", "분류되지 않은 작업 실패 (%s)", ErrorKind.UNKNOWN),

  // === Governor Rejections ===
  CIRCUIT_OPEN("G101", "서킷 브레이커 OPEN 상태로 호출 차단 (operation: %s, 남은 대기: %sms)", ErrorKind.CIRCUIT_OPEN),
  RATE_LIMIT_TIMEOUT(
      "G102", "동시 실행 허가 대기 시간 초과 (대기: %sms, ceiling: %s)", ErrorKind.RATE_LIMIT_TIMEOUT);

  private final String code;
  private final String message;
  private final ErrorKind kind;

  /**
   * 작업 실패 종류에 대응하는 에러 코드
   *
   * @param kind 실패 종류
   * @return 대응 코드
   */
  public static CommonErrorCode of(ErrorKind kind) {
    return switch (kind) {
      case NETWORK -> NETWORK_FAILURE;
      case TIMEOUT -> OPERATION_TIMEOUT;
      case BLOCKED -> BLOCKED_BY_REMOTE;
      case UNKNOWN -> UNCLASSIFIED_FAILURE;
      case CIRCUIT_OPEN -> CIRCUIT_OPEN;
      case RATE_LIMIT_TIMEOUT -> RATE_LIMIT_TIMEOUT;
    };
  }
}
