package crawl.governor.error.exception.base;

import crawl.governor.error.ErrorCode;

/**
 * ServerBaseException: 보호 대상 작업을 실제로 시도했거나 시도 자체를 차단한 '서버 측 예외'를 처리하며, 장애 회고를 위한 상세 로그를 남기는
 * 것이 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  // 상세 메시지(args)와 실제 에러(cause)를 동시에 기록
  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
