package crawl.governor.error.exception.base;

import crawl.governor.error.ErrorCode;

/**
 * ClientBaseException: 호출자가 지정한 조건(대기 한도 등)을 만족하지 못했을 때 발생하는 예외입니다. 호출자가 작업을 다시 큐에 넣을지 결정할 수 있도록
 * 구체적인 원인을 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
