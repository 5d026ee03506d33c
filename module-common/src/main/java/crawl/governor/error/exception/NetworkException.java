package crawl.governor.error.exception;

import crawl.governor.error.CommonErrorCode;
import crawl.governor.error.exception.base.ServerBaseException;

/** 보호 대상 작업이 일시적 네트워크 오류를 알릴 때 던집니다. */
public class NetworkException extends ServerBaseException {

  public NetworkException(String detail) {
    super(CommonErrorCode.NETWORK_FAILURE, detail);
  }

  public NetworkException(String detail, Throwable cause) {
    super(CommonErrorCode.NETWORK_FAILURE, cause, detail);
  }
}
