package crawl.governor.error.exception;

import crawl.governor.error.CommonErrorCode;
import crawl.governor.error.exception.base.ServerBaseException;

/** 보호 대상 작업이 자체 타임아웃을 초과했을 때 던집니다. 타임아웃 강제는 작업 쪽 책임입니다. */
public class OperationTimeoutException extends ServerBaseException {

  public OperationTimeoutException(String detail) {
    super(CommonErrorCode.OPERATION_TIMEOUT, detail);
  }

  public OperationTimeoutException(String detail, Throwable cause) {
    super(CommonErrorCode.OPERATION_TIMEOUT, cause, detail);
  }
}
