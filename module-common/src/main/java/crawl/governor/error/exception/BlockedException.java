package crawl.governor.error.exception;

import crawl.governor.error.CommonErrorCode;
import crawl.governor.error.exception.base.ServerBaseException;

/**
 * 원격 측 차단(캡차, 403, 접근 제한 페이지 등)을 감지했을 때 던집니다.
 *
 * <p>즉시 재시도해도 해소되지 않으므로 기본 정책에서는 재시도하지 않지만, 반복 차단 시 트래픽을 멈출 수 있도록 서킷 브레이커 실패로는 집계됩니다.
 */
public class BlockedException extends ServerBaseException {

  public BlockedException(String detail) {
    super(CommonErrorCode.BLOCKED_BY_REMOTE, detail);
  }

  public BlockedException(String detail, Throwable cause) {
    super(CommonErrorCode.BLOCKED_BY_REMOTE, cause, detail);
  }
}
