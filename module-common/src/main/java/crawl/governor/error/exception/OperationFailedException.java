package crawl.governor.error.exception;

import crawl.governor.error.CommonErrorCode;
import crawl.governor.error.ErrorKind;
import crawl.governor.error.exception.base.ServerBaseException;
import lombok.Getter;

/**
 * 허용된 시도를 모두 소진했거나 재시도 불가 실패가 발생해 최종적으로 표면화되는 예외
 *
 * <p>{@link #getErrorKind()}는 마지막 시도의 실패 종류이며, 원본 예외는 cause로 보존됩니다.
 */
@Getter
public class OperationFailedException extends ServerBaseException {

  private final String operationClass;
  private final int attempts;

  public OperationFailedException(
      ErrorKind kind, String operationClass, int attempts, Throwable cause) {
    super(
        CommonErrorCode.of(requireOperationFailure(kind)),
        cause,
        "operation=" + operationClass + ", attempts=" + attempts);
    this.operationClass = operationClass;
    this.attempts = attempts;
  }

  private static ErrorKind requireOperationFailure(ErrorKind kind) {
    if (!kind.isOperationFailure()) {
      throw new IllegalArgumentException("not an operation failure kind: " + kind);
    }
    return kind;
  }
}
