package crawl.governor.infrastructure.resilience;

import crawl.governor.error.ErrorKind;
import crawl.governor.error.exception.base.BaseException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * 작업이 던진 예외를 {@link ErrorKind}로 분류
 *
 * <h3>분류 규칙 (우선순위 순)</h3>
 *
 * <ol>
 *   <li>{@link BaseException}: 자신이 가진 종류
 *   <li>{@link TimeoutException}, {@link SocketTimeoutException}, {@link HttpTimeoutException}:
 *       TIMEOUT
 *   <li>그 외 {@link IOException}: NETWORK
 *   <li>나머지: UNKNOWN (보수적으로 재시도 제외)
 * </ol>
 *
 * <p>래핑된 예외는 cause chain을 따라 최대 {@value #MAX_DEPTH}단계까지 확인합니다.
 */
public class ErrorClassifier {

  private static final int MAX_DEPTH = 8;

  public ErrorKind classify(Throwable failure) {
    Throwable current = failure;
    for (int depth = 0; current != null && depth < MAX_DEPTH; depth++) {
      ErrorKind kind = classifyDirect(current);
      if (kind != null) {
        return kind;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return ErrorKind.UNKNOWN;
  }

  private ErrorKind classifyDirect(Throwable t) {
    if (t instanceof BaseException base) {
      return base.getErrorKind();
    }
    if (t instanceof TimeoutException
        || t instanceof SocketTimeoutException
        || t instanceof HttpTimeoutException) {
      return ErrorKind.TIMEOUT;
    }
    if (t instanceof IOException) {
      return ErrorKind.NETWORK;
    }
    return null;
  }
}
