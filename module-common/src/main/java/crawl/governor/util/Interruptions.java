package crawl.governor.util;

import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;

/**
 * 작업 실패가 "중단 요청"인지 판별
 *
 * <p>보호 대상 작업이 던진 예외 그래프(cause chain + suppressed)에서 아래 중 하나가 발견되면 스레드 중단으로 봅니다. 이 경우 실패로
 * 집계하지 않고 호출자에게 중단을 전달해야 합니다.
 *
 * <ul>
 *   <li>{@link InterruptedException}
 *   <li>{@link ClosedByInterruptException}: 인터럽트로 채널이 닫힘
 *   <li>정확히 {@link InterruptedIOException} 타입인 예외
 * </ul>
 *
 * <p>{@link java.net.SocketTimeoutException} 등 {@link InterruptedIOException}의 하위 타입은 I/O 타임아웃이므로
 * 중단이 아닙니다. TIMEOUT 실패로 분류되어 재시도와 서킷 집계 대상이 됩니다.
 */
public final class Interruptions {

  /** 예외 그래프 탐색 깊이 상한 (순환 참조 방지) */
  private static final int MAX_GRAPH_DEPTH = 32;

  private Interruptions() {}

  /**
   * @param failure 작업이 던진 예외 (null 허용)
   * @return 스레드 중단에 의한 실패이면 true
   */
  public static boolean isInterruption(Throwable failure) {
    return search(failure, 0);
  }

  /**
   * 중단에 의한 실패이면 현재 스레드의 interrupt 플래그를 다시 세웁니다.
   *
   * @return 플래그를 복원했으면 true
   */
  public static boolean restoreIfInterruption(Throwable failure) {
    if (!isInterruption(failure)) {
      return false;
    }
    Thread.currentThread().interrupt();
    return true;
  }

  private static boolean search(Throwable t, int depth) {
    if (t == null || depth >= MAX_GRAPH_DEPTH) {
      return false;
    }
    if (isInterruptSignal(t)) {
      return true;
    }
    for (Throwable suppressed : t.getSuppressed()) {
      if (search(suppressed, depth + 1)) {
        return true;
      }
    }
    return t.getCause() != t && search(t.getCause(), depth + 1);
  }

  private static boolean isInterruptSignal(Throwable t) {
    return t instanceof InterruptedException
        || t instanceof ClosedByInterruptException
        || t.getClass() == InterruptedIOException.class;
  }
}
