package crawl.governor.function;

/**
 * 체크 예외를 던질 수 있는 void 작업
 *
 * <p>호출자 제공 콜백(메모리 해제 훅, 알림 리스너)처럼 실패해도 흐름을 멈추지 않아야 하는 부가 작업에 사용합니다.
 */
@FunctionalInterface
public interface CheckedRunnable {
  void run() throws Exception;
}
