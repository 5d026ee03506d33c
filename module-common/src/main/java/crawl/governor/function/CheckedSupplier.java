package crawl.governor.function;

/**
 * 체크 예외를 던질 수 있는 작업 단위
 *
 * <p>보호 대상 작업(페이지 조회 등)은 이 형태로 전달됩니다. 거버너는 작업 내용을 알지 못하며 결과 또는 예외만 관찰합니다.
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface CheckedSupplier<T> {
  T get() throws Exception;
}
