package crawl.governor.infrastructure.ratelimit;

import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;

/**
 * 동시 실행 허가
 *
 * <p>try-with-resources로 모든 종료 경로(정상, 예외, 타임아웃)에서 반납합니다. 반납은 멱등이라 명시적 {@code release} 후
 * {@code close}가 다시 호출되어도 in-flight가 두 번 감소하지 않습니다.
 */
public final class Permit implements AutoCloseable {

  private final AdaptiveRateLimiter owner;
  @Getter private final long id;
  private final AtomicBoolean released = new AtomicBoolean();

  Permit(AdaptiveRateLimiter owner, long id) {
    this.owner = owner;
    this.id = id;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    owner.release(this);
  }

  boolean belongsTo(AdaptiveRateLimiter limiter) {
    return owner == limiter;
  }

  /** 최초 반납일 때만 true */
  boolean markReleased() {
    return released.compareAndSet(false, true);
  }
}
