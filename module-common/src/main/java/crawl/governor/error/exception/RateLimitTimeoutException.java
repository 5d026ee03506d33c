package crawl.governor.error.exception;

import crawl.governor.error.CommonErrorCode;
import crawl.governor.error.exception.base.ClientBaseException;
import java.time.Duration;
import lombok.Getter;

/** 허가 대기가 호출자가 지정한 한도를 초과했을 때 발생합니다. 재시도 여부는 호출자가 결정합니다. */
@Getter
public class RateLimitTimeoutException extends ClientBaseException {

  private final Duration waited;
  private final int ceiling;

  public RateLimitTimeoutException(Duration waited, int ceiling) {
    super(CommonErrorCode.RATE_LIMIT_TIMEOUT, waited.toMillis(), ceiling);
    this.waited = waited;
    this.ceiling = ceiling;
  }
}
