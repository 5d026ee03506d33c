package crawl.governor.error.exception;

import crawl.governor.error.CommonErrorCode;
import crawl.governor.error.exception.base.ServerBaseException;
import java.time.Duration;
import lombok.Getter;

/**
 * 서킷이 OPEN(또는 HALF_OPEN 시험 호출 진행 중)이라 작업을 호출하지 않았음을 알립니다.
 *
 * <p>"시도했으나 실패"가 아닌 "시도하지 않음"이므로 서킷 브레이커 카운트에 반영되지 않습니다.
 */
@Getter
public class CircuitOpenException extends ServerBaseException {

  private final String operationClass;
  private final Duration remainingCooldown;

  public CircuitOpenException(String operationClass, Duration remainingCooldown) {
    super(CommonErrorCode.CIRCUIT_OPEN, operationClass, remainingCooldown.toMillis());
    this.operationClass = operationClass;
    this.remainingCooldown = remainingCooldown;
  }
}
