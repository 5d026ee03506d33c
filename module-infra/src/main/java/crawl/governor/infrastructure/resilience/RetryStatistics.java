package crawl.governor.infrastructure.resilience;

import java.util.concurrent.atomic.LongAdder;

/** 재시도 누적 통계 (LongAdder: 경합 최적화) */
public class RetryStatistics {

  private final LongAdder executions = new LongAdder();
  private final LongAdder attempts = new LongAdder();
  private final LongAdder firstAttemptSuccesses = new LongAdder();
  private final LongAdder successfulRetries = new LongAdder();
  private final LongAdder failedAfterRetries = new LongAdder();
  private final LongAdder nonRetryableFailures = new LongAdder();
  private final LongAdder circuitOpenRejections = new LongAdder();

  void recordExecution() {
    executions.increment();
  }

  void recordAttempt() {
    attempts.increment();
  }

  void recordSuccess(int attempt) {
    if (attempt == 1) {
      firstAttemptSuccesses.increment();
    } else {
      successfulRetries.increment();
    }
  }

  void recordExhausted() {
    failedAfterRetries.increment();
  }

  void recordNonRetryable() {
    nonRetryableFailures.increment();
  }

  void recordCircuitOpenRejection() {
    circuitOpenRejections.increment();
  }

  public Snapshot snapshot() {
    return new Snapshot(
        executions.sum(),
        attempts.sum(),
        firstAttemptSuccesses.sum(),
        successfulRetries.sum(),
        failedAfterRetries.sum(),
        nonRetryableFailures.sum(),
        circuitOpenRejections.sum());
  }

  public record Snapshot(
      long executions,
      long attempts,
      long firstAttemptSuccesses,
      long successfulRetries,
      long failedAfterRetries,
      long nonRetryableFailures,
      long circuitOpenRejections) {

    /** 재시도에 들어간 실행 중 최종 성공 비율. 재시도가 없었으면 0 */
    public double retrySuccessRate() {
      long retried = successfulRetries + failedAfterRetries;
      return retried == 0 ? 0.0 : (double) successfulRetries / retried;
    }
  }
}
