package crawl.governor.core.domain.metric;

import crawl.governor.error.ErrorKind;

/** Outcome of one attempt as seen by the metrics window. */
public enum Outcome {
  SUCCESS,
  FAILURE,
  BLOCKED;

  /**
   * Maps an attempt failure to its outcome bucket.
   *
   * @throws IllegalArgumentException for governor rejections, which are not attempts
   */
  public static Outcome ofFailure(ErrorKind kind) {
    return switch (kind) {
      case BLOCKED -> BLOCKED;
      case NETWORK, TIMEOUT, UNKNOWN -> FAILURE;
      case CIRCUIT_OPEN, RATE_LIMIT_TIMEOUT ->
          throw new IllegalArgumentException(kind + " is not an attempt outcome");
    };
  }
}
