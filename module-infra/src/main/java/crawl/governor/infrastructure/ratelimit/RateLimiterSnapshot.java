package crawl.governor.infrastructure.ratelimit;

/** 제한기 상태 스냅샷 (동일 락 아래에서 읽은 일관된 값) */
public record RateLimiterSnapshot(
    int ceiling, int inFlight, int waiting, int minCeiling, int maxCeiling, long admitted) {}
