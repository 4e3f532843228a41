package keystone.platform.domain.model.ratelimit;

import java.time.Duration;
import java.util.Locale;
import keystone.platform.error.exception.InvalidInputException;

/**
 * 스코프 하나에 적용되는 Rate Limit 규칙 (불변, 생성 시 검증)
 *
 * <ul>
 *   <li>SLIDING_WINDOW / FIXED_WINDOW: window 동안 최대 limit 건
 *   <li>TOKEN_BUCKET: 용량 limit, 초당 refillPerSecond 토큰 보충
 * </ul>
 *
 * @param cost 요청 1건이 소비하는 단위 (기본 1)
 */
public record RateLimitRule(
    RateLimitAlgorithm algorithm, long limit, Duration window, double refillPerSecond, int cost) {

  public RateLimitRule {
    if (algorithm == null) {
      throw new InvalidInputException("rate limit algorithm is required");
    }
    if (limit <= 0) {
      throw new InvalidInputException("rate limit must be positive: " + limit);
    }
    if (window == null || window.isNegative() || window.isZero()) {
      throw new InvalidInputException("rate limit window must be positive");
    }
    if (algorithm == RateLimitAlgorithm.TOKEN_BUCKET && refillPerSecond <= 0) {
      throw new InvalidInputException("token bucket refill rate must be positive");
    }
    if (cost <= 0 || cost > limit) {
      throw new InvalidInputException("cost must be within 1.." + limit + ": " + cost);
    }
  }

  public static RateLimitRule slidingWindow(long limit, Duration window) {
    return new RateLimitRule(RateLimitAlgorithm.SLIDING_WINDOW, limit, window, 0, 1);
  }

  public static RateLimitRule fixedWindow(long limit, WindowKind kind) {
    return new RateLimitRule(RateLimitAlgorithm.FIXED_WINDOW, limit, kind.duration(), 0, 1);
  }

  /** window는 버킷이 비었다가 가득 찰 때까지의 시간 (키 이름과 TTL 계산용) */
  public static RateLimitRule tokenBucket(long capacity, double refillPerSecond) {
    long fillMillis = (long) Math.ceil(capacity * 1000.0 / refillPerSecond);
    return new RateLimitRule(
        RateLimitAlgorithm.TOKEN_BUCKET,
        capacity,
        Duration.ofMillis(Math.max(1, fillMillis)),
        refillPerSecond,
        1);
  }

  public RateLimitRule withCost(int newCost) {
    return new RateLimitRule(algorithm, limit, window, refillPerSecond, newCost);
  }

  /** 키에 들어가는 윈도우 라벨: minute/hour/day 또는 "90s" 형식 */
  public String windowLabel() {
    return WindowKind.matching(window)
        .map(k -> k.name().toLowerCase(Locale.ROOT))
        .orElseGet(() -> window.toMillis() % 1000 == 0
            ? window.toSeconds() + "s"
            : window.toMillis() + "ms");
  }
}
