package keystone.platform.domain.model.ratelimit;

import java.time.Duration;
import keystone.platform.error.exception.RateLimitExceededException;

/**
 * Rate Limit 판정 결과
 *
 * <p>거부는 예외가 아니라 정상적인 제어 흐름입니다. 저장소 장애 시의 fail-open도 {@link Verdict#FAIL_OPEN}으로 드러나므로 호출자가
 * 구분할 수 있습니다.
 *
 * @param remaining 이번 요청 반영 후 남은 허용량 (FAIL_OPEN이면 -1)
 * @param retryAfter 거부 시 재시도까지 대기 시간. 허용이면 {@link Duration#ZERO}
 */
public record RateLimitDecision(
    Verdict verdict, RateLimitScope scope, long limit, long remaining, Duration retryAfter) {

  public enum Verdict {
    ALLOWED,
    DENIED,
    FAIL_OPEN
  }

  public static RateLimitDecision allowed(RateLimitScope scope, long limit, long remaining) {
    return new RateLimitDecision(Verdict.ALLOWED, scope, limit, remaining, Duration.ZERO);
  }

  public static RateLimitDecision denied(RateLimitScope scope, long limit, Duration retryAfter) {
    return new RateLimitDecision(Verdict.DENIED, scope, limit, 0, retryAfter);
  }

  /** 저장소를 사용할 수 없어 검사하지 못하고 통과시킨 경우 */
  public static RateLimitDecision failOpen(RateLimitScope scope) {
    return new RateLimitDecision(Verdict.FAIL_OPEN, scope, -1, -1, Duration.ZERO);
  }

  public boolean isAllowed() {
    return verdict != Verdict.DENIED;
  }

  public boolean isFailOpen() {
    return verdict == Verdict.FAIL_OPEN;
  }

  /** HTTP Retry-After 값 (초, 올림) */
  public long retryAfterSeconds() {
    long millis = retryAfter.toMillis();
    return millis <= 0 ? 0 : (millis + 999) / 1000;
  }

  /** 거부면 {@link RateLimitExceededException}, 아니면 자기 자신 */
  public RateLimitDecision orThrow() {
    if (verdict == Verdict.DENIED) {
      throw new RateLimitExceededException(scope.key(), retryAfterSeconds());
    }
    return this;
  }
}
