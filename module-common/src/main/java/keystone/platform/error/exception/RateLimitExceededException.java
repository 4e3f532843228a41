package keystone.platform.error.exception;

import lombok.Getter;
import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ClientBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

/**
 * Rate Limit 초과 예외 (429 Too Many Requests)
 *
 * <p>Rate Limiter는 거부를 예외가 아닌 결정 객체로 반환합니다. 이 예외는 호출자가 {@code decision.orThrow()}로 명시적으로 변환할 때만
 * 생성됩니다.
 *
 * <h4>응답 예시</h4>
 *
 * <pre>
 * HTTP/1.1 429 Too Many Requests
 * Retry-After: 30
 * </pre>
 */
@Getter
public class RateLimitExceededException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  /** 재시도까지 대기 시간 (초, HTTP Retry-After 값) */
  private final long retryAfterSeconds;

  /** 거부한 스코프 이름 (ip, user, tenant, endpoint) */
  private final String scope;

  public RateLimitExceededException(String scope, long retryAfterSeconds) {
    super(CommonErrorCode.RATE_LIMIT_EXCEEDED, retryAfterSeconds);
    this.scope = scope;
    this.retryAfterSeconds = retryAfterSeconds;
  }
}
