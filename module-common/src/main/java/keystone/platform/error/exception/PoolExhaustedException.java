package keystone.platform.error.exception;

import lombok.Getter;
import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ServerBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

/** 커넥션 풀 획득 대기가 제한 시간을 넘김. backoff 후 재시도 가능합니다. */
@Getter
public class PoolExhaustedException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  private final int maxConnections;

  public PoolExhaustedException(int maxConnections, String operation, Throwable cause) {
    super(CommonErrorCode.POOL_EXHAUSTED, cause, maxConnections, operation);
    this.maxConnections = maxConnections;
  }
}
