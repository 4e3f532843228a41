package keystone.platform.error.exception;

import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ClientBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

/** strict 모드에서 테넌트 스코프 없이 호출됨. 항상 호출 실패로 끝나며 재시도하지 않습니다. */
public class ScopeRequiredException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  public ScopeRequiredException(String operation) {
    super(CommonErrorCode.SCOPE_REQUIRED, operation);
  }
}
