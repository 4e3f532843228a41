package keystone.platform.error.exception;

import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ServerBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

/**
 * 서킷이 OPEN(또는 HALF_OPEN 시도 슬롯 소진) 상태라 저장소를 호출하지 않고 즉시 실패했습니다.
 *
 * <p>호출자는 자체 fallback을 적용하거나 그대로 노출해야 합니다.
 */
public class CircuitOpenException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  public CircuitOpenException(String breakerName) {
    super(CommonErrorCode.CIRCUIT_OPEN, breakerName);
  }
}
