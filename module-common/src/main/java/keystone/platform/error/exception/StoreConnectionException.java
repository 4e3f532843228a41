package keystone.platform.error.exception;

import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ServerBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerRecordMarker;

/** 저장소에 도달할 수 없음. 서킷 브레이커 실패로 집계되며 로컬 재시도 대상입니다. */
public class StoreConnectionException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  public StoreConnectionException(String operation, Throwable cause) {
    super(CommonErrorCode.STORE_CONNECTION_FAILED, cause, operation);
  }

  public StoreConnectionException(String operation) {
    super(CommonErrorCode.STORE_CONNECTION_FAILED, operation);
  }
}
