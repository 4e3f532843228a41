package keystone.platform.error.exception;

import lombok.Getter;
import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ServerBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerRecordMarker;

/** 호출이 제한 시간을 넘김. 서킷 브레이커 입장에서는 실패와 동일하게 취급합니다. */
@Getter
public class StoreTimeoutException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  private final long timeoutMillis;

  public StoreTimeoutException(String operation, long timeoutMillis) {
    super(CommonErrorCode.STORE_TIMEOUT, operation, timeoutMillis);
    this.timeoutMillis = timeoutMillis;
  }

  public StoreTimeoutException(String operation, long timeoutMillis, Throwable cause) {
    super(CommonErrorCode.STORE_TIMEOUT, cause, operation, timeoutMillis);
    this.timeoutMillis = timeoutMillis;
  }
}
