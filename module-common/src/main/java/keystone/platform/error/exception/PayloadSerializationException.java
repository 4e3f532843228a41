package keystone.platform.error.exception;

import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ServerBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

public class PayloadSerializationException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  public PayloadSerializationException(String detail, Throwable cause) {
    super(CommonErrorCode.PAYLOAD_SERIALIZATION_FAILED, cause, detail);
  }
}
