package keystone.platform.error.exception;

import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ClientBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

public class InvalidInputException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  public InvalidInputException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
