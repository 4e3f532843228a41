package keystone.platform.error.exception;

import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ClientBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

public class TaskNotFoundException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  public TaskNotFoundException(String taskId) {
    super(CommonErrorCode.TASK_NOT_FOUND, taskId);
  }
}
