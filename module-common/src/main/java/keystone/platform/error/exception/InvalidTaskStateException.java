package keystone.platform.error.exception;

import lombok.Getter;
import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ClientBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

/** 현재 상태에서 허용되지 않는 전이를 시도함 (예: queued 태스크에 complete). 정합성 오류로 취급합니다. */
@Getter
public class InvalidTaskStateException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  private final String taskId;
  private final String currentStatus;

  public InvalidTaskStateException(String taskId, String currentStatus, String action) {
    super(CommonErrorCode.INVALID_TASK_STATE, taskId, currentStatus, action);
    this.taskId = taskId;
    this.currentStatus = currentStatus;
  }
}
