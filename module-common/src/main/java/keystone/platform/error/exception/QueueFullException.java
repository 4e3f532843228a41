package keystone.platform.error.exception;

import lombok.Getter;
import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ClientBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

/** 큐(또는 테넌트 몫) 용량 초과. 내부 재시도 없이 호출자에게 전달됩니다. */
@Getter
public class QueueFullException extends ClientBaseException implements CircuitBreakerIgnoreMarker {

  private final String queueName;
  private final long limit;

  public QueueFullException(String queueName, long limit) {
    super(CommonErrorCode.QUEUE_FULL, queueName, limit);
    this.queueName = queueName;
    this.limit = limit;
  }
}
