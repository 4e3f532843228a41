package keystone.platform.domain.model.task;

import java.time.Duration;
import keystone.platform.error.exception.InvalidInputException;

/**
 * 큐 타입별 한도
 *
 * @param maxSize 대기(pending + delayed) 태스크 최대 수
 * @param priorityLevels 우선순위 레벨 수 (0 ~ levels-1)
 * @param processingTimeout in_progress 상태 최대 유지 시간. 초과 시 실패 처리
 * @param tenantShare 테넌트 하나가 차지할 수 있는 maxSize 비율 (0 < share ≤ 1)
 */
public record QueueLimits(
    int maxSize, int priorityLevels, Duration processingTimeout, double tenantShare) {

  public QueueLimits {
    if (maxSize <= 0) {
      throw new InvalidInputException("queue maxSize must be positive: " + maxSize);
    }
    if (priorityLevels < 1 || priorityLevels > 10) {
      throw new InvalidInputException("priorityLevels must be within 1..10: " + priorityLevels);
    }
    if (processingTimeout == null || processingTimeout.isNegative() || processingTimeout.isZero()) {
      throw new InvalidInputException("processingTimeout must be positive");
    }
    if (tenantShare <= 0 || tenantShare > 1) {
      throw new InvalidInputException("tenantShare must be within (0, 1]: " + tenantShare);
    }
  }

  public int clampPriority(int priority) {
    return Math.max(0, Math.min(priority, priorityLevels - 1));
  }

  /** 테넌트 하나의 최대 대기 태스크 수 (최소 1) */
  public long tenantLimit() {
    return Math.max(1, (long) Math.floor(maxSize * tenantShare));
  }
}
