package keystone.platform.domain.model.task;

import java.time.Instant;
import keystone.platform.domain.model.tenant.TenantScope;

/**
 * 큐 태스크 스냅샷
 *
 * <p>상태 전이는 Task Queue Manager만 수행합니다. 이 레코드는 저장소에서 읽은 시점의 값입니다.
 *
 * @param payload JSON 문자열
 * @param attempts dequeue 될 때마다 1 증가
 * @param nextAttemptAt 재시도 대기 중일 때 다시 꺼낼 수 있는 시각
 */
public record Task(
    String id,
    TaskType type,
    TenantScope scope,
    String payload,
    int priority,
    int attempts,
    int maxAttempts,
    TaskStatus status,
    Instant enqueuedAt,
    Instant startedAt,
    Instant completedAt,
    Instant nextAttemptAt,
    String lastError,
    String result) {

  public int attemptsRemaining() {
    return Math.max(0, maxAttempts - attempts);
  }

  public boolean hasAttemptsRemaining() {
    return attempts < maxAttempts;
  }
}
