package keystone.platform.domain.model.task;

import java.time.Instant;

/**
 * 재시도 예산을 소진한 태스크 기록
 *
 * @param task dead letter 이동 시점의 태스크 스냅샷
 * @param autoRetryCount 자동 재처리된 횟수
 * @param nextAutoRetryAt 자동 재처리 대상이 아니면 null
 */
public record DeadLetterRecord(
    Task task,
    String errorMessage,
    FailureCategory category,
    int attempts,
    Instant deadLetteredAt,
    int autoRetryCount,
    Instant nextAutoRetryAt) {

  public boolean isAutoRetryDue(Instant now, int maxAutoRetries) {
    return category.isAutoRetryEligible()
        && autoRetryCount < maxAutoRetries
        && nextAutoRetryAt != null
        && !nextAutoRetryAt.isAfter(now);
  }
}
