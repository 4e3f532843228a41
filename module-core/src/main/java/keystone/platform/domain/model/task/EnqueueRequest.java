package keystone.platform.domain.model.task;

import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import lombok.Builder;

/**
 * enqueue 입력
 *
 * @param taskId null이면 새로 발급. 같은 ID로 다시 enqueue하면 기존 태스크를 반환합니다.
 * @param priority null이면 {@link TaskPriority#NORMAL}
 * @param maxAttempts 1 ~ 10, 0이면 기본값 3
 */
@Builder
public record EnqueueRequest(
    String taskId,
    TaskType type,
    TenantScope scope,
    Object payload,
    Integer priority,
    int maxAttempts) {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final int MAX_ATTEMPTS_LIMIT = 10;

  public EnqueueRequest {
    if (type == null) {
      throw new InvalidInputException("task type is required");
    }
    if (priority == null) {
      priority = TaskPriority.NORMAL.level();
    }
    if (maxAttempts == 0) {
      maxAttempts = DEFAULT_MAX_ATTEMPTS;
    }
    if (maxAttempts < 1 || maxAttempts > MAX_ATTEMPTS_LIMIT) {
      throw new InvalidInputException(
          "maxAttempts must be within 1.." + MAX_ATTEMPTS_LIMIT + ": " + maxAttempts);
    }
  }

  public static EnqueueRequest of(
      TaskType type, TenantScope scope, Object payload, TaskPriority priority) {
    return new EnqueueRequest(null, type, scope, payload, priority.level(), DEFAULT_MAX_ATTEMPTS);
  }
}
