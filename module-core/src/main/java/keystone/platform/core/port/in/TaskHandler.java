package keystone.platform.core.port.in;

import keystone.platform.domain.model.task.Task;
import keystone.platform.domain.model.task.TaskType;

/**
 * 워커가 꺼낸 태스크를 처리하는 애플리케이션 코드
 *
 * <p>at-least-once 전달이므로 구현은 멱등해야 합니다. 예외를 던지면 실패 경로(재시도 / dead letter)로 넘어가고, 반환값은 완료 결과로
 * 기록됩니다.
 */
public interface TaskHandler {

  TaskType type();

  /** @return 완료 결과 (nullable) */
  String handle(Task task) throws Exception;

  /** false를 반환하는 예외는 재시도 없이 바로 dead letter로 이동 */
  default boolean isRetryable(Throwable error) {
    return true;
  }
}
