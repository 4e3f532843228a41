package keystone.platform.domain.model.task;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * 태스크 상태 머신
 *
 * <pre>
 * queued → in_progress → succeeded
 *                      → failed → queued        (재시도 잔여)
 *                               → dead_lettered (재시도 소진)
 * dead_lettered → queued (수동/자동 재처리)
 * </pre>
 */
public enum TaskStatus {
  QUEUED("queued"),
  IN_PROGRESS("in_progress"),
  SUCCEEDED("succeeded"),
  FAILED("failed"),
  DEAD_LETTERED("dead_lettered");

  private final String wireValue;

  TaskStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  public Set<TaskStatus> nextStates() {
    return switch (this) {
      case QUEUED -> EnumSet.of(IN_PROGRESS);
      case IN_PROGRESS -> EnumSet.of(SUCCEEDED, FAILED);
      case FAILED -> EnumSet.of(QUEUED, DEAD_LETTERED);
      case DEAD_LETTERED -> EnumSet.of(QUEUED);
      case SUCCEEDED -> EnumSet.noneOf(TaskStatus.class);
    };
  }

  public boolean canTransitionTo(TaskStatus next) {
    return nextStates().contains(next);
  }

  public boolean isTerminal() {
    return this == SUCCEEDED || this == DEAD_LETTERED;
  }

  public static TaskStatus fromWire(String value) {
    return Arrays.stream(values())
        .filter(s -> s.wireValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown task status: " + value));
  }
}
