package keystone.platform.domain.model.task;

/**
 * 이름 있는 우선순위 레벨. 숫자가 작을수록 긴급합니다.
 *
 * <p>큐 타입마다 레벨 수가 다르므로 실제 레벨은 {@link QueueLimits#clampPriority(int)}로 보정됩니다.
 */
public enum TaskPriority {
  CRITICAL(0),
  HIGH(1),
  NORMAL(2),
  LOW(3),
  BACKGROUND(4);

  private final int level;

  TaskPriority(int level) {
    this.level = level;
  }

  public int level() {
    return level;
  }
}
