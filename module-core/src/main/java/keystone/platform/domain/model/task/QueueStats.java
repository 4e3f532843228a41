package keystone.platform.domain.model.task;

/** 큐 타입별 현재 깊이와 누적 카운터. */
public record QueueStats(
    TaskType type,
    long pending,
    long delayed,
    long inFlight,
    long deadLettered,
    long enqueuedTotal,
    long completedTotal,
    long failedTotal,
    long deadLetteredTotal,
    int maxSize) {

  /** 대기(pending + delayed) / maxSize */
  public double utilization() {
    return (pending + delayed) / (double) maxSize;
  }
}
