package keystone.platform.domain.model.task;

import java.time.Duration;
import java.util.Arrays;

/** 큐 타입. 각 타입은 독립된 네임스페이스와 기본 한도를 가집니다. */
public enum TaskType {
  EMBEDDINGS("embeddings", 1000, 5, Duration.ofMinutes(10)),
  AGENT_TASKS("agent-tasks", 500, 5, Duration.ofMinutes(30)),
  BACKGROUND_JOBS("background-jobs", 100, 3, Duration.ofHours(1)),
  EXPORTS("exports", 200, 3, Duration.ofMinutes(20)),
  NOTIFICATIONS("notifications", 5000, 2, Duration.ofSeconds(30)),
  CLEANUP("cleanup", 100, 2, Duration.ofMinutes(10)),
  HEALTH_CHECKS("health-checks", 50, 1, Duration.ofMinutes(1));

  public static final double DEFAULT_TENANT_SHARE = 0.25;

  private final String queueName;
  private final int defaultMaxSize;
  private final int defaultPriorityLevels;
  private final Duration defaultProcessingTimeout;

  TaskType(String queueName, int maxSize, int priorityLevels, Duration processingTimeout) {
    this.queueName = queueName;
    this.defaultMaxSize = maxSize;
    this.defaultPriorityLevels = priorityLevels;
    this.defaultProcessingTimeout = processingTimeout;
  }

  public String queueName() {
    return queueName;
  }

  public QueueLimits defaultLimits() {
    return new QueueLimits(
        defaultMaxSize, defaultPriorityLevels, defaultProcessingTimeout, DEFAULT_TENANT_SHARE);
  }

  public static TaskType fromQueueName(String name) {
    return Arrays.stream(values())
        .filter(t -> t.queueName.equals(name))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown queue: " + name));
  }
}
