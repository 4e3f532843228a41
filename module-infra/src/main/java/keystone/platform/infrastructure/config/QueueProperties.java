package keystone.platform.infrastructure.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import keystone.platform.domain.model.task.QueueLimits;
import keystone.platform.domain.model.task.TaskType;
import keystone.platform.domain.service.RetryBackoffPolicy;
import keystone.platform.error.exception.InvalidInputException;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 태스크 큐 설정 ({@code keystone.queue.*})
 *
 * <pre>
 * keystone:
 *   queue:
 *     retry: { base-delay: 1s, multiplier: 2.0, max-delay: 300s, jitter: 0.25, min-delay: 100ms }
 *     task-ttl: 24h
 *     dead-letter-retention: 30d
 *     max-auto-retries: 5
 *     types:
 *       embeddings: { max-size: 1000, priority-levels: 5, processing-timeout: 10m }
 * </pre>
 *
 * @param taskTtl 종료 상태(succeeded / dead_lettered)가 된 태스크 레코드 보존 기간
 */
@ConfigurationProperties(prefix = "keystone.queue")
public record QueueProperties(
    RetrySpec retry,
    Duration taskTtl,
    Duration deadLetterRetention,
    Integer maxAutoRetries,
    Map<String, TypeSpec> types) {

  public record RetrySpec(
      Duration baseDelay, Double multiplier, Duration maxDelay, Double jitter, Duration minDelay) {

    public RetryBackoffPolicy toPolicy() {
      RetryBackoffPolicy d = RetryBackoffPolicy.STANDARD;
      return new RetryBackoffPolicy(
          baseDelay == null ? d.baseDelay() : baseDelay,
          multiplier == null ? d.multiplier() : multiplier,
          maxDelay == null ? d.maxDelay() : maxDelay,
          jitter == null ? d.jitter() : jitter,
          minDelay == null ? d.minDelay() : minDelay);
    }
  }

  public record TypeSpec(
      Integer maxSize, Integer priorityLevels, Duration processingTimeout, Double tenantShare) {}

  public QueueProperties {
    retry = retry == null ? new RetrySpec(null, null, null, null, null) : retry;
    taskTtl = taskTtl == null ? Duration.ofHours(24) : taskTtl;
    deadLetterRetention = deadLetterRetention == null ? Duration.ofDays(30) : deadLetterRetention;
    maxAutoRetries = maxAutoRetries == null ? 5 : maxAutoRetries;
    types = types == null ? Map.of() : Map.copyOf(types);
    retry.toPolicy();
    for (String name : types.keySet()) {
      TaskType.fromQueueName(name);
    }
    if (maxAutoRetries < 0) {
      throw new InvalidInputException("keystone.queue.max-auto-retries must be >= 0");
    }
  }

  public static QueueProperties defaults() {
    return new QueueProperties(null, null, null, null, null);
  }

  public RetryBackoffPolicy backoffPolicy() {
    return retry.toPolicy();
  }

  /** 타입별 한도: 설정값이 없는 항목은 {@link TaskType}의 기본값 */
  public Map<TaskType, QueueLimits> limits() {
    Map<TaskType, QueueLimits> limits = new EnumMap<>(TaskType.class);
    for (TaskType type : TaskType.values()) {
      QueueLimits d = type.defaultLimits();
      TypeSpec spec = types.get(type.queueName());
      if (spec == null) {
        limits.put(type, d);
        continue;
      }
      limits.put(
          type,
          new QueueLimits(
              spec.maxSize() == null ? d.maxSize() : spec.maxSize(),
              spec.priorityLevels() == null ? d.priorityLevels() : spec.priorityLevels(),
              spec.processingTimeout() == null ? d.processingTimeout() : spec.processingTimeout(),
              spec.tenantShare() == null ? d.tenantShare() : spec.tenantShare()));
    }
    return limits;
  }
}
