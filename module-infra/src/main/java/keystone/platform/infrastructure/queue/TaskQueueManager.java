package keystone.platform.infrastructure.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import keystone.platform.core.port.out.KeyStoreClient;
import keystone.platform.domain.model.task.DeadLetterRecord;
import keystone.platform.domain.model.task.EnqueueRequest;
import keystone.platform.domain.model.task.FailOutcome;
import keystone.platform.domain.model.task.FailOutcome.Disposition;
import keystone.platform.domain.model.task.FailureCategory;
import keystone.platform.domain.model.task.QueueLimits;
import keystone.platform.domain.model.task.QueueStats;
import keystone.platform.domain.model.task.Task;
import keystone.platform.domain.model.task.TaskStatus;
import keystone.platform.domain.model.task.TaskType;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.domain.service.RetryBackoffPolicy;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.error.exception.InvalidTaskStateException;
import keystone.platform.error.exception.QueueFullException;
import keystone.platform.error.exception.TaskNotFoundException;
import keystone.platform.infrastructure.config.QueueProperties;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.executor.TaskContext;
import keystone.platform.infrastructure.executor.strategy.ExceptionTranslator;
import keystone.platform.infrastructure.keystore.ScriptResults;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import lombok.extern.slf4j.Slf4j;

/**
 * 우선순위 태스크 큐
 *
 * <h3>전달 보장</h3>
 *
 * <ul>
 *   <li>같은 우선순위 안에서 FIFO
 *   <li>dequeue는 원자적: 한 태스크는 동시에 한 워커에게만 전달
 *   <li>at-least-once: 처리 제한 시간을 넘긴 in-flight 태스크는 {@link #recoverExpiredInFlight}가 실패로 처리해 다시
 *       배달
 * </ul>
 *
 * <h3>실패 처리</h3>
 *
 * <pre>
 * fail(retryable=true, attempts &lt; max) → failed (delayed, 지수 백오프 + 지터, 우선순위 한 단계 상향)
 * 그 외                                  → dead_lettered (DeadLetterStore에서 조회/재처리)
 * </pre>
 *
 * <p>저장소 장애는 호출자에게 그대로 전파합니다. 큐 연산은 fail-open 하지 않습니다.
 */
@Slf4j
public class TaskQueueManager {

  static final int PROMOTION_BATCH = 100;
  private static final int MAX_TASK_ID_LENGTH = 128;
  private static final int MAX_ERROR_LENGTH = 2000;
  private static final long MAX_AUTO_RETRY_DELAY_MINUTES = 60;

  private final TenantIsolatedAccessor accessor;
  private final LogicExecutor executor;
  private final ObjectMapper objectMapper;
  private final QueueProperties properties;
  private final QueueMetrics metrics;
  private final Clock clock;
  private final Map<TaskType, QueueLimits> limits;
  private final RetryBackoffPolicy backoff;

  public TaskQueueManager(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      ObjectMapper objectMapper,
      QueueProperties properties,
      QueueMetrics metrics,
      Clock clock) {
    this.accessor = accessor;
    this.executor = executor;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.limits = new EnumMap<>(properties.limits());
    this.backoff = properties.backoffPolicy();
  }

  /**
   * 태스크 추가
   *
   * <p>같은 taskId가 이미 있으면 새로 추가하지 않고 기존 태스크를 반환합니다. 우선순위는 큐 타입의 레벨 수에 맞게 보정됩니다.
   *
   * @throws QueueFullException 큐 전체(pending + delayed) 또는 테넌트 몫이 가득 참
   */
  public Task enqueue(EnqueueRequest request) {
    TaskType type = request.type();
    TenantScope scope = accessor.resolveScope(request.scope(), "queue.enqueue");
    QueueLimits limit = limitsOf(type);
    int priority = limit.clampPriority(request.priority());
    String taskId =
        request.taskId() == null ? UUID.randomUUID().toString() : requireTaskId(request.taskId());
    String payload = serialize(request.payload(), taskId);
    Instant now = clock.instant();

    List<Object> reply =
        ScriptResults.asList(
            executor.execute(
                () ->
                    accessor
                        .global()
                        .eval(
                            QueueScripts.ENQUEUE,
                            List.of(
                                QueueKeys.queue(type),
                                QueueKeys.pending(type),
                                QueueKeys.tenant(type, scope),
                                QueueKeys.task(taskId),
                                QueueKeys.delayed(type)),
                            List.of(
                                taskId,
                                type.queueName(),
                                scope.value(),
                                payload,
                                String.valueOf(priority),
                                String.valueOf(request.maxAttempts()),
                                String.valueOf(now.toEpochMilli()),
                                String.valueOf(limit.maxSize()),
                                String.valueOf(limit.tenantLimit()))),
                TaskContext.of("TaskQueue", "enqueue", type.queueName())));

    long code = ScriptResults.longAt(reply, 0);
    if (code == -1) {
      log.warn("⚠️ [TaskQueue] queue full: type={}, maxSize={}", type.queueName(), limit.maxSize());
      throw new QueueFullException(type.queueName(), limit.maxSize());
    }
    if (code == -2) {
      log.warn(
          "⚠️ [TaskQueue] tenant share exhausted: type={}, scope={}, limit={}",
          type.queueName(),
          scope,
          limit.tenantLimit());
      throw new QueueFullException(type.queueName() + "/" + scope.value(), limit.tenantLimit());
    }
    if (code == 0) {
      Task existing = getTask(taskId);
      if (!existing.scope().equals(scope) || existing.type() != type) {
        throw new InvalidInputException("task id already in use: " + taskId);
      }
      log.debug("[TaskQueue] duplicate enqueue ignored: id={}", taskId);
      return existing;
    }
    metrics.operation(type, "enqueue");
    return new Task(
        taskId,
        type,
        scope,
        payload,
        priority,
        0,
        request.maxAttempts(),
        TaskStatus.QUEUED,
        now,
        null,
        null,
        null,
        null,
        null);
  }

  /** 모든 테넌트 대상 dequeue */
  public Optional<Task> dequeue(TaskType type) {
    return dequeueInternal(type, "");
  }

  /** 한 테넌트의 태스크만 dequeue */
  public Optional<Task> dequeue(TaskType type, TenantScope scope) {
    TenantScope resolved = accessor.resolveScope(scope, "queue.dequeue");
    return dequeueInternal(type, resolved.value());
  }

  /**
   * in_progress → succeeded
   *
   * @param result nullable
   */
  public Task complete(String taskId, String result) {
    TaskType taskType =
        executor
            .execute(
                () -> accessor.global().hashGet(QueueKeys.task(taskId), "type"),
                TaskContext.of("TaskQueue", "complete", taskId))
            .map(TaskType::fromQueueName)
            .orElseThrow(() -> new TaskNotFoundException(taskId));
    long code =
        ScriptResults.asLong(
            executor.execute(
                () ->
                    accessor
                        .global()
                        .eval(
                            QueueScripts.COMPLETE,
                            List.of(
                                QueueKeys.queue(taskType),
                                QueueKeys.inflight(taskType),
                                QueueKeys.task(taskId)),
                            List.of(
                                taskId,
                                String.valueOf(clock.millis()),
                                result == null ? "" : result,
                                String.valueOf(properties.taskTtl().toMillis()))),
                TaskContext.of("TaskQueue", "complete", taskId)));
    if (code == -1) {
      throw new TaskNotFoundException(taskId);
    }
    if (code == -2) {
      throw new InvalidTaskStateException(taskId, currentStatus(taskId), "complete");
    }
    metrics.operation(taskType, "complete");
    return getTask(taskId);
  }

  /**
   * in_progress 태스크의 실패 보고
   *
   * @param retryable false면 남은 시도 횟수와 관계없이 dead letter
   */
  public FailOutcome fail(String taskId, String error, boolean retryable) {
    Map<String, String> fields = readTask(taskId);
    return failInternal(taskId, fields, error, retryable);
  }

  public Task getTask(String taskId) {
    return findTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  public Optional<Task> findTask(String taskId) {
    Map<String, String> fields =
        executor.execute(
            () -> accessor.global().hashGetAll(QueueKeys.task(taskId)),
            TaskContext.of("TaskQueue", "getTask", taskId));
    return fields.isEmpty() ? Optional.empty() : Optional.of(TaskHashMapper.toTask(fields));
  }

  public QueueStats stats(TaskType type) {
    return executor.execute(
        () -> {
          KeyStoreClient store = accessor.global();
          Map<String, String> counters = store.hashGetAll(QueueKeys.queue(type));
          return new QueueStats(
              type,
              store.zCard(QueueKeys.pending(type)),
              store.zCard(QueueKeys.delayed(type)),
              store.zCard(QueueKeys.inflight(type)),
              store.zCard(QueueKeys.deadLetterIndex(type)),
              counter(counters, "enqueued_total"),
              counter(counters, "completed_total"),
              counter(counters, "failed_total"),
              counter(counters, "dead_lettered_total"),
              limitsOf(type).maxSize());
        },
        TaskContext.of("TaskQueue", "stats", type.queueName()));
  }

  public List<QueueStats> stats() {
    List<QueueStats> all = new ArrayList<>();
    for (TaskType type : TaskType.values()) {
      all.add(stats(type));
    }
    metrics.refresh(all);
    return all;
  }

  /**
   * 처리 제한 시간을 넘긴 in-flight 태스크를 재시도 가능한 실패로 처리
   *
   * @return 복구한 태스크 수
   */
  public int recoverExpiredInFlight(TaskType type, int batchSize) {
    List<String> expired =
        executor.execute(
            () ->
                accessor
                    .global()
                    .zRangeByScore(
                        QueueKeys.inflight(type),
                        Double.NEGATIVE_INFINITY,
                        clock.millis(),
                        batchSize),
            TaskContext.of("TaskQueue", "scanInflight", type.queueName()));
    int recovered = 0;
    for (String taskId : expired) {
      Map<String, String> fields =
          executor.execute(
              () -> accessor.global().hashGetAll(QueueKeys.task(taskId)),
              TaskContext.of("TaskQueue", "recover", taskId));
      if (fields.isEmpty() || !TaskStatus.IN_PROGRESS.wireValue().equals(fields.get("status"))) {
        executor.execute(
            () -> accessor.global().zRemove(QueueKeys.inflight(type), taskId),
            TaskContext.of("TaskQueue", "dropStaleInflight", taskId));
        continue;
      }
      try {
        failInternal(
            taskId,
            fields,
            "processing timeout exceeded (" + limitsOf(type).processingTimeout() + ")",
            true);
        metrics.operation(type, "recover");
        recovered++;
      } catch (InvalidTaskStateException e) {
        log.debug(
            "[TaskQueue] in-flight task {} changed during recovery: {}", taskId, e.getMessage());
      }
    }
    if (recovered > 0) {
      log.warn(
          "⚠️ [TaskQueue] recovered {} expired in-flight tasks: type={}",
          recovered,
          type.queueName());
    }
    return recovered;
  }

  /** 모든 큐 타입 대상 */
  public int recoverExpiredInFlight(int batchSize) {
    int total = 0;
    for (TaskType type : TaskType.values()) {
      total += recoverExpiredInFlight(type, batchSize);
    }
    return total;
  }

  public QueueLimits limitsOf(TaskType type) {
    return limits.get(type);
  }

  // ==================== internal ====================

  private Optional<Task> dequeueInternal(TaskType type, String scopeFilter) {
    long now = clock.millis();
    long deadline = now + limitsOf(type).processingTimeout().toMillis();
    Object reply =
        executor.execute(
            () ->
                accessor
                    .global()
                    .eval(
                        QueueScripts.DEQUEUE,
                        List.of(
                            QueueKeys.queue(type),
                            QueueKeys.pending(type),
                            QueueKeys.delayed(type),
                            QueueKeys.inflight(type)),
                        List.of(
                            String.valueOf(now),
                            String.valueOf(deadline),
                            QueueKeys.taskPrefix(),
                            QueueKeys.tenantPrefix(type),
                            scopeFilter,
                            String.valueOf(PROMOTION_BATCH))),
            TaskContext.of("TaskQueue", "dequeue", type.queueName()));
    Map<String, String> fields = ScriptResults.toMap(reply);
    if (fields.isEmpty()) {
      return Optional.empty();
    }
    metrics.operation(type, "dequeue");
    return Optional.of(TaskHashMapper.toTask(fields));
  }

  private FailOutcome failInternal(
      String taskId, Map<String, String> fields, String error, boolean retryable) {
    Task task = TaskHashMapper.toTask(fields);
    if (task.status() != TaskStatus.IN_PROGRESS) {
      throw new InvalidTaskStateException(taskId, task.status().wireValue(), "fail");
    }
    TaskType type = task.type();
    Instant now = clock.instant();
    String message = truncate(error);
    boolean retry = retryable && task.hasAttemptsRemaining();

    Duration delay = Duration.ZERO;
    String deadLetterJson = "";
    if (retry) {
      delay = backoff.delayFor(task.attempts());
    } else {
      deadLetterJson =
          serialize(
              deadLetterRecord(task, message, TaskHashMapper.autoRetryCount(fields), now), taskId);
    }
    Instant eligibleAt = now.plus(delay);
    int promoted = Math.max(0, task.priority() - 1);
    String disposition = retry ? "retry" : "dead";
    String json = deadLetterJson;

    long code =
        ScriptResults.asLong(
            executor.execute(
                () ->
                    accessor
                        .global()
                        .eval(
                            QueueScripts.FAIL,
                            List.of(
                                QueueKeys.queue(type),
                                QueueKeys.inflight(type),
                                QueueKeys.delayed(type),
                                QueueKeys.task(taskId),
                                QueueKeys.deadLetterIndex(type),
                                QueueKeys.deadLetterRecord(type, taskId)),
                            List.of(
                                taskId,
                                String.valueOf(task.attempts()),
                                String.valueOf(now.toEpochMilli()),
                                message,
                                disposition,
                                String.valueOf(eligibleAt.toEpochMilli()),
                                String.valueOf(promoted),
                                json,
                                String.valueOf(properties.taskTtl().toMillis()),
                                String.valueOf(properties.deadLetterRetention().toMillis()))),
                TaskContext.of("TaskQueue", "fail", taskId)));

    if (code == -1) {
      throw new TaskNotFoundException(taskId);
    }
    if (code == -2 || code == -3) {
      throw new InvalidTaskStateException(taskId, currentStatus(taskId), "fail");
    }
    if (code == 1) {
      metrics.operation(type, "retry");
      log.info(
          "[TaskQueue] retry scheduled: id={}, attempt {}/{}, delay={}",
          taskId,
          task.attempts(),
          task.maxAttempts(),
          delay);
      return new FailOutcome(Disposition.RETRY_SCHEDULED, task.attempts(), delay);
    }
    metrics.operation(type, "dead_letter");
    log.warn(
        "⚠️ [TaskQueue] dead-lettered: id={}, type={}, attempts={}, error={}",
        taskId,
        type.queueName(),
        task.attempts(),
        message);
    return new FailOutcome(Disposition.DEAD_LETTERED, task.attempts(), Duration.ZERO);
  }

  private DeadLetterRecord deadLetterRecord(
      Task task, String error, int autoRetryCount, Instant now) {
    FailureCategory category = FailureCategory.classify(error);
    Instant nextAutoRetryAt =
        category.isAutoRetryEligible() && autoRetryCount < properties.maxAutoRetries()
            ? now.plus(autoRetryDelay(autoRetryCount))
            : null;
    Task snapshot =
        new Task(
            task.id(),
            task.type(),
            task.scope(),
            task.payload(),
            task.priority(),
            task.attempts(),
            task.maxAttempts(),
            TaskStatus.DEAD_LETTERED,
            task.enqueuedAt(),
            task.startedAt(),
            now,
            null,
            error,
            null);
    return new DeadLetterRecord(
        snapshot, error, category, task.attempts(), now, autoRetryCount, nextAutoRetryAt);
  }

  /** 2^n 분, 최대 60분 */
  static Duration autoRetryDelay(int autoRetryCount) {
    long minutes = autoRetryCount >= 6 ? MAX_AUTO_RETRY_DELAY_MINUTES : 1L << autoRetryCount;
    return Duration.ofMinutes(Math.min(minutes, MAX_AUTO_RETRY_DELAY_MINUTES));
  }

  private Map<String, String> readTask(String taskId) {
    Map<String, String> fields =
        executor.execute(
            () -> accessor.global().hashGetAll(QueueKeys.task(taskId)),
            TaskContext.of("TaskQueue", "readTask", taskId));
    if (fields.isEmpty()) {
      throw new TaskNotFoundException(taskId);
    }
    return fields;
  }

  private String currentStatus(String taskId) {
    return executor.execute(
        () -> accessor.global().hashGet(QueueKeys.task(taskId), "status").orElse("missing"),
        TaskContext.of("TaskQueue", "status", taskId));
  }

  private String serialize(Object value, String taskId) {
    if (value == null) {
      return "";
    }
    if (value instanceof String s) {
      return s;
    }
    return executor.executeWithTranslation(
        () -> objectMapper.writeValueAsString(value),
        ExceptionTranslator.forJson(),
        TaskContext.of("TaskQueue", "serialize", taskId));
  }

  private static String requireTaskId(String taskId) {
    if (taskId.isBlank()
        || taskId.length() > MAX_TASK_ID_LENGTH
        || taskId.chars().anyMatch(Character::isWhitespace)) {
      throw new InvalidInputException(
          "task id must be 1.." + MAX_TASK_ID_LENGTH + " chars without whitespace");
    }
    return taskId;
  }

  private static String truncate(String error) {
    if (error == null) {
      return "";
    }
    return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
  }

  private static long counter(Map<String, String> counters, String name) {
    String value = counters.get(name);
    return value == null ? 0 : Long.parseLong(value);
  }
}
