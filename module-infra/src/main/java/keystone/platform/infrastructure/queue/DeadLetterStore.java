package keystone.platform.infrastructure.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import keystone.platform.core.port.out.ScoredMember;
import keystone.platform.domain.model.task.DeadLetterRecord;
import keystone.platform.domain.model.task.QueueLimits;
import keystone.platform.domain.model.task.Task;
import keystone.platform.domain.model.task.TaskType;
import keystone.platform.error.exception.InvalidInputException;
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
 * Dead Letter 저장소
 *
 * <h3>자동 재처리</h3>
 *
 * <p>일시적 장애로 분류된 실패(TIMEOUT, CONNECTION, RATE_LIMIT)만 대상입니다. n번째 자동 재처리는 dead letter 시각으로부터
 * min(2^n, 60)분 뒤이며 {@code keystone.queue.max-auto-retries}회까지 수행합니다.
 *
 * <h3>보존</h3>
 *
 * <p>{@code keystone.queue.dead-letter-retention}(기본 30일)이 지난 기록은 {@link #purgeExpired}가 삭제합니다.
 */
@Slf4j
public class DeadLetterStore {

  private static final int MAX_PAGE_SIZE = 500;

  private final TenantIsolatedAccessor accessor;
  private final LogicExecutor executor;
  private final ObjectMapper objectMapper;
  private final QueueProperties properties;
  private final TaskQueueManager queueManager;
  private final QueueMetrics metrics;
  private final Clock clock;

  public DeadLetterStore(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      ObjectMapper objectMapper,
      QueueProperties properties,
      TaskQueueManager queueManager,
      QueueMetrics metrics,
      Clock clock) {
    this.accessor = accessor;
    this.executor = executor;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.queueManager = queueManager;
    this.metrics = metrics;
    this.clock = clock;
  }

  /** 최신순 페이지 조회 */
  public List<DeadLetterRecord> list(TaskType type, int offset, int limit) {
    if (offset < 0 || limit < 1 || limit > MAX_PAGE_SIZE) {
      throw new InvalidInputException("offset >= 0 and 1 <= limit <= " + MAX_PAGE_SIZE);
    }
    String index = QueueKeys.deadLetterIndex(type);
    List<ScoredMember> page =
        executor.execute(
            () -> {
              long size = accessor.global().zCard(index);
              long end = size - 1 - offset;
              if (end < 0) {
                return List.<ScoredMember>of();
              }
              long start = Math.max(0, end - limit + 1);
              return accessor.global().zRangeWithScores(index, (int) start, (int) end);
            },
            TaskContext.of("DeadLetter", "list", type.queueName()));
    List<DeadLetterRecord> records = new ArrayList<>();
    for (ScoredMember member : page) {
      get(type, member.member()).ifPresent(records::add);
    }
    Collections.reverse(records);
    return records;
  }

  public Optional<DeadLetterRecord> get(TaskType type, String taskId) {
    Optional<String> json =
        executor.execute(
            () -> accessor.global().get(QueueKeys.deadLetterRecord(type, taskId)),
            TaskContext.of("DeadLetter", "get", taskId));
    return json.map(value -> deserialize(value, taskId));
  }

  /**
   * 수동 재처리: attempts를 0으로 초기화해 대기열에 다시 넣습니다.
   *
   * @throws TaskNotFoundException 기록 없음
   * @throws QueueFullException 대기열 가득 참
   */
  public Task reprocess(TaskType type, String taskId) {
    DeadLetterRecord record =
        get(type, taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    Task task = reprocess(record, record.autoRetryCount());
    log.info("[DeadLetter] reprocessed: id={}, type={}", taskId, type.queueName());
    return task;
  }

  /** @return 기록이 있어 삭제되었으면 true */
  public boolean remove(TaskType type, String taskId) {
    return executor.execute(
        () -> {
          long deleted =
              accessor.global().delete(List.of(QueueKeys.deadLetterRecord(type, taskId)));
          boolean indexed = accessor.global().zRemove(QueueKeys.deadLetterIndex(type), taskId);
          return deleted > 0 || indexed;
        },
        TaskContext.of("DeadLetter", "remove", taskId));
  }

  /** 보존 기간이 지난 기록 삭제 */
  public long purgeExpired(TaskType type) {
    long cutoff = clock.millis() - properties.deadLetterRetention().toMillis();
    String index = QueueKeys.deadLetterIndex(type);
    long purged =
        executor.execute(
            () -> {
              List<String> expired =
                  accessor
                      .global()
                      .zRangeByScore(index, Double.NEGATIVE_INFINITY, cutoff, Integer.MAX_VALUE);
              if (expired.isEmpty()) {
                return 0L;
              }
              List<String> recordKeys = new ArrayList<>();
              for (String taskId : expired) {
                recordKeys.add(QueueKeys.deadLetterRecord(type, taskId));
              }
              accessor.global().delete(recordKeys);
              return accessor.global().zRemoveRangeByScore(index, Double.NEGATIVE_INFINITY, cutoff);
            },
            TaskContext.of("DeadLetter", "purge", type.queueName()));
    if (purged > 0) {
      log.info("[DeadLetter] purged {} expired records: type={}", purged, type.queueName());
    }
    return purged;
  }

  public long purgeExpired() {
    long total = 0;
    for (TaskType type : TaskType.values()) {
      total += purgeExpired(type);
    }
    return total;
  }

  /**
   * 자동 재처리 대상 중 시각이 된 기록을 대기열로 되돌립니다.
   *
   * @param batchSize 큐 타입마다 검사할 최대 기록 수 (오래된 순)
   * @return 재처리한 수
   */
  public int autoReprocess(int batchSize) {
    Instant now = clock.instant();
    int reprocessed = 0;
    for (TaskType type : TaskType.values()) {
      String index = QueueKeys.deadLetterIndex(type);
      List<ScoredMember> oldest =
          executor.execute(
              () -> accessor.global().zRangeWithScores(index, 0, batchSize - 1),
              TaskContext.of("DeadLetter", "scan", type.queueName()));
      for (ScoredMember member : oldest) {
        Optional<DeadLetterRecord> record = get(type, member.member());
        if (record.isEmpty()) {
          executor.execute(
              () -> accessor.global().zRemove(index, member.member()),
              TaskContext.of("DeadLetter", "dropOrphan", member.member()));
          continue;
        }
        if (!record.get().isAutoRetryDue(now, properties.maxAutoRetries())) {
          continue;
        }
        try {
          reprocess(record.get(), record.get().autoRetryCount() + 1);
          reprocessed++;
        } catch (QueueFullException e) {
          log.warn(
              "⚠️ [DeadLetter] auto reprocess deferred, queue full: type={}", type.queueName());
          break;
        }
      }
    }
    if (reprocessed > 0) {
      log.info("[DeadLetter] auto reprocessed {} tasks", reprocessed);
    }
    return reprocessed;
  }

  // ==================== internal ====================

  private Task reprocess(DeadLetterRecord record, int autoRetryCount) {
    Task task = record.task();
    TaskType type = task.type();
    QueueLimits limits = queueManager.limitsOf(type);
    long code =
        ScriptResults.asLong(
            executor.execute(
                () ->
                    accessor
                        .global()
                        .eval(
                            QueueScripts.REPROCESS,
                            List.of(
                                QueueKeys.queue(type),
                                QueueKeys.pending(type),
                                QueueKeys.delayed(type),
                                QueueKeys.deadLetterIndex(type),
                                QueueKeys.deadLetterRecord(type, task.id()),
                                QueueKeys.task(task.id()),
                                QueueKeys.tenant(type, task.scope())),
                            List.of(
                                task.id(),
                                type.queueName(),
                                task.scope().value(),
                                task.payload() == null ? "" : task.payload(),
                                String.valueOf(limits.clampPriority(task.priority())),
                                String.valueOf(task.maxAttempts()),
                                String.valueOf(clock.millis()),
                                String.valueOf(limits.maxSize()),
                                String.valueOf(autoRetryCount))),
                TaskContext.of("DeadLetter", "reprocess", task.id())));
    if (code == -1) {
      throw new TaskNotFoundException(task.id());
    }
    if (code == -2) {
      throw new QueueFullException(type.queueName(), limits.maxSize());
    }
    metrics.operation(type, "reprocess");
    return queueManager.getTask(task.id());
  }

  private DeadLetterRecord deserialize(String json, String taskId) {
    return executor.executeWithTranslation(
        () -> objectMapper.readValue(json, DeadLetterRecord.class),
        ExceptionTranslator.forJson(),
        TaskContext.of("DeadLetter", "deserialize", taskId));
  }
}
