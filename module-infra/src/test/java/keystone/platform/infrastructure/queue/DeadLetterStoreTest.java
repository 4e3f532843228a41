package keystone.platform.infrastructure.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import keystone.platform.domain.model.task.DeadLetterRecord;
import keystone.platform.domain.model.task.EnqueueRequest;
import keystone.platform.domain.model.task.FailureCategory;
import keystone.platform.domain.model.task.Task;
import keystone.platform.domain.model.task.TaskStatus;
import keystone.platform.domain.model.task.TaskType;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.error.exception.TaskNotFoundException;
import keystone.platform.infrastructure.config.QueueProperties;
import keystone.platform.infrastructure.config.TenantProperties;
import keystone.platform.infrastructure.executor.DefaultLogicExecutor;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.keystore.InMemoryKeyStoreClient;
import keystone.platform.infrastructure.support.MutableClock;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DeadLetterStore")
class DeadLetterStoreTest {

  private static final TenantScope ACME = TenantScope.of("acme");

  private MutableClock clock;
  private TaskQueueManager queue;
  private DeadLetterStore deadLetters;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    TenantIsolatedAccessor accessor =
        new TenantIsolatedAccessor(new InMemoryKeyStoreClient(clock), TenantProperties.strict());
    LogicExecutor executor = new DefaultLogicExecutor();
    ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    QueueProperties properties = TaskQueueManagerTest.testProperties();
    QueueMetrics metrics = new QueueMetrics(new SimpleMeterRegistry());
    queue = new TaskQueueManager(accessor, executor, objectMapper, properties, metrics, clock);
    deadLetters =
        new DeadLetterStore(accessor, executor, objectMapper, properties, queue, metrics, clock);
  }

  /** 시도 1회짜리 태스크를 꺼내 실패시켜 dead letter로 보낸다 */
  private Task deadLetter(String taskId, String error) {
    queue.enqueue(
        EnqueueRequest.builder()
            .taskId(taskId)
            .type(TaskType.EMBEDDINGS)
            .scope(ACME)
            .payload("{\"doc\":\"" + taskId + "\"}")
            .maxAttempts(1)
            .build());
    Task taken = queue.dequeue(TaskType.EMBEDDINGS).orElseThrow();
    queue.fail(taken.id(), error, true);
    return taken;
  }

  @Test
  @DisplayName("실패 정보와 분류, 다음 자동 재처리 시각을 기록한다")
  void recordsFailure() {
    deadLetter("t-1", "connection reset by peer");

    DeadLetterRecord record = deadLetters.get(TaskType.EMBEDDINGS, "t-1").orElseThrow();

    assertThat(record.errorMessage()).isEqualTo("connection reset by peer");
    assertThat(record.category()).isEqualTo(FailureCategory.CONNECTION);
    assertThat(record.attempts()).isEqualTo(1);
    assertThat(record.deadLetteredAt()).isEqualTo(clock.instant());
    assertThat(record.autoRetryCount()).isZero();
    assertThat(record.nextAutoRetryAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(1)));
    assertThat(record.task().status()).isEqualTo(TaskStatus.DEAD_LETTERED);
    assertThat(record.task().scope()).isEqualTo(ACME);
    assertThat(record.task().payload()).isEqualTo("{\"doc\":\"t-1\"}");
  }

  @Test
  @DisplayName("list는 최신순으로 페이지를 나눠 돌려준다")
  void listsNewestFirst() {
    deadLetter("t-1", "boom");
    clock.advance(Duration.ofSeconds(1));
    deadLetter("t-2", "boom");
    clock.advance(Duration.ofSeconds(1));
    deadLetter("t-3", "boom");

    assertThat(deadLetters.list(TaskType.EMBEDDINGS, 0, 10))
        .extracting(r -> r.task().id())
        .containsExactly("t-3", "t-2", "t-1");
    assertThat(deadLetters.list(TaskType.EMBEDDINGS, 1, 1))
        .extracting(r -> r.task().id())
        .containsExactly("t-2");
    assertThat(deadLetters.list(TaskType.EMBEDDINGS, 5, 10)).isEmpty();
    assertThatThrownBy(() -> deadLetters.list(TaskType.EMBEDDINGS, 0, 0))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  @DisplayName("수동 재처리는 시도 횟수를 초기화해 대기열로 되돌린다")
  void reprocessesManually() {
    deadLetter("t-1", "invalid payload");

    Task requeued = deadLetters.reprocess(TaskType.EMBEDDINGS, "t-1");

    assertThat(requeued.status()).isEqualTo(TaskStatus.QUEUED);
    assertThat(requeued.attempts()).isZero();
    assertThat(deadLetters.get(TaskType.EMBEDDINGS, "t-1")).isEmpty();
    assertThat(queue.stats(TaskType.EMBEDDINGS).deadLettered()).isZero();
    Task taken = queue.dequeue(TaskType.EMBEDDINGS).orElseThrow();
    assertThat(taken.id()).isEqualTo("t-1");
    assertThat(taken.payload()).isEqualTo("{\"doc\":\"t-1\"}");
    assertThatThrownBy(() -> deadLetters.reprocess(TaskType.EMBEDDINGS, "t-1"))
        .isInstanceOf(TaskNotFoundException.class);
  }

  @Test
  @DisplayName("remove는 기록이 있을 때만 true")
  void removes() {
    deadLetter("t-1", "boom");

    assertThat(deadLetters.remove(TaskType.EMBEDDINGS, "t-1")).isTrue();
    assertThat(deadLetters.remove(TaskType.EMBEDDINGS, "t-1")).isFalse();
    assertThat(deadLetters.list(TaskType.EMBEDDINGS, 0, 10)).isEmpty();
  }

  @Test
  @DisplayName("보존 기간이 지난 기록을 색인과 함께 삭제한다")
  void purgesExpired() {
    deadLetter("t-1", "boom");
    clock.advance(Duration.ofDays(29));
    deadLetter("t-2", "boom");

    assertThat(deadLetters.purgeExpired()).isZero();

    clock.advance(Duration.ofDays(2));

    assertThat(deadLetters.purgeExpired()).isEqualTo(1);
    assertThat(deadLetters.list(TaskType.EMBEDDINGS, 0, 10))
        .extracting(r -> r.task().id())
        .containsExactly("t-2");
  }

  @Nested
  @DisplayName("자동 재처리")
  class AutoReprocess {

    @Test
    @DisplayName("일시적 장애는 예정 시각이 되면 대기열로 돌아가고 간격이 늘어난다")
    void transientFailureBacksOff() {
      deadLetter("t-1", "request timed out");
      clock.advance(Duration.ofSeconds(59));

      assertThat(deadLetters.autoReprocess(10)).isZero();

      clock.advance(Duration.ofSeconds(1));

      assertThat(deadLetters.autoReprocess(10)).isEqualTo(1);
      Task taken = queue.dequeue(TaskType.EMBEDDINGS).orElseThrow();
      queue.fail(taken.id(), "request timed out", true);
      DeadLetterRecord again = deadLetters.get(TaskType.EMBEDDINGS, "t-1").orElseThrow();
      assertThat(again.autoRetryCount()).isEqualTo(1);
      assertThat(again.nextAutoRetryAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(2)));
    }

    @Test
    @DisplayName("영구 실패는 자동 재처리하지 않는다")
    void permanentFailureStays() {
      deadLetter("t-1", "invalid payload");
      clock.advance(Duration.ofHours(2));

      assertThat(deadLetters.autoReprocess(10)).isZero();
      List<DeadLetterRecord> records = deadLetters.list(TaskType.EMBEDDINGS, 0, 10);
      assertThat(records).hasSize(1);
      assertThat(records.get(0).category()).isEqualTo(FailureCategory.VALIDATION);
      assertThat(records.get(0).nextAutoRetryAt()).isNull();
    }
  }
}
