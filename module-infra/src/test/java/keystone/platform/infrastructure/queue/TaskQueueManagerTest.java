package keystone.platform.infrastructure.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import keystone.platform.domain.model.task.EnqueueRequest;
import keystone.platform.domain.model.task.FailOutcome;
import keystone.platform.domain.model.task.FailOutcome.Disposition;
import keystone.platform.domain.model.task.QueueStats;
import keystone.platform.domain.model.task.Task;
import keystone.platform.domain.model.task.TaskPriority;
import keystone.platform.domain.model.task.TaskStatus;
import keystone.platform.domain.model.task.TaskType;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.error.exception.InvalidTaskStateException;
import keystone.platform.error.exception.QueueFullException;
import keystone.platform.error.exception.ScopeRequiredException;
import keystone.platform.error.exception.TaskNotFoundException;
import keystone.platform.infrastructure.config.QueueProperties;
import keystone.platform.infrastructure.config.QueueProperties.RetrySpec;
import keystone.platform.infrastructure.config.QueueProperties.TypeSpec;
import keystone.platform.infrastructure.config.TenantProperties;
import keystone.platform.infrastructure.executor.DefaultLogicExecutor;
import keystone.platform.infrastructure.keystore.InMemoryKeyStoreClient;
import keystone.platform.infrastructure.support.MutableClock;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TaskQueueManager")
class TaskQueueManagerTest {

  private static final TenantScope ACME = TenantScope.of("acme");
  private static final TenantScope GLOBEX = TenantScope.of("globex");
  private static final TenantScope INITECH = TenantScope.of("initech");

  /** 지터 없는 재시도: 1회차 실패 후 2초, 2회차 후 4초 */
  static QueueProperties testProperties() {
    return new QueueProperties(
        new RetrySpec(
            Duration.ofSeconds(1), 2.0, Duration.ofMinutes(1), 0.0, Duration.ofMillis(100)),
        null,
        null,
        null,
        Map.of("cleanup", new TypeSpec(4, null, null, 0.5)));
  }

  private MutableClock clock;
  private SimpleMeterRegistry meterRegistry;
  private TaskQueueManager queue;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    meterRegistry = new SimpleMeterRegistry();
    InMemoryKeyStoreClient store = new InMemoryKeyStoreClient(clock);
    queue =
        new TaskQueueManager(
            new TenantIsolatedAccessor(store, TenantProperties.strict()),
            new DefaultLogicExecutor(),
            JsonMapper.builder().findAndAddModules().build(),
            testProperties(),
            new QueueMetrics(meterRegistry),
            clock);
  }

  private Task enqueue(TaskType type, TenantScope scope, TaskPriority priority) {
    return queue.enqueue(EnqueueRequest.of(type, scope, "{}", priority));
  }

  private Task dequeue(TaskType type) {
    return queue.dequeue(type).orElseThrow();
  }

  @Nested
  @DisplayName("enqueue / dequeue")
  class Ordering {

    @Test
    @DisplayName("우선순위가 높은 태스크부터, 같은 우선순위는 들어온 순서대로 꺼낸다")
    void priorityThenFifo() {
      Task low = enqueue(TaskType.EMBEDDINGS, ACME, TaskPriority.LOW);
      Task first = enqueue(TaskType.EMBEDDINGS, ACME, TaskPriority.HIGH);
      Task second = enqueue(TaskType.EMBEDDINGS, GLOBEX, TaskPriority.HIGH);

      assertThat(dequeue(TaskType.EMBEDDINGS).id()).isEqualTo(first.id());
      assertThat(dequeue(TaskType.EMBEDDINGS).id()).isEqualTo(second.id());
      assertThat(dequeue(TaskType.EMBEDDINGS).id()).isEqualTo(low.id());
      assertThat(queue.dequeue(TaskType.EMBEDDINGS)).isEmpty();
    }

    @Test
    @DisplayName("우선순위는 큐 타입의 레벨 수에 맞게 보정된다")
    void clampsPriority() {
      Task task = enqueue(TaskType.CLEANUP, ACME, TaskPriority.BACKGROUND);

      assertThat(task.priority()).isEqualTo(1);
      assertThat(queue.getTask(task.id()).priority()).isEqualTo(1);
    }

    @Test
    @DisplayName("꺼낸 태스크는 in_progress이고 시도 횟수가 1 증가한다")
    void dequeueMarksInProgress() {
      Map<String, String> payload = Map.of("doc", "d-1");
      Task queued =
          queue.enqueue(
              EnqueueRequest.of(TaskType.EMBEDDINGS, ACME, payload, TaskPriority.NORMAL));

      Task taken = dequeue(TaskType.EMBEDDINGS);

      assertThat(queued.status()).isEqualTo(TaskStatus.QUEUED);
      assertThat(taken.status()).isEqualTo(TaskStatus.IN_PROGRESS);
      assertThat(taken.attempts()).isEqualTo(1);
      assertThat(taken.startedAt()).isEqualTo(clock.instant());
      assertThat(taken.payload()).isEqualTo("{\"doc\":\"d-1\"}");
      assertThat(taken.scope()).isEqualTo(ACME);
    }

    @Test
    @DisplayName("테넌트를 지정하면 그 테넌트의 태스크만 꺼낸다")
    void dequeueByTenant() {
      Task acme = enqueue(TaskType.EMBEDDINGS, ACME, TaskPriority.HIGH);
      Task globex = enqueue(TaskType.EMBEDDINGS, GLOBEX, TaskPriority.LOW);

      assertThat(queue.dequeue(TaskType.EMBEDDINGS, GLOBEX).orElseThrow().id())
          .isEqualTo(globex.id());
      assertThat(queue.dequeue(TaskType.EMBEDDINGS, GLOBEX)).isEmpty();
      assertThat(dequeue(TaskType.EMBEDDINGS).id()).isEqualTo(acme.id());
    }

    @Test
    @DisplayName("같은 taskId 재등록은 기존 태스크를 돌려주고 다른 테넌트면 거부한다")
    void duplicateTaskId() {
      EnqueueRequest request =
          EnqueueRequest.builder().taskId("job-1").type(TaskType.CLEANUP).scope(ACME).build();

      Task first = queue.enqueue(request);
      Task again = queue.enqueue(request);

      assertThat(again.id()).isEqualTo(first.id());
      assertThat(queue.stats(TaskType.CLEANUP).enqueuedTotal()).isEqualTo(1);
      assertThatThrownBy(
              () ->
                  queue.enqueue(
                      EnqueueRequest.builder()
                          .taskId("job-1")
                          .type(TaskType.CLEANUP)
                          .scope(GLOBEX)
                          .build()))
          .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("잘못된 입력과 스코프 누락을 거부한다")
    void validatesInput() {
      assertThatThrownBy(
              () ->
                  queue.enqueue(
                      EnqueueRequest.builder()
                          .taskId("has space")
                          .type(TaskType.CLEANUP)
                          .scope(ACME)
                          .build()))
          .isInstanceOf(InvalidInputException.class);
      EnqueueRequest unscoped = EnqueueRequest.of(TaskType.CLEANUP, null, "{}", TaskPriority.LOW);
      assertThatThrownBy(() -> queue.enqueue(unscoped))
          .isInstanceOf(ScopeRequiredException.class);
      assertThatThrownBy(
              () ->
                  EnqueueRequest.builder()
                      .type(TaskType.CLEANUP)
                      .scope(ACME)
                      .maxAttempts(11)
                      .build())
          .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("16개 스레드가 동시에 꺼내도 200개 태스크가 정확히 한 번씩만 나간다")
    void concurrentDequeueHandsOutEachTaskOnce() throws InterruptedException {
      int taskCount = 200;
      int threadCount = 16;
      Set<String> enqueued = new HashSet<>();
      for (int i = 0; i < taskCount; i++) {
        TenantScope scope = i % 2 == 0 ? ACME : GLOBEX;
        enqueued.add(enqueue(TaskType.EMBEDDINGS, scope, TaskPriority.NORMAL).id());
      }

      ExecutorService workers = Executors.newFixedThreadPool(threadCount);
      CountDownLatch start = new CountDownLatch(1);
      CountDownLatch done = new CountDownLatch(threadCount);
      Queue<String> dequeued = new ConcurrentLinkedQueue<>();
      for (int t = 0; t < threadCount; t++) {
        workers.submit(
            () -> {
              try {
                start.await();
                Optional<Task> next;
                while ((next = queue.dequeue(TaskType.EMBEDDINGS)).isPresent()) {
                  dequeued.add(next.get().id());
                }
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              } finally {
                done.countDown();
              }
            });
      }
      start.countDown();
      assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
      workers.shutdown();

      assertThat(dequeued).hasSize(taskCount);
      assertThat(new HashSet<>(dequeued)).isEqualTo(enqueued);
      assertThat(queue.stats(TaskType.EMBEDDINGS).pending()).isZero();
    }
  }

  @Nested
  @DisplayName("용량 제한")
  class Capacity {

    @Test
    @DisplayName("테넌트 몫을 넘으면 거부하고 다른 테넌트는 계속 받는다")
    void tenantShare() {
      enqueue(TaskType.CLEANUP, ACME, TaskPriority.HIGH);
      enqueue(TaskType.CLEANUP, ACME, TaskPriority.HIGH);

      assertThatThrownBy(() -> enqueue(TaskType.CLEANUP, ACME, TaskPriority.HIGH))
          .isInstanceOf(QueueFullException.class);
      assertThat(enqueue(TaskType.CLEANUP, GLOBEX, TaskPriority.HIGH).status())
          .isEqualTo(TaskStatus.QUEUED);
    }

    @Test
    @DisplayName("큐 전체가 가득 차면 거부하고 꺼내면 다시 받는다")
    void queueFull() {
      enqueue(TaskType.CLEANUP, ACME, TaskPriority.HIGH);
      enqueue(TaskType.CLEANUP, ACME, TaskPriority.HIGH);
      enqueue(TaskType.CLEANUP, GLOBEX, TaskPriority.HIGH);
      enqueue(TaskType.CLEANUP, GLOBEX, TaskPriority.HIGH);

      assertThatThrownBy(() -> enqueue(TaskType.CLEANUP, INITECH, TaskPriority.HIGH))
          .isInstanceOf(QueueFullException.class);

      dequeue(TaskType.CLEANUP);

      assertThat(enqueue(TaskType.CLEANUP, INITECH, TaskPriority.HIGH)).isNotNull();
    }
  }

  @Nested
  @DisplayName("complete / fail")
  class Lifecycle {

    @Test
    @DisplayName("complete는 결과와 완료 시각을 기록하고 두 번째 호출은 거부한다")
    void completes() {
      Task task = enqueue(TaskType.EMBEDDINGS, ACME, TaskPriority.NORMAL);
      dequeue(TaskType.EMBEDDINGS);
      clock.advance(Duration.ofSeconds(3));

      Task done = queue.complete(task.id(), "ok");

      assertThat(done.status()).isEqualTo(TaskStatus.SUCCEEDED);
      assertThat(done.result()).isEqualTo("ok");
      assertThat(done.completedAt()).isEqualTo(clock.instant());
      assertThat(queue.stats(TaskType.EMBEDDINGS).inFlight()).isZero();
      assertThatThrownBy(() -> queue.complete(task.id(), "again"))
          .isInstanceOf(InvalidTaskStateException.class);
      assertThatThrownBy(() -> queue.complete("missing", null))
          .isInstanceOf(TaskNotFoundException.class);
    }

    @Test
    @DisplayName("재시도 가능한 실패는 backoff 후 한 단계 높은 우선순위로 돌아온다")
    void retriesWithBackoff() {
      Task task = enqueue(TaskType.EMBEDDINGS, ACME, TaskPriority.NORMAL);
      dequeue(TaskType.EMBEDDINGS);

      FailOutcome outcome = queue.fail(task.id(), "upstream 503", true);

      assertThat(outcome.disposition()).isEqualTo(Disposition.RETRY_SCHEDULED);
      assertThat(outcome.retryDelay()).isEqualTo(Duration.ofSeconds(2));
      Task failed = queue.getTask(task.id());
      assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
      assertThat(failed.lastError()).isEqualTo("upstream 503");
      assertThat(failed.nextAttemptAt()).isEqualTo(clock.instant().plusSeconds(2));
      assertThat(queue.stats(TaskType.EMBEDDINGS).delayed()).isEqualTo(1);
      assertThat(queue.dequeue(TaskType.EMBEDDINGS)).isEmpty();

      clock.advance(Duration.ofSeconds(2));
      Task retried = dequeue(TaskType.EMBEDDINGS);

      assertThat(retried.id()).isEqualTo(task.id());
      assertThat(retried.attempts()).isEqualTo(2);
      assertThat(retried.priority()).isEqualTo(TaskPriority.HIGH.level());
      assertThat(queue.fail(task.id(), "upstream 503", true).retryDelay())
          .isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("시도 횟수를 모두 쓰면 dead letter로 보낸다")
    void deadLettersWhenExhausted() {
      Task task =
          queue.enqueue(
              EnqueueRequest.builder()
                  .type(TaskType.EMBEDDINGS)
                  .scope(ACME)
                  .payload("{}")
                  .maxAttempts(1)
                  .build());
      dequeue(TaskType.EMBEDDINGS);

      FailOutcome outcome = queue.fail(task.id(), "connection reset", true);

      assertThat(outcome.isDeadLettered()).isTrue();
      assertThat(queue.getTask(task.id()).status()).isEqualTo(TaskStatus.DEAD_LETTERED);
      QueueStats stats = queue.stats(TaskType.EMBEDDINGS);
      assertThat(stats.deadLettered()).isEqualTo(1);
      assertThat(stats.deadLetteredTotal()).isEqualTo(1);
      assertThat(stats.failedTotal()).isEqualTo(1);
      assertThat(stats.inFlight()).isZero();
    }

    @Test
    @DisplayName("재시도 불가 실패는 남은 시도와 관계없이 dead letter로 보낸다")
    void deadLettersWhenNotRetryable() {
      Task task = enqueue(TaskType.EMBEDDINGS, ACME, TaskPriority.NORMAL);
      dequeue(TaskType.EMBEDDINGS);

      FailOutcome outcome = queue.fail(task.id(), "invalid payload", false);

      assertThat(outcome.disposition()).isEqualTo(Disposition.DEAD_LETTERED);
      assertThat(outcome.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("in_progress가 아닌 태스크의 실패 보고는 거부한다")
    void failRequiresInProgress() {
      Task task = enqueue(TaskType.EMBEDDINGS, ACME, TaskPriority.NORMAL);

      assertThatThrownBy(() -> queue.fail(task.id(), "boom", true))
          .isInstanceOf(InvalidTaskStateException.class);
      assertThatThrownBy(() -> queue.fail("missing", "boom", true))
          .isInstanceOf(TaskNotFoundException.class);
    }
  }

  @Test
  @DisplayName("처리 제한 시간을 넘긴 in-flight 태스크를 재시도로 돌린다")
  void recoversExpiredInFlight() {
    Task task = enqueue(TaskType.HEALTH_CHECKS, ACME, TaskPriority.NORMAL);
    dequeue(TaskType.HEALTH_CHECKS);

    assertThat(queue.recoverExpiredInFlight(TaskType.HEALTH_CHECKS, 10)).isZero();

    clock.advance(Duration.ofMinutes(2));

    assertThat(queue.recoverExpiredInFlight(10)).isEqualTo(1);
    Task recovered = queue.getTask(task.id());
    assertThat(recovered.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(recovered.lastError()).contains("processing timeout");
    assertThat(queue.stats(TaskType.HEALTH_CHECKS).inFlight()).isZero();
  }

  @Test
  @DisplayName("stats()는 큐별 통계를 모으고 depth 게이지를 갱신한다")
  void statsRefreshGauges() {
    enqueue(TaskType.EMBEDDINGS, ACME, TaskPriority.NORMAL);
    enqueue(TaskType.EMBEDDINGS, ACME, TaskPriority.NORMAL);
    dequeue(TaskType.EMBEDDINGS);

    QueueStats embeddings =
        queue.stats().stream()
            .filter(s -> s.type() == TaskType.EMBEDDINGS)
            .findFirst()
            .orElseThrow();

    assertThat(embeddings.pending()).isEqualTo(1);
    assertThat(embeddings.inFlight()).isEqualTo(1);
    assertThat(embeddings.enqueuedTotal()).isEqualTo(2);
    assertThat(embeddings.utilization()).isEqualTo(1 / 1000.0);
    assertThat(
            meterRegistry
                .get("keystone.queue.depth")
                .tag("type", "embeddings")
                .tag("state", "pending")
                .gauge()
                .value())
        .isEqualTo(1.0);
  }
}
