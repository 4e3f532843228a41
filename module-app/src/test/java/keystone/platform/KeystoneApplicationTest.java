package keystone.platform;

import static org.assertj.core.api.Assertions.assertThat;

import keystone.platform.domain.model.health.HealthStatus;
import keystone.platform.domain.model.task.EnqueueRequest;
import keystone.platform.domain.model.task.Task;
import keystone.platform.domain.model.task.TaskPriority;
import keystone.platform.domain.model.task.TaskType;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.infrastructure.health.KeyStoreHealthService;
import keystone.platform.infrastructure.queue.TaskQueueManager;
import keystone.platform.lifecycle.QueueWorkerLifecycle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    properties = {"keystone.store.mode=in-memory", "keystone.maintenance.enabled=false"})
@DisplayName("애플리케이션 컨텍스트 (in-memory 모드)")
class KeystoneApplicationTest {

  @Autowired private ApplicationContext context;
  @Autowired private KeyStoreHealthService healthService;
  @Autowired private TaskQueueManager queueManager;

  @Test
  @DisplayName("Redis 없이 기동하고 HEALTHY로 보고한다")
  void startsWithoutRedis() {
    assertThat(context.getBeansOfType(RedissonClient.class)).isEmpty();
    assertThat(context.getBean(QueueWorkerLifecycle.class).isRunning()).isTrue();
    assertThat(healthService.check().status()).isEqualTo(HealthStatus.HEALTHY);
  }

  @Test
  @DisplayName("조립된 큐로 enqueue → dequeue 가 동작한다")
  void queueRoundTrip() {
    TenantScope scope = TenantScope.of("app-test");
    Task queued =
        queueManager.enqueue(
            EnqueueRequest.of(TaskType.CLEANUP, scope, "{\"path\":\"/tmp\"}", TaskPriority.HIGH));

    Task taken = queueManager.dequeue(TaskType.CLEANUP, scope).orElseThrow();

    assertThat(taken.id()).isEqualTo(queued.id());
    assertThat(taken.attempts()).isEqualTo(1);
  }
}
