package keystone.platform.scheduler;

import keystone.platform.domain.model.health.HealthReport;
import keystone.platform.infrastructure.config.MaintenanceProperties;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.executor.TaskContext;
import keystone.platform.infrastructure.health.KeyStoreHealthService;
import keystone.platform.infrastructure.queue.DeadLetterStore;
import keystone.platform.infrastructure.queue.TaskQueueManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 저장소 유지보수 스케줄러
 *
 * <h3>스케줄링 주기 (fixedDelay)</h3>
 *
 * <ul>
 *   <li>healthCheck: 30초
 *   <li>recoverInFlight: 30초 (처리 제한 시간 초과 태스크 재배달)
 *   <li>refreshQueueDepth: 15초 ({@code keystone.queue.depth} 게이지)
 *   <li>autoReprocessDeadLetters: 5분
 *   <li>purgeDeadLetters: 1시간
 * </ul>
 *
 * <p>여러 인스턴스가 동시에 실행해도 안전합니다. 모든 상태 전이가 원자 스크립트 안에서 CAS로 수행됩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "keystone.maintenance",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class StoreMaintenanceScheduler {

  private final KeyStoreHealthService healthService;
  private final TaskQueueManager queueManager;
  private final DeadLetterStore deadLetterStore;
  private final MaintenanceProperties properties;
  private final LogicExecutor executor;

  @Scheduled(fixedDelay = 30000, initialDelay = 5000)
  public void healthCheck() {
    HealthReport report = healthService.check();
    log.debug("[Maintenance] health={}, breaker={}", report.status(), report.breaker().snapshot());
  }

  @Scheduled(fixedDelay = 30000, initialDelay = 10000)
  public void recoverInFlight() {
    executor.executeVoid(
        () -> queueManager.recoverExpiredInFlight(properties.recoveryBatchSize()),
        TaskContext.of("Scheduler", "Queue.RecoverInFlight"));
  }

  @Scheduled(fixedDelay = 15000, initialDelay = 5000)
  public void refreshQueueDepth() {
    executor.executeVoid(queueManager::stats, TaskContext.of("Scheduler", "Queue.Depth"));
  }

  @Scheduled(fixedDelay = 300000, initialDelay = 60000)
  public void autoReprocessDeadLetters() {
    executor.executeVoid(
        () -> deadLetterStore.autoReprocess(properties.recoveryBatchSize()),
        TaskContext.of("Scheduler", "DeadLetter.AutoReprocess"));
  }

  @Scheduled(fixedDelay = 3600000, initialDelay = 120000)
  public void purgeDeadLetters() {
    executor.executeVoid(
        deadLetterStore::purgeExpired, TaskContext.of("Scheduler", "DeadLetter.Purge"));
  }
}
