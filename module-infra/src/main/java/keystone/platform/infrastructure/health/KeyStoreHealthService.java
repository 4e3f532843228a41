package keystone.platform.infrastructure.health;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import keystone.platform.core.port.out.KeyStoreClient;
import keystone.platform.domain.model.breaker.CircuitBreakerStatus;
import keystone.platform.domain.model.breaker.CircuitState;
import keystone.platform.domain.model.health.HealthReport;
import keystone.platform.domain.model.health.HealthStatus;
import keystone.platform.domain.model.task.QueueStats;
import keystone.platform.domain.model.task.TaskType;
import keystone.platform.infrastructure.config.MaintenanceProperties;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.executor.TaskContext;
import keystone.platform.infrastructure.queue.TaskQueueManager;
import keystone.platform.infrastructure.resilience.StoreCircuitBreaker;
import lombok.extern.slf4j.Slf4j;

/**
 * 저장소 헬스 체크
 *
 * <h3>판정</h3>
 *
 * <pre>
 * UNHEALTHY : PING 실패 또는 서킷 OPEN
 * DEGRADED  : 서킷 HALF_OPEN 또는 큐 사용률 &gt; keystone.maintenance.queue-degraded-utilization
 * HEALTHY   : 그 외
 * </pre>
 *
 * <p>마지막 리포트를 보관하며, 상태가 바뀔 때만 로그를 남깁니다.
 */
@Slf4j
public class KeyStoreHealthService {

  private final KeyStoreClient store;
  private final StoreCircuitBreaker breaker;
  private final TaskQueueManager queueManager;
  private final MaintenanceProperties properties;
  private final LogicExecutor executor;
  private final Clock clock;
  private volatile HealthReport lastReport;

  public KeyStoreHealthService(
      KeyStoreClient store,
      StoreCircuitBreaker breaker,
      TaskQueueManager queueManager,
      MaintenanceProperties properties,
      LogicExecutor executor,
      Clock clock) {
    this.store = store;
    this.breaker = breaker;
    this.queueManager = queueManager;
    this.properties = properties;
    this.executor = executor;
    this.clock = clock;
  }

  public HealthReport check() {
    long started = System.nanoTime();
    boolean reachable =
        executor.executeOrDefault(
            () -> "PONG".equalsIgnoreCase(store.ping()), false, TaskContext.of("Health", "ping"));
    Duration latency = reachable ? Duration.ofNanos(System.nanoTime() - started) : null;

    Map<TaskType, QueueStats> queues = new EnumMap<>(TaskType.class);
    if (reachable) {
      List<QueueStats> stats =
          executor.executeOrDefault(
              queueManager::stats, List.of(), TaskContext.of("Health", "queueStats"));
      for (QueueStats s : stats) {
        queues.put(s.type(), s);
      }
    }

    CircuitBreakerStatus breakerStatus = breaker.status();
    HealthStatus status = evaluate(reachable, breakerStatus.snapshot().state(), queues);
    HealthReport report =
        new HealthReport(status, reachable, latency, breakerStatus, queues, clock.instant());
    logTransition(report);
    lastReport = report;
    return report;
  }

  /** 아직 검사 전이면 null */
  public HealthReport lastReport() {
    return lastReport;
  }

  HealthStatus evaluate(
      boolean reachable, CircuitState state, Map<TaskType, QueueStats> queues) {
    if (!reachable || state == CircuitState.OPEN) {
      return HealthStatus.UNHEALTHY;
    }
    if (state == CircuitState.HALF_OPEN) {
      return HealthStatus.DEGRADED;
    }
    boolean saturated =
        queues.values().stream()
            .anyMatch(s -> s.utilization() > properties.queueDegradedUtilization());
    return saturated ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
  }

  private void logTransition(HealthReport report) {
    HealthReport previous = lastReport;
    HealthStatus before = previous == null ? HealthStatus.HEALTHY : previous.status();
    if (before == report.status()) {
      return;
    }
    if (report.status() == HealthStatus.HEALTHY) {
      log.info("✅ [Health] store healthy again (was {})", before);
    } else {
      log.warn(
          "⚠️ [Health] {} → {}: reachable={}, breaker={}",
          before,
          report.status(),
          report.storeReachable(),
          report.breaker().snapshot().state());
    }
  }
}
