package keystone.platform.domain.model.health;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import keystone.platform.domain.model.breaker.CircuitBreakerStatus;
import keystone.platform.domain.model.task.QueueStats;
import keystone.platform.domain.model.task.TaskType;

/**
 * 저장소 연결, 서킷 상태, 큐 깊이를 종합한 헬스 리포트
 *
 * @param pingLatency 저장소에 도달하지 못했으면 null
 * @param queues 조회에 실패하면 비어 있음
 */
public record HealthReport(
    HealthStatus status,
    boolean storeReachable,
    Duration pingLatency,
    CircuitBreakerStatus breaker,
    Map<TaskType, QueueStats> queues,
    Instant checkedAt) {

  public HealthReport {
    queues = queues == null ? Map.of() : Map.copyOf(queues);
  }
}
