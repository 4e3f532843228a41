package keystone.platform.infrastructure.resilience;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import java.time.Duration;
import keystone.platform.error.exception.PoolExhaustedException;

/**
 * 프로세스 전역 저장소 커넥션 풀 (Semaphore Bulkhead)
 *
 * <p>획득은 호출 스레드에서 최대 {@code maxWait}까지 대기한 뒤 {@link PoolExhaustedException}으로 실패합니다. 반납은 실제 저장소
 * 호출이 끝난 시점에 합니다 (호출자가 타임아웃으로 먼저 빠져나가도 풀은 계속 점유).
 */
public class StoreConnectionPool {

  private final Bulkhead bulkhead;
  private final int maxConnections;

  public StoreConnectionPool(String name, int maxConnections, Duration maxWait) {
    this.maxConnections = maxConnections;
    this.bulkhead =
        Bulkhead.of(
            name,
            BulkheadConfig.custom()
                .maxConcurrentCalls(maxConnections)
                .maxWaitDuration(maxWait)
                .build());
  }

  /** @throws PoolExhaustedException 대기 시간 안에 슬롯을 얻지 못한 경우 */
  public void acquire(String operation) {
    if (!bulkhead.tryAcquirePermission()) {
      throw new PoolExhaustedException(maxConnections, operation, null);
    }
  }

  public void release() {
    bulkhead.onComplete();
  }

  public int available() {
    return bulkhead.getMetrics().getAvailableConcurrentCalls();
  }

  public int maxConnections() {
    return maxConnections;
  }
}
