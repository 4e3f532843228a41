package keystone.platform.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 큐 워커 설정 ({@code keystone.worker.*})
 *
 * @param workersPerHandler TaskHandler 하나당 워커 스레드 수
 * @param idleBackoff 큐가 비었을 때 다음 dequeue까지 대기
 * @param shutdownTimeout 종료 시 처리 중인 태스크 대기 상한
 */
@ConfigurationProperties(prefix = "keystone.worker")
public record WorkerProperties(
    Boolean enabled, Integer workersPerHandler, Duration idleBackoff, Duration shutdownTimeout) {

  public WorkerProperties {
    enabled = enabled == null || enabled;
    workersPerHandler = workersPerHandler == null ? 1 : workersPerHandler;
    idleBackoff = idleBackoff == null ? Duration.ofMillis(500) : idleBackoff;
    shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(30) : shutdownTimeout;
  }
}
