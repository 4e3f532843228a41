package keystone.platform.infrastructure.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.List;
import keystone.platform.error.exception.InvalidInputException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 저장소 연결 설정 ({@code keystone.store.*})
 *
 * <pre>
 * keystone:
 *   store:
 *     mode: redis              # redis | in-memory
 *     address: redis://localhost:6379
 *     max-connections: 10
 *     operation-timeout: 10s
 *     sentinel-master: mymaster  # 지정 시 sentinel 모드
 *     sentinel-nodes: [host1:26379, host2:26379]
 * </pre>
 *
 * @param operationTimeout 커넥션 풀 획득 대기 상한
 * @param retryAttempts 일시적 저장소 오류 로컬 재시도 횟수 (첫 시도 포함)
 */
@Validated
@ConfigurationProperties(prefix = "keystone.store")
public record KeyStoreProperties(
    Mode mode,
    String address,
    String password,
    @Min(0) @Max(15) int database,
    @Min(1) @Max(1024) Integer maxConnections,
    Duration connectTimeout,
    Duration operationTimeout,
    @Min(1) @Max(10) Integer retryAttempts,
    Duration retryInitialInterval,
    String sentinelMaster,
    List<String> sentinelNodes) {

  public enum Mode {
    REDIS,
    IN_MEMORY
  }

  public KeyStoreProperties {
    mode = mode == null ? Mode.REDIS : mode;
    address = address == null ? "redis://localhost:6379" : address;
    maxConnections = maxConnections == null ? 10 : maxConnections;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
    operationTimeout = operationTimeout == null ? Duration.ofSeconds(10) : operationTimeout;
    retryAttempts = retryAttempts == null ? 3 : retryAttempts;
    retryInitialInterval =
        retryInitialInterval == null ? Duration.ofMillis(100) : retryInitialInterval;
    sentinelNodes = sentinelNodes == null ? List.of() : List.copyOf(sentinelNodes);
    if (maxConnections < 1) {
      throw new InvalidInputException("keystone.store.max-connections must be >= 1");
    }
    if (operationTimeout.isNegative() || operationTimeout.isZero()) {
      throw new InvalidInputException("keystone.store.operation-timeout must be positive");
    }
    if (retryAttempts < 1) {
      throw new InvalidInputException("keystone.store.retry-attempts must be >= 1");
    }
  }

  public static KeyStoreProperties inMemory() {
    return new KeyStoreProperties(
        Mode.IN_MEMORY, null, null, 0, null, null, null, null, null, null, null);
  }

  public boolean isSentinelMode() {
    return sentinelMaster != null && !sentinelMaster.isBlank() && !sentinelNodes.isEmpty();
  }
}
