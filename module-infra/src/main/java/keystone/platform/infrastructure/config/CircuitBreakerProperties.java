package keystone.platform.infrastructure.config;

import java.time.Duration;
import keystone.platform.error.exception.InvalidInputException;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 서킷 브레이커 설정 ({@code keystone.circuit-breaker.*})
 *
 * @param failureThreshold CLOSED → OPEN 연속 실패 수 (기본 5)
 * @param recoveryTimeout OPEN → HALF_OPEN 대기 (기본 60s)
 * @param successThreshold HALF_OPEN 시도 호출 수. 모두 성공하면 CLOSED (기본 3)
 * @param callTimeout 호출 1건 제한 시간. 초과 시 실패 (기본 10s)
 */
@ConfigurationProperties(prefix = "keystone.circuit-breaker")
public record CircuitBreakerProperties(
    Integer failureThreshold,
    Duration recoveryTimeout,
    Integer successThreshold,
    Duration callTimeout) {

  public CircuitBreakerProperties {
    failureThreshold = failureThreshold == null ? 5 : failureThreshold;
    recoveryTimeout = recoveryTimeout == null ? Duration.ofSeconds(60) : recoveryTimeout;
    successThreshold = successThreshold == null ? 3 : successThreshold;
    callTimeout = callTimeout == null ? Duration.ofSeconds(10) : callTimeout;
    if (failureThreshold < 1 || successThreshold < 1) {
      throw new InvalidInputException("circuit breaker thresholds must be >= 1");
    }
    if (recoveryTimeout.isNegative() || callTimeout.isNegative() || callTimeout.isZero()) {
      throw new InvalidInputException("circuit breaker durations must be positive");
    }
  }

  public static CircuitBreakerProperties defaults() {
    return new CircuitBreakerProperties(null, null, null, null);
  }
}
