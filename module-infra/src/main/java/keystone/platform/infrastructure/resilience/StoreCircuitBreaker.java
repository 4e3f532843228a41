package keystone.platform.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.circuitbreaker.IllegalStateTransitionException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import keystone.platform.domain.model.breaker.CircuitBreakerSnapshot;
import keystone.platform.domain.model.breaker.CircuitBreakerStatus;
import keystone.platform.domain.model.breaker.CircuitState;
import keystone.platform.error.exception.CircuitOpenException;
import keystone.platform.error.exception.StoreTimeoutException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;
import keystone.platform.error.exception.marker.CircuitBreakerRecordMarker;
import keystone.platform.infrastructure.config.CircuitBreakerProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * 저장소 앞단 서킷 브레이커 (Resilience4j {@link CircuitBreaker} 기반)
 *
 * <h3>상태 전이</h3>
 *
 * <pre>
 * CLOSED ──(연속 실패 N회)──▶ OPEN ──(recovery-timeout 경과)──▶ HALF_OPEN
 *   ▲                                                          │
 *   └──────────(시도 M회 모두 성공)──────┘   실패 1회 → OPEN ◀──┘
 * </pre>
 *
 * <h3>Resilience4j 설정 매핑</h3>
 *
 * <ul>
 *   <li>COUNT_BASED 윈도우 크기 = 최소 호출 수 = failure-threshold, 실패율 임계치 100%
 *   <li>waitDurationInOpenState = recovery-timeout, HALF_OPEN 자동 전이
 *   <li>permittedNumberOfCallsInHalfOpenState = success-threshold
 *   <li>{@link CircuitBreakerRecordMarker} 예외만 실패로 집계, 나머지는 ignore (HALF_OPEN 슬롯 반납)
 * </ul>
 *
 * <p>HALF_OPEN 시도 중 실패가 하나라도 보고되면 남은 시도를 기다리지 않고 즉시 OPEN으로 되돌립니다.
 */
@Slf4j
public class StoreCircuitBreaker {

  /** 호출 1건의 입장권. 결과 보고 시 그대로 돌려줘야 합니다. */
  public record Permit(boolean trial, long startedNanos) {

    long elapsedNanos() {
      return System.nanoTime() - startedNanos;
    }
  }

  private final CircuitBreaker circuitBreaker;
  private final Duration callTimeout;
  private final AtomicReference<Instant> openedAt = new AtomicReference<>();

  private final LongAdder totalCalls = new LongAdder();
  private final LongAdder successfulCalls = new LongAdder();
  private final LongAdder failedCalls = new LongAdder();
  private final LongAdder timedOutCalls = new LongAdder();
  private final LongAdder rejectedCalls = new LongAdder();
  private final LongAdder opens = new LongAdder();

  public StoreCircuitBreaker(CircuitBreaker circuitBreaker, CircuitBreakerProperties properties) {
    this.circuitBreaker = circuitBreaker;
    this.callTimeout = properties.callTimeout();
    registerCounters();
  }

  /** 단독 레지스트리로 생성 (테스트, 수동 구성용) */
  public static StoreCircuitBreaker of(String name, CircuitBreakerProperties properties) {
    CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(configOf(properties));
    return new StoreCircuitBreaker(registry.circuitBreaker(name), properties);
  }

  public static CircuitBreakerConfig configOf(CircuitBreakerProperties properties) {
    return CircuitBreakerConfig.custom()
        .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
        .slidingWindowSize(properties.failureThreshold())
        .minimumNumberOfCalls(properties.failureThreshold())
        .failureRateThreshold(100)
        .waitDurationInOpenState(properties.recoveryTimeout())
        .automaticTransitionFromOpenToHalfOpenEnabled(true)
        .permittedNumberOfCallsInHalfOpenState(properties.successThreshold())
        .recordException(StoreCircuitBreaker::isRecorded)
        .ignoreException(e -> e instanceof CircuitBreakerIgnoreMarker || !isRecorded(e))
        .build();
  }

  private static boolean isRecorded(Throwable e) {
    return e instanceof CircuitBreakerRecordMarker && !(e instanceof CircuitBreakerIgnoreMarker);
  }

  public String name() {
    return circuitBreaker.getName();
  }

  public Duration callTimeout() {
    return callTimeout;
  }

  /** 이벤트 구독용 (로깅, 메트릭) */
  public CircuitBreaker.EventPublisher eventPublisher() {
    return circuitBreaker.getEventPublisher();
  }

  /**
   * 호출 허가 요청
   *
   * @throws CircuitOpenException OPEN이거나 HALF_OPEN 시도 슬롯이 가득 찬 경우
   */
  public Permit acquirePermission() {
    try {
      circuitBreaker.acquirePermission();
    } catch (CallNotPermittedException e) {
      throw new CircuitOpenException(name());
    }
    return new Permit(state() == CircuitState.HALF_OPEN, System.nanoTime());
  }

  public void onSuccess(Permit permit) {
    circuitBreaker.onSuccess(permit.elapsedNanos(), TimeUnit.NANOSECONDS);
  }

  /** 예외 분류에 따라 실패 집계 또는 무시 */
  public void onError(Permit permit, Throwable error) {
    circuitBreaker.onError(permit.elapsedNanos(), TimeUnit.NANOSECONDS, error);
  }

  /** 강제로 CLOSED 전이 */
  public void reset() {
    if (circuitBreaker.getState() != CircuitBreaker.State.CLOSED) {
      circuitBreaker.transitionToClosedState();
    }
  }

  public CircuitState state() {
    return toCircuitState(circuitBreaker.getState());
  }

  public CircuitBreakerSnapshot snapshot() {
    CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();
    return new CircuitBreakerSnapshot(
        state(),
        metrics.getNumberOfBufferedCalls(),
        metrics.getNumberOfFailedCalls(),
        metrics.getFailureRate(),
        openedAt.get());
  }

  public CircuitBreakerStatus status() {
    return new CircuitBreakerStatus(
        name(),
        snapshot(),
        totalCalls.sum(),
        successfulCalls.sum(),
        failedCalls.sum(),
        timedOutCalls.sum(),
        rejectedCalls.sum(),
        opens.sum());
  }

  static CircuitState toCircuitState(CircuitBreaker.State state) {
    return switch (state) {
      case OPEN, FORCED_OPEN -> CircuitState.OPEN;
      case HALF_OPEN -> CircuitState.HALF_OPEN;
      default -> CircuitState.CLOSED;
    };
  }

  // ==================== event wiring ====================

  private void registerCounters() {
    circuitBreaker
        .getEventPublisher()
        .onSuccess(
            event -> {
              totalCalls.increment();
              successfulCalls.increment();
            })
        .onError(
            event -> {
              totalCalls.increment();
              failedCalls.increment();
              if (event.getThrowable() instanceof StoreTimeoutException) {
                timedOutCalls.increment();
              }
              reopenIfHalfOpen();
            })
        .onIgnoredError(event -> totalCalls.increment())
        .onCallNotPermitted(event -> rejectedCalls.increment())
        .onStateTransition(
            event -> {
              CircuitBreaker.State to = event.getStateTransition().getToState();
              if (to == CircuitBreaker.State.OPEN) {
                opens.increment();
                openedAt.set(event.getCreationTime().toInstant());
              } else if (to == CircuitBreaker.State.CLOSED) {
                openedAt.set(null);
              }
            });
  }

  private void reopenIfHalfOpen() {
    if (circuitBreaker.getState() == CircuitBreaker.State.HALF_OPEN) {
      log.debug("[CircuitBreaker:{}] trial call failed, reopening", name());
      try {
        circuitBreaker.transitionToOpenState();
      } catch (IllegalStateTransitionException e) {
        // 다른 시도 호출이 먼저 OPEN으로 되돌림
        log.debug("[CircuitBreaker:{}] already reopened: {}", name(), e.getMessage());
      }
    }
  }
}
