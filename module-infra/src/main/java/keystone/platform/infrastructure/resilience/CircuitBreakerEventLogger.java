package keystone.platform.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * CircuitBreaker 상태 전이 이벤트 로거
 *
 * <h3>기록 대상</h3>
 *
 * <ul>
 *   <li>상태 전이 (State Transition): WARN 레벨
 *   <li>복구 완료 (→ CLOSED): INFO 레벨
 *   <li>실패율 임계치 초과: WARN 레벨
 *   <li>거부된 호출은 메트릭으로만 집계 (로그 폭주 방지)
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class CircuitBreakerEventLogger {

  private final CircuitBreakerRegistry circuitBreakerRegistry;

  public void registerEventListeners() {
    circuitBreakerRegistry.getAllCircuitBreakers().forEach(this::registerStateTransitionListener);

    // 동적으로 추가되는 CB도 등록
    circuitBreakerRegistry
        .getEventPublisher()
        .onEntryAdded(event -> registerStateTransitionListener(event.getAddedEntry()));
  }

  private void registerStateTransitionListener(CircuitBreaker cb) {
    cb.getEventPublisher()
        .onStateTransition(
            event -> {
              CircuitBreaker.State to = event.getStateTransition().getToState();
              log.warn(
                  "[CircuitBreaker:{}] State transition: {} → {}",
                  event.getCircuitBreakerName(),
                  event.getStateTransition().getFromState(),
                  to);
              if (to == CircuitBreaker.State.CLOSED) {
                log.info("✅ [CircuitBreaker:{}] Store recovered", event.getCircuitBreakerName());
              }
            })
        .onFailureRateExceeded(
            event ->
                log.warn(
                    "[CircuitBreaker:{}] Failure rate exceeded: {}%",
                    event.getCircuitBreakerName(), event.getFailureRate()));
  }
}
