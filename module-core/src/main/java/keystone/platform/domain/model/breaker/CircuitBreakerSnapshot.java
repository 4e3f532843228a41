package keystone.platform.domain.model.breaker;

import java.time.Instant;

/**
 * 서킷 브레이커 상태 스냅샷 (전역, 테넌트 무관)
 *
 * @param bufferedCalls 현재 윈도우에 집계된 호출 수
 * @param failedCalls 현재 윈도우의 실패 호출 수
 * @param failureRate 윈도우 실패율(%). 최소 호출 수 미달이면 -1
 * @param openedAt 마지막으로 OPEN 전이한 시각. CLOSED면 null
 */
public record CircuitBreakerSnapshot(
    CircuitState state, int bufferedCalls, int failedCalls, float failureRate, Instant openedAt) {}
