package keystone.platform.domain.model.breaker;

/** 스냅샷 + 누적 호출 카운터. */
public record CircuitBreakerStatus(
    String name,
    CircuitBreakerSnapshot snapshot,
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long timedOutCalls,
    long rejectedCalls,
    long opens) {

  public double failureRate() {
    long completed = successfulCalls + failedCalls;
    return completed == 0 ? 0.0 : failedCalls / (double) completed;
  }
}
