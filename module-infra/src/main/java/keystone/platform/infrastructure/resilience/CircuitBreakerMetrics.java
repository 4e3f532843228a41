package keystone.platform.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;

/**
 * 서킷 브레이커 Micrometer 바인딩 (Resilience4j 이벤트 구독)
 *
 * <ul>
 *   <li>{@code keystone.breaker.transitions{name,from,to}} - Counter
 *   <li>{@code keystone.breaker.calls{name,outcome}} - Timer (호출 수 + 지연)
 *   <li>{@code keystone.breaker.state{name}} - Gauge (0=CLOSED, 1=OPEN, 2=HALF_OPEN)
 * </ul>
 */
public class CircuitBreakerMetrics {

  private final MeterRegistry registry;

  public CircuitBreakerMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  public void bindTo(StoreCircuitBreaker breaker) {
    String name = breaker.name();
    Gauge.builder("keystone.breaker.state", breaker, b -> b.state().gaugeValue())
        .tag("name", name)
        .description("circuit breaker state (0=closed, 1=open, 2=half_open)")
        .register(registry);

    breaker
        .eventPublisher()
        .onStateTransition(event -> transition(name, event.getStateTransition()))
        .onSuccess(event -> call(name, CallOutcome.SUCCESS, event.getElapsedDuration()))
        .onError(
            event -> call(name, CallOutcome.of(event.getThrowable()), event.getElapsedDuration()))
        .onIgnoredError(event -> call(name, CallOutcome.IGNORED, event.getElapsedDuration()))
        .onCallNotPermitted(event -> call(name, CallOutcome.REJECTED, Duration.ZERO));
  }

  private void transition(String name, CircuitBreaker.StateTransition transition) {
    Counter.builder("keystone.breaker.transitions")
        .tag("name", name)
        .tag("from", tagOf(transition.getFromState()))
        .tag("to", tagOf(transition.getToState()))
        .register(registry)
        .increment();
  }

  private void call(String name, CallOutcome outcome, Duration latency) {
    Timer.builder("keystone.breaker.calls")
        .tag("name", name)
        .tag("outcome", outcome.tag())
        .register(registry)
        .record(latency);
  }

  private static String tagOf(CircuitBreaker.State state) {
    return StoreCircuitBreaker.toCircuitState(state).name().toLowerCase();
  }
}
