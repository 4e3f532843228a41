package keystone.platform.infrastructure.queue;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import keystone.platform.domain.model.task.QueueStats;
import keystone.platform.domain.model.task.TaskType;

/**
 * 큐 메트릭
 *
 * <ul>
 *   <li>{@code keystone.queue.operations{type, operation}}: enqueue / dequeue / complete / retry /
 *       dead_letter / reprocess / recover 카운터
 *   <li>{@code keystone.queue.depth{type, state}}: pending / delayed / in_flight / dead_letter 게이지.
 *       {@link #refresh}가 호출될 때만 갱신됩니다.
 * </ul>
 */
public class QueueMetrics {

  private final MeterRegistry meterRegistry;
  private final Map<String, AtomicLong> depths = new ConcurrentHashMap<>();

  public QueueMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void operation(TaskType type, String operation) {
    Counter.builder("keystone.queue.operations")
        .tag("type", type.queueName())
        .tag("operation", operation)
        .register(meterRegistry)
        .increment();
  }

  public void refresh(Collection<QueueStats> stats) {
    for (QueueStats s : stats) {
      depth(s.type(), "pending").set(s.pending());
      depth(s.type(), "delayed").set(s.delayed());
      depth(s.type(), "in_flight").set(s.inFlight());
      depth(s.type(), "dead_letter").set(s.deadLettered());
    }
  }

  long depthOf(TaskType type, String state) {
    AtomicLong value = depths.get(type.queueName() + ":" + state);
    return value == null ? 0 : value.get();
  }

  private AtomicLong depth(TaskType type, String state) {
    return depths.computeIfAbsent(
        type.queueName() + ":" + state,
        k -> {
          AtomicLong holder = new AtomicLong();
          Gauge.builder("keystone.queue.depth", holder, AtomicLong::get)
              .tag("type", type.queueName())
              .tag("state", state)
              .register(meterRegistry);
          return holder;
        });
  }
}
