package keystone.platform.lifecycle;

import java.util.List;
import keystone.platform.config.WorkerProperties;
import keystone.platform.core.port.in.TaskHandler;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.queue.QueueWorkerPool;
import keystone.platform.infrastructure.queue.TaskQueueManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * 등록된 {@link TaskHandler}마다 워커를 띄우고, 종료 시 처리 중인 태스크를 기다립니다.
 *
 * <p>TaskHandler 빈이 없거나 {@code keystone.worker.enabled=false}면 아무 것도 하지 않습니다. 종료는 스케줄러보다 먼저
 * 일어나도록 높은 phase를 사용합니다.
 */
@Slf4j
@Component
public class QueueWorkerLifecycle implements SmartLifecycle {

  private final QueueWorkerPool pool;
  private final WorkerProperties properties;
  private volatile boolean running = false;

  public QueueWorkerLifecycle(
      TaskQueueManager queueManager,
      ObjectProvider<TaskHandler> handlers,
      LogicExecutor executor,
      WorkerProperties properties) {
    List<TaskHandler> registered = handlers.orderedStream().toList();
    this.properties = properties;
    this.pool =
        registered.isEmpty() || !properties.enabled()
            ? null
            : new QueueWorkerPool(
                queueManager,
                registered,
                executor,
                properties.workersPerHandler(),
                properties.idleBackoff());
  }

  @Override
  public void start() {
    if (pool == null) {
      log.info("[QueueWorker] no task handlers registered, workers disabled");
    } else {
      pool.start();
    }
    running = true;
  }

  @Override
  public void stop() {
    if (pool != null) {
      pool.stop(properties.shutdownTimeout());
    }
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return Integer.MAX_VALUE - 1;
  }
}
