package keystone.platform.infrastructure.queue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import keystone.platform.core.port.in.TaskHandler;
import keystone.platform.domain.model.task.Task;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.executor.TaskContext;
import lombok.extern.slf4j.Slf4j;

/**
 * 큐 워커 풀
 *
 * <h3>Flow</h3>
 *
 * <ol>
 *   <li>{@link TaskQueueManager#dequeue}로 태스크를 꺼냄 (비어 있으면 idle 대기)
 *   <li>{@link TaskHandler#handle} 실행
 *   <li>성공 → complete, 예외 → fail (재시도 여부는 {@link TaskHandler#isRetryable})
 * </ol>
 *
 * <p>dequeue 중 저장소 장애는 로그만 남기고 idle 대기 후 다시 시도합니다. {@link #stop}은 새 태스크 수신을 멈추고 처리 중인 태스크가
 * 끝나기를 기다립니다.
 */
@Slf4j
public class QueueWorkerPool {

  private final TaskQueueManager queue;
  private final List<TaskHandler> handlers;
  private final LogicExecutor executor;
  private final int workersPerHandler;
  private final Duration idleBackoff;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicInteger activeWorkers = new AtomicInteger();
  private ExecutorService threads;

  public QueueWorkerPool(
      TaskQueueManager queue,
      List<TaskHandler> handlers,
      LogicExecutor executor,
      int workersPerHandler,
      Duration idleBackoff) {
    if (workersPerHandler < 1) {
      throw new IllegalArgumentException("workersPerHandler must be >= 1");
    }
    this.queue = queue;
    this.handlers = List.copyOf(handlers);
    this.executor = executor;
    this.workersPerHandler = workersPerHandler;
    this.idleBackoff = idleBackoff;
  }

  public synchronized void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    AtomicInteger sequence = new AtomicInteger();
    threads =
        Executors.newFixedThreadPool(
            Math.max(1, handlers.size() * workersPerHandler),
            r -> {
              Thread t = new Thread(r, "queue-worker-" + sequence.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    for (TaskHandler handler : handlers) {
      for (int i = 0; i < workersPerHandler; i++) {
        threads.submit(() -> loop(handler));
      }
    }
    log.info(
        "[QueueWorker] started: handlers={}, workersPerHandler={}",
        handlers.size(),
        workersPerHandler);
  }

  /** @return 제한 시간 안에 모든 워커가 종료되면 true */
  public synchronized boolean stop(Duration timeout) {
    if (!running.compareAndSet(true, false)) {
      return true;
    }
    threads.shutdown();
    boolean terminated =
        executor.executeOrDefault(
            () -> threads.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS),
            false,
            TaskContext.of("QueueWorker", "stop"));
    if (!terminated) {
      log.warn("⚠️ [QueueWorker] workers still busy after {}, interrupting", timeout);
      threads.shutdownNow();
    } else {
      log.info("[QueueWorker] stopped");
    }
    return terminated;
  }

  public boolean isRunning() {
    return running.get();
  }

  public int activeWorkers() {
    return activeWorkers.get();
  }

  /** 한 건 처리. 꺼낸 태스크가 없으면 false */
  public boolean processOne(TaskHandler handler) {
    Optional<Task> next =
        executor.executeOrCatch(
            () -> queue.dequeue(handler.type()),
            e -> {
              log.warn(
                  "⚠️ [QueueWorker] dequeue failed: type={}, cause={}",
                  handler.type().queueName(),
                  e.getMessage());
              return Optional.empty();
            },
            TaskContext.of("QueueWorker", "dequeue", handler.type().queueName()));
    if (next.isEmpty()) {
      return false;
    }
    Task task = next.get();
    HandlerOutcome outcome =
        executor.execute(
            () -> {
              try {
                return new HandlerOutcome(handler.handle(task), null);
              } catch (Exception e) {
                return new HandlerOutcome(null, e);
              }
            },
            TaskContext.of("QueueWorker", "handle", task.id()));
    if (outcome.error() == null) {
      queue.complete(task.id(), outcome.result());
      return true;
    }
    Throwable error = outcome.error();
    log.warn(
        "⚠️ [QueueWorker] task failed: id={}, attempt={}, error={}",
        task.id(),
        task.attempts(),
        error.toString());
    String message = error.getMessage() == null ? error.toString() : error.getMessage();
    queue.fail(task.id(), message, handler.isRetryable(error));
    return true;
  }

  // ==================== internal ====================

  private void loop(TaskHandler handler) {
    activeWorkers.incrementAndGet();
    try {
      while (running.get() && !Thread.currentThread().isInterrupted()) {
        boolean processed =
            executor.executeOrCatch(
                () -> processOne(handler),
                e -> {
                  log.error("[QueueWorker] unexpected failure: type={}", handler.type(), e);
                  return false;
                },
                TaskContext.of("QueueWorker", "loop", handler.type().queueName()));
        if (!processed) {
          idle();
        }
      }
    } finally {
      activeWorkers.decrementAndGet();
    }
  }

  private void idle() {
    try {
      Thread.sleep(idleBackoff.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private record HandlerOutcome(String result, Throwable error) {}
}
