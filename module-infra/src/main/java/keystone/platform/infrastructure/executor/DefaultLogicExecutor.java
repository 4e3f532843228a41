package keystone.platform.infrastructure.executor;

import java.util.Objects;
import java.util.function.Function;
import keystone.platform.common.function.ThrowingRunnable;
import keystone.platform.common.function.ThrowingSupplier;
import keystone.platform.infrastructure.executor.policy.LoggingPolicy;
import keystone.platform.infrastructure.executor.strategy.ExceptionTranslator;
import lombok.RequiredArgsConstructor;

/**
 * LogicExecutor 기본 구현
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>번역 실패 격리</b>: translator가 던진 RuntimeException은 그 자체를 primary로 사용
 *   <li><b>로깅</b>: [Task:START] / [Task:SUCCESS] / [Task:SLOW] / [Task:FAILURE]
 * </ul>
 */
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;
  private final LoggingPolicy loggingPolicy;

  public DefaultLogicExecutor() {
    this(ExceptionTranslator.defaultTranslator(), new LoggingPolicy(LoggingPolicy.DEFAULT_SLOW_MS));
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<RuntimeException, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    try {
      return executeWithTranslation(task, translator, context);
    } catch (RuntimeException e) {
      return recovery.apply(e);
    }
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    loggingPolicy.before(context);
    try {
      T result = task.get();
      loggingPolicy.onSuccess(context, System.nanoTime() - start);
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translateSafe(customTranslator, t, context);
      loggingPolicy.onFailure(context, System.nanoTime() - start, primary);
      throw primary;
    }
  }

  private static RuntimeException translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException ex) {
      return ex;
    } catch (Error e) {
      throw e;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }
}
