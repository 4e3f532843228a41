package keystone.platform.infrastructure.executor;

import java.util.function.Function;
import keystone.platform.common.function.ThrowingRunnable;
import keystone.platform.common.function.ThrowingSupplier;
import keystone.platform.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>try/catch 정책을 호출부마다 흩어 놓지 않고 한곳에 모읍니다. 특히 "실패 시 대체값"을 쓰는 경로(캐시 읽기 → miss, Rate Limit →
 * fail-open)는 {@link #executeOrCatch}로만 표현해, 어떤 예외가 흡수되는지가 호출부에 드러나도록 합니다.
 *
 * <ol>
 *   <li>try-catch-throw (예외 변환 후 재전파) - {@link #execute}
 *   <li>try-catch-recover (예외를 보고 복구값 결정) - {@link #executeOrCatch}
 *   <li>try-catch-return (기본값 반환) - {@link #executeOrDefault}
 *   <li>다중 catch (ExceptionTranslator 지정) - {@link #executeWithTranslation}
 * </ol>
 *
 * <pre>{@code
 * return executor.executeOrCatch(
 *     () -> readEntry(scope, key),
 *     e -> degradeToMiss(e, key),
 *     TaskContext.of("Cache", "get", scope.value()));
 * }</pre>
 */
public interface LogicExecutor {

  /** 예외를 기본 translator로 변환해 전파. BaseException은 그대로 전파됩니다. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /**
   * 예외 발생 시 recovery 결과를 반환
   *
   * <p>recovery는 변환된 예외를 받습니다. 복구할 수 없는 예외라면 recovery 안에서 다시 던져야 합니다.
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<RuntimeException, T> recovery, TaskContext context);

  /** 예외 발생 시 로그를 남기고 기본값 반환. 백그라운드 유지보수 작업 전용 */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
