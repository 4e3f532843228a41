package keystone.platform.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import keystone.platform.error.exception.PayloadSerializationException;
import keystone.platform.error.exception.StoreConnectionException;
import keystone.platform.error.exception.base.BaseException;
import keystone.platform.infrastructure.executor.TaskContext;

/** 기술 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>BaseException → 그대로 반환
   *   <li>나머지는 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrapAsync(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  static Throwable unwrapAsync(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** 기본 변환기: 알 수 없는 RuntimeException은 그대로, checked 예외는 IllegalStateException으로 감쌈 */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          if (unwrapped instanceof RuntimeException re) {
            return re;
          }
          return new IllegalStateException(
              "task failed [" + context.toTaskName() + "]: " + unwrapped.getMessage(), unwrapped);
        });
  }

  /** JSON 직렬화 예외 변환기 */
  static ExceptionTranslator forJson() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof JsonProcessingException) {
            return new PayloadSerializationException(context.toTaskName(), unwrapped);
          }
          return defaultTranslator().translate(unwrapped, context);
        });
  }

  /** 저장소 호출 예외 변환기: 분류되지 않은 저장소 예외는 연결 실패로 간주 */
  static ExceptionTranslator forStore() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          return new StoreConnectionException(context.toTaskName(), unwrapped);
        });
  }
}
