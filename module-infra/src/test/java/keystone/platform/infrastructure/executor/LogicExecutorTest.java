package keystone.platform.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import keystone.platform.error.exception.PayloadSerializationException;
import keystone.platform.error.exception.QueueFullException;
import keystone.platform.error.exception.StoreConnectionException;
import keystone.platform.infrastructure.executor.strategy.ExceptionTranslator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LogicExecutor")
class LogicExecutorTest {

  private final LogicExecutor executor = new DefaultLogicExecutor();
  private final TaskContext context = TaskContext.of("Test", "op", "value");

  @Nested
  @DisplayName("execute")
  class Execute {

    @Test
    @DisplayName("성공 시 결과를 그대로 반환한다")
    void returnsResult() {
      assertThat(executor.execute(() -> 42, context)).isEqualTo(42);
    }

    @Test
    @DisplayName("BaseException은 변환 없이 전파한다")
    void propagatesBaseException() {
      QueueFullException original = new QueueFullException("embeddings", 10);

      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw original;
                      },
                      context))
          .isSameAs(original);
    }

    @Test
    @DisplayName("checked 예외는 작업 이름을 담은 IllegalStateException으로 감싼다")
    void wrapsCheckedException() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new IOException("disk");
                      },
                      context))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("Test:op:value")
          .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("CompletionException은 원인으로 풀어서 전파한다")
    void unwrapsCompletionException() {
      QueueFullException cause = new QueueFullException("exports", 5);

      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new CompletionException(cause);
                      },
                      context))
          .isSameAs(cause);
    }

    @Test
    @DisplayName("Error는 번역하지 않는다")
    void rethrowsError() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new AssertionError("fatal");
                      },
                      context))
          .isInstanceOf(AssertionError.class);
    }
  }

  @Test
  @DisplayName("executeOrCatch: recovery는 변환된 예외를 받는다")
  void recoveryReceivesTranslatedException() {
    AtomicReference<RuntimeException> seen = new AtomicReference<>();

    String result =
        executor.executeOrCatch(
            () -> {
              throw new IOException("io");
            },
            e -> {
              seen.set(e);
              return "recovered";
            },
            context);

    assertThat(result).isEqualTo("recovered");
    assertThat(seen.get()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("executeOrDefault: 실패 시 기본값")
  void defaultOnFailure() {
    Integer value =
        executor.executeOrDefault(
            () -> {
              throw new IllegalStateException("boom");
            },
            -1,
            context);

    assertThat(value).isEqualTo(-1);
  }

  @Test
  @DisplayName("executeVoid: 작업을 실행하고 예외는 전파한다")
  void executeVoid() {
    AtomicBoolean ran = new AtomicBoolean();

    executor.executeVoid(() -> ran.set(true), context);

    assertThat(ran).isTrue();
    assertThatThrownBy(
            () ->
                executor.executeVoid(
                    () -> {
                      throw new IllegalArgumentException("bad");
                    },
                    context))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Nested
  @DisplayName("executeWithTranslation")
  class Translation {

    @Test
    @DisplayName("forJson: Jackson 예외를 PayloadSerializationException으로 변환한다")
    void jsonTranslator() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new JsonParseException((JsonParser) null, "unexpected token");
                      },
                      ExceptionTranslator.forJson(),
                      context))
          .isInstanceOf(PayloadSerializationException.class);
    }

    @Test
    @DisplayName("forStore: 분류되지 않은 예외는 연결 실패로 간주한다")
    void storeTranslator() {
      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new IllegalStateException("socket closed");
                      },
                      ExceptionTranslator.forStore(),
                      context))
          .isInstanceOf(StoreConnectionException.class)
          .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("translator 자체가 던진 예외를 primary로 사용한다")
    void translatorFailure() {
      ExceptionTranslator broken =
          (e, ctx) -> {
            throw new UnsupportedOperationException("translator broke");
          };

      assertThatThrownBy(
              () ->
                  executor.executeWithTranslation(
                      () -> {
                        throw new IOException("io");
                      },
                      broken,
                      context))
          .isInstanceOf(UnsupportedOperationException.class);
    }
  }
}
