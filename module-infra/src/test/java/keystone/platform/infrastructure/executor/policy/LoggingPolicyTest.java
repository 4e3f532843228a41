package keystone.platform.infrastructure.executor.policy;

import static org.assertj.core.api.Assertions.assertThat;

import keystone.platform.infrastructure.executor.TaskContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LoggingPolicy 작업 이름")
class LoggingPolicyTest {

  @Test
  @DisplayName("dynamicValue가 없으면 component:operation")
  void withoutDynamicValue() {
    assertThat(LoggingPolicy.taskNameOf(TaskContext.of("Cache", "get"))).isEqualTo("Cache:get");
  }

  @Test
  @DisplayName("호출자 식별자의 개행과 공백은 한 줄 로그를 깨지 않도록 치환한다")
  void sanitizesCallerSuppliedValue() {
    TaskContext forged = TaskContext.of("RateLimiter", "check", "10.0.0.1\r\n[Task:SUCCESS] x");

    assertThat(LoggingPolicy.taskNameOf(forged))
        .isEqualTo("RateLimiter:check:10.0.0.1__[Task:SUCCESS]_x");
  }

  @Test
  @DisplayName("긴 식별자는 잘라서 기록한다")
  void truncatesLongValue() {
    String name = LoggingPolicy.taskNameOf(TaskContext.of("Session", "revokeAll", "u".repeat(200)));

    assertThat(name)
        .isEqualTo("Session:revokeAll:" + "u".repeat(LoggingPolicy.MAX_DYNAMIC_LENGTH) + "...");
  }

  @Test
  @DisplayName("컨텍스트가 없으면 unknown")
  void nullContext() {
    assertThat(LoggingPolicy.taskNameOf(null)).isEqualTo("unknown");
  }
}
