package keystone.platform.domain.model.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import keystone.platform.error.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TaskStatusTest {

  @Nested
  @DisplayName("상태 전이")
  class Transitions {

    @Test
    void queuedOnlyMovesToInProgress() {
      assertThat(TaskStatus.QUEUED.nextStates()).containsExactly(TaskStatus.IN_PROGRESS);
    }

    @Test
    void inProgressEndsInSucceededOrFailed() {
      assertThat(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.SUCCEEDED)).isTrue();
      assertThat(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.FAILED)).isTrue();
      assertThat(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.QUEUED)).isFalse();
    }

    @Test
    void succeededIsFinal() {
      assertThat(TaskStatus.SUCCEEDED.nextStates()).isEmpty();
      assertThat(TaskStatus.SUCCEEDED.isTerminal()).isTrue();
    }

    @Test
    void deadLetterCanBeReprocessed() {
      assertThat(TaskStatus.DEAD_LETTERED.canTransitionTo(TaskStatus.QUEUED)).isTrue();
    }
  }

  @Test
  @DisplayName("wire 값으로 복원한다")
  void roundTripsWireValue() {
    assertThat(TaskStatus.fromWire("dead_lettered")).isEqualTo(TaskStatus.DEAD_LETTERED);
  }

  @Nested
  @DisplayName("큐 한도")
  class Limits {

    @Test
    @DisplayName("우선순위는 큐의 레벨 수 안으로 보정된다")
    void clampsPriority() {
      QueueLimits limits = TaskType.NOTIFICATIONS.defaultLimits();

      assertThat(limits.priorityLevels()).isEqualTo(2);
      assertThat(limits.clampPriority(TaskPriority.BACKGROUND.level())).isEqualTo(1);
      assertThat(limits.clampPriority(-3)).isZero();
    }

    @Test
    @DisplayName("테넌트 몫은 maxSize의 25%")
    void tenantShare() {
      assertThat(TaskType.EMBEDDINGS.defaultLimits().tenantLimit()).isEqualTo(250);
      assertThat(new QueueLimits(2, 1, Duration.ofSeconds(1), 0.25).tenantLimit()).isEqualTo(1);
    }

    @Test
    void rejectsInvalidLimits() {
      assertThatThrownBy(() -> new QueueLimits(0, 1, Duration.ofSeconds(1), 0.5))
          .isInstanceOf(InvalidInputException.class);
      assertThatThrownBy(() -> new QueueLimits(10, 1, Duration.ZERO, 0.5))
          .isInstanceOf(InvalidInputException.class);
    }
  }

  @Test
  @DisplayName("에러 메시지로 실패를 분류한다")
  void classifiesFailures() {
    assertThat(FailureCategory.classify("Read timed out")).isEqualTo(FailureCategory.TIMEOUT);
    assertThat(FailureCategory.classify("Connection refused"))
        .isEqualTo(FailureCategory.CONNECTION);
    assertThat(FailureCategory.classify("HTTP 429 Too Many Requests"))
        .isEqualTo(FailureCategory.RATE_LIMIT);
    assertThat(FailureCategory.classify("invalid payload")).isEqualTo(FailureCategory.VALIDATION);
    assertThat(FailureCategory.classify(null)).isEqualTo(FailureCategory.UNKNOWN);
    assertThat(FailureCategory.VALIDATION.isAutoRetryEligible()).isFalse();
  }

  @Test
  @DisplayName("maxAttempts 기본값과 범위를 검증한다")
  void enqueueRequestDefaults() {
    EnqueueRequest request =
        EnqueueRequest.builder().type(TaskType.EXPORTS).payload("x").build();

    assertThat(request.maxAttempts()).isEqualTo(EnqueueRequest.DEFAULT_MAX_ATTEMPTS);
    assertThat(request.priority()).isEqualTo(TaskPriority.NORMAL.level());
    assertThatThrownBy(
            () -> EnqueueRequest.builder().type(TaskType.EXPORTS).maxAttempts(11).build())
        .isInstanceOf(InvalidInputException.class);
  }
}
