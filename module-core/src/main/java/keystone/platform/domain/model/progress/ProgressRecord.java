package keystone.platform.domain.model.progress;

import java.time.Instant;
import java.util.List;

/**
 * 장기 작업 진행률
 *
 * <p>completedSteps는 totalSteps를 넘지 않습니다. 종료 상태가 되면 유예 기간 뒤 자동 만료됩니다.
 */
public record ProgressRecord(
    String correlationId,
    int totalSteps,
    int completedSteps,
    String lastMessage,
    ProgressStatus status,
    Instant startedAt,
    Instant updatedAt,
    Instant completedAt,
    String errorMessage,
    List<String> recentMessages) {

  public ProgressRecord {
    recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
  }

  /** 0.0 ~ 100.0 */
  public double percent() {
    if (totalSteps <= 0) {
      return 0.0;
    }
    return Math.min(100.0, completedSteps * 100.0 / totalSteps);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
