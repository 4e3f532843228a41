package keystone.platform.domain.model.task;

import java.time.Duration;

/**
 * fail 호출 결과
 *
 * @param retryDelay RETRY_SCHEDULED일 때만 의미 있음
 */
public record FailOutcome(Disposition disposition, int attempts, Duration retryDelay) {

  public enum Disposition {
    RETRY_SCHEDULED,
    DEAD_LETTERED
  }

  public boolean isDeadLettered() {
    return disposition == Disposition.DEAD_LETTERED;
  }
}
