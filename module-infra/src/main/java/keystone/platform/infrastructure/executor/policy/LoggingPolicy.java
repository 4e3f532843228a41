package keystone.platform.infrastructure.executor.policy;

import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import keystone.platform.error.exception.base.ClientBaseException;
import keystone.platform.infrastructure.executor.TaskContext;
import lombok.extern.slf4j.Slf4j;

/**
 * 작업 단위 로깅 정책
 *
 * <ul>
 *   <li>before: [Task:START] {taskName} → DEBUG
 *   <li>onSuccess: [Task:SUCCESS] → DEBUG, 임계치 이상이면 [Task:SLOW] → INFO
 *   <li>onFailure: [Task:FAILURE] → 4xx 계열은 WARN (스택 없음), 그 외 ERROR
 * </ul>
 *
 * <p>dynamicValue에는 호출자가 넘긴 식별자(IP, userId, 테넌트)가 들어오므로 제어문자와 공백을 {@code _}로 바꾸고 {@value
 * #MAX_DYNAMIC_LENGTH}자에서 자릅니다.
 */
@Slf4j
public class LoggingPolicy {

  public static final long DEFAULT_SLOW_MS = 500L;
  private static final long MAX_SLOW_MS = 60_000L;

  private static final String TAG_START = "[Task:START]";
  private static final String TAG_SUCCESS = "[Task:SUCCESS]";
  private static final String TAG_SLOW = "[Task:SLOW]";
  private static final String TAG_FAILURE = "[Task:FAILURE]";

  static final int MAX_DYNAMIC_LENGTH = 64;
  private static final String UNKNOWN = "unknown";
  private static final Pattern UNSAFE = Pattern.compile("[\\p{Cntrl}\\s]");

  private final long slowThresholdMs;
  private final long slowThresholdNanos;

  /** @param slowMs 0 이하면 SLOW 판정 비활성 */
  public LoggingPolicy(long slowMs) {
    long clamped = Math.max(0L, Math.min(slowMs, MAX_SLOW_MS));
    this.slowThresholdMs = clamped;
    this.slowThresholdNanos =
        clamped > 0 ? TimeUnit.MILLISECONDS.toNanos(clamped) : Long.MAX_VALUE;
  }

  public void before(TaskContext context) {
    if (!log.isDebugEnabled()) return;
    log.debug("{} {}", TAG_START, taskNameOf(context));
  }

  public void onSuccess(TaskContext context, long elapsedNanos) {
    String taskName = taskNameOf(context);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
    if (elapsedNanos >= slowThresholdNanos) {
      log.info(
          "{} {}, elapsed={}ms, threshold={}ms", TAG_SLOW, taskName, elapsedMs, slowThresholdMs);
      return;
    }
    if (!log.isDebugEnabled()) return;
    log.debug("{} {}, elapsed={}ms", TAG_SUCCESS, taskName, elapsedMs);
  }

  public void onFailure(TaskContext context, long elapsedNanos, Throwable error) {
    String taskName = taskNameOf(context);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
    String errorType = error.getClass().getSimpleName();
    if (error instanceof ClientBaseException) {
      log.warn("{} {}, elapsed={}ms, errorType={}, message={}",
          TAG_FAILURE, taskName, elapsedMs, errorType, error.getMessage());
      return;
    }
    log.error(
        "{} {}, elapsed={}ms, errorType={}", TAG_FAILURE, taskName, elapsedMs, errorType, error);
  }

  static String taskNameOf(TaskContext context) {
    if (context == null) return UNKNOWN;

    String dynamic = context.dynamicValue();
    if (dynamic.isEmpty()) {
      return context.component() + ":" + context.operation();
    }
    String sanitized = UNSAFE.matcher(dynamic).replaceAll("_");
    if (sanitized.length() > MAX_DYNAMIC_LENGTH) {
      sanitized = sanitized.substring(0, MAX_DYNAMIC_LENGTH) + "...";
    }
    return context.component() + ":" + context.operation() + ":" + sanitized;
  }
}
