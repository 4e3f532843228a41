package keystone.platform.domain.model.task;

import java.util.Locale;

/**
 * 에러 메시지 기반 실패 분류
 *
 * <p>일시적 장애(TIMEOUT, CONNECTION, RATE_LIMIT)만 dead letter 자동 재처리 대상입니다.
 */
public enum FailureCategory {
  TIMEOUT(true),
  CONNECTION(true),
  RATE_LIMIT(true),
  VALIDATION(false),
  UNKNOWN(false);

  private final boolean autoRetryEligible;

  FailureCategory(boolean autoRetryEligible) {
    this.autoRetryEligible = autoRetryEligible;
  }

  public boolean isAutoRetryEligible() {
    return autoRetryEligible;
  }

  public static FailureCategory classify(String errorMessage) {
    if (errorMessage == null) {
      return UNKNOWN;
    }
    String m = errorMessage.toLowerCase(Locale.ROOT);
    if (m.contains("timeout") || m.contains("timed out")) {
      return TIMEOUT;
    }
    if (m.contains("connection") || m.contains("network") || m.contains("unreachable")) {
      return CONNECTION;
    }
    if (m.contains("rate limit") || m.contains("too many requests") || m.contains("429")) {
      return RATE_LIMIT;
    }
    if (m.contains("invalid") || m.contains("validation") || m.contains("malformed")) {
      return VALIDATION;
    }
    return UNKNOWN;
  }
}
