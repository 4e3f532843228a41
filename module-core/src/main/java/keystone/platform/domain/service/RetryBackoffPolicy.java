package keystone.platform.domain.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import keystone.platform.error.exception.InvalidInputException;

/**
 * 지수 백오프 + 지터 재시도 정책
 *
 * <p>{@code delay(n) = clamp(base * multiplier^n * (1 ± jitter), minDelay, maxDelay)}
 *
 * <h3>단조성</h3>
 *
 * <p>jitter가 {@code (m-1)/(m+1)} 미만이면 n번째 지연의 상한이 n+1번째 지연의 하한보다 작아, 난수와 무관하게 delay(n+1) ≥
 * delay(n) 이 성립합니다 (m=2 → jitter &lt; 1/3). clamp는 단조 함수이므로 상한/하한 적용 후에도 유지됩니다. 생성 시 이 조건을
 * 검증합니다.
 */
public record RetryBackoffPolicy(
    Duration baseDelay, double multiplier, Duration maxDelay, double jitter, Duration minDelay) {

  /** base 1s, x2, max 300s, ±25%, min 100ms */
  public static final RetryBackoffPolicy STANDARD =
      new RetryBackoffPolicy(
          Duration.ofSeconds(1), 2.0, Duration.ofMinutes(5), 0.25, Duration.ofMillis(100));

  /** 빠른 재시도: 짧은 지연, 낮은 상한 */
  public static final RetryBackoffPolicy QUICK =
      new RetryBackoffPolicy(
          Duration.ofMillis(500), 2.0, Duration.ofSeconds(30), 0.1, Duration.ofMillis(100));

  /** 외부 API 호출: 상대방 rate limit 회복을 기다림 */
  public static final RetryBackoffPolicy EXTERNAL =
      new RetryBackoffPolicy(
          Duration.ofSeconds(2), 2.0, Duration.ofMinutes(2), 0.25, Duration.ofMillis(500));

  /** 비용 큰 작업 (임베딩, 내보내기) */
  public static final RetryBackoffPolicy EXPENSIVE =
      new RetryBackoffPolicy(
          Duration.ofSeconds(5), 2.0, Duration.ofMinutes(10), 0.25, Duration.ofSeconds(1));

  public RetryBackoffPolicy {
    if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
      throw new InvalidInputException("baseDelay must be positive");
    }
    if (multiplier < 1.0) {
      throw new InvalidInputException("multiplier must be >= 1.0: " + multiplier);
    }
    if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
      throw new InvalidInputException("maxDelay must be >= baseDelay");
    }
    if (minDelay == null || minDelay.isNegative() || minDelay.compareTo(maxDelay) > 0) {
      throw new InvalidInputException("minDelay must be within 0..maxDelay");
    }
    double jitterBound = (multiplier - 1.0) / (multiplier + 1.0);
    if (jitter < 0 || (jitter > 0 && jitter >= jitterBound)) {
      throw new InvalidInputException(
          "jitter must be within [0, " + jitterBound + ") to keep delays monotonic: " + jitter);
    }
  }

  /**
   * @param attempt 지금까지 시도한 횟수 (1 이상)
   */
  public Duration delayFor(int attempt) {
    return delayFor(attempt, ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param unitRandom [0, 1) 구간 난수. 0 → -jitter, 1 → +jitter
   */
  public Duration delayFor(int attempt, double unitRandom) {
    if (attempt < 1) {
      throw new InvalidInputException("attempt must be >= 1: " + attempt);
    }
    double raw = baseDelay.toMillis() * Math.pow(multiplier, attempt);
    double factor = 1.0 + jitter * (2.0 * unitRandom - 1.0);
    double jittered = Math.min(raw * factor, (double) maxDelay.toMillis());
    long millis = Math.max(minDelay.toMillis(), (long) jittered);
    return Duration.ofMillis(millis);
  }
}
