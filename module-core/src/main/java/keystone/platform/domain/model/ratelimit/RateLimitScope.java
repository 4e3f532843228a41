package keystone.platform.domain.model.ratelimit;

/**
 * Rate Limit 스코프
 *
 * <p>선언 순서가 평가 순서입니다 (IP → user → tenant → endpoint). 가장 먼저 거부한 스코프의 결정이 최종 결정이 됩니다.
 */
public enum RateLimitScope {
  IP("ip"),
  USER("user"),
  TENANT("tenant"),
  ENDPOINT("endpoint");

  private final String key;

  RateLimitScope(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
