package keystone.platform.domain.model.ratelimit;

public enum RateLimitAlgorithm {
  SLIDING_WINDOW("sliding_window"),
  TOKEN_BUCKET("token_bucket"),
  FIXED_WINDOW("fixed_window");

  private final String key;

  RateLimitAlgorithm(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
