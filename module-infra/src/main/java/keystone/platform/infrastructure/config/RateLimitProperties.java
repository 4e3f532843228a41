package keystone.platform.infrastructure.config;

import java.time.Duration;
import java.util.Map;
import keystone.platform.domain.model.ratelimit.RateLimitAlgorithm;
import keystone.platform.domain.model.ratelimit.RateLimitRule;
import keystone.platform.domain.model.ratelimit.RateLimitScope;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Rate Limit 기본 규칙 ({@code keystone.rate-limit.*})
 *
 * <pre>
 * keystone:
 *   rate-limit:
 *     enabled: true
 *     ip:       { limit: 100,  window: 60s }
 *     user:     { limit: 1000, window: 1h }
 *     tenant:   { limit: 5000, window: 1h }
 *     endpoint: { limit: 200,  window: 60s }
 *     endpoints:
 *       "/api/agents/run":
 *         { limit: 10, window: 60s, algorithm: token_bucket, refill-per-second: 0.2 }
 * </pre>
 */
@ConfigurationProperties(prefix = "keystone.rate-limit")
public record RateLimitProperties(
    Boolean enabled,
    RuleSpec ip,
    RuleSpec user,
    RuleSpec tenant,
    RuleSpec endpoint,
    Map<String, RuleSpec> endpoints) {

  /** 바인딩용 규칙 명세. algorithm 미지정 시 sliding window */
  public record RuleSpec(
      RateLimitAlgorithm algorithm, Long limit, Duration window, Double refillPerSecond) {

    public RateLimitRule toRule() {
      RateLimitAlgorithm algo = algorithm == null ? RateLimitAlgorithm.SLIDING_WINDOW : algorithm;
      if (algo == RateLimitAlgorithm.TOKEN_BUCKET) {
        double rate =
            refillPerSecond != null ? refillPerSecond : limit / (double) window.toSeconds();
        return RateLimitRule.tokenBucket(limit, rate);
      }
      return new RateLimitRule(algo, limit, window, 0, 1);
    }
  }

  public RateLimitProperties {
    enabled = enabled == null || enabled;
    ip = ip == null ? new RuleSpec(null, 100L, Duration.ofSeconds(60), null) : ip;
    user = user == null ? new RuleSpec(null, 1000L, Duration.ofHours(1), null) : user;
    tenant = tenant == null ? new RuleSpec(null, 5000L, Duration.ofHours(1), null) : tenant;
    endpoint = endpoint == null ? new RuleSpec(null, 200L, Duration.ofSeconds(60), null) : endpoint;
    endpoints = endpoints == null ? Map.of() : Map.copyOf(endpoints);
    // 생성 시점에 규칙 검증
    ip.toRule();
    user.toRule();
    tenant.toRule();
    endpoint.toRule();
    endpoints.values().forEach(RuleSpec::toRule);
  }

  public static RateLimitProperties defaults() {
    return new RateLimitProperties(null, null, null, null, null, null);
  }

  public RateLimitRule ruleFor(RateLimitScope scope) {
    return switch (scope) {
      case IP -> ip.toRule();
      case USER -> user.toRule();
      case TENANT -> tenant.toRule();
      case ENDPOINT -> endpoint.toRule();
    };
  }

  /** endpoint 전용 규칙이 있으면 그것을, 없으면 endpoint 기본 규칙 */
  public RateLimitRule ruleForEndpoint(String path) {
    RuleSpec spec = endpoints.get(path);
    return spec == null ? endpoint.toRule() : spec.toRule();
  }
}
