package keystone.platform.infrastructure.ratelimit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.domain.model.ratelimit.RateLimitAlgorithm;
import keystone.platform.domain.model.ratelimit.RateLimitDecision;
import keystone.platform.domain.model.ratelimit.RateLimitDecision.Verdict;
import keystone.platform.domain.model.ratelimit.RateLimitRequest;
import keystone.platform.domain.model.ratelimit.RateLimitRule;
import keystone.platform.domain.model.ratelimit.RateLimitScope;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.infrastructure.config.RateLimitProperties;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.executor.TaskContext;
import keystone.platform.infrastructure.keystore.ScriptResults;
import keystone.platform.infrastructure.resilience.StoreFailures;
import keystone.platform.infrastructure.tenant.GlobalKeyspace;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import lombok.extern.slf4j.Slf4j;

/**
 * 분산 Rate Limiter
 *
 * <h3>복합 검사 ({@link #checkAll})</h3>
 *
 * <pre>
 * IP → user → tenant → endpoint
 *   └ 먼저 거부한 스코프의 결정을 반환 (뒤 스코프는 검사하지 않음)
 *   └ 모두 허용이면 remaining이 가장 작은 결정
 * </pre>
 *
 * <h3>Fail-Open</h3>
 *
 * <p>저장소에 닿지 못하면(연결, 타임아웃, 서킷 OPEN, 풀 고갈) 요청을 허용하고 {@link Verdict#FAIL_OPEN} 결정을 반환합니다. WARN
 * 로그와 {@code keystone.ratelimit.decisions{verdict=fail_open}} 메트릭이 남습니다. 검증 오류와 스크립트 오류는 그대로
 * 전파합니다.
 */
@Slf4j
public class RateLimitService {

  private final TenantIsolatedAccessor accessor;
  private final LogicExecutor executor;
  private final RateLimitProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public RateLimitService(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      RateLimitProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.accessor = accessor;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /** 단일 스코프 검사 (허용 시 cost만큼 소비). 비활성화 상태면 저장소 없이 허용 */
  public RateLimitDecision check(String identifier, RateLimitScope scope, RateLimitRule rule) {
    if (!properties.enabled()) {
      return unrestricted();
    }
    String key = keyOf(identifier, scope, rule);
    RateLimitDecision decision =
        executor.executeOrCatch(
            () -> evaluate(key, scope, rule),
            e -> failOpen(e, scope, identifier),
            TaskContext.of("RateLimiter", "check", scope.key()));
    record(decision);
    return decision;
  }

  /** 요청에 포함된 모든 스코프를 설정된 규칙으로 순서대로 검사 */
  public RateLimitDecision checkAll(RateLimitRequest request) {
    if (!properties.enabled()) {
      return unrestricted();
    }
    RateLimitDecision tightest = null;
    RateLimitDecision degraded = null;
    for (Map.Entry<RateLimitScope, String> entry : request.identifiers().entrySet()) {
      RateLimitScope scope = entry.getKey();
      RateLimitRule rule =
          scope == RateLimitScope.ENDPOINT
              ? properties.ruleForEndpoint(request.endpoint())
              : properties.ruleFor(scope);
      RateLimitDecision decision = check(entry.getValue(), scope, rule);
      if (decision.verdict() == Verdict.DENIED) {
        return decision;
      }
      if (decision.isFailOpen()) {
        degraded = degraded == null ? decision : degraded;
      } else if (tightest == null || decision.remaining() < tightest.remaining()) {
        tightest = decision;
      }
    }
    if (degraded != null) {
      return degraded;
    }
    return tightest == null ? unrestricted() : tightest;
  }

  /** 소비 없이 현재 사용량 조회 */
  public long usage(String identifier, RateLimitScope scope, RateLimitRule rule) {
    String key = keyOf(identifier, scope, rule);
    long now = clock.millis();
    return executor.execute(
        () ->
            switch (rule.algorithm()) {
              case SLIDING_WINDOW -> (long)
                  accessor
                      .global()
                      .zRangeByScore(
                          key,
                          now - rule.window().toMillis() + 1,
                          Double.POSITIVE_INFINITY,
                          Integer.MAX_VALUE)
                      .size();
              case FIXED_WINDOW -> fixedWindowUsage(accessor.global().hashGetAll(key), now);
              case TOKEN_BUCKET -> tokenBucketUsage(accessor.global().hashGetAll(key), rule, now);
            },
        TaskContext.of("RateLimiter", "usage", scope.key()));
  }

  /** @return 기록이 있어 삭제되었으면 true */
  public boolean reset(String identifier, RateLimitScope scope, RateLimitRule rule) {
    String key = keyOf(identifier, scope, rule);
    boolean deleted =
        executor.execute(
            () -> accessor.global().delete(List.of(key)) > 0,
            TaskContext.of("RateLimiter", "reset", scope.key()));
    log.info("[RateLimiter] reset scope={}, identifier={}, existed={}", scope, identifier, deleted);
    return deleted;
  }

  // ==================== internal ====================

  private RateLimitDecision evaluate(String key, RateLimitScope scope, RateLimitRule rule) {
    long now = clock.millis();
    List<String> args =
        switch (rule.algorithm()) {
          case SLIDING_WINDOW -> List.of(
              String.valueOf(now),
              String.valueOf(rule.window().toMillis()),
              String.valueOf(rule.limit()),
              String.valueOf(rule.cost()),
              UUID.randomUUID().toString());
          case TOKEN_BUCKET -> List.of(
              String.valueOf(now),
              String.valueOf(rule.limit()),
              Double.toString(rule.refillPerSecond()),
              String.valueOf(rule.cost()),
              String.valueOf(rule.window().toMillis() + 1000));
          case FIXED_WINDOW -> List.of(
              String.valueOf(now),
              String.valueOf(rule.window().toMillis()),
              String.valueOf(rule.limit()),
              String.valueOf(rule.cost()));
        };
    Object raw = accessor.global().eval(scriptFor(rule.algorithm()), List.of(key), args);
    List<Object> reply = ScriptResults.asList(raw);
    boolean allowed = ScriptResults.longAt(reply, 0) == 1;
    long remaining = ScriptResults.longAt(reply, 1);
    if (allowed) {
      return RateLimitDecision.allowed(scope, rule.limit(), remaining);
    }
    Duration retryAfter = Duration.ofMillis(Math.max(1, ScriptResults.longAt(reply, 2)));
    log.debug("[RateLimiter] denied scope={}, key={}, retryAfter={}", scope, key, retryAfter);
    return RateLimitDecision.denied(scope, rule.limit(), retryAfter);
  }

  private RateLimitDecision failOpen(RuntimeException e, RateLimitScope scope, String identifier) {
    if (!StoreFailures.isUnavailable(e)) {
      throw e;
    }
    log.warn(
        "⚠️ [RateLimiter] fail-open: scope={}, identifier={}, cause={}",
        scope,
        identifier,
        e.getMessage());
    return RateLimitDecision.failOpen(scope);
  }

  private void record(RateLimitDecision decision) {
    Counter.builder("keystone.ratelimit.decisions")
        .tag("scope", decision.scope().key())
        .tag("verdict", decision.verdict().name().toLowerCase())
        .register(meterRegistry)
        .increment();
  }

  private static StoreScript scriptFor(RateLimitAlgorithm algorithm) {
    return switch (algorithm) {
      case SLIDING_WINDOW -> RateLimitScripts.SLIDING_WINDOW;
      case TOKEN_BUCKET -> RateLimitScripts.TOKEN_BUCKET;
      case FIXED_WINDOW -> RateLimitScripts.FIXED_WINDOW;
    };
  }

  private static String keyOf(String identifier, RateLimitScope scope, RateLimitRule rule) {
    if (identifier == null || identifier.isBlank()) {
      throw new InvalidInputException("rate limit identifier must not be blank");
    }
    return GlobalKeyspace.RATE_LIMIT.key(
        rule.algorithm().key(), scope.key(), identifier, rule.windowLabel());
  }

  private static long fixedWindowUsage(Map<String, String> fields, long now) {
    String resetAt = fields.get("reset_at");
    if (resetAt == null || now >= Long.parseLong(resetAt)) {
      return 0;
    }
    return Long.parseLong(fields.getOrDefault("count", "0"));
  }

  private static long tokenBucketUsage(Map<String, String> fields, RateLimitRule rule, long now) {
    if (!fields.containsKey("tokens") || !fields.containsKey("last_refill")) {
      return 0;
    }
    double tokens = Double.parseDouble(fields.get("tokens"));
    long elapsed = Math.max(0, now - Long.parseLong(fields.get("last_refill")));
    double current = Math.min(rule.limit(), tokens + elapsed * rule.refillPerSecond() / 1000);
    return rule.limit() - (long) Math.floor(current);
  }

  private static RateLimitDecision unrestricted() {
    return new RateLimitDecision(Verdict.ALLOWED, null, -1, -1, Duration.ZERO);
  }
}
