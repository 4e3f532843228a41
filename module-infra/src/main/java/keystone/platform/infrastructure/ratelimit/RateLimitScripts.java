package keystone.platform.infrastructure.ratelimit;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import keystone.platform.core.port.out.KeyStoreCommands;
import keystone.platform.core.port.out.ScoredMember;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.core.port.out.StoreScript.ResultType;

/**
 * Rate Limit 원자 스크립트
 *
 * <p>check-then-add를 한 번의 스크립트로 실행해 같은 식별자에 대한 동시 요청이 경합하지 않도록 합니다. 모든 스크립트의 반환 형태는
 * 같습니다.
 *
 * <pre>
 * Returns: {allowed (1|0), remaining, retry_after_ms}
 * </pre>
 */
public final class RateLimitScripts {

  private RateLimitScripts() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Sliding Window Log
   *
   * <p>요청마다 ZSET 엔트리(score = 요청 시각 ms)를 남기고, 윈도우 밖 엔트리를 정리한 뒤 개수를 셉니다. 거부 시 retry_after는 가장
   * 오래된 엔트리가 윈도우를 벗어날 때까지의 시간입니다.
   *
   * <pre>
   * KEYS[1] = ratelimit:sliding_window:{scope}:{identifier}:{window}
   * ARGV[1] = now (ms)
   * ARGV[2] = window (ms)
   * ARGV[3] = limit
   * ARGV[4] = cost
   * ARGV[5] = request id (ZSET member 접두사)
   * </pre>
   */
  public static final StoreScript SLIDING_WINDOW =
      StoreScript.of(
          "ratelimit-sliding-window",
          """
          local now = tonumber(ARGV[1])
          local window = tonumber(ARGV[2])
          local limit = tonumber(ARGV[3])
          local cost = tonumber(ARGV[4])
          redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', now - window)
          local count = redis.call('ZCARD', KEYS[1])
          if count + cost <= limit then
              for i = 1, cost do
                  redis.call('ZADD', KEYS[1], ARGV[1], ARGV[5] .. ':' .. i)
              end
              redis.call('PEXPIRE', KEYS[1], ARGV[2])
              return {1, limit - count - cost, 0}
          end
          local retry = window
          local oldest = redis.call('ZRANGE', KEYS[1], 0, 0, 'WITHSCORES')
          if oldest[2] then
              retry = tonumber(oldest[2]) + window - now
          end
          return {0, math.max(0, limit - count), retry}
          """,
          ResultType.MULTI,
          RateLimitScripts::slidingWindow);

  /**
   * Token Bucket
   *
   * <p>마지막 보충 시각부터 경과한 시간만큼 토큰을 채운 뒤(용량 상한) cost만큼 소비합니다. 거부 시 retry_after는 부족한 토큰이 채워질
   * 때까지의 시간입니다.
   *
   * <pre>
   * KEYS[1] = ratelimit:token_bucket:{scope}:{identifier}:{window}
   * ARGV[1] = now (ms)
   * ARGV[2] = capacity
   * ARGV[3] = refill per second
   * ARGV[4] = cost
   * ARGV[5] = key ttl (ms)
   * </pre>
   */
  public static final StoreScript TOKEN_BUCKET =
      StoreScript.of(
          "ratelimit-token-bucket",
          """
          local now = tonumber(ARGV[1])
          local capacity = tonumber(ARGV[2])
          local rate = tonumber(ARGV[3])
          local cost = tonumber(ARGV[4])
          local tokens = tonumber(redis.call('HGET', KEYS[1], 'tokens'))
          local last = tonumber(redis.call('HGET', KEYS[1], 'last_refill'))
          if tokens == nil or last == nil then
              tokens = capacity
              last = now
          end
          local elapsed = math.max(0, now - last)
          tokens = math.min(capacity, tokens + elapsed * rate / 1000)
          local allowed = 0
          local retry = 0
          if tokens >= cost then
              tokens = tokens - cost
              allowed = 1
          else
              retry = math.ceil((cost - tokens) * 1000 / rate)
          end
          redis.call('HSET', KEYS[1], 'tokens', tostring(tokens), 'last_refill', ARGV[1])
          redis.call('PEXPIRE', KEYS[1], ARGV[5])
          return {allowed, math.floor(tokens), retry}
          """,
          ResultType.MULTI,
          RateLimitScripts::tokenBucket);

  /**
   * Fixed Window (정렬된 분/시/일 버킷)
   *
   * <pre>
   * KEYS[1] = ratelimit:fixed_window:{scope}:{identifier}:{window}
   * ARGV[1] = now (ms)
   * ARGV[2] = window (ms)
   * ARGV[3] = limit
   * ARGV[4] = cost
   * </pre>
   */
  public static final StoreScript FIXED_WINDOW =
      StoreScript.of(
          "ratelimit-fixed-window",
          """
          local now = tonumber(ARGV[1])
          local window = tonumber(ARGV[2])
          local limit = tonumber(ARGV[3])
          local cost = tonumber(ARGV[4])
          local count = tonumber(redis.call('HGET', KEYS[1], 'count'))
          local reset = tonumber(redis.call('HGET', KEYS[1], 'reset_at'))
          if count == nil or reset == nil or now >= reset then
              count = 0
              reset = now - (now % window) + window
          end
          if count + cost <= limit then
              count = count + cost
              redis.call('HSET', KEYS[1], 'count', count, 'reset_at', reset)
              redis.call('PEXPIRE', KEYS[1], reset - now)
              return {1, limit - count, 0}
          end
          return {0, math.max(0, limit - count), reset - now}
          """,
          ResultType.MULTI,
          RateLimitScripts::fixedWindow);

  public static List<StoreScript> all() {
    return List.of(SLIDING_WINDOW, TOKEN_BUCKET, FIXED_WINDOW);
  }

  // ==================== Java 구현 ====================

  private static Object slidingWindow(
      KeyStoreCommands store, List<String> keys, List<String> args) {
    String key = keys.get(0);
    long now = Long.parseLong(args.get(0));
    long window = Long.parseLong(args.get(1));
    long limit = Long.parseLong(args.get(2));
    long cost = Long.parseLong(args.get(3));
    store.zRemoveRangeByScore(key, Double.NEGATIVE_INFINITY, now - window);
    long count = store.zCard(key);
    if (count + cost <= limit) {
      for (int i = 1; i <= cost; i++) {
        store.zAdd(key, now, args.get(4) + ":" + i);
      }
      store.expire(key, Duration.ofMillis(window));
      return List.of(1L, limit - count - cost, 0L);
    }
    long retry = window;
    List<ScoredMember> oldest = store.zRangeWithScores(key, 0, 0);
    if (!oldest.isEmpty()) {
      retry = (long) oldest.get(0).score() + window - now;
    }
    return List.of(0L, Math.max(0, limit - count), retry);
  }

  private static Object tokenBucket(KeyStoreCommands store, List<String> keys, List<String> args) {
    String key = keys.get(0);
    long now = Long.parseLong(args.get(0));
    double capacity = Double.parseDouble(args.get(1));
    double rate = Double.parseDouble(args.get(2));
    double cost = Double.parseDouble(args.get(3));
    Double tokens = store.hashGet(key, "tokens").map(Double::parseDouble).orElse(null);
    Long last = store.hashGet(key, "last_refill").map(Long::parseLong).orElse(null);
    if (tokens == null || last == null) {
      tokens = capacity;
      last = now;
    }
    long elapsed = Math.max(0, now - last);
    double current = Math.min(capacity, tokens + elapsed * rate / 1000);
    long allowed = 0;
    long retry = 0;
    if (current >= cost) {
      current -= cost;
      allowed = 1;
    } else {
      retry = (long) Math.ceil((cost - current) * 1000 / rate);
    }
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("tokens", Double.toString(current));
    fields.put("last_refill", args.get(0));
    store.hashPutAll(key, fields);
    store.expire(key, Duration.ofMillis(Long.parseLong(args.get(4))));
    return List.of(allowed, (long) Math.floor(current), retry);
  }

  private static Object fixedWindow(KeyStoreCommands store, List<String> keys, List<String> args) {
    String key = keys.get(0);
    long now = Long.parseLong(args.get(0));
    long window = Long.parseLong(args.get(1));
    long limit = Long.parseLong(args.get(2));
    long cost = Long.parseLong(args.get(3));
    Long count = store.hashGet(key, "count").map(Long::parseLong).orElse(null);
    Long reset = store.hashGet(key, "reset_at").map(Long::parseLong).orElse(null);
    if (count == null || reset == null || now >= reset) {
      count = 0L;
      reset = now - (now % window) + window;
    }
    if (count + cost <= limit) {
      count += cost;
      Map<String, String> fields = new LinkedHashMap<>();
      fields.put("count", String.valueOf(count));
      fields.put("reset_at", String.valueOf(reset));
      store.hashPutAll(key, fields);
      store.expire(key, Duration.ofMillis(reset - now));
      return List.of(1L, limit - count, 0L);
    }
    return List.of(0L, Math.max(0, limit - count), reset - now);
  }
}
