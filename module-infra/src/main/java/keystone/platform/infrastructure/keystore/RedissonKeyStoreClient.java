package keystone.platform.infrastructure.keystore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import keystone.platform.core.port.out.KeyStoreClient;
import keystone.platform.core.port.out.ScoredMember;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.error.exception.StoreConnectionException;
import keystone.platform.error.exception.StoreScriptExecutionException;
import keystone.platform.error.exception.StoreTimeoutException;
import keystone.platform.error.exception.base.BaseException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.RedissonShutdownException;
import org.redisson.api.RKeys;
import org.redisson.api.RMap;
import org.redisson.api.RScoredSortedSet;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisException;
import org.redisson.client.RedisTimeoutException;
import org.redisson.client.codec.StringCodec;
import org.redisson.client.protocol.ScoredEntry;

/**
 * Redisson 기반 KeyStoreClient
 *
 * <h3>예외 변환</h3>
 *
 * <ul>
 *   <li>RedisConnectionException / RedissonShutdownException → {@link StoreConnectionException}
 *   <li>RedisTimeoutException → {@link StoreTimeoutException}
 *   <li>스크립트/명령 오류 (ERR, WRONGTYPE) → {@link StoreScriptExecutionException} (서킷 집계 제외)
 *   <li>그 외 RedisException → {@link StoreConnectionException}
 * </ul>
 *
 * <p>모든 값은 {@link StringCodec}으로 저장되므로 Lua 스크립트와 Java 코드가 같은 표현을 봅니다.
 */
@Slf4j
public class RedissonKeyStoreClient implements KeyStoreClient {

  private static final String RPUSH = "return redis.call('RPUSH', KEYS[1], ARGV[1])";
  private static final String HINCRBY = "return redis.call('HINCRBY', KEYS[1], ARGV[1], ARGV[2])";
  private static final String SADD = "return redis.call('SADD', KEYS[1], unpack(ARGV))";
  private static final String SREM = "return redis.call('SREM', KEYS[1], unpack(ARGV))";
  private static final String PING = "return redis.call('PING')";

  private final RedissonClient redissonClient;
  private final ScriptShaCache shaCache;
  private final long timeoutMillis;

  public RedissonKeyStoreClient(
      RedissonClient redissonClient, ScriptShaCache shaCache, Duration operationTimeout) {
    this.redissonClient = redissonClient;
    this.shaCache = shaCache;
    this.timeoutMillis = operationTimeout.toMillis();
  }

  // ==================== String / Key ====================

  @Override
  public Optional<String> get(String key) {
    return call(
        "get",
        () ->
            Optional.ofNullable(
                redissonClient.<String>getBucket(key, StringCodec.INSTANCE).get()));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    call(
        "set",
        () -> {
          if (ttl == null) {
            redissonClient.getBucket(key, StringCodec.INSTANCE).set(value);
          } else {
            redissonClient
                .getBucket(key, StringCodec.INSTANCE)
                .set(value, Math.max(1, ttl.toMillis()), TimeUnit.MILLISECONDS);
          }
          return null;
        });
  }

  @Override
  public long delete(Collection<String> keys) {
    if (keys.isEmpty()) {
      return 0;
    }
    return call("delete", () -> keys().delete(keys.toArray(new String[0])));
  }

  @Override
  public boolean exists(String key) {
    return call("exists", () -> keys().countExists(key) > 0);
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return call(
        "expire", () -> keys().expire(key, Math.max(1, ttl.toMillis()), TimeUnit.MILLISECONDS));
  }

  @Override
  public Optional<Duration> ttl(String key) {
    return call(
        "ttl",
        () -> {
          long remaining = keys().remainTimeToLive(key);
          return remaining < 0
              ? Optional.<Duration>empty()
              : Optional.of(Duration.ofMillis(remaining));
        });
  }

  @Override
  public long increment(String key, long delta) {
    return call("increment", () -> redissonClient.getAtomicLong(key).addAndGet(delta));
  }

  @Override
  public List<String> scan(String pattern, int batchSize) {
    return call(
        "scan",
        () -> {
          List<String> result = new ArrayList<>();
          keys().getKeysByPattern(pattern, batchSize).forEach(result::add);
          return result;
        });
  }

  // ==================== Hash ====================

  @Override
  public Map<String, String> hashGetAll(String key) {
    return call("hashGetAll", () -> new LinkedHashMap<>(map(key).readAllMap()));
  }

  @Override
  public Optional<String> hashGet(String key, String field) {
    return call("hashGet", () -> Optional.ofNullable(map(key).get(field)));
  }

  @Override
  public void hashPutAll(String key, Map<String, String> fields) {
    if (fields.isEmpty()) {
      return;
    }
    call(
        "hashPutAll",
        () -> {
          map(key).putAll(fields);
          return null;
        });
  }

  @Override
  public long hashIncrement(String key, String field, long delta) {
    return call(
        "hashIncrement",
        () ->
            toLong(
                inline(
                    HINCRBY,
                    RScript.ReturnType.INTEGER,
                    List.of(key),
                    field,
                    Long.toString(delta))));
  }

  // ==================== Sorted Set ====================

  @Override
  public boolean zAdd(String key, double score, String member) {
    return call("zAdd", () -> zset(key).add(score, member));
  }

  @Override
  public boolean zRemove(String key, String member) {
    return call("zRemove", () -> zset(key).remove(member));
  }

  @Override
  public long zRemoveRangeByScore(String key, double min, double max) {
    return call(
        "zRemoveRangeByScore", () -> (long) zset(key).removeRangeByScore(min, true, max, true));
  }

  @Override
  public long zCard(String key) {
    return call("zCard", () -> (long) zset(key).size());
  }

  @Override
  public List<ScoredMember> zRangeWithScores(String key, int start, int end) {
    return call(
        "zRangeWithScores",
        () -> {
          Collection<ScoredEntry<String>> entries = zset(key).entryRange(start, end);
          List<ScoredMember> result = new ArrayList<>(entries.size());
          for (ScoredEntry<String> entry : entries) {
            result.add(new ScoredMember(entry.getValue(), entry.getScore()));
          }
          return result;
        });
  }

  @Override
  public List<String> zRangeByScore(String key, double min, double max, int limit) {
    return call(
        "zRangeByScore",
        () -> new ArrayList<>(zset(key).valueRange(min, true, max, true, 0, limit)));
  }

  @Override
  public Optional<Double> zScore(String key, String member) {
    return call("zScore", () -> Optional.ofNullable(zset(key).getScore(member)));
  }

  // ==================== List ====================

  @Override
  public long listPush(String key, String value) {
    return call(
        "listPush", () -> toLong(inline(RPUSH, RScript.ReturnType.INTEGER, List.of(key), value)));
  }

  @Override
  public List<String> listRange(String key, int start, int end) {
    return call(
        "listRange",
        () ->
            new ArrayList<>(
                redissonClient.<String>getList(key, StringCodec.INSTANCE).range(start, end)));
  }

  @Override
  public void listTrim(String key, int start, int end) {
    call(
        "listTrim",
        () -> {
          redissonClient.getList(key, StringCodec.INSTANCE).trim(start, end);
          return null;
        });
  }

  @Override
  public long listLength(String key) {
    return call(
        "listLength", () -> (long) redissonClient.getList(key, StringCodec.INSTANCE).size());
  }

  // ==================== Set ====================

  @Override
  public long setAdd(String key, Collection<String> members) {
    if (members.isEmpty()) {
      return 0;
    }
    return call(
        "setAdd",
        () -> toLong(inline(SADD, RScript.ReturnType.INTEGER, List.of(key), members.toArray())));
  }

  @Override
  public Set<String> setMembers(String key) {
    return call(
        "setMembers",
        () ->
            new LinkedHashSet<>(
                redissonClient.<String>getSet(key, StringCodec.INSTANCE).readAll()));
  }

  @Override
  public long setRemove(String key, Collection<String> members) {
    if (members.isEmpty()) {
      return 0;
    }
    return call(
        "setRemove",
        () -> toLong(inline(SREM, RScript.ReturnType.INTEGER, List.of(key), members.toArray())));
  }

  // ==================== Connection / Script ====================

  @Override
  public String ping() {
    return call("ping", () -> String.valueOf(inline(PING, RScript.ReturnType.STATUS, List.of())));
  }

  @Override
  public Object eval(StoreScript script, List<String> keys, List<String> args) {
    return call("eval:" + script.name(), () -> evalWithNoscriptHandling(script, keys, args));
  }

  private Object evalWithNoscriptHandling(
      StoreScript script, List<String> keys, List<String> args) {
    try {
      return evalSha(script, shaCache.shaOf(script), keys, args);
    } catch (RedisException e) {
      if (!ScriptShaCache.isNoscriptError(e)) {
        throw e;
      }
      log.warn("⚠️ [NOSCRIPT] 스크립트 재로드 필요: {}", script.name());
      return evalSha(script, shaCache.reload(script), keys, args);
    }
  }

  private Object evalSha(StoreScript script, String sha, List<String> keys, List<String> args) {
    RScript rScript = redissonClient.getScript(StringCodec.INSTANCE);
    return rScript.evalSha(
        RScript.Mode.READ_WRITE,
        sha,
        returnTypeOf(script.resultType()),
        new ArrayList<Object>(keys),
        args.toArray());
  }

  private static RScript.ReturnType returnTypeOf(StoreScript.ResultType type) {
    return switch (type) {
      case INTEGER -> RScript.ReturnType.INTEGER;
      case VALUE -> RScript.ReturnType.VALUE;
      case MULTI -> RScript.ReturnType.MULTI;
    };
  }

  // ==================== internals ====================

  private RKeys keys() {
    return redissonClient.getKeys();
  }

  private RMap<String, String> map(String key) {
    return redissonClient.getMap(key, StringCodec.INSTANCE);
  }

  private RScoredSortedSet<String> zset(String key) {
    return redissonClient.getScoredSortedSet(key, StringCodec.INSTANCE);
  }

  private Object inline(
      String lua, RScript.ReturnType returnType, List<String> keys, Object... args) {
    RScript rScript = redissonClient.getScript(StringCodec.INSTANCE);
    return rScript.eval(
        RScript.Mode.READ_WRITE, lua, returnType, new ArrayList<Object>(keys), args);
  }

  private static long toLong(Object value) {
    return ScriptResults.asLong(value);
  }

  private <T> T call(String operation, Supplier<T> command) {
    try {
      return command.get();
    } catch (BaseException e) {
      throw e;
    } catch (RedisTimeoutException e) {
      throw new StoreTimeoutException(operation, timeoutMillis, e);
    } catch (RedisConnectionException | RedissonShutdownException e) {
      throw new StoreConnectionException(operation, e);
    } catch (RedisException e) {
      if (isCommandError(e)) {
        throw new StoreScriptExecutionException(operation, e);
      }
      throw new StoreConnectionException(operation, e);
    }
  }

  private static boolean isCommandError(RedisException e) {
    String message = e.getMessage();
    return message != null
        && (message.contains("WRONGTYPE")
            || message.contains("ERR ")
            || message.contains("NOSCRIPT")
            || message.contains("Error running script"));
  }
}
