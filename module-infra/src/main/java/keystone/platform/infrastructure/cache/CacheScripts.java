package keystone.platform.infrastructure.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import keystone.platform.core.port.out.KeyStoreCommands;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.core.port.out.StoreScript.ResultType;
import keystone.platform.infrastructure.keystore.ScriptResults;

/**
 * 테넌트 캐시 / 진행률 원자 스크립트
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │  Entry:    tenant:{scope}:cache:{key}     (HASH)             │
 * │            payload, version, created_at, last_accessed_at,   │
 * │            ttl_ms, tags                                      │
 * │  Tag:      tenant:{scope}:tag:{tag}       (SET of cache key) │
 * │  Progress: tenant:{scope}:progress:{id}   (HASH)             │
 * │  Log:      tenant:{scope}:progress:{id}:log (LIST)           │
 * └──────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>각 스크립트는 Lua 본문과 같은 의미의 Java 구현을 함께 가집니다.
 */
public final class CacheScripts {

  private CacheScripts() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * 엔트리 쓰기 + 버전 증가 + 태그 색인
   *
   * <pre>
   * KEYS[1]    = entry
   * KEYS[2..n] = tag sets
   * ARGV[1] = payload
   * ARGV[2] = now (ms)
   * ARGV[3] = ttl (ms)
   * ARGV[4] = tags (comma separated)
   * ARGV[5] = logical cache key (tag set member)
   *
   * Returns: 새 version
   * </pre>
   *
   * <p>태그 SET의 TTL은 가장 오래 사는 엔트리에 맞춰 늘리기만 합니다.
   */
  public static final StoreScript PUT =
      StoreScript.of(
          "cache-put",
          """
          local created = redis.call('HGET', KEYS[1], 'created_at')
          if not created then
              created = ARGV[2]
          end
          local version = redis.call('HINCRBY', KEYS[1], 'version', 1)
          redis.call('HSET', KEYS[1], 'payload', ARGV[1], 'created_at', created,
              'last_accessed_at', ARGV[2], 'ttl_ms', ARGV[3], 'tags', ARGV[4])
          local ttl = tonumber(ARGV[3])
          redis.call('PEXPIRE', KEYS[1], ttl)
          for i = 2, #KEYS do
              redis.call('SADD', KEYS[i], ARGV[5])
              if redis.call('PTTL', KEYS[i]) < ttl then
                  redis.call('PEXPIRE', KEYS[i], ttl)
              end
          end
          return version
          """,
          ResultType.INTEGER,
          CacheScripts::put);

  /**
   * 엔트리 읽기 + last_accessed_at 갱신
   *
   * <pre>
   * KEYS[1] = entry
   * ARGV[1] = now (ms)
   *
   * Returns: HGETALL 결과, 없으면 빈 배열
   * </pre>
   */
  public static final StoreScript GET =
      StoreScript.of(
          "cache-get",
          """
          if redis.call('EXISTS', KEYS[1]) == 0 then
              return {}
          end
          redis.call('HSET', KEYS[1], 'last_accessed_at', ARGV[1])
          return redis.call('HGETALL', KEYS[1])
          """,
          ResultType.MULTI,
          CacheScripts::get);

  /**
   * 태그 무효화
   *
   * <p>엔트리의 현재 tags 필드에 태그가 남아 있는 경우에만 삭제합니다. 같은 태그로 두 번 호출하면 두 번째는 0을 반환합니다.
   *
   * <pre>
   * KEYS[1] = tag set
   * ARGV[1] = entry key prefix (tenant:{scope}:cache:)
   * ARGV[2] = tag
   *
   * Returns: 실제로 삭제된 엔트리 수
   * </pre>
   */
  public static final StoreScript INVALIDATE_TAG =
      StoreScript.of(
          "cache-invalidate-tag",
          """
          local members = redis.call('SMEMBERS', KEYS[1])
          local deleted = 0
          local needle = ',' .. ARGV[2] .. ','
          for _, member in ipairs(members) do
              local entry = ARGV[1] .. member
              local tags = redis.call('HGET', entry, 'tags')
              if tags and string.find(',' .. tags .. ',', needle, 1, true) then
                  deleted = deleted + redis.call('DEL', entry)
              end
          end
          redis.call('DEL', KEYS[1])
          return deleted
          """,
          ResultType.INTEGER,
          CacheScripts::invalidateTag);

  /**
   * 진행률 시작 (기존 기록 덮어씀)
   *
   * <pre>
   * KEYS[1] = progress hash
   * KEYS[2] = progress log
   * ARGV[1] = total steps
   * ARGV[2] = now (ms)
   * ARGV[3] = message ('' 허용)
   * ARGV[4] = ttl (ms)
   *
   * Returns: 1
   * </pre>
   */
  public static final StoreScript PROGRESS_START =
      StoreScript.of(
          "progress-start",
          """
          redis.call('DEL', KEYS[1], KEYS[2])
          redis.call('HSET', KEYS[1], 'total_steps', ARGV[1], 'completed_steps', 0,
              'last_message', ARGV[3], 'status', 'in_progress',
              'started_at', ARGV[2], 'updated_at', ARGV[2])
          redis.call('PEXPIRE', KEYS[1], ARGV[4])
          if ARGV[3] ~= '' then
              redis.call('RPUSH', KEYS[2], ARGV[3])
              redis.call('PEXPIRE', KEYS[2], ARGV[4])
          end
          return 1
          """,
          ResultType.INTEGER,
          CacheScripts::progressStart);

  /**
   * 진행률 전진 (total_steps 상한)
   *
   * <pre>
   * KEYS[1] = progress hash
   * KEYS[2] = progress log
   * ARGV[1] = steps
   * ARGV[2] = now (ms)
   * ARGV[3] = message ('' 허용)
   * ARGV[4] = ttl (ms)
   * ARGV[5] = log 보존 개수
   *
   * Returns: 갱신된 completed_steps, -1 (없음), -2 (이미 종료)
   * </pre>
   */
  public static final StoreScript PROGRESS_ADVANCE =
      StoreScript.of(
          "progress-advance",
          """
          local status = redis.call('HGET', KEYS[1], 'status')
          if not status then
              return -1
          end
          if status ~= 'in_progress' then
              return -2
          end
          local total = tonumber(redis.call('HGET', KEYS[1], 'total_steps'))
          local done = tonumber(redis.call('HGET', KEYS[1], 'completed_steps')) + tonumber(ARGV[1])
          if done > total then
              done = total
          end
          if done < 0 then
              done = 0
          end
          redis.call('HSET', KEYS[1], 'completed_steps', done, 'updated_at', ARGV[2])
          if ARGV[3] ~= '' then
              redis.call('HSET', KEYS[1], 'last_message', ARGV[3])
              redis.call('RPUSH', KEYS[2], ARGV[3])
              redis.call('LTRIM', KEYS[2], -tonumber(ARGV[5]), -1)
          end
          redis.call('PEXPIRE', KEYS[1], ARGV[4])
          redis.call('PEXPIRE', KEYS[2], ARGV[4])
          return done
          """,
          ResultType.INTEGER,
          CacheScripts::progressAdvance);

  /**
   * 진행률 종료 (completed / failed). 종료 후에는 유예 TTL만 남습니다.
   *
   * <pre>
   * KEYS[1] = progress hash
   * KEYS[2] = progress log
   * ARGV[1] = status (completed | failed)
   * ARGV[2] = now (ms)
   * ARGV[3] = message ('' 허용)
   * ARGV[4] = error ('' 허용)
   * ARGV[5] = grace ttl (ms)
   * ARGV[6] = log 보존 개수
   *
   * Returns: 1 (종료), -1 (없음), -2 (이미 종료)
   * </pre>
   */
  public static final StoreScript PROGRESS_FINISH =
      StoreScript.of(
          "progress-finish",
          """
          local status = redis.call('HGET', KEYS[1], 'status')
          if not status then
              return -1
          end
          if status ~= 'in_progress' then
              return -2
          end
          redis.call('HSET', KEYS[1], 'status', ARGV[1],
              'updated_at', ARGV[2], 'completed_at', ARGV[2])
          if ARGV[1] == 'completed' then
              local total = redis.call('HGET', KEYS[1], 'total_steps')
              redis.call('HSET', KEYS[1], 'completed_steps', total)
          end
          if ARGV[3] ~= '' then
              redis.call('HSET', KEYS[1], 'last_message', ARGV[3])
              redis.call('RPUSH', KEYS[2], ARGV[3])
              redis.call('LTRIM', KEYS[2], -tonumber(ARGV[6]), -1)
          end
          if ARGV[4] ~= '' then
              redis.call('HSET', KEYS[1], 'error_message', ARGV[4])
          end
          redis.call('PEXPIRE', KEYS[1], ARGV[5])
          redis.call('PEXPIRE', KEYS[2], ARGV[5])
          return 1
          """,
          ResultType.INTEGER,
          CacheScripts::progressFinish);

  public static List<StoreScript> all() {
    return List.of(PUT, GET, INVALIDATE_TAG, PROGRESS_START, PROGRESS_ADVANCE, PROGRESS_FINISH);
  }

  // ==================== Java 구현 ====================

  private static Object put(KeyStoreCommands store, List<String> keys, List<String> args) {
    String entry = keys.get(0);
    String created = store.hashGet(entry, "created_at").orElse(args.get(1));
    long version = store.hashIncrement(entry, "version", 1);
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("payload", args.get(0));
    fields.put("created_at", created);
    fields.put("last_accessed_at", args.get(1));
    fields.put("ttl_ms", args.get(2));
    fields.put("tags", args.get(3));
    store.hashPutAll(entry, fields);
    long ttl = Long.parseLong(args.get(2));
    store.expire(entry, Duration.ofMillis(ttl));
    for (String tagKey : keys.subList(1, keys.size())) {
      store.setAdd(tagKey, List.of(args.get(4)));
      long current = store.ttl(tagKey).map(Duration::toMillis).orElse(-1L);
      if (current < ttl) {
        store.expire(tagKey, Duration.ofMillis(ttl));
      }
    }
    return version;
  }

  private static Object get(KeyStoreCommands store, List<String> keys, List<String> args) {
    String entry = keys.get(0);
    if (!store.exists(entry)) {
      return new ArrayList<>();
    }
    store.hashPutAll(entry, Map.of("last_accessed_at", args.get(0)));
    return ScriptResults.flatten(store.hashGetAll(entry));
  }

  private static Object invalidateTag(
      KeyStoreCommands store, List<String> keys, List<String> args) {
    String needle = "," + args.get(1) + ",";
    long deleted = 0;
    for (String member : store.setMembers(keys.get(0))) {
      String entry = args.get(0) + member;
      String tags = store.hashGet(entry, "tags").orElse(null);
      if (tags != null && ("," + tags + ",").contains(needle)) {
        deleted += store.delete(List.of(entry));
      }
    }
    store.delete(List.of(keys.get(0)));
    return deleted;
  }

  private static Object progressStart(
      KeyStoreCommands store, List<String> keys, List<String> args) {
    store.delete(keys);
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("total_steps", args.get(0));
    fields.put("completed_steps", "0");
    fields.put("last_message", args.get(2));
    fields.put("status", "in_progress");
    fields.put("started_at", args.get(1));
    fields.put("updated_at", args.get(1));
    store.hashPutAll(keys.get(0), fields);
    Duration ttl = Duration.ofMillis(Long.parseLong(args.get(3)));
    store.expire(keys.get(0), ttl);
    if (!args.get(2).isEmpty()) {
      store.listPush(keys.get(1), args.get(2));
      store.expire(keys.get(1), ttl);
    }
    return 1L;
  }

  private static Object progressAdvance(
      KeyStoreCommands store, List<String> keys, List<String> args) {
    String status = store.hashGet(keys.get(0), "status").orElse(null);
    if (status == null) {
      return -1L;
    }
    if (!"in_progress".equals(status)) {
      return -2L;
    }
    long total = Long.parseLong(store.hashGet(keys.get(0), "total_steps").orElse("0"));
    long done =
        Long.parseLong(store.hashGet(keys.get(0), "completed_steps").orElse("0"))
            + Long.parseLong(args.get(0));
    done = Math.max(0, Math.min(total, done));
    store.hashPutAll(
        keys.get(0), Map.of("completed_steps", String.valueOf(done), "updated_at", args.get(1)));
    if (!args.get(2).isEmpty()) {
      store.hashPutAll(keys.get(0), Map.of("last_message", args.get(2)));
      store.listPush(keys.get(1), args.get(2));
      store.listTrim(keys.get(1), -Integer.parseInt(args.get(4)), -1);
    }
    Duration ttl = Duration.ofMillis(Long.parseLong(args.get(3)));
    store.expire(keys.get(0), ttl);
    store.expire(keys.get(1), ttl);
    return done;
  }

  private static Object progressFinish(
      KeyStoreCommands store, List<String> keys, List<String> args) {
    String status = store.hashGet(keys.get(0), "status").orElse(null);
    if (status == null) {
      return -1L;
    }
    if (!"in_progress".equals(status)) {
      return -2L;
    }
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("status", args.get(0));
    fields.put("updated_at", args.get(1));
    fields.put("completed_at", args.get(1));
    if ("completed".equals(args.get(0))) {
      fields.put("completed_steps", store.hashGet(keys.get(0), "total_steps").orElse("0"));
    }
    if (!args.get(2).isEmpty()) {
      fields.put("last_message", args.get(2));
    }
    if (!args.get(3).isEmpty()) {
      fields.put("error_message", args.get(3));
    }
    store.hashPutAll(keys.get(0), fields);
    if (!args.get(2).isEmpty()) {
      store.listPush(keys.get(1), args.get(2));
      store.listTrim(keys.get(1), -Integer.parseInt(args.get(5)), -1);
    }
    Duration grace = Duration.ofMillis(Long.parseLong(args.get(4)));
    store.expire(keys.get(0), grace);
    store.expire(keys.get(1), grace);
    return 1L;
  }
}
