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
 * 세션 원자 스크립트
 *
 * <pre>
 * session:{id}            (HASH) user_id, tenants, created_at, last_activity_at, ttl_ms, revision
 * session:user:{userId}   (SET)  session ids
 * </pre>
 */
public final class SessionScripts {

  private SessionScripts() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * 세션 생성 + 사용자 색인
   *
   * <pre>
   * KEYS[1] = session:{id}
   * KEYS[2] = session:user:{userId}
   * ARGV[1] = userId
   * ARGV[2] = tenants (comma separated)
   * ARGV[3] = now (ms)
   * ARGV[4] = ttl (ms)
   * ARGV[5] = session id
   * </pre>
   */
  public static final StoreScript CREATE =
      StoreScript.of(
          "session-create",
          """
          redis.call('HSET', KEYS[1], 'user_id', ARGV[1], 'tenants', ARGV[2],
              'created_at', ARGV[3], 'last_activity_at', ARGV[3], 'ttl_ms', ARGV[4], 'revision', 0)
          redis.call('PEXPIRE', KEYS[1], ARGV[4])
          redis.call('SADD', KEYS[2], ARGV[5])
          if redis.call('PTTL', KEYS[2]) < tonumber(ARGV[4]) then
              redis.call('PEXPIRE', KEYS[2], ARGV[4])
          end
          return 1
          """,
          ResultType.INTEGER,
          SessionScripts::create);

  /**
   * 활동 갱신 (validate / extend)
   *
   * <p>세션이 있을 때만 last_activity_at과 TTL을 갱신합니다. ARGV[2]가 비어 있으면 저장된 ttl_ms를 다시 적용합니다.
   *
   * <pre>
   * KEYS[1] = session:{id}
   * ARGV[1] = now (ms)
   * ARGV[2] = 새 ttl (ms) 또는 ''
   * ARGV[3] = 사용자 색인 접두사 (session:user:)
   *
   * Returns: HGETALL 결과, 없으면 빈 배열
   * </pre>
   */
  public static final StoreScript TOUCH =
      StoreScript.of(
          "session-touch",
          """
          if redis.call('EXISTS', KEYS[1]) == 0 then
              return {}
          end
          local ttl = ARGV[2]
          if ttl == '' then
              ttl = redis.call('HGET', KEYS[1], 'ttl_ms')
          else
              redis.call('HSET', KEYS[1], 'ttl_ms', ttl)
          end
          redis.call('HSET', KEYS[1], 'last_activity_at', ARGV[1])
          redis.call('PEXPIRE', KEYS[1], ttl)
          local userKey = ARGV[3] .. redis.call('HGET', KEYS[1], 'user_id')
          if redis.call('PTTL', userKey) < tonumber(ttl) then
              redis.call('PEXPIRE', userKey, ttl)
          end
          return redis.call('HGETALL', KEYS[1])
          """,
          ResultType.MULTI,
          SessionScripts::touch);

  /**
   * 세션 폐기
   *
   * <pre>
   * KEYS[1] = session:{id}
   * ARGV[1] = 사용자 색인 접두사 (session:user:)
   * ARGV[2] = session id
   *
   * Returns: 1 (폐기), 0 (없음)
   * </pre>
   */
  public static final StoreScript REVOKE =
      StoreScript.of(
          "session-revoke",
          """
          local user = redis.call('HGET', KEYS[1], 'user_id')
          if not user then
              return 0
          end
          redis.call('DEL', KEYS[1])
          redis.call('SREM', ARGV[1] .. user, ARGV[2])
          return 1
          """,
          ResultType.INTEGER,
          SessionScripts::revoke);

  /**
   * 사용자 전체 세션 폐기
   *
   * <pre>
   * KEYS[1] = session:user:{userId}
   * ARGV[1] = 세션 키 접두사 (session:)
   *
   * Returns: 삭제된 세션 수
   * </pre>
   */
  public static final StoreScript REVOKE_USER =
      StoreScript.of(
          "session-revoke-user",
          """
          local ids = redis.call('SMEMBERS', KEYS[1])
          local deleted = 0
          for _, id in ipairs(ids) do
              deleted = deleted + redis.call('DEL', ARGV[1] .. id)
          end
          redis.call('DEL', KEYS[1])
          return deleted
          """,
          ResultType.INTEGER,
          SessionScripts::revokeUser);

  /**
   * revision 기반 tenants 교체 (CAS)
   *
   * <pre>
   * KEYS[1] = session:{id}
   * ARGV[1] = 기대 revision
   * ARGV[2] = 새 tenants
   *
   * Returns: 새 revision, -1 (세션 없음), -2 (revision 불일치)
   * </pre>
   */
  public static final StoreScript COMPARE_AND_SET_TENANTS =
      StoreScript.of(
          "session-cas-tenants",
          """
          local revision = redis.call('HGET', KEYS[1], 'revision')
          if not revision then
              return -1
          end
          if revision ~= ARGV[1] then
              return -2
          end
          redis.call('HSET', KEYS[1], 'tenants', ARGV[2])
          return redis.call('HINCRBY', KEYS[1], 'revision', 1)
          """,
          ResultType.INTEGER,
          SessionScripts::compareAndSetTenants);

  public static List<StoreScript> all() {
    return List.of(CREATE, TOUCH, REVOKE, REVOKE_USER, COMPARE_AND_SET_TENANTS);
  }

  // ==================== Java 구현 ====================

  private static Object create(KeyStoreCommands store, List<String> keys, List<String> args) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("user_id", args.get(0));
    fields.put("tenants", args.get(1));
    fields.put("created_at", args.get(2));
    fields.put("last_activity_at", args.get(2));
    fields.put("ttl_ms", args.get(3));
    fields.put("revision", "0");
    store.hashPutAll(keys.get(0), fields);
    Duration ttl = Duration.ofMillis(Long.parseLong(args.get(3)));
    store.expire(keys.get(0), ttl);
    store.setAdd(keys.get(1), List.of(args.get(4)));
    extendIfShorter(store, keys.get(1), ttl);
    return 1L;
  }

  private static Object touch(KeyStoreCommands store, List<String> keys, List<String> args) {
    String session = keys.get(0);
    if (!store.exists(session)) {
      return new ArrayList<>();
    }
    String ttl = args.get(1);
    if (ttl.isEmpty()) {
      ttl = store.hashGet(session, "ttl_ms").orElse("0");
    } else {
      store.hashPutAll(session, Map.of("ttl_ms", ttl));
    }
    store.hashPutAll(session, Map.of("last_activity_at", args.get(0)));
    Duration duration = Duration.ofMillis(Long.parseLong(ttl));
    store.expire(session, duration);
    String userKey = args.get(2) + store.hashGet(session, "user_id").orElse("");
    extendIfShorter(store, userKey, duration);
    return ScriptResults.flatten(store.hashGetAll(session));
  }

  private static Object revoke(KeyStoreCommands store, List<String> keys, List<String> args) {
    String user = store.hashGet(keys.get(0), "user_id").orElse(null);
    if (user == null) {
      return 0L;
    }
    store.delete(List.of(keys.get(0)));
    store.setRemove(args.get(0) + user, List.of(args.get(1)));
    return 1L;
  }

  private static Object revokeUser(KeyStoreCommands store, List<String> keys, List<String> args) {
    long deleted = 0;
    for (String id : store.setMembers(keys.get(0))) {
      deleted += store.delete(List.of(args.get(0) + id));
    }
    store.delete(List.of(keys.get(0)));
    return deleted;
  }

  private static Object compareAndSetTenants(
      KeyStoreCommands store, List<String> keys, List<String> args) {
    String revision = store.hashGet(keys.get(0), "revision").orElse(null);
    if (revision == null) {
      return -1L;
    }
    if (!revision.equals(args.get(0))) {
      return -2L;
    }
    store.hashPutAll(keys.get(0), Map.of("tenants", args.get(1)));
    return store.hashIncrement(keys.get(0), "revision", 1);
  }

  private static void extendIfShorter(KeyStoreCommands store, String key, Duration ttl) {
    long current = store.ttl(key).map(Duration::toMillis).orElse(-1L);
    if (current < ttl.toMillis()) {
      store.expire(key, ttl);
    }
  }
}
