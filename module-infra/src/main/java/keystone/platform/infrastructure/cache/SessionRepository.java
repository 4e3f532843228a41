package keystone.platform.infrastructure.cache;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import keystone.platform.domain.model.session.Session;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.error.exception.StoreScriptExecutionException;
import keystone.platform.infrastructure.config.CacheProperties;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.executor.TaskContext;
import keystone.platform.infrastructure.keystore.ScriptResults;
import keystone.platform.infrastructure.tenant.GlobalKeyspace;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import lombok.extern.slf4j.Slf4j;

/**
 * 세션 저장소
 *
 * <p>세션은 여러 테넌트에 걸치므로 전역 {@link GlobalKeyspace#SESSION} 공간에 저장합니다. 세션 ID는 256bit 난수를 base64url로
 * 인코딩한 43자 토큰입니다. 형식이 맞지 않는 ID는 저장소에 닿기 전에 "없는 세션"으로 처리합니다 (사용자 인덱스 키와의 충돌 방지).
 *
 * <h3>테넌트 권한 변경</h3>
 *
 * <p>revision 필드로 낙관적 CAS를 수행하고, 충돌 시 최대 {@value #MAX_CAS_ATTEMPTS}회까지 다시 읽어 재시도합니다.
 */
@Slf4j
public class SessionRepository {

  private static final int TOKEN_BYTES = 32;
  private static final int MAX_CAS_ATTEMPTS = 3;
  private static final String USER_INDEX = "user";
  private static final String TENANT_SEPARATOR = ",";
  private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9_-]{43}");

  private final TenantIsolatedAccessor accessor;
  private final LogicExecutor executor;
  private final CacheProperties properties;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  public SessionRepository(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      CacheProperties properties,
      Clock clock) {
    this.accessor = accessor;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * 세션 생성
   *
   * <p>{@code keystone.cache.single-session-per-user}가 켜져 있으면 같은 사용자의 기존 세션을 먼저 폐기합니다.
   *
   * @param ttl null이면 {@code keystone.cache.session-ttl}
   */
  public Session create(String userId, Collection<TenantScope> tenants, Duration ttl) {
    requireUserId(userId);
    Duration effectiveTtl = ttl == null ? properties.sessionTtl() : requirePositive(ttl);
    if (properties.singleSessionPerUser()) {
      revokeAllForUser(userId);
    }
    String sessionId = newToken();
    Set<TenantScope> scopes = new LinkedHashSet<>(tenants == null ? List.of() : tenants);
    Instant now = clock.instant();

    executor.execute(
        () ->
            accessor
                .global()
                .eval(
                    SessionScripts.CREATE,
                    List.of(sessionKey(sessionId), userKey(userId)),
                    List.of(
                        userId,
                        joinTenants(scopes),
                        String.valueOf(now.toEpochMilli()),
                        String.valueOf(effectiveTtl.toMillis()),
                        sessionId)),
        TaskContext.of("Session", "create"));
    log.debug("[Session] created for user={}, tenants={}", userId, scopes.size());
    return new Session(sessionId, userId, scopes, now, now, effectiveTtl);
  }

  /** 세션 검증. 유효하면 활동 시각과 TTL을 갱신합니다 (sliding expiration). */
  public Optional<Session> validate(String sessionId) {
    if (!isWellFormed(sessionId)) {
      return Optional.empty();
    }
    return touch(sessionId, null, "validate");
  }

  /** TTL을 새 값으로 바꿔 연장 */
  public Optional<Session> extend(String sessionId, Duration ttl) {
    requirePositive(ttl);
    if (!isWellFormed(sessionId)) {
      return Optional.empty();
    }
    return touch(sessionId, ttl, "extend");
  }

  /** 활동 갱신 없이 조회 */
  public Optional<Session> find(String sessionId) {
    if (!isWellFormed(sessionId)) {
      return Optional.empty();
    }
    Map<String, String> fields =
        executor.execute(
            () -> accessor.global().hashGetAll(sessionKey(sessionId)),
            TaskContext.of("Session", "find"));
    return fields.isEmpty() ? Optional.empty() : Optional.of(toSession(sessionId, fields));
  }

  /** @return 세션이 존재해 폐기되었으면 true */
  public boolean revoke(String sessionId) {
    if (!isWellFormed(sessionId)) {
      return false;
    }
    long revoked =
        ScriptResults.asLong(
            executor.execute(
                () ->
                    accessor
                        .global()
                        .eval(
                            SessionScripts.REVOKE,
                            List.of(sessionKey(sessionId)),
                            List.of(userKeyPrefix(), sessionId)),
                TaskContext.of("Session", "revoke")));
    return revoked > 0;
  }

  /** @return 폐기된 세션 수 */
  public long revokeAllForUser(String userId) {
    requireUserId(userId);
    long revoked =
        ScriptResults.asLong(
            executor.execute(
                () ->
                    accessor
                        .global()
                        .eval(
                            SessionScripts.REVOKE_USER,
                            List.of(userKey(userId)),
                            List.of(GlobalKeyspace.SESSION.prefix() + ":")),
                TaskContext.of("Session", "revokeAll", userId)));
    if (revoked > 0) {
      log.info("[Session] revoked {} sessions of user={}", revoked, userId);
    }
    return revoked;
  }

  public Optional<Session> grantTenant(String sessionId, TenantScope scope) {
    return updateTenants(
        sessionId,
        tenants -> {
          tenants.add(scope);
          return tenants;
        });
  }

  public Optional<Session> revokeTenant(String sessionId, TenantScope scope) {
    return updateTenants(
        sessionId,
        tenants -> {
          tenants.remove(scope);
          return tenants;
        });
  }

  // ==================== internal ====================

  private Optional<Session> touch(String sessionId, Duration ttl, String operation) {
    Object reply =
        executor.execute(
            () ->
                accessor
                    .global()
                    .eval(
                        SessionScripts.TOUCH,
                        List.of(sessionKey(sessionId)),
                        List.of(
                            String.valueOf(clock.millis()),
                            ttl == null ? "" : String.valueOf(ttl.toMillis()),
                            userKeyPrefix())),
            TaskContext.of("Session", operation));
    Map<String, String> fields = ScriptResults.toMap(reply);
    return fields.isEmpty() ? Optional.empty() : Optional.of(toSession(sessionId, fields));
  }

  private Optional<Session> updateTenants(
      String sessionId, UnaryOperator<Set<TenantScope>> change) {
    if (!isWellFormed(sessionId)) {
      return Optional.empty();
    }
    for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
      Map<String, String> fields =
          executor.execute(
              () -> accessor.global().hashGetAll(sessionKey(sessionId)),
              TaskContext.of("Session", "readTenants"));
      if (fields.isEmpty()) {
        return Optional.empty();
      }
      Set<TenantScope> tenants = new LinkedHashSet<>(parseTenants(fields.get("tenants")));
      String next = joinTenants(change.apply(tenants));
      long result =
          ScriptResults.asLong(
              executor.execute(
                  () ->
                      accessor
                          .global()
                          .eval(
                              SessionScripts.COMPARE_AND_SET_TENANTS,
                              List.of(sessionKey(sessionId)),
                              List.of(fields.getOrDefault("revision", "0"), next)),
                  TaskContext.of("Session", "casTenants")));
      if (result == -1) {
        return Optional.empty();
      }
      if (result >= 0) {
        return find(sessionId);
      }
      log.debug("[Session] tenant update conflict, attempt {}/{}", attempt, MAX_CAS_ATTEMPTS);
    }
    throw new StoreScriptExecutionException(SessionScripts.COMPARE_AND_SET_TENANTS.name());
  }

  private Session toSession(String sessionId, Map<String, String> fields) {
    return new Session(
        sessionId,
        fields.get("user_id"),
        parseTenants(fields.get("tenants")),
        Instant.ofEpochMilli(Long.parseLong(fields.getOrDefault("created_at", "0"))),
        Instant.ofEpochMilli(Long.parseLong(fields.getOrDefault("last_activity_at", "0"))),
        Duration.ofMillis(Long.parseLong(fields.getOrDefault("ttl_ms", "0"))));
  }

  private static Set<TenantScope> parseTenants(String value) {
    if (value == null || value.isEmpty()) {
      return Set.of();
    }
    return Arrays.stream(value.split(TENANT_SEPARATOR))
        .map(TenantScope::of)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private static String joinTenants(Collection<TenantScope> tenants) {
    return tenants.stream().map(TenantScope::value).collect(Collectors.joining(TENANT_SEPARATOR));
  }

  private String newToken() {
    byte[] bytes = new byte[TOKEN_BYTES];
    random.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  static boolean isWellFormed(String sessionId) {
    return sessionId != null && SESSION_ID.matcher(sessionId).matches();
  }

  private static String sessionKey(String sessionId) {
    return GlobalKeyspace.SESSION.key(sessionId);
  }

  private static String userKey(String userId) {
    return GlobalKeyspace.SESSION.key(USER_INDEX, userId);
  }

  private static String userKeyPrefix() {
    return GlobalKeyspace.SESSION.prefix() + ":" + USER_INDEX + ":";
  }

  private static void requireUserId(String userId) {
    if (userId == null || userId.isBlank() || userId.chars().anyMatch(Character::isWhitespace)) {
      throw new InvalidInputException("userId must be non-blank without whitespace");
    }
  }

  private static Duration requirePositive(Duration ttl) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new InvalidInputException("session ttl must be positive");
    }
    return ttl;
  }
}
