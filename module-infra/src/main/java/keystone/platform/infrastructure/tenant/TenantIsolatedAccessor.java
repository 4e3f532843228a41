package keystone.platform.infrastructure.tenant;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import keystone.platform.core.port.out.KeyStoreClient;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.error.exception.ScopeRequiredException;
import keystone.platform.infrastructure.config.TenantProperties;
import keystone.platform.infrastructure.config.TenantProperties.IsolationMode;
import lombok.extern.slf4j.Slf4j;

/**
 * 테넌트 격리 저장소 접근자
 *
 * <p>모든 호출은 물리 키 {@code tenant:{scope}:{key}}로 변환되어 보호 계층({@code GuardedKeyStore})을 거칩니다. 키 이름 규칙은
 * 이 클래스 안에만 존재합니다.
 *
 * <h3>스코프 결정 순서</h3>
 *
 * <ol>
 *   <li>인자로 받은 scope
 *   <li>{@link TenantContext}에 바인딩된 scope
 *   <li>strict: {@link ScopeRequiredException} / permissive: default-scope + WARN
 * </ol>
 *
 * <p>테넌트에 속하지 않는 데이터(세션, Rate Limit, 큐)는 {@link #global()}과 {@link GlobalKeyspace}로 명시적으로 접근합니다.
 */
@Slf4j
public class TenantIsolatedAccessor {

  private static final String TENANT_PREFIX = "tenant:";
  private static final int SCAN_BATCH = 500;

  private final KeyStoreClient store;
  private final IsolationMode isolationMode;
  private final TenantScope defaultScope;

  public TenantIsolatedAccessor(KeyStoreClient store, TenantProperties properties) {
    this.store = store;
    this.isolationMode = properties.isolationMode();
    this.defaultScope = properties.defaultTenantScope();
  }

  // ==================== Key derivation ====================

  public TenantScope resolveScope(TenantScope scope, String operation) {
    if (scope != null) {
      return scope;
    }
    Optional<TenantScope> bound = TenantContext.current();
    if (bound.isPresent()) {
      return bound.get();
    }
    if (isolationMode == IsolationMode.PERMISSIVE) {
      log.warn(
          "⚠️ [TenantIsolation] {} called without scope, using default scope '{}'",
          operation,
          defaultScope);
      return defaultScope;
    }
    throw new ScopeRequiredException(operation);
  }

  /** 물리 키 파생. scope가 null이면 {@link #resolveScope} 규칙을 따릅니다. */
  public String physicalKey(TenantScope scope, String key) {
    return prefixOf(resolveScope(scope, "key")) + requireKey(key);
  }

  private static String prefixOf(TenantScope scope) {
    return TENANT_PREFIX + scope.value() + ":";
  }

  private static String requireKey(String key) {
    if (key == null || key.isBlank()) {
      throw new InvalidInputException("key must not be blank");
    }
    return key;
  }

  private String key(TenantScope scope, String key, String operation) {
    return prefixOf(resolveScope(scope, operation)) + requireKey(key);
  }

  // ==================== Core contract ====================

  public Optional<String> get(TenantScope scope, String key) {
    return store.get(key(scope, key, "get"));
  }

  public void set(TenantScope scope, String key, String value, Duration ttl) {
    store.set(key(scope, key, "set"), value, ttl);
  }

  /** @return 삭제되었으면 true */
  public boolean delete(TenantScope scope, String key) {
    return store.delete(List.of(key(scope, key, "delete"))) > 0;
  }

  /**
   * 스코프 안의 키 검색
   *
   * @param pattern 논리 키 glob ({@code *}, {@code ?})
   * @return 접두사를 제거한 논리 키
   */
  public List<String> scan(TenantScope scope, String pattern) {
    String prefix = prefixOf(resolveScope(scope, "scan"));
    return store.scan(prefix + requireKey(pattern), SCAN_BATCH).stream()
        .map(physical -> physical.substring(prefix.length()))
        .toList();
  }

  // ==================== Scoped extras ====================

  public boolean exists(TenantScope scope, String key) {
    return store.exists(key(scope, key, "exists"));
  }

  public boolean expire(TenantScope scope, String key, Duration ttl) {
    return store.expire(key(scope, key, "expire"), ttl);
  }

  public Optional<Duration> ttl(TenantScope scope, String key) {
    return store.ttl(key(scope, key, "ttl"));
  }

  public long deleteAll(TenantScope scope, Collection<String> keys) {
    TenantScope resolved = resolveScope(scope, "deleteAll");
    return store.delete(keys.stream().map(k -> prefixOf(resolved) + requireKey(k)).toList());
  }

  public Map<String, String> hashGetAll(TenantScope scope, String key) {
    return store.hashGetAll(key(scope, key, "hashGetAll"));
  }

  public void hashPutAll(TenantScope scope, String key, Map<String, String> fields) {
    store.hashPutAll(key(scope, key, "hashPutAll"), fields);
  }

  public Set<String> setMembers(TenantScope scope, String key) {
    return store.setMembers(key(scope, key, "setMembers"));
  }

  public List<String> listRange(TenantScope scope, String key, int start, int end) {
    return store.listRange(key(scope, key, "listRange"), start, end);
  }

  /**
   * 스코프 키로 원자적 스크립트 실행
   *
   * <p>스크립트 안에서 추가 키를 만들어야 하면 {@link #keyPrefix}를 인자로 넘깁니다.
   */
  public Object eval(TenantScope scope, StoreScript script, List<String> keys, List<String> args) {
    TenantScope resolved = resolveScope(scope, script.name());
    List<String> physical = keys.stream().map(k -> prefixOf(resolved) + requireKey(k)).toList();
    return store.eval(script, physical, args);
  }

  /** 스크립트 인자용 물리 접두사 ({@code tenant:{scope}:}) */
  public String keyPrefix(TenantScope scope) {
    return prefixOf(resolveScope(scope, "keyPrefix"));
  }

  // ==================== Global keyspaces ====================

  /** 전역 키 공간 전용 클라이언트. 키는 반드시 {@link GlobalKeyspace#key}로 만들어야 합니다. */
  public KeyStoreClient global() {
    return store;
  }
}
