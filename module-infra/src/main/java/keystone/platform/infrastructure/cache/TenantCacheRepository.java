package keystone.platform.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import keystone.platform.domain.model.cache.CacheEntry;
import keystone.platform.domain.model.cache.CacheKeys;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.infrastructure.config.CacheProperties;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.executor.TaskContext;
import keystone.platform.infrastructure.executor.strategy.ExceptionTranslator;
import keystone.platform.infrastructure.keystore.ScriptResults;
import keystone.platform.infrastructure.resilience.StoreFailures;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import lombok.extern.slf4j.Slf4j;

/**
 * 테넌트 데이터 캐시
 *
 * <h3>읽기 실패 정책</h3>
 *
 * <p>저장소 장애(연결, 타임아웃, 서킷 OPEN, 풀 고갈) 중의 읽기는 miss로 처리하고 WARN 로그와
 * {@code keystone.cache.degraded} 카운터를 남깁니다. 호출자는 원본 데이터 소스로 진행합니다. 쓰기와 무효화는
 * 실패를 그대로 전파합니다. 스코프 누락과 검증 오류는 읽기에서도 흡수하지 않습니다.
 *
 * <h3>버전</h3>
 *
 * <p>같은 키에 쓸 때마다 version이 1씩 증가합니다 (Lua HINCRBY).
 */
@Slf4j
public class TenantCacheRepository {

  private static final String ENTRY_PREFIX = "cache:";
  private static final String TAG_PREFIX = "tag:";

  private final TenantIsolatedAccessor accessor;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final CacheProperties properties;
  private final Clock clock;
  private final Counter hits;
  private final Counter misses;
  private final Counter degraded;

  public TenantCacheRepository(
      TenantIsolatedAccessor accessor,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      CacheProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.accessor = accessor;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
    this.hits =
        Counter.builder("keystone.cache.requests").tag("result", "hit").register(meterRegistry);
    this.misses =
        Counter.builder("keystone.cache.requests").tag("result", "miss").register(meterRegistry);
    this.degraded = Counter.builder("keystone.cache.degraded").register(meterRegistry);
  }

  // ==================== Read ====================

  public <T> Optional<T> get(TenantScope scope, String key, Class<T> type) {
    return getEntry(scope, key).map(entry -> deserialize(entry.payload(), type, key));
  }

  /** 엔트리 전체 (version, 태그 포함) */
  public Optional<CacheEntry> getEntry(TenantScope scope, String key) {
    CacheKeys.requireValidKey(key);
    TenantScope resolved = accessor.resolveScope(scope, "cache.get");
    TaskContext context = TaskContext.of("Cache", "get", resolved.value());
    Optional<CacheEntry> entry =
        executor.executeOrCatch(
            () -> readEntry(resolved, key), e -> degradeToMiss(e, resolved, key), context);
    (entry.isPresent() ? hits : misses).increment();
    return entry;
  }

  /**
   * cache-aside 조회
   *
   * <p>miss면 loader 결과를 저장하고 반환합니다. 저장 실패는 WARN만 남기고 loader 결과를 그대로 돌려줍니다.
   */
  public <T> T getOrLoad(
      TenantScope scope, String key, Class<T> type, Duration ttl, Supplier<T> loader) {
    Optional<T> cached = get(scope, key, type);
    if (cached.isPresent()) {
      return cached.get();
    }
    T loaded = loader.get();
    if (loaded == null) {
      return null;
    }
    executor.executeOrCatch(
        () -> put(scope, key, loaded, ttl, List.of()),
        e -> {
          if (!StoreFailures.isUnavailable(e)) {
            throw e;
          }
          log.warn("⚠️ [Cache] write-back skipped: key={}, cause={}", key, e.getMessage());
          return null;
        },
        TaskContext.of("Cache", "writeBack", key));
    return loaded;
  }

  // ==================== Write ====================

  public CacheEntry put(TenantScope scope, String key, Object value) {
    return put(scope, key, value, null, List.of());
  }

  /**
   * 값 저장
   *
   * @param ttl null이면 {@code keystone.cache.default-ttl}
   * @return 저장된 엔트리 (증가된 version 포함)
   */
  public CacheEntry put(
      TenantScope scope, String key, Object value, Duration ttl, Collection<String> tags) {
    String payload = serialize(value, key);
    return putRaw(scope, key, payload, ttl, tags);
  }

  /** 이미 직렬화된 UTF-8 payload 저장 */
  public CacheEntry putRaw(
      TenantScope scope, String key, String payload, Duration ttl, Collection<String> tags) {
    CacheKeys.requireValidKey(key);
    Set<String> tagSet = new LinkedHashSet<>(tags == null ? List.of() : tags);
    CacheKeys.requireValidTags(tagSet);
    Duration effectiveTtl = ttl == null ? properties.defaultTtl() : ttl;
    if (effectiveTtl.isNegative() || effectiveTtl.isZero()) {
      throw new InvalidInputException("cache ttl must be positive");
    }
    TenantScope resolved = accessor.resolveScope(scope, "cache.put");
    Instant now = clock.instant();

    List<String> keys = new ArrayList<>();
    keys.add(ENTRY_PREFIX + key);
    tagSet.forEach(tag -> keys.add(TAG_PREFIX + tag));
    List<String> args =
        List.of(
            payload,
            String.valueOf(now.toEpochMilli()),
            String.valueOf(effectiveTtl.toMillis()),
            String.join(String.valueOf(CacheKeys.TAG_SEPARATOR), tagSet),
            key);

    long version =
        ScriptResults.asLong(
            executor.execute(
                () -> accessor.eval(resolved, CacheScripts.PUT, keys, args),
                TaskContext.of("Cache", "put", resolved.value())));
    return new CacheEntry(resolved, key, payload, version, now, now, effectiveTtl, tagSet);
  }

  // ==================== Invalidate ====================

  /** @return 엔트리가 존재해 삭제되었으면 true */
  public boolean invalidate(TenantScope scope, String key) {
    CacheKeys.requireValidKey(key);
    TenantScope resolved = accessor.resolveScope(scope, "cache.invalidate");
    return executor.execute(
        () -> accessor.delete(resolved, ENTRY_PREFIX + key),
        TaskContext.of("Cache", "invalidate", resolved.value()));
  }

  /**
   * 태그 무효화 (멱등)
   *
   * @return 실제로 삭제된 엔트리 수. 연속 두 번째 호출은 0
   */
  public long invalidateTag(TenantScope scope, String tag) {
    CacheKeys.requireValidTag(tag);
    TenantScope resolved = accessor.resolveScope(scope, "cache.invalidateTag");
    long deleted =
        ScriptResults.asLong(
            executor.execute(
                () ->
                    accessor.eval(
                        resolved,
                        CacheScripts.INVALIDATE_TAG,
                        List.of(TAG_PREFIX + tag),
                        List.of(accessor.keyPrefix(resolved) + ENTRY_PREFIX, tag)),
                TaskContext.of("Cache", "invalidateTag", resolved.value())));
    if (deleted > 0) {
      log.info("[Cache] invalidated {} entries by tag: scope={}, tag={}", deleted, resolved, tag);
    }
    return deleted;
  }

  /**
   * 스코프 전체 무효화. 엔트리와 태그 인덱스를 SCAN으로 찾아 함께 지웁니다.
   *
   * <p>SCAN과 삭제 사이에 쓰인 엔트리는 남을 수 있습니다.
   *
   * @return 삭제된 엔트리 수 (태그 인덱스 키 제외)
   */
  public long invalidateScope(TenantScope scope) {
    TenantScope resolved = accessor.resolveScope(scope, "cache.invalidateScope");
    long deleted =
        executor.execute(
            () -> {
              List<String> entries = accessor.scan(resolved, ENTRY_PREFIX + "*");
              List<String> tagIndexes = accessor.scan(resolved, TAG_PREFIX + "*");
              long removed = entries.isEmpty() ? 0 : accessor.deleteAll(resolved, entries);
              if (!tagIndexes.isEmpty()) {
                accessor.deleteAll(resolved, tagIndexes);
              }
              return removed;
            },
            TaskContext.of("Cache", "invalidateScope", resolved.value()));
    log.info("[Cache] invalidated scope: scope={}, entries={}", resolved, deleted);
    return deleted;
  }

  // ==================== internal ====================

  private Optional<CacheEntry> readEntry(TenantScope scope, String key) {
    Object reply =
        accessor.eval(
            scope,
            CacheScripts.GET,
            List.of(ENTRY_PREFIX + key),
            List.of(String.valueOf(clock.millis())));
    Map<String, String> fields = ScriptResults.toMap(reply);
    if (fields.isEmpty() || !fields.containsKey("payload")) {
      return Optional.empty();
    }
    return Optional.of(toEntry(scope, key, fields));
  }

  private Optional<CacheEntry> degradeToMiss(RuntimeException e, TenantScope scope, String key) {
    if (!StoreFailures.isUnavailable(e)) {
      throw e;
    }
    degraded.increment();
    log.warn(
        "⚠️ [Cache] read degraded to miss: scope={}, key={}, cause={}",
        scope,
        key,
        e.getMessage());
    return Optional.empty();
  }

  private static CacheEntry toEntry(TenantScope scope, String key, Map<String, String> fields) {
    String tags = fields.getOrDefault("tags", "");
    return new CacheEntry(
        scope,
        key,
        fields.get("payload"),
        Long.parseLong(fields.getOrDefault("version", "1")),
        Instant.ofEpochMilli(Long.parseLong(fields.getOrDefault("created_at", "0"))),
        Instant.ofEpochMilli(Long.parseLong(fields.getOrDefault("last_accessed_at", "0"))),
        fields.containsKey("ttl_ms")
            ? Duration.ofMillis(Long.parseLong(fields.get("ttl_ms")))
            : null,
        tags.isEmpty()
            ? Set.of()
            : new LinkedHashSet<>(
                Arrays.asList(tags.split(String.valueOf(CacheKeys.TAG_SEPARATOR)))));
  }

  private String serialize(Object value, String key) {
    if (value instanceof String s) {
      return s;
    }
    return executor.executeWithTranslation(
        () -> objectMapper.writeValueAsString(value),
        ExceptionTranslator.forJson(),
        TaskContext.of("Cache", "serialize", key));
  }

  private <T> T deserialize(String payload, Class<T> type, String key) {
    if (type == String.class) {
      return type.cast(payload);
    }
    return executor.executeWithTranslation(
        () -> objectMapper.readValue(payload, type),
        ExceptionTranslator.forJson(),
        TaskContext.of("Cache", "deserialize", key));
  }
}
