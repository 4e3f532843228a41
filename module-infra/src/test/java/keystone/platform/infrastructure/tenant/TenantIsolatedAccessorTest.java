package keystone.platform.infrastructure.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.error.exception.ScopeRequiredException;
import keystone.platform.infrastructure.config.TenantProperties;
import keystone.platform.infrastructure.config.TenantProperties.IsolationMode;
import keystone.platform.infrastructure.keystore.InMemoryKeyStoreClient;
import keystone.platform.infrastructure.keystore.ScriptResults;
import keystone.platform.infrastructure.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenantIsolatedAccessor")
class TenantIsolatedAccessorTest {

  private static final TenantScope ACME = TenantScope.of("acme");
  private static final TenantScope GLOBEX = TenantScope.of("globex");

  private InMemoryKeyStoreClient store;
  private TenantIsolatedAccessor accessor;

  @BeforeEach
  void setUp() {
    store = new InMemoryKeyStoreClient(MutableClock.startingAt("2026-01-01T00:00:00Z"));
    accessor = new TenantIsolatedAccessor(store, TenantProperties.strict());
  }

  @AfterEach
  void clearContext() {
    TenantContext.clear();
  }

  @Test
  @DisplayName("모든 키는 tenant:{scope}: 접두사로 저장된다")
  void prefixesKeys() {
    accessor.set(ACME, "profile", "a", Duration.ofMinutes(1));

    assertThat(store.get("tenant:acme:profile")).contains("a");
    assertThat(accessor.physicalKey(ACME, "profile")).isEqualTo("tenant:acme:profile");
    assertThat(accessor.keyPrefix(GLOBEX)).isEqualTo("tenant:globex:");
  }

  @Test
  @DisplayName("같은 논리 키라도 테넌트끼리 보이지 않는다")
  void isolatesTenants() {
    accessor.set(ACME, "profile", "a", null);
    accessor.set(GLOBEX, "profile", "g", null);

    assertThat(accessor.get(ACME, "profile")).contains("a");
    assertThat(accessor.get(GLOBEX, "profile")).contains("g");

    assertThat(accessor.delete(ACME, "profile")).isTrue();
    assertThat(accessor.get(GLOBEX, "profile")).contains("g");
  }

  @Test
  @DisplayName("scan은 자기 스코프의 논리 키만 돌려준다")
  void scanStripsPrefix() {
    accessor.set(ACME, "doc:1", "x", null);
    accessor.set(ACME, "doc:2", "y", null);
    accessor.set(GLOBEX, "doc:3", "z", null);

    assertThat(accessor.scan(ACME, "doc:*")).containsExactlyInAnyOrder("doc:1", "doc:2");
  }

  @Test
  @DisplayName("glob 문자를 넣어도 다른 테넌트 키에 닿지 않는다")
  void scopeCannotEscape() {
    accessor.set(GLOBEX, "secret", "s", null);

    assertThat(accessor.scan(ACME, "*")).isEmpty();
    assertThatThrownBy(() -> TenantScope.of("*")).isInstanceOf(InvalidInputException.class);
  }

  @Test
  @DisplayName("빈 논리 키는 거부한다")
  void rejectsBlankKey() {
    assertThatThrownBy(() -> accessor.get(ACME, " ")).isInstanceOf(InvalidInputException.class);
  }

  @Test
  @DisplayName("스크립트 키도 스코프 접두사가 붙는다")
  void evalPrefixesKeys() {
    StoreScript echoKey =
        StoreScript.of(
            "echo_key",
            "redis.call('SET', KEYS[1], ARGV[1]) return 1",
            StoreScript.ResultType.INTEGER,
            (s, keys, args) -> {
              s.set(keys.get(0), args.get(0), null);
              return 1L;
            });

    Object reply = accessor.eval(ACME, echoKey, List.of("counter"), List.of("7"));

    assertThat(ScriptResults.asLong(reply)).isEqualTo(1);
    assertThat(store.get("tenant:acme:counter")).contains("7");
  }

  @Test
  @DisplayName("hash, ttl, deleteAll 도 스코프 안에서 동작한다")
  void scopedExtras() {
    accessor.hashPutAll(ACME, "h", Map.of("f", "v"));
    accessor.set(ACME, "a", "1", null);
    accessor.set(ACME, "b", "2", null);

    assertThat(accessor.expire(ACME, "a", Duration.ofSeconds(30))).isTrue();
    assertThat(accessor.ttl(ACME, "a")).contains(Duration.ofSeconds(30));
    assertThat(accessor.hashGetAll(ACME, "h")).containsEntry("f", "v");
    assertThat(accessor.deleteAll(ACME, List.of("a", "b", "missing"))).isEqualTo(2);
    assertThat(accessor.exists(ACME, "h")).isTrue();
  }

  @Nested
  @DisplayName("스코프 해석")
  class ScopeResolution {

    @Test
    @DisplayName("strict 모드에서 스코프가 없으면 ScopeRequired")
    void strictRequiresScope() {
      assertThatThrownBy(() -> accessor.get(null, "profile"))
          .isInstanceOf(ScopeRequiredException.class)
          .hasMessageContaining("get");
    }

    @Test
    @DisplayName("스레드에 바인딩된 스코프를 사용한다")
    void usesBoundScope() {
      try (TenantContext.Binding ignored = TenantContext.bind(ACME)) {
        accessor.set(null, "profile", "bound", null);
      }

      assertThat(store.get("tenant:acme:profile")).contains("bound");
      assertThat(TenantContext.current()).isEmpty();
    }

    @Test
    @DisplayName("명시적 스코프가 바인딩보다 우선한다")
    void explicitWins() {
      try (TenantContext.Binding ignored = TenantContext.bind(ACME)) {
        assertThat(accessor.resolveScope(GLOBEX, "get")).isEqualTo(GLOBEX);
      }
    }

    @Test
    @DisplayName("permissive 모드는 기본 스코프로 대체한다")
    void permissiveFallsBack() {
      TenantIsolatedAccessor permissive =
          new TenantIsolatedAccessor(store, new TenantProperties(IsolationMode.PERMISSIVE, "dev"));

      permissive.set(null, "profile", "p", null);

      assertThat(store.get("tenant:dev:profile")).contains("p");
    }
  }
}
