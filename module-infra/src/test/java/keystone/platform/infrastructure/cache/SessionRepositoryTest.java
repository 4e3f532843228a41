package keystone.platform.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import keystone.platform.domain.model.session.Session;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.infrastructure.config.CacheProperties;
import keystone.platform.infrastructure.config.TenantProperties;
import keystone.platform.infrastructure.executor.DefaultLogicExecutor;
import keystone.platform.infrastructure.keystore.InMemoryKeyStoreClient;
import keystone.platform.infrastructure.support.MutableClock;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SessionRepository")
class SessionRepositoryTest {

  private static final TenantScope ACME = TenantScope.of("acme");
  private static final TenantScope GLOBEX = TenantScope.of("globex");

  private MutableClock clock;
  private InMemoryKeyStoreClient store;
  private SessionRepository sessions;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    store = new InMemoryKeyStoreClient(clock);
    sessions = repository(CacheProperties.defaults());
  }

  @Test
  @DisplayName("세션 ID는 추측하기 어려운 43자 base64url 토큰이다")
  void tokenFormat() {
    Session a = sessions.create("user-1", List.of(ACME), null);
    Session b = sessions.create("user-1", List.of(ACME), null);

    assertThat(a.sessionId()).hasSize(43).matches("[A-Za-z0-9_-]+");
    assertThat(a.sessionId()).isNotEqualTo(b.sessionId());
    assertThat(a.ttl()).isEqualTo(Duration.ofHours(2));
  }

  @Test
  @DisplayName("validate는 활동 시각을 갱신하고 만료를 미룬다")
  void slidingExpiration() {
    Session created = sessions.create("user-1", List.of(ACME), Duration.ofMinutes(30));

    clock.advance(Duration.ofMinutes(20));
    Session touched = sessions.validate(created.sessionId()).orElseThrow();
    clock.advance(Duration.ofMinutes(20));

    assertThat(touched.lastActivityAt())
        .isEqualTo(created.createdAt().plus(Duration.ofMinutes(20)));
    assertThat(sessions.validate(created.sessionId())).isPresent();

    clock.advance(Duration.ofMinutes(31));
    assertThat(sessions.validate(created.sessionId())).isEmpty();
  }

  @Test
  @DisplayName("find는 활동 시각을 바꾸지 않는다")
  void findDoesNotTouch() {
    Session created = sessions.create("user-1", List.of(), null);
    clock.advance(Duration.ofMinutes(1));

    Session found = sessions.find(created.sessionId()).orElseThrow();

    assertThat(found.lastActivityAt()).isEqualTo(created.lastActivityAt());
  }

  @Test
  @DisplayName("extend는 TTL을 새 값으로 바꾼다")
  void extend() {
    Session created = sessions.create("user-1", List.of(), Duration.ofMinutes(10));

    Session extended = sessions.extend(created.sessionId(), Duration.ofHours(8)).orElseThrow();

    assertThat(extended.ttl()).isEqualTo(Duration.ofHours(8));
    clock.advance(Duration.ofHours(7));
    assertThat(sessions.find(created.sessionId())).isPresent();
  }

  @Test
  @DisplayName("revoke 후에는 검증에 실패한다")
  void revoke() {
    Session created = sessions.create("user-1", List.of(ACME), null);

    assertThat(sessions.revoke(created.sessionId())).isTrue();
    assertThat(sessions.revoke(created.sessionId())).isFalse();
    assertThat(sessions.validate(created.sessionId())).isEmpty();
  }

  @Test
  @DisplayName("사용자의 모든 세션을 한 번에 폐기한다")
  void revokeAllForUser() {
    Session a = sessions.create("user-1", List.of(), null);
    Session b = sessions.create("user-1", List.of(), null);
    Session other = sessions.create("user-2", List.of(), null);

    assertThat(sessions.revokeAllForUser("user-1")).isEqualTo(2);

    assertThat(sessions.find(a.sessionId())).isEmpty();
    assertThat(sessions.find(b.sessionId())).isEmpty();
    assertThat(sessions.find(other.sessionId())).isPresent();
  }

  @Test
  @DisplayName("single-session-per-user면 새 세션이 이전 세션을 폐기한다")
  void singleSessionPerUser() {
    SessionRepository single =
        repository(new CacheProperties(null, null, null, null, null, true));
    Session first = single.create("user-1", List.of(), null);

    Session second = single.create("user-1", List.of(), null);

    assertThat(single.find(first.sessionId())).isEmpty();
    assertThat(single.find(second.sessionId())).isPresent();
  }

  @Test
  @DisplayName("테넌트 권한을 추가하고 제거한다")
  void grantAndRevokeTenant() {
    Session created = sessions.create("user-1", List.of(ACME), null);

    Session granted = sessions.grantTenant(created.sessionId(), GLOBEX).orElseThrow();
    Session revoked = sessions.revokeTenant(created.sessionId(), ACME).orElseThrow();

    assertThat(granted.tenants()).containsExactlyInAnyOrder(ACME, GLOBEX);
    assertThat(revoked.canAccess(ACME)).isFalse();
    assertThat(revoked.canAccess(GLOBEX)).isTrue();
    assertThat(store.hashGet("session:" + created.sessionId(), "revision")).contains("2");
  }

  @Test
  @DisplayName("없는 세션의 권한 변경은 empty")
  void grantOnMissingSession() {
    assertThat(sessions.grantTenant("no-such-session", ACME)).isEmpty();
  }

  @Test
  @DisplayName("세션 ID 형식이 아니면 저장소를 건드리지 않고 없는 세션으로 처리한다")
  void malformedSessionIdIsUnknown() {
    Session created = sessions.create("alice", List.of(ACME), null);

    assertThat(sessions.validate("user:alice")).isEmpty();
    assertThat(sessions.find("user:alice")).isEmpty();
    assertThat(sessions.extend("user:alice", Duration.ofHours(1))).isEmpty();
    assertThat(sessions.grantTenant("user:alice", GLOBEX)).isEmpty();
    assertThat(sessions.revokeTenant("user:alice", ACME)).isEmpty();
    assertThat(sessions.revoke("user:alice")).isFalse();
    assertThat(sessions.validate(null)).isEmpty();

    assertThat(sessions.validate(created.sessionId())).isPresent();
  }

  @Test
  @DisplayName("공백이 들어간 userId는 거부한다")
  void rejectsInvalidUser() {
    assertThatThrownBy(() -> sessions.create("user 1", List.of(), null))
        .isInstanceOf(InvalidInputException.class);
  }

  private SessionRepository repository(CacheProperties properties) {
    return new SessionRepository(
        new TenantIsolatedAccessor(store, TenantProperties.strict()),
        new DefaultLogicExecutor(),
        properties,
        clock);
  }
}
