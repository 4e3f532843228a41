package keystone.platform.infrastructure.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import keystone.platform.core.port.out.KeyStoreClient;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.infrastructure.cache.ProgressTracker;
import keystone.platform.infrastructure.cache.SessionRepository;
import keystone.platform.infrastructure.cache.TenantCacheRepository;
import keystone.platform.infrastructure.config.TenantProperties.IsolationMode;
import keystone.platform.infrastructure.health.KeyStoreHealthService;
import keystone.platform.infrastructure.keystore.InMemoryKeyStoreClient;
import keystone.platform.infrastructure.queue.DeadLetterStore;
import keystone.platform.infrastructure.queue.TaskQueueManager;
import keystone.platform.infrastructure.ratelimit.RateLimitService;
import keystone.platform.infrastructure.resilience.GuardedKeyStore;
import keystone.platform.infrastructure.resilience.StoreCircuitBreaker;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

/**
 * KeystoneInfraAutoConfiguration 조립 검증
 *
 * <p>in-memory 모드로 실행하므로 Redis 없이 전체 빈 그래프를 확인합니다.
 */
@DisplayName("KeystoneInfraAutoConfiguration")
class KeystoneInfraAutoConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(KeystoneInfraAutoConfiguration.class))
          .withPropertyValues("keystone.store.mode=in-memory");

  @Test
  @DisplayName("in-memory 모드는 Redisson 없이 모든 도메인 컴포넌트를 등록한다")
  void registersDomainComponents() {
    contextRunner.run(
        context -> {
          assertThat(context).doesNotHaveBean(RedissonClient.class);
          assertThat(context).hasSingleBean(TenantIsolatedAccessor.class);
          assertThat(context).hasSingleBean(TenantCacheRepository.class);
          assertThat(context).hasSingleBean(SessionRepository.class);
          assertThat(context).hasSingleBean(ProgressTracker.class);
          assertThat(context).hasSingleBean(RateLimitService.class);
          assertThat(context).hasSingleBean(TaskQueueManager.class);
          assertThat(context).hasSingleBean(DeadLetterStore.class);
          assertThat(context).hasSingleBean(KeyStoreHealthService.class);
          assertThat(context).hasSingleBean(StoreCircuitBreaker.class);
        });
  }

  @Test
  @DisplayName("KeyStoreClient 주입은 보호 계층을 거치고 원본은 이름으로만 노출된다")
  void primaryClientIsGuarded() {
    contextRunner.run(
        context -> {
          assertThat(context.getBean(KeyStoreClient.class)).isInstanceOf(GuardedKeyStore.class);
          assertThat(context.getBean("rawKeyStoreClient"))
              .isInstanceOf(InMemoryKeyStoreClient.class);
        });
  }

  @Test
  @DisplayName("keystone.* 설정을 바인딩한다")
  void bindsProperties() {
    contextRunner
        .withPropertyValues(
            "keystone.circuit-breaker.failure-threshold=2",
            "keystone.tenant.isolation-mode=permissive",
            "keystone.tenant.default-scope=sandbox",
            "keystone.queue.types.cleanup.max-size=7")
        .run(
            context -> {
              assertThat(context.getBean(CircuitBreakerProperties.class).failureThreshold())
                  .isEqualTo(2);
              assertThat(
                      context
                          .getBean(CircuitBreakerRegistry.class)
                          .circuitBreaker("keystore")
                          .getCircuitBreakerConfig()
                          .getSlidingWindowSize())
                  .isEqualTo(2);
              TenantProperties tenant = context.getBean(TenantProperties.class);
              assertThat(tenant.isolationMode()).isEqualTo(IsolationMode.PERMISSIVE);
              assertThat(tenant.defaultScope()).isEqualTo("sandbox");
              assertThat(context.getBean(QueueProperties.class).types()).containsKey("cleanup");
            });
  }

  @Test
  @DisplayName("사용자가 등록한 Clock을 그대로 쓴다")
  void backsOffForUserClock() {
    Clock fixed = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    contextRunner
        .withBean(Clock.class, () -> fixed)
        .run(context -> assertThat(context.getBean(Clock.class)).isSameAs(fixed));
  }

  @Test
  @DisplayName("조립된 캐시는 테넌트 단위로 읽고 쓴다")
  void cacheWorksEndToEnd() {
    contextRunner.run(
        context -> {
          TenantCacheRepository cache = context.getBean(TenantCacheRepository.class);
          TenantScope acme = TenantScope.of("acme");

          cache.put(acme, "greeting", "hello");

          assertThat(cache.get(acme, "greeting", String.class)).contains("hello");
          assertThat(cache.get(TenantScope.of("globex"), "greeting", String.class)).isEmpty();
        });
  }

  @Test
  @DisplayName("웜업 대상 스크립트 이름은 중복되지 않는다")
  void scriptNamesAreUnique() {
    List<StoreScript> scripts = KeystoneInfraAutoConfiguration.allScripts();

    assertThat(scripts).extracting(StoreScript::name).doesNotHaveDuplicates();
    assertThat(scripts).isNotEmpty();
  }
}
