package keystone.platform.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import keystone.platform.core.port.out.KeyStoreClient;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.infrastructure.cache.CacheScripts;
import keystone.platform.infrastructure.cache.ProgressTracker;
import keystone.platform.infrastructure.cache.SessionRepository;
import keystone.platform.infrastructure.cache.SessionScripts;
import keystone.platform.infrastructure.cache.TenantCacheRepository;
import keystone.platform.infrastructure.executor.DefaultLogicExecutor;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.health.KeyStoreHealthService;
import keystone.platform.infrastructure.keystore.InMemoryKeyStoreClient;
import keystone.platform.infrastructure.queue.DeadLetterStore;
import keystone.platform.infrastructure.queue.QueueMetrics;
import keystone.platform.infrastructure.queue.QueueScripts;
import keystone.platform.infrastructure.queue.TaskQueueManager;
import keystone.platform.infrastructure.ratelimit.RateLimitScripts;
import keystone.platform.infrastructure.ratelimit.RateLimitService;
import keystone.platform.infrastructure.resilience.CircuitBreakerEventLogger;
import keystone.platform.infrastructure.resilience.CircuitBreakerMetrics;
import keystone.platform.infrastructure.resilience.GuardedKeyStore;
import keystone.platform.infrastructure.resilience.StoreCircuitBreaker;
import keystone.platform.infrastructure.resilience.StoreConnectionPool;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

/**
 * 저장소 플랫폼 조립
 *
 * <h3>호출 경로</h3>
 *
 * <pre>
 * 도메인 컴포넌트 (cache / session / progress / rate limit / queue)
 *   └ TenantIsolatedAccessor       tenant:{scope}: 접두사
 *       └ GuardedKeyStore          @Primary. 서킷 브레이커 + 풀 + 재시도 + 호출 제한 시간
 *           └ rawKeyStoreClient    Redisson (redis) | InMemoryKeyStoreClient (in-memory)
 * </pre>
 *
 * <p>{@code keystone.store.mode=in-memory}는 테스트와 로컬 개발용입니다. 같은 스크립트 의미를 Java로 실행합니다.
 */
@Slf4j
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@Import(RedissonConfig.class)
@EnableConfigurationProperties({
  KeyStoreProperties.class,
  CircuitBreakerProperties.class,
  TenantProperties.class,
  CacheProperties.class,
  RateLimitProperties.class,
  QueueProperties.class,
  MaintenanceProperties.class
})
public class KeystoneInfraAutoConfiguration {

  static final String BREAKER_NAME = "keystore";

  /** 원자 스크립트 전체 목록 (SCRIPT LOAD 웜업 대상) */
  public static List<StoreScript> allScripts() {
    List<StoreScript> scripts = new ArrayList<>();
    scripts.addAll(CacheScripts.all());
    scripts.addAll(SessionScripts.all());
    scripts.addAll(RateLimitScripts.all());
    scripts.addAll(QueueScripts.all());
    return scripts;
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock keystoneClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor logicExecutor() {
    return new DefaultLogicExecutor();
  }

  @Bean
  @ConditionalOnMissingBean
  public ObjectMapper keystoneObjectMapper() {
    return JsonMapper.builder()
        .findAndAddModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry keystoneMeterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean(name = "rawKeyStoreClient")
  @ConditionalOnProperty(prefix = "keystone.store", name = "mode", havingValue = "in-memory")
  public InMemoryKeyStoreClient inMemoryKeyStoreClient(Clock clock) {
    log.info("[KeyStore] in-memory mode");
    return new InMemoryKeyStoreClient(clock);
  }

  // ==================== Resilience ====================

  @Bean
  @ConditionalOnMissingBean
  public CircuitBreakerRegistry keystoneCircuitBreakerRegistry(
      CircuitBreakerProperties properties) {
    CircuitBreakerRegistry registry =
        CircuitBreakerRegistry.of(StoreCircuitBreaker.configOf(properties));
    new CircuitBreakerEventLogger(registry).registerEventListeners();
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean
  public StoreCircuitBreaker storeCircuitBreaker(
      CircuitBreakerRegistry circuitBreakerRegistry,
      CircuitBreakerProperties properties,
      MeterRegistry meterRegistry) {
    StoreCircuitBreaker breaker =
        new StoreCircuitBreaker(circuitBreakerRegistry.circuitBreaker(BREAKER_NAME), properties);
    new CircuitBreakerMetrics(meterRegistry).bindTo(breaker);
    return breaker;
  }

  @Bean
  @ConditionalOnMissingBean
  public StoreConnectionPool storeConnectionPool(KeyStoreProperties properties) {
    return new StoreConnectionPool(
        BREAKER_NAME, properties.maxConnections(), properties.operationTimeout());
  }

  @Bean(destroyMethod = "shutdown")
  @Primary
  public GuardedKeyStore keyStoreClient(
      @Qualifier("rawKeyStoreClient") KeyStoreClient rawKeyStoreClient,
      StoreCircuitBreaker breaker,
      StoreConnectionPool pool,
      KeyStoreProperties properties) {
    return new GuardedKeyStore(
        rawKeyStoreClient,
        breaker,
        pool,
        properties.retryAttempts(),
        properties.retryInitialInterval());
  }

  // ==================== Domain ====================

  @Bean
  public TenantIsolatedAccessor tenantIsolatedAccessor(
      KeyStoreClient keyStoreClient, TenantProperties properties) {
    return new TenantIsolatedAccessor(keyStoreClient, properties);
  }

  @Bean
  public TenantCacheRepository tenantCacheRepository(
      TenantIsolatedAccessor accessor,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      CacheProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new TenantCacheRepository(
        accessor, objectMapper, executor, properties, clock, meterRegistry);
  }

  @Bean
  public SessionRepository sessionRepository(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      CacheProperties properties,
      Clock clock) {
    return new SessionRepository(accessor, executor, properties, clock);
  }

  @Bean
  public ProgressTracker progressTracker(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      CacheProperties properties,
      Clock clock) {
    return new ProgressTracker(accessor, executor, properties, clock);
  }

  @Bean
  public RateLimitService rateLimitService(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      RateLimitProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new RateLimitService(accessor, executor, properties, clock, meterRegistry);
  }

  @Bean
  public QueueMetrics queueMetrics(MeterRegistry meterRegistry) {
    return new QueueMetrics(meterRegistry);
  }

  @Bean
  public TaskQueueManager taskQueueManager(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      ObjectMapper objectMapper,
      QueueProperties properties,
      QueueMetrics metrics,
      Clock clock) {
    return new TaskQueueManager(accessor, executor, objectMapper, properties, metrics, clock);
  }

  @Bean
  public DeadLetterStore deadLetterStore(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      ObjectMapper objectMapper,
      QueueProperties properties,
      TaskQueueManager queueManager,
      QueueMetrics metrics,
      Clock clock) {
    return new DeadLetterStore(
        accessor, executor, objectMapper, properties, queueManager, metrics, clock);
  }

  @Bean
  public KeyStoreHealthService keyStoreHealthService(
      GuardedKeyStore keyStoreClient,
      StoreCircuitBreaker breaker,
      TaskQueueManager queueManager,
      MaintenanceProperties properties,
      LogicExecutor executor,
      Clock clock) {
    return new KeyStoreHealthService(
        keyStoreClient, breaker, queueManager, properties, executor, clock);
  }
}
