package keystone.platform.infrastructure.config;

import java.time.Duration;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.keystore.RedissonKeyStoreClient;
import keystone.platform.infrastructure.keystore.ScriptShaCache;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.redisson.config.ReadMode;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redis 모드 저장소 구성
 *
 * <p>single server 또는 sentinel 구성을 지원합니다. 스크립트가 동적 키를 다루므로 Redis Cluster는 지원하지 않습니다.
 *
 * <h3>Timeout 계층</h3>
 *
 * <ul>
 *   <li>Redisson command timeout = operation-timeout
 *   <li>서킷 브레이커 call-timeout이 그 바깥을 감쌉니다
 * </ul>
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(
    prefix = "keystone.store",
    name = "mode",
    havingValue = "redis",
    matchIfMissing = true)
public class RedissonConfig {

  private static final String REDISSON_HOST_PREFIX = "redis://";

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public RedissonClient redissonClient(KeyStoreProperties properties) {
    return Redisson.create(buildConfig(properties));
  }

  @Bean
  @ConditionalOnMissingBean
  public ScriptShaCache scriptShaCache(RedissonClient redissonClient, LogicExecutor executor) {
    return new ScriptShaCache(redissonClient, executor);
  }

  @Bean
  @ConditionalOnMissingBean(name = "rawKeyStoreClient")
  public RedissonKeyStoreClient rawKeyStoreClient(
      RedissonClient redissonClient, ScriptShaCache shaCache, KeyStoreProperties properties) {
    return new RedissonKeyStoreClient(redissonClient, shaCache, properties.operationTimeout());
  }

  /** 모든 원자 스크립트를 시작 시 SCRIPT LOAD. 실패해도 첫 호출 시 다시 적재합니다. */
  @Bean
  public SmartInitializingSingleton scriptWarmUp(ScriptShaCache shaCache) {
    return () -> shaCache.warmUp(KeystoneInfraAutoConfiguration.allScripts());
  }

  static Config buildConfig(KeyStoreProperties properties) {
    Config config = new Config();
    config.setCodec(StringCodec.INSTANCE);
    if (properties.isSentinelMode()) {
      configureSentinel(config, properties);
    } else {
      configureSingleServer(config, properties);
    }
    return config;
  }

  private static void configureSentinel(Config config, KeyStoreProperties properties) {
    String[] addresses =
        properties.sentinelNodes().stream()
            .map(node -> withPrefix(node.trim()))
            .toArray(String[]::new);

    var sentinelConfig =
        config
            .useSentinelServers()
            .setMasterName(properties.sentinelMaster())
            .addSentinelAddress(addresses)
            .setCheckSentinelsList(false)
            .setScanInterval(1000)
            .setReadMode(ReadMode.MASTER)
            .setDatabase(properties.database())
            .setRetryAttempts(0)
            .setTimeout(millis(properties.operationTimeout()))
            .setConnectTimeout(millis(properties.connectTimeout()))
            .setMasterConnectionPoolSize(properties.maxConnections())
            .setMasterConnectionMinimumIdleSize(Math.min(properties.maxConnections(), 2));
    if (properties.password() != null && !properties.password().isBlank()) {
      sentinelConfig.setPassword(properties.password());
    }
    log.info(
        "[KeyStore] Redis sentinel mode: master={}, nodes={}",
        properties.sentinelMaster(),
        properties.sentinelNodes());
  }

  private static void configureSingleServer(Config config, KeyStoreProperties properties) {
    var serverConfig =
        config
            .useSingleServer()
            .setAddress(withPrefix(properties.address()))
            .setDatabase(properties.database())
            .setRetryAttempts(0)
            .setTimeout(millis(properties.operationTimeout()))
            .setConnectTimeout(millis(properties.connectTimeout()))
            .setConnectionPoolSize(properties.maxConnections())
            .setConnectionMinimumIdleSize(Math.min(properties.maxConnections(), 2));
    if (properties.password() != null && !properties.password().isBlank()) {
      serverConfig.setPassword(properties.password());
    }
    log.info("[KeyStore] Redis single server mode: {}", serverConfig.getAddress());
  }

  private static String withPrefix(String address) {
    if (address.startsWith("redis://") || address.startsWith("rediss://")) {
      return address;
    }
    return REDISSON_HOST_PREFIX + address;
  }

  private static int millis(Duration duration) {
    return (int) Math.min(Integer.MAX_VALUE, duration.toMillis());
  }
}
