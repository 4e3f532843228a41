package keystone.platform.infrastructure.config;

import java.time.Duration;
import keystone.platform.error.exception.InvalidInputException;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 캐시 도메인 TTL 설정
 *
 * <ul>
 *   <li>{@code keystone.cache.default-ttl}: 테넌트 데이터 (기본 1h)
 *   <li>{@code keystone.cache.session-ttl}: 세션 (기본 2h)
 *   <li>{@code keystone.cache.progress-ttl}: 진행 중 진행률 (기본 30m)
 *   <li>{@code keystone.cache.progress-grace}: 종료 후 보존 (기본 5m)
 * </ul>
 */
@ConfigurationProperties(prefix = "keystone.cache")
public record CacheProperties(
    Duration defaultTtl,
    Duration sessionTtl,
    Duration progressTtl,
    Duration progressGrace,
    Integer progressLogSize,
    Boolean singleSessionPerUser) {

  public CacheProperties {
    defaultTtl = defaultTtl == null ? Duration.ofHours(1) : defaultTtl;
    sessionTtl = sessionTtl == null ? Duration.ofHours(2) : sessionTtl;
    progressTtl = progressTtl == null ? Duration.ofMinutes(30) : progressTtl;
    progressGrace = progressGrace == null ? Duration.ofMinutes(5) : progressGrace;
    progressLogSize = progressLogSize == null ? 20 : progressLogSize;
    singleSessionPerUser = singleSessionPerUser != null && singleSessionPerUser;
    if (defaultTtl.isNegative()
        || defaultTtl.isZero()
        || sessionTtl.isNegative()
        || sessionTtl.isZero()) {
      throw new InvalidInputException("cache TTLs must be positive");
    }
    if (progressLogSize < 1) {
      throw new InvalidInputException("keystone.cache.progress-log-size must be >= 1");
    }
  }

  public static CacheProperties defaults() {
    return new CacheProperties(null, null, null, null, null, null);
  }
}
