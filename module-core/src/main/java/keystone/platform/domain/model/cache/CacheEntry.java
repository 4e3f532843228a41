package keystone.platform.domain.model.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import keystone.platform.domain.model.tenant.TenantScope;

/**
 * 테넌트 캐시 엔트리
 *
 * <p>version은 쓰기마다 1씩 증가합니다. 삭제되거나 만료된 뒤 다시 쓰면 1부터 시작합니다.
 *
 * @param payload UTF-8 문자열 (구조화 값은 JSON)
 * @param ttl 남은 TTL이 아니라 쓰기 시 지정한 TTL. null이면 만료 없음
 */
public record CacheEntry(
    TenantScope scope,
    String key,
    String payload,
    long version,
    Instant createdAt,
    Instant lastAccessedAt,
    Duration ttl,
    Set<String> tags) {

  public CacheEntry {
    tags = tags == null ? Set.of() : Set.copyOf(tags);
  }

  /** 다른 리더가 본 버전보다 새 버전인지 */
  public boolean isNewerThan(long observedVersion) {
    return version > observedVersion;
  }

  public boolean hasTag(String tag) {
    return tags.contains(tag);
  }
}
