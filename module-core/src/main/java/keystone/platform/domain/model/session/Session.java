package keystone.platform.domain.model.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import keystone.platform.domain.model.tenant.TenantScope;

/**
 * 사용자 세션
 *
 * <p>세션은 여러 테넌트에 걸쳐 있으므로 테넌트 키 공간이 아닌 전역 세션 키 공간에 저장됩니다. 접근 가능한 테넌트 목록으로 격리를 판단합니다.
 */
public record Session(
    String sessionId,
    String userId,
    Set<TenantScope> tenants,
    Instant createdAt,
    Instant lastActivityAt,
    Duration ttl) {

  public Session {
    tenants = tenants == null ? Set.of() : Set.copyOf(tenants);
  }

  public boolean canAccess(TenantScope scope) {
    return tenants.contains(scope);
  }

  public Instant expiresAt() {
    return lastActivityAt.plus(ttl);
  }
}
