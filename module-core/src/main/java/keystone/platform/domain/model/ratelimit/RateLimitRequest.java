package keystone.platform.domain.model.ratelimit;

import java.util.EnumMap;
import java.util.Map;
import keystone.platform.domain.model.tenant.TenantScope;
import lombok.Builder;

/**
 * 복합 Rate Limit 검사 입력. null인 항목의 스코프는 건너뜁니다.
 *
 * <p>endpoint 제한은 테넌트별로 분리되며, 테넌트가 없으면 endpoint 단독으로 식별합니다.
 */
@Builder
public record RateLimitRequest(String ip, String userId, TenantScope tenant, String endpoint) {

  /** 평가 순서대로 정렬된 스코프별 식별자 */
  public Map<RateLimitScope, String> identifiers() {
    Map<RateLimitScope, String> ids = new EnumMap<>(RateLimitScope.class);
    if (ip != null) {
      ids.put(RateLimitScope.IP, ip);
    }
    if (userId != null) {
      ids.put(RateLimitScope.USER, userId);
    }
    if (tenant != null) {
      ids.put(RateLimitScope.TENANT, tenant.value());
    }
    if (endpoint != null) {
      ids.put(RateLimitScope.ENDPOINT, tenant == null ? endpoint : tenant.value() + ":" + endpoint);
    }
    return ids;
  }
}
