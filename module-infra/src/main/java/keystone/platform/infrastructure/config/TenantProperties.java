package keystone.platform.infrastructure.config;

import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 테넌트 격리 설정 ({@code keystone.tenant.*})
 *
 * @param isolationMode strict(운영): 스코프 누락 시 ScopeRequired. permissive(개발): defaultScope로 대체
 */
@ConfigurationProperties(prefix = "keystone.tenant")
public record TenantProperties(IsolationMode isolationMode, String defaultScope) {

  public enum IsolationMode {
    STRICT,
    PERMISSIVE
  }

  public TenantProperties {
    isolationMode = isolationMode == null ? IsolationMode.STRICT : isolationMode;
    boolean missingDefault = defaultScope == null || defaultScope.isBlank();
    if (isolationMode == IsolationMode.PERMISSIVE && missingDefault) {
      throw new InvalidInputException(
          "keystone.tenant.default-scope is required in permissive mode");
    }
  }

  public static TenantProperties strict() {
    return new TenantProperties(IsolationMode.STRICT, null);
  }

  public TenantScope defaultTenantScope() {
    return defaultScope == null ? null : TenantScope.of(defaultScope);
  }
}
