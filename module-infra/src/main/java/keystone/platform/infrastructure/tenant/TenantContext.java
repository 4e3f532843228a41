package keystone.platform.infrastructure.tenant;

import java.util.Optional;
import keystone.platform.domain.model.tenant.TenantScope;

/**
 * 요청 스레드에 바인딩된 테넌트 스코프
 *
 * <pre>{@code
 * try (TenantContext.Binding ignored = TenantContext.bind(TenantScope.of("acme"))) {
 *   cache.get(null, "profile", Profile.class);
 * }
 * }</pre>
 */
public final class TenantContext {

  private static final ThreadLocal<TenantScope> CURRENT = new ThreadLocal<>();

  private TenantContext() {}

  public static Optional<TenantScope> current() {
    return Optional.ofNullable(CURRENT.get());
  }

  /** 이전 바인딩은 close 시 복원됩니다. */
  public static Binding bind(TenantScope scope) {
    TenantScope previous = CURRENT.get();
    CURRENT.set(scope);
    return () -> {
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    };
  }

  public static void clear() {
    CURRENT.remove();
  }

  @FunctionalInterface
  public interface Binding extends AutoCloseable {
    @Override
    void close();
  }
}
