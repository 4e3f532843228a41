package keystone.platform.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 백그라운드 유지보수 설정 ({@code keystone.maintenance.*})
 *
 * @param recoveryBatchSize 1회 실행에서 복구할 만료 in-flight 태스크 최대 수
 */
@ConfigurationProperties(prefix = "keystone.maintenance")
public record MaintenanceProperties(
    Boolean enabled,
    Integer schedulerPoolSize,
    Integer recoveryBatchSize,
    Double queueDegradedUtilization) {

  public MaintenanceProperties {
    enabled = enabled == null || enabled;
    schedulerPoolSize = schedulerPoolSize == null ? 2 : schedulerPoolSize;
    recoveryBatchSize = recoveryBatchSize == null ? 100 : recoveryBatchSize;
    queueDegradedUtilization = queueDegradedUtilization == null ? 0.8 : queueDegradedUtilization;
  }

  public static MaintenanceProperties defaults() {
    return new MaintenanceProperties(null, null, null, null);
  }
}
