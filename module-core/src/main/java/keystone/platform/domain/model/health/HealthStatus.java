package keystone.platform.domain.model.health;

public enum HealthStatus {
  HEALTHY,
  DEGRADED,
  UNHEALTHY
}
