package keystone.platform.infrastructure.cache;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import keystone.platform.domain.model.cache.CacheKeys;
import keystone.platform.domain.model.progress.ProgressRecord;
import keystone.platform.domain.model.progress.ProgressStatus;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.error.exception.InvalidInputException;
import keystone.platform.infrastructure.config.CacheProperties;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.executor.TaskContext;
import keystone.platform.infrastructure.keystore.ScriptResults;
import keystone.platform.infrastructure.resilience.StoreFailures;
import keystone.platform.infrastructure.tenant.TenantIsolatedAccessor;
import lombok.extern.slf4j.Slf4j;

/**
 * 장기 작업 진행률 추적
 *
 * <ul>
 *   <li>진행 중: {@code keystone.cache.progress-ttl} (기본 30m), 갱신마다 연장
 *   <li>종료 후: {@code keystone.cache.progress-grace} (기본 5m) 뒤 만료
 *   <li>최근 메시지는 {@code progress-log-size}개만 보존
 * </ul>
 *
 * <p>이미 종료된 진행률에 대한 advance/complete/fail은 상태를 바꾸지 않고 현재 기록을 반환합니다.
 */
@Slf4j
public class ProgressTracker {

  private static final String PREFIX = "progress:";
  private static final String LOG_SUFFIX = ":log";

  private final TenantIsolatedAccessor accessor;
  private final LogicExecutor executor;
  private final CacheProperties properties;
  private final Clock clock;

  public ProgressTracker(
      TenantIsolatedAccessor accessor,
      LogicExecutor executor,
      CacheProperties properties,
      Clock clock) {
    this.accessor = accessor;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
  }

  public ProgressRecord start(
      TenantScope scope, String correlationId, int totalSteps, String message) {
    CacheKeys.requireValidKey(correlationId);
    if (totalSteps < 1) {
      throw new InvalidInputException("totalSteps must be >= 1");
    }
    TenantScope resolved = accessor.resolveScope(scope, "progress.start");
    Instant now = clock.instant();
    executor.execute(
        () ->
            accessor.eval(
                resolved,
                CacheScripts.PROGRESS_START,
                keys(correlationId),
                List.of(
                    String.valueOf(totalSteps),
                    String.valueOf(now.toEpochMilli()),
                    nullToEmpty(message),
                    String.valueOf(properties.progressTtl().toMillis()))),
        TaskContext.of("Progress", "start", resolved.value()));
    return new ProgressRecord(
        correlationId,
        totalSteps,
        0,
        nullToEmpty(message),
        ProgressStatus.IN_PROGRESS,
        now,
        now,
        null,
        null,
        message == null || message.isEmpty() ? List.of() : List.of(message));
  }

  /** steps만큼 전진 (totalSteps 상한). 기록이 없으면 empty */
  public Optional<ProgressRecord> advance(
      TenantScope scope, String correlationId, int steps, String message) {
    CacheKeys.requireValidKey(correlationId);
    TenantScope resolved = accessor.resolveScope(scope, "progress.advance");
    long result =
        ScriptResults.asLong(
            executor.execute(
                () ->
                    accessor.eval(
                        resolved,
                        CacheScripts.PROGRESS_ADVANCE,
                        keys(correlationId),
                        List.of(
                            String.valueOf(steps),
                            String.valueOf(clock.millis()),
                            nullToEmpty(message),
                            String.valueOf(properties.progressTtl().toMillis()),
                            String.valueOf(properties.progressLogSize()))),
                TaskContext.of("Progress", "advance", resolved.value())));
    if (result == -1) {
      return Optional.empty();
    }
    return read(resolved, correlationId);
  }

  public Optional<ProgressRecord> complete(
      TenantScope scope, String correlationId, String message) {
    return finish(scope, correlationId, ProgressStatus.COMPLETED, message, null);
  }

  public Optional<ProgressRecord> fail(TenantScope scope, String correlationId, String error) {
    return finish(scope, correlationId, ProgressStatus.FAILED, null, error);
  }

  /** 조회. 저장소 장애 시 empty (캐시 읽기와 같은 정책) */
  public Optional<ProgressRecord> get(TenantScope scope, String correlationId) {
    CacheKeys.requireValidKey(correlationId);
    TenantScope resolved = accessor.resolveScope(scope, "progress.get");
    return executor.executeOrCatch(
        () -> read(resolved, correlationId),
        e -> {
          if (!StoreFailures.isUnavailable(e)) {
            throw e;
          }
          log.warn("⚠️ [Progress] read degraded: id={}, cause={}", correlationId, e.getMessage());
          return Optional.empty();
        },
        TaskContext.of("Progress", "get", resolved.value()));
  }

  // ==================== internal ====================

  private Optional<ProgressRecord> finish(
      TenantScope scope,
      String correlationId,
      ProgressStatus status,
      String message,
      String error) {
    CacheKeys.requireValidKey(correlationId);
    TenantScope resolved = accessor.resolveScope(scope, "progress." + status.wireValue());
    long result =
        ScriptResults.asLong(
            executor.execute(
                () ->
                    accessor.eval(
                        resolved,
                        CacheScripts.PROGRESS_FINISH,
                        keys(correlationId),
                        List.of(
                            status.wireValue(),
                            String.valueOf(clock.millis()),
                            nullToEmpty(message),
                            nullToEmpty(error),
                            String.valueOf(properties.progressGrace().toMillis()),
                            String.valueOf(properties.progressLogSize()))),
                TaskContext.of("Progress", status.wireValue(), resolved.value())));
    if (result == -1) {
      return Optional.empty();
    }
    return read(resolved, correlationId);
  }

  private Optional<ProgressRecord> read(TenantScope scope, String correlationId) {
    Map<String, String> fields = accessor.hashGetAll(scope, PREFIX + correlationId);
    if (fields.isEmpty()) {
      return Optional.empty();
    }
    List<String> recent = accessor.listRange(scope, PREFIX + correlationId + LOG_SUFFIX, 0, -1);
    return Optional.of(
        new ProgressRecord(
            correlationId,
            Integer.parseInt(fields.getOrDefault("total_steps", "0")),
            Integer.parseInt(fields.getOrDefault("completed_steps", "0")),
            fields.getOrDefault("last_message", ""),
            ProgressStatus.fromWire(fields.getOrDefault("status", "in_progress")),
            instant(fields.get("started_at")),
            instant(fields.get("updated_at")),
            instant(fields.get("completed_at")),
            emptyToNull(fields.get("error_message")),
            recent));
  }

  private static List<String> keys(String correlationId) {
    return List.of(PREFIX + correlationId, PREFIX + correlationId + LOG_SUFFIX);
  }

  private static Instant instant(String epochMillis) {
    return epochMillis == null ? null : Instant.ofEpochMilli(Long.parseLong(epochMillis));
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
