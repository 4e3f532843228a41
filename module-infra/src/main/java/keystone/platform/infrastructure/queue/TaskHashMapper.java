package keystone.platform.infrastructure.queue;

import java.time.Instant;
import java.util.Map;
import keystone.platform.domain.model.task.Task;
import keystone.platform.domain.model.task.TaskStatus;
import keystone.platform.domain.model.task.TaskType;
import keystone.platform.domain.model.tenant.TenantScope;

/** task:{id} HASH → {@link Task} */
final class TaskHashMapper {

  private TaskHashMapper() {
    throw new UnsupportedOperationException("Utility class");
  }

  static Task toTask(Map<String, String> fields) {
    return new Task(
        fields.get("id"),
        TaskType.fromQueueName(fields.get("type")),
        TenantScope.of(fields.get("scope")),
        fields.get("payload"),
        intOf(fields, "priority"),
        intOf(fields, "attempts"),
        intOf(fields, "max_attempts"),
        TaskStatus.fromWire(fields.get("status")),
        instantOf(fields, "enqueued_at"),
        instantOf(fields, "started_at"),
        instantOf(fields, "completed_at"),
        instantOf(fields, "next_attempt_at"),
        emptyToNull(fields.get("last_error")),
        emptyToNull(fields.get("result")));
  }

  static int autoRetryCount(Map<String, String> fields) {
    return intOf(fields, "auto_retry_count");
  }

  private static int intOf(Map<String, String> fields, String name) {
    String value = fields.get(name);
    return value == null || value.isEmpty() ? 0 : Integer.parseInt(value);
  }

  private static Instant instantOf(Map<String, String> fields, String name) {
    String value = fields.get(name);
    return value == null || value.isEmpty() ? null : Instant.ofEpochMilli(Long.parseLong(value));
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
