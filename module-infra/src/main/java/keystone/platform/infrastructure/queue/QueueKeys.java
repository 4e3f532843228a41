package keystone.platform.infrastructure.queue;

import keystone.platform.domain.model.task.TaskType;
import keystone.platform.domain.model.tenant.TenantScope;
import keystone.platform.infrastructure.tenant.GlobalKeyspace;

/** 큐 타입별 물리 키 */
final class QueueKeys {

  private QueueKeys() {
    throw new UnsupportedOperationException("Utility class");
  }

  static String queue(TaskType type) {
    return GlobalKeyspace.QUEUE.key(type.queueName());
  }

  static String pending(TaskType type) {
    return GlobalKeyspace.QUEUE.key(type.queueName(), "priority");
  }

  static String delayed(TaskType type) {
    return GlobalKeyspace.QUEUE.key(type.queueName(), "delayed");
  }

  static String inflight(TaskType type) {
    return GlobalKeyspace.QUEUE.key(type.queueName(), "inflight");
  }

  static String tenantPrefix(TaskType type) {
    return GlobalKeyspace.QUEUE.key(type.queueName(), "tenant") + ":";
  }

  static String tenant(TaskType type, TenantScope scope) {
    return tenantPrefix(type) + scope.value();
  }

  static String taskPrefix() {
    return GlobalKeyspace.TASK.prefix() + ":";
  }

  static String task(String taskId) {
    return GlobalKeyspace.TASK.key(taskId);
  }

  static String deadLetterIndex(TaskType type) {
    return GlobalKeyspace.DEAD_LETTER.key(type.queueName());
  }

  static String deadLetterRecord(TaskType type, String taskId) {
    return GlobalKeyspace.DEAD_LETTER.key(type.queueName(), "task", taskId);
  }
}
