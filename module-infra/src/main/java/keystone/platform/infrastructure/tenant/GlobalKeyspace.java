package keystone.platform.infrastructure.tenant;

import keystone.platform.error.exception.InvalidInputException;

/**
 * 테넌트에 속하지 않는 명시적 전역 키 공간
 *
 * <pre>
 * SESSION      session:{id}, session:user:{userId}
 * RATE_LIMIT   ratelimit:{algorithm}:{identifier}:{window}
 * QUEUE        queue:{type}, queue:{type}:priority, ...
 * TASK         task:{id}
 * DEAD_LETTER  deadletter:{type}, deadletter:{type}:task:{id}
 * </pre>
 */
public enum GlobalKeyspace {
  SESSION("session"),
  RATE_LIMIT("ratelimit"),
  QUEUE("queue"),
  TASK("task"),
  DEAD_LETTER("deadletter");

  private final String prefix;

  GlobalKeyspace(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }

  public String key(String... parts) {
    StringBuilder key = new StringBuilder(prefix);
    for (String part : parts) {
      if (part == null || part.isBlank()) {
        throw new InvalidInputException(prefix + " key part must not be blank");
      }
      key.append(':').append(part);
    }
    return key.toString();
  }
}
