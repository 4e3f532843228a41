package keystone.platform.infrastructure.executor;

import java.util.Objects;

/**
 * 메트릭 카디널리티 통제를 위한 작업 컨텍스트
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("RateLimiter", "check", "ip")  → "RateLimiter:check:ip"
 * - TaskContext.of("Cache", "get")                → "Cache:get"
 * </pre>
 *
 * <ul>
 *   <li>component, operation: 고정 taxonomy (메트릭 태그로 사용 가능)
 *   <li>dynamicValue: 로그에만 기록. 테넌트 ID 같은 고카디널리티 값은 여기로
 * </ul>
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
