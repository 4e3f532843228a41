package keystone.platform.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 공통 에러 코드
 *
 * <h3>코드 체계</h3>
 *
 * <ul>
 *   <li>C0xx: 입력값 / 요청 검증 (4xx)
 *   <li>T0xx: 테넌트 격리 (4xx)
 *   <li>R0xx: Rate Limit (429)
 *   <li>Q0xx: 태스크 큐 (4xx)
 *   <li>S0xx: 저장소 / 시스템 (5xx)
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {

  // Client
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  SCOPE_REQUIRED("T001", "테넌트 스코프가 필요합니다 (operation: %s)", HttpStatus.BAD_REQUEST),
  RATE_LIMIT_EXCEEDED(
      "R001", "요청 한도를 초과했습니다. %s초 후 다시 시도해주세요.", HttpStatus.TOO_MANY_REQUESTS),
  QUEUE_FULL("Q001", "큐 용량을 초과했습니다 (queue: %s, limit: %s)", HttpStatus.TOO_MANY_REQUESTS),
  TASK_NOT_FOUND("Q002", "태스크를 찾을 수 없습니다 (taskId: %s)", HttpStatus.NOT_FOUND),
  INVALID_TASK_STATE(
      "Q003", "태스크 상태 전이가 허용되지 않습니다 (taskId: %s, status: %s, action: %s)", HttpStatus.CONFLICT),

  // Server
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  STORE_CONNECTION_FAILED(
      "S002", "저장소 연결에 실패했습니다 (operation: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  STORE_TIMEOUT(
      "S003", "저장소 호출 시간이 초과되었습니다 (operation: %s, timeout: %sms)", HttpStatus.GATEWAY_TIMEOUT),
  CIRCUIT_OPEN("S004", "서킷 브레이커가 열려 있습니다 (breaker: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  POOL_EXHAUSTED(
      "S005", "커넥션 풀이 고갈되었습니다 (max: %s, operation: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  STORE_SCRIPT_FAILED("S006", "저장소 스크립트 실행 실패 (script: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  PAYLOAD_SERIALIZATION_FAILED(
      "S007", "페이로드 직렬화 처리 실패 (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
