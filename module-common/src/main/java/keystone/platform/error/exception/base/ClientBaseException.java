package keystone.platform.error.exception.base;

import keystone.platform.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 입력이나 사용 방식이 잘못되었을 때 발생하는 4xx 계열 예외입니다. 재시도해도 결과가 바뀌지 않으므로
 * 저장소 재시도 정책과 서킷 브레이커 집계 대상에서 제외됩니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "태스크를 찾을 수 없습니다 (taskId: %s)" 처럼 동적 인자로 메시지 완성
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
