package keystone.platform.error;

import org.springframework.http.HttpStatus;

/** 코드 접두사: C 입력, T 테넌트, R rate limit, Q 큐, S 저장소/서버 */
public interface ErrorCode {
  String getCode();

  String getMessage();

  HttpStatus getStatus();

  /** 저장소나 서버 쪽 원인인지 여부 (5xx) */
  default boolean isServerSide() {
    return getStatus().is5xxServerError();
  }
}
