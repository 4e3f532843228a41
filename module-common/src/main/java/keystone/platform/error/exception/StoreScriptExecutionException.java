package keystone.platform.error.exception;

import keystone.platform.error.CommonErrorCode;
import keystone.platform.error.exception.base.ServerBaseException;
import keystone.platform.error.exception.marker.CircuitBreakerIgnoreMarker;

/** Lua 스크립트나 명령 자체의 오류 (WRONGTYPE 등). 저장소 가용성과 무관하므로 서킷 집계 제외. */
public class StoreScriptExecutionException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  public StoreScriptExecutionException(String scriptName, Throwable cause) {
    super(CommonErrorCode.STORE_SCRIPT_FAILED, cause, scriptName);
  }

  public StoreScriptExecutionException(String scriptName) {
    super(CommonErrorCode.STORE_SCRIPT_FAILED, scriptName);
  }
}
