package keystone.platform.infrastructure.resilience;

import keystone.platform.error.exception.StoreTimeoutException;

/** 서킷 브레이커가 집계하는 호출 결과 */
public enum CallOutcome {
  SUCCESS,
  FAILURE,
  TIMEOUT,
  /** OPEN 또는 HALF_OPEN 시도 슬롯 초과로 저장소에 닿기 전에 거부됨 */
  REJECTED,
  /** 상태 집계에서 제외되는 예외 (검증, 스코프, 스크립트, 풀 고갈) */
  IGNORED;

  /** 실패로 집계된 예외의 세부 분류 */
  static CallOutcome of(Throwable recorded) {
    return recorded instanceof StoreTimeoutException ? TIMEOUT : FAILURE;
  }

  public String tag() {
    return name().toLowerCase();
  }
}
