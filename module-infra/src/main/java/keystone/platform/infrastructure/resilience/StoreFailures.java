package keystone.platform.infrastructure.resilience;

import keystone.platform.error.exception.CircuitOpenException;

/** 저장소 가용성 실패 분류. 캐시 읽기 miss 처리와 Rate Limit fail-open 판단에 사용합니다. */
public final class StoreFailures {

  private StoreFailures() {}

  /** 저장소에 도달하지 못한 실패 (연결, 타임아웃, 서킷 OPEN, 풀 고갈) */
  public static boolean isUnavailable(Throwable e) {
    return GuardedKeyStore.isTransient(e) || e instanceof CircuitOpenException;
  }
}
