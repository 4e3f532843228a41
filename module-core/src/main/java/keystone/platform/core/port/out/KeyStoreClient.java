package keystone.platform.core.port.out;

import java.util.List;

/**
 * 저장소 연결 추상화 (Redis / In-Memory)
 *
 * <p>풀링과 호출 제한 시간은 구현체와 그 앞단(서킷 브레이커)에서 처리합니다. check-then-act가 필요한 연산은 반드시 {@link #eval}로
 * 원자적으로 실행해야 합니다.
 */
public interface KeyStoreClient extends KeyStoreCommands {

  /** @return "PONG" */
  String ping();

  /**
   * 원자적 스크립트 실행
   *
   * @return {@link StoreScript.ResultType}에 따라 Long, String, 또는 List&lt;Object&gt;
   */
  Object eval(StoreScript script, List<String> keys, List<String> args);
}
