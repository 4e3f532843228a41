package keystone.platform.infrastructure.keystore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import keystone.platform.error.exception.StoreScriptExecutionException;

/**
 * 스크립트 반환값 해석 헬퍼
 *
 * <p>Redis는 Lua number를 integer reply로, table을 multi-bulk로 돌려줍니다. Redisson + StringCodec 조합에서는 정수가
 * {@code Long}, 문자열이 {@code String}으로 옵니다. In-Memory 구현도 같은 형태를 반환합니다.
 */
public final class ScriptResults {

  private ScriptResults() {}

  public static long asLong(Object value) {
    if (value instanceof Number n) {
      return n.longValue();
    }
    if (value instanceof String s) {
      try {
        return Long.parseLong(s);
      } catch (NumberFormatException e) {
        throw new StoreScriptExecutionException("unexpected integer reply: " + s, e);
      }
    }
    throw new StoreScriptExecutionException("unexpected integer reply: " + value);
  }

  public static String asString(Object value) {
    return value == null ? null : String.valueOf(value);
  }

  public static List<Object> asList(Object value) {
    if (value instanceof List<?> list) {
      @SuppressWarnings("unchecked")
      List<Object> casted = (List<Object>) list;
      return casted;
    }
    throw new StoreScriptExecutionException("unexpected multi-bulk reply: " + value);
  }

  public static long longAt(List<Object> reply, int index) {
    return asLong(reply.get(index));
  }

  public static String stringAt(List<Object> reply, int index) {
    return asString(reply.get(index));
  }

  /** HGETALL 형태의 평탄화된 [field, value, ...] 응답을 Map으로 */
  public static Map<String, String> toMap(Object value) {
    List<Object> flat = asList(value);
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i + 1 < flat.size(); i += 2) {
      map.put(asString(flat.get(i)), asString(flat.get(i + 1)));
    }
    return map;
  }

  /** Java 스크립트 구현에서 HGETALL 응답 형태를 만들 때 사용 */
  public static List<Object> flatten(Map<String, String> map) {
    List<Object> flat = new ArrayList<>(map.size() * 2);
    map.forEach(
        (field, v) -> {
          flat.add(field);
          flat.add(v);
        });
    return flat;
  }
}
