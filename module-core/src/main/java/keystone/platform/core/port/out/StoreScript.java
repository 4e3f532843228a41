package keystone.platform.core.port.out;

import java.util.List;
import java.util.Objects;

/**
 * 원자적 저장소 스크립트
 *
 * <p>Redis에서는 {@code lua} 본문을 EVALSHA로 실행하고, In-Memory 저장소에서는 같은 의미의 {@code local} 구현을 단일 락 아래에서
 * 실행합니다. 두 구현은 같은 KEYS/ARGV 규약과 같은 반환 형태를 가져야 합니다.
 */
public record StoreScript(String name, String lua, ResultType resultType, LocalScript local) {

  public enum ResultType {
    INTEGER,
    VALUE,
    MULTI
  }

  /** 스크립트의 Java 구현. 저장소 명령만 사용하며 호출 동안 다른 명령은 끼어들지 않습니다. */
  @FunctionalInterface
  public interface LocalScript {
    Object execute(KeyStoreCommands store, List<String> keys, List<String> args);
  }

  public StoreScript {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(lua, "lua");
    Objects.requireNonNull(resultType, "resultType");
    Objects.requireNonNull(local, "local");
  }

  public static StoreScript of(String name, String lua, ResultType type, LocalScript local) {
    return new StoreScript(name, lua, type, local);
  }
}
