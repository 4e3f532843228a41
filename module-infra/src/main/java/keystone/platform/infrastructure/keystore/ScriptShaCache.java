package keystone.platform.infrastructure.keystore;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.infrastructure.executor.LogicExecutor;
import keystone.platform.infrastructure.executor.TaskContext;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * Lua Script SHA 캐시
 *
 * <p>스크립트 이름별로 SHA를 캐싱하고, Redis 재시작 등으로 서버 스크립트 캐시가 비어 NOSCRIPT가 발생하면 {@link #reload}로 다시
 * 적재합니다.
 *
 * <pre>
 * 1. evalSha(sha)
 * 2. NOSCRIPT (서버에 스크립트 없음)
 * 3. scriptLoad() 재로드 → 캐시 갱신
 * 4. evalSha(newSha) 1회 재시도
 * </pre>
 */
@Slf4j
public class ScriptShaCache {

  private static final String NOSCRIPT_ERROR_PREFIX = "NOSCRIPT";

  private final RedissonClient redissonClient;
  private final LogicExecutor executor;
  private final Map<String, String> shaByName = new ConcurrentHashMap<>();

  public ScriptShaCache(RedissonClient redissonClient, LogicExecutor executor) {
    this.redissonClient = redissonClient;
    this.executor = executor;
  }

  /**
   * 시작 시 웜업. Redis 연결 실패해도 애플리케이션 시작에는 영향 없음 (첫 호출 시 lazy loading).
   *
   * @return 적재에 성공한 스크립트 수
   */
  public int warmUp(Collection<StoreScript> scripts) {
    int loaded = 0;
    for (StoreScript script : scripts) {
      boolean ok =
          executor.executeOrDefault(
              () -> {
                reload(script);
                return true;
              },
              false,
              TaskContext.of("LuaScript", "WarmUp", script.name()));
      if (ok) {
        loaded++;
      }
    }
    if (loaded < scripts.size()) {
      log.warn(
          "⚠️ [ScriptShaCache] 시작 시 스크립트 일부 로드 실패 ({}/{}) - 첫 호출 시 재시도",
          loaded,
          scripts.size());
    } else {
      log.info("✅ [ScriptShaCache] SHA 캐싱 완료 - {}개", loaded);
    }
    return loaded;
  }

  public String shaOf(StoreScript script) {
    return shaByName.computeIfAbsent(script.name(), name -> load(script));
  }

  public String reload(StoreScript script) {
    String sha = load(script);
    shaByName.put(script.name(), sha);
    log.info("🔄 [ScriptShaCache] 스크립트 로드 - {}: {}", script.name(), sha);
    return sha;
  }

  public static boolean isNoscriptError(Throwable e) {
    Throwable current = e;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && message.contains(NOSCRIPT_ERROR_PREFIX)) {
        return true;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }

  private String load(StoreScript script) {
    RScript rScript = redissonClient.getScript(StringCodec.INSTANCE);
    return rScript.scriptLoad(script.lua());
  }
}
