package keystone.platform.infrastructure.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import keystone.platform.core.port.out.KeyStoreClient;
import keystone.platform.core.port.out.ScoredMember;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.error.exception.PoolExhaustedException;
import keystone.platform.error.exception.StoreConnectionException;
import keystone.platform.error.exception.StoreTimeoutException;
import keystone.platform.infrastructure.executor.TaskContext;
import keystone.platform.infrastructure.executor.strategy.ExceptionTranslator;
import lombok.extern.slf4j.Slf4j;

/**
 * 보호 계층이 적용된 KeyStoreClient (Decorator)
 *
 * <h3>호출 1회 시도 순서</h3>
 *
 * <ol>
 *   <li>서킷 브레이커 허가 - OPEN이면 {@code CircuitOpenException}, 저장소 미접촉
 *   <li>커넥션 풀 획득 (호출 스레드, 최대 operation-timeout 대기) - 실패 시 {@code PoolExhaustedException}
 *   <li>저장소 호출을 전용 executor에서 실행, {@link TimeLimiter}로 call-timeout 적용
 *   <li>결과를 서킷 브레이커에 보고 (marker 인터페이스로 실패/무시 분류)
 * </ol>
 *
 * <h3>재시도</h3>
 *
 * <p>바깥의 Resilience4j {@link Retry}가 일시적 오류(연결 실패, 타임아웃, 풀 고갈)만 지수 backoff로 재시도합니다.
 * CircuitOpen, 스코프, 검증, 스크립트 오류는 재시도하지 않습니다.
 *
 * <p>타임아웃으로 호출자가 먼저 반환되어도 실제 호출이 끝날 때까지 풀 슬롯은 반납되지 않습니다.
 */
@Slf4j
public class GuardedKeyStore implements KeyStoreClient {

  private static final String COMPONENT = "KeyStore";

  private final KeyStoreClient delegate;
  private final StoreCircuitBreaker breaker;
  private final StoreConnectionPool pool;
  private final Retry retry;
  private final TimeLimiter timeLimiter;
  private final ExecutorService callExecutor;
  private final ExceptionTranslator translator = ExceptionTranslator.forStore();

  public GuardedKeyStore(
      KeyStoreClient delegate,
      StoreCircuitBreaker breaker,
      StoreConnectionPool pool,
      int retryAttempts,
      Duration retryInitialInterval) {
    this.delegate = delegate;
    this.breaker = breaker;
    this.pool = pool;
    this.retry =
        Retry.of(
            "keystore",
            RetryConfig.custom()
                .maxAttempts(retryAttempts)
                .intervalFunction(
                    IntervalFunction.ofExponentialBackoff(retryInitialInterval.toMillis(), 2.0))
                .retryOnException(GuardedKeyStore::isTransient)
                .build());
    this.timeLimiter =
        TimeLimiter.of(
            "keystore",
            TimeLimiterConfig.custom()
                .timeoutDuration(breaker.callTimeout())
                .cancelRunningFuture(false)
                .build());
    this.callExecutor = Executors.newCachedThreadPool(new CallThreadFactory());
  }

  /** 로컬 재시도 대상: 연결 실패, 타임아웃, 풀 고갈 */
  public static boolean isTransient(Throwable e) {
    return e instanceof StoreConnectionException
        || e instanceof StoreTimeoutException
        || e instanceof PoolExhaustedException;
  }

  public StoreCircuitBreaker breaker() {
    return breaker;
  }

  public StoreConnectionPool pool() {
    return pool;
  }

  public void shutdown() {
    callExecutor.shutdown();
    try {
      if (!callExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        callExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      callExecutor.shutdownNow();
    }
  }

  // ==================== String / Key ====================

  @Override
  public Optional<String> get(String key) {
    return guard("get", () -> delegate.get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    guard(
        "set",
        () -> {
          delegate.set(key, value, ttl);
          return null;
        });
  }

  @Override
  public long delete(Collection<String> keys) {
    return guard("delete", () -> delegate.delete(keys));
  }

  @Override
  public boolean exists(String key) {
    return guard("exists", () -> delegate.exists(key));
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return guard("expire", () -> delegate.expire(key, ttl));
  }

  @Override
  public Optional<Duration> ttl(String key) {
    return guard("ttl", () -> delegate.ttl(key));
  }

  @Override
  public long increment(String key, long delta) {
    return guard("increment", () -> delegate.increment(key, delta));
  }

  @Override
  public List<String> scan(String pattern, int batchSize) {
    return guard("scan", () -> delegate.scan(pattern, batchSize));
  }

  // ==================== Hash ====================

  @Override
  public Map<String, String> hashGetAll(String key) {
    return guard("hashGetAll", () -> delegate.hashGetAll(key));
  }

  @Override
  public Optional<String> hashGet(String key, String field) {
    return guard("hashGet", () -> delegate.hashGet(key, field));
  }

  @Override
  public void hashPutAll(String key, Map<String, String> fields) {
    guard(
        "hashPutAll",
        () -> {
          delegate.hashPutAll(key, fields);
          return null;
        });
  }

  @Override
  public long hashIncrement(String key, String field, long delta) {
    return guard("hashIncrement", () -> delegate.hashIncrement(key, field, delta));
  }

  // ==================== Sorted Set ====================

  @Override
  public boolean zAdd(String key, double score, String member) {
    return guard("zAdd", () -> delegate.zAdd(key, score, member));
  }

  @Override
  public boolean zRemove(String key, String member) {
    return guard("zRemove", () -> delegate.zRemove(key, member));
  }

  @Override
  public long zRemoveRangeByScore(String key, double min, double max) {
    return guard("zRemoveRangeByScore", () -> delegate.zRemoveRangeByScore(key, min, max));
  }

  @Override
  public long zCard(String key) {
    return guard("zCard", () -> delegate.zCard(key));
  }

  @Override
  public List<ScoredMember> zRangeWithScores(String key, int start, int end) {
    return guard("zRangeWithScores", () -> delegate.zRangeWithScores(key, start, end));
  }

  @Override
  public List<String> zRangeByScore(String key, double min, double max, int limit) {
    return guard("zRangeByScore", () -> delegate.zRangeByScore(key, min, max, limit));
  }

  @Override
  public Optional<Double> zScore(String key, String member) {
    return guard("zScore", () -> delegate.zScore(key, member));
  }

  // ==================== List ====================

  @Override
  public long listPush(String key, String value) {
    return guard("listPush", () -> delegate.listPush(key, value));
  }

  @Override
  public List<String> listRange(String key, int start, int end) {
    return guard("listRange", () -> delegate.listRange(key, start, end));
  }

  @Override
  public void listTrim(String key, int start, int end) {
    guard(
        "listTrim",
        () -> {
          delegate.listTrim(key, start, end);
          return null;
        });
  }

  @Override
  public long listLength(String key) {
    return guard("listLength", () -> delegate.listLength(key));
  }

  // ==================== Set ====================

  @Override
  public long setAdd(String key, Collection<String> members) {
    return guard("setAdd", () -> delegate.setAdd(key, members));
  }

  @Override
  public Set<String> setMembers(String key) {
    return guard("setMembers", () -> delegate.setMembers(key));
  }

  @Override
  public long setRemove(String key, Collection<String> members) {
    return guard("setRemove", () -> delegate.setRemove(key, members));
  }

  // ==================== Server ====================

  @Override
  public String ping() {
    return guard("ping", delegate::ping);
  }

  @Override
  public Object eval(StoreScript script, List<String> keys, List<String> args) {
    return guard("eval:" + script.name(), () -> delegate.eval(script, keys, args));
  }

  // ==================== guard ====================

  private <T> T guard(String operation, Supplier<T> call) {
    return Retry.decorateSupplier(retry, () -> attempt(operation, call)).get();
  }

  private <T> T attempt(String operation, Supplier<T> call) {
    StoreCircuitBreaker.Permit permit = breaker.acquirePermission();
    try {
      pool.acquire(operation);
    } catch (PoolExhaustedException e) {
      breaker.onError(permit, e);
      throw e;
    }

    CompletableFuture<T> future;
    try {
      future = CompletableFuture.supplyAsync(releasing(call), callExecutor);
    } catch (RejectedExecutionException e) {
      pool.release();
      StoreConnectionException rejected = new StoreConnectionException(operation, e);
      breaker.onError(permit, rejected);
      throw rejected;
    }

    try {
      T result = timeLimiter.executeFutureSupplier(() -> future);
      breaker.onSuccess(permit);
      return result;
    } catch (TimeoutException e) {
      StoreTimeoutException timeout =
          new StoreTimeoutException(operation, breaker.callTimeout().toMillis(), e);
      breaker.onError(permit, timeout);
      log.warn("⚠️ [KeyStore] {} exceeded {}ms", operation, breaker.callTimeout().toMillis());
      throw timeout;
    } catch (Exception e) {
      RuntimeException translated = translator.translate(e, TaskContext.of(COMPONENT, operation));
      breaker.onError(permit, translated);
      throw translated;
    }
  }

  private <T> Supplier<T> releasing(Supplier<T> call) {
    return () -> {
      try {
        return call.get();
      } finally {
        pool.release();
      }
    };
  }

  private static final class CallThreadFactory implements ThreadFactory {

    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, "keystore-call-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
