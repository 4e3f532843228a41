package keystone.platform.infrastructure.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import keystone.platform.core.port.out.KeyStoreClient;
import keystone.platform.core.port.out.StoreScript;
import keystone.platform.domain.model.breaker.CircuitState;
import keystone.platform.error.exception.CircuitOpenException;
import keystone.platform.error.exception.PoolExhaustedException;
import keystone.platform.error.exception.StoreConnectionException;
import keystone.platform.error.exception.StoreScriptExecutionException;
import keystone.platform.error.exception.StoreTimeoutException;
import keystone.platform.infrastructure.config.CircuitBreakerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("GuardedKeyStore 보호 계층")
class GuardedKeyStoreTest {

  @Mock private KeyStoreClient delegate;

  private StoreCircuitBreaker breaker;
  private GuardedKeyStore store;

  @AfterEach
  void tearDown() {
    if (store != null) {
      store.shutdown();
    }
  }

  @Test
  @DisplayName("정상 호출은 위임 결과를 반환하고 성공으로 집계한다")
  void passesThrough() {
    guarded(5, Duration.ofSeconds(1), 3, 2);
    when(delegate.get("k")).thenReturn(Optional.of("v"));

    assertThat(store.get("k")).contains("v");
    assertThat(breaker.status().successfulCalls()).isEqualTo(1);
    assertThat(store.pool().available()).isEqualTo(2);
  }

  @Test
  @DisplayName("연결 실패는 retry-attempts 만큼 재시도한 뒤 전파한다")
  void retriesTransientFailures() {
    guarded(10, Duration.ofSeconds(1), 3, 2);
    when(delegate.get("k")).thenThrow(new StoreConnectionException("get"));

    assertThatThrownBy(() -> store.get("k")).isInstanceOf(StoreConnectionException.class);
    verify(delegate, times(3)).get("k");
    assertThat(breaker.status().failedCalls()).isEqualTo(3);
  }

  @Test
  @DisplayName("일시적 실패 후 재시도가 성공하면 결과를 반환한다")
  void recoversOnRetry() {
    guarded(10, Duration.ofSeconds(1), 3, 2);
    when(delegate.get("k"))
        .thenThrow(new StoreConnectionException("get"))
        .thenReturn(Optional.of("v"));

    assertThat(store.get("k")).contains("v");
    verify(delegate, times(2)).get("k");
  }

  @Test
  @DisplayName("분류되지 않은 예외는 연결 실패로 변환된다")
  void translatesUnknownFailures() {
    guarded(10, Duration.ofSeconds(1), 1, 2);
    when(delegate.ping()).thenThrow(new IllegalStateException("socket reset"));

    assertThatThrownBy(store::ping)
        .isInstanceOf(StoreConnectionException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("스크립트 오류는 재시도하지 않고 서킷에도 집계하지 않는다")
  void scriptErrorsNotRetried() {
    guarded(1, Duration.ofSeconds(1), 3, 2);
    StoreScript script =
        StoreScript.of("noop", "return 1", StoreScript.ResultType.INTEGER, (s, k, a) -> 1L);
    when(delegate.eval(any(), anyList(), anyList()))
        .thenThrow(new StoreScriptExecutionException("noop"));

    assertThatThrownBy(() -> store.eval(script, List.of("k"), List.of()))
        .isInstanceOf(StoreScriptExecutionException.class);
    verify(delegate, times(1)).eval(any(), anyList(), anyList());
    assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
  }

  @Test
  @DisplayName("call-timeout을 넘긴 호출은 StoreTimeout으로 실패한다")
  void timesOut() {
    guarded(10, Duration.ofMillis(100), 1, 2);
    when(delegate.get("slow"))
        .thenAnswer(
            invocation -> {
              Thread.sleep(1_000);
              return Optional.of("late");
            });

    assertThatThrownBy(() -> store.get("slow")).isInstanceOf(StoreTimeoutException.class);
    assertThat(breaker.status().timedOutCalls()).isEqualTo(1);
  }

  @Test
  @DisplayName("서킷이 OPEN이면 저장소에 닿지 않고 거부한다")
  void rejectsWhenOpen() {
    guarded(2, Duration.ofSeconds(1), 1, 2);
    when(delegate.get("k")).thenThrow(new StoreConnectionException("get"));
    assertThatThrownBy(() -> store.get("k")).isInstanceOf(StoreConnectionException.class);
    assertThatThrownBy(() -> store.get("k")).isInstanceOf(StoreConnectionException.class);

    assertThatThrownBy(() -> store.set("other", "v", null))
        .isInstanceOf(CircuitOpenException.class);
    verify(delegate, never()).set(any(), any(), any());
  }

  @Test
  @DisplayName("풀이 가득 차면 PoolExhausted, 서킷 상태에는 영향 없음")
  void poolExhausted() throws Exception {
    guarded(1, Duration.ofSeconds(5), 1, 1);
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(delegate.get("busy"))
        .thenAnswer(
            invocation -> {
              entered.countDown();
              release.await(5, TimeUnit.SECONDS);
              return Optional.of("v");
            });
    CompletableFuture<Optional<String>> holder =
        CompletableFuture.supplyAsync(() -> store.get("busy"));
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    assertThatThrownBy(() -> store.get("k")).isInstanceOf(PoolExhaustedException.class);
    assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);

    release.countDown();
    assertThat(holder.get(5, TimeUnit.SECONDS)).contains("v");
  }

  private void guarded(
      int failureThreshold, Duration callTimeout, int retryAttempts, int poolSize) {
    breaker =
        StoreCircuitBreaker.of(
            "keystore",
            new CircuitBreakerProperties(failureThreshold, Duration.ofSeconds(60), 3, callTimeout));
    StoreConnectionPool pool = new StoreConnectionPool("keystore", poolSize, Duration.ofMillis(50));
    store = new GuardedKeyStore(delegate, breaker, pool, retryAttempts, Duration.ofMillis(10));
  }
}
