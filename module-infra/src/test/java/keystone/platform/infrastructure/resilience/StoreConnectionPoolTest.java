package keystone.platform.infrastructure.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import keystone.platform.error.exception.PoolExhaustedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StoreConnectionPoolTest {

  @Test
  @DisplayName("슬롯이 모두 사용 중이면 대기 후 PoolExhausted")
  void exhausted() {
    StoreConnectionPool pool = new StoreConnectionPool("test", 2, Duration.ofMillis(20));
    pool.acquire("get");
    pool.acquire("get");

    assertThat(pool.available()).isZero();
    assertThatThrownBy(() -> pool.acquire("set"))
        .isInstanceOf(PoolExhaustedException.class)
        .hasMessageContaining("set");
  }

  @Test
  @DisplayName("반납하면 다시 획득할 수 있다")
  void releaseMakesSlotAvailable() {
    StoreConnectionPool pool = new StoreConnectionPool("test", 1, Duration.ofMillis(20));
    pool.acquire("get");

    pool.release();
    pool.acquire("get");

    assertThat(pool.maxConnections()).isEqualTo(1);
    assertThat(pool.available()).isZero();
  }
}
