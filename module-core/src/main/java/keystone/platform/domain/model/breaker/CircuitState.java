package keystone.platform.domain.model.breaker;

public enum CircuitState {
  CLOSED(0),
  OPEN(1),
  HALF_OPEN(2);

  /** Micrometer gauge 값 */
  private final int gaugeValue;

  CircuitState(int gaugeValue) {
    this.gaugeValue = gaugeValue;
  }

  public int gaugeValue() {
    return gaugeValue;
  }
}
