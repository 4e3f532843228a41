package keystone.platform.domain.model.progress;

import java.util.Arrays;

public enum ProgressStatus {
  IN_PROGRESS("in_progress"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String wireValue;

  ProgressStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }

  public static ProgressStatus fromWire(String value) {
    return Arrays.stream(values())
        .filter(s -> s.wireValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown progress status: " + value));
  }
}
