package keystone.platform.domain.model.ratelimit;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

public enum WindowKind {
  MINUTE(Duration.ofMinutes(1)),
  HOUR(Duration.ofHours(1)),
  DAY(Duration.ofDays(1));

  private final Duration duration;

  WindowKind(Duration duration) {
    this.duration = duration;
  }

  public Duration duration() {
    return duration;
  }

  public static Optional<WindowKind> matching(Duration window) {
    return Arrays.stream(values()).filter(k -> k.duration.equals(window)).findFirst();
  }
}
