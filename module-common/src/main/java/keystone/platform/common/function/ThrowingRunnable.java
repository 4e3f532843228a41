package keystone.platform.common.function;

@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
