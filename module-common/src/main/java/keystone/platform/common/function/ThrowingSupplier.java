package keystone.platform.common.function;

/** Checked 예외를 던질 수 있는 Supplier. LogicExecutor 작업 단위로 사용됩니다. */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
