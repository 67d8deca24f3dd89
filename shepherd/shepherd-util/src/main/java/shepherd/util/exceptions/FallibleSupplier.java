package shepherd.util.exceptions;

import java.util.concurrent.Callable;

@FunctionalInterface
public interface FallibleSupplier<T, E extends Exception> extends Callable<T> {
  T getOrThrow() throws E;

  @Override
  default T call() throws Exception {
    return getOrThrow();
  }
}
