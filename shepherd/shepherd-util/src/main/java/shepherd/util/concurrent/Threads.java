package shepherd.util.concurrent;

import com.google.common.base.Throwables;
import shepherd.util.exceptions.UncheckedInterruptedException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

public class Threads {
  public static void sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      throw UncheckedInterruptedException.propagate(e);
    }
  }

  /**
   * Blocks for the result of the given future, rethrowing its failure (unwrapped from the
   * {@link ExecutionException}) and converting interruption into an {@link UncheckedInterruptedException}.
   */
  public static <T> T await(Future<T> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      throw UncheckedInterruptedException.propagate(e);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new RuntimeException(e.getCause());
    }
  }
}
