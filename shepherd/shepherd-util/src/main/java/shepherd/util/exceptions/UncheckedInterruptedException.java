package shepherd.util.exceptions;

public class UncheckedInterruptedException extends RuntimeException {
  private UncheckedInterruptedException(InterruptedException cause) {
    super(cause);
  }

  /**
   * Restores the interrupt flag of the current thread before wrapping the cause.
   */
  public static UncheckedInterruptedException propagate(InterruptedException cause) {
    Thread.currentThread().interrupt();
    throw new UncheckedInterruptedException(cause);
  }

  public static <T> T propagate(FallibleSupplier<T, InterruptedException> block) {
    try {
      return block.getOrThrow();
    } catch (InterruptedException e) {
      throw propagate(e);
    }
  }
}
