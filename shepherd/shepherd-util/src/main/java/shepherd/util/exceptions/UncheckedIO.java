package shepherd.util.exceptions;

import java.io.IOException;
import java.io.UncheckedIOException;

public class UncheckedIO {
  public static void runUnchecked(Fallible<? extends IOException> runnable) {
    try {
      runnable.runOrThrow();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
