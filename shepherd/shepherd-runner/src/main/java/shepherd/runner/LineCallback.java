package shepherd.runner;

/**
 * Receives the lines read from one process stream by a {@link StreamPump}: {@link #line} once per line in the order
 * the process wrote them, then {@link #endOfStream} exactly once.
 */
@FunctionalInterface
public interface LineCallback {
  LineCallback IGNORE = line -> { };

  void line(String line);

  default void endOfStream() {
  }

  /**
   * A callback which delivers each event to this callback and then to {@code next}.
   */
  default LineCallback andThen(LineCallback next) {
    LineCallback first = this;
    return new LineCallback() {
      @Override
      public void line(String line) {
        first.line(line);
        next.line(line);
      }

      @Override
      public void endOfStream() {
        first.endOfStream();
        next.endOfStream();
      }
    };
  }
}
