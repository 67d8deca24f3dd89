package shepherd.runner.output;

/**
 * The session log. Written concurrently by stream pumps of many commands; implementations serialize their own writes.
 */
public interface OutputSink {
  String DEFAULT_PREFIX = "RUN";

  void write(String message, String prefix);

  default void write(String message) {
    write(message, DEFAULT_PREFIX);
  }

  /**
   * The most recent lines written to this sink, oldest first, joined with newlines.
   */
  String readRecent();
}
