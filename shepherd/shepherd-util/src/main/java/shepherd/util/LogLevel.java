package shepherd.util;

import org.slf4j.Logger;

import java.util.function.BiConsumer;

/**
 * A logging level that can be named in configuration.
 */
public enum LogLevel {
  Trace(Logger::trace),
  Debug(Logger::debug),
  Info(Logger::info),
  Warn(Logger::warn),
  Error(Logger::error);

  private final BiConsumer<Logger, String> sink;

  LogLevel(BiConsumer<Logger, String> sink) {
    this.sink = sink;
  }

  public void log(Logger logger, String message) {
    sink.accept(logger, message);
  }
}
