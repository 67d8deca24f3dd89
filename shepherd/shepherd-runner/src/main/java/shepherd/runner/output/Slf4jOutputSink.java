package shepherd.runner.output;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.EvictingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shepherd.runner.RunnerConfig;
import shepherd.util.LogLevel;
import shepherd.util.strings.MoreStrings;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * An {@link OutputSink} which stamps each line with the seconds elapsed since the sink was created, mirrors it to the
 * {@code shepherd.output} logger, and retains a bounded history for {@link #readRecent}.
 */
@Singleton
public class Slf4jOutputSink implements OutputSink {
  static final String LOGGER_NAME = "shepherd.output";
  private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

  private final Stopwatch sinceStart;
  private final LogLevel level;
  private final EvictingQueue<String> history;

  @Inject
  public Slf4jOutputSink(RunnerConfig config) {
    this(Ticker.systemTicker(), config.outputLogLevel(), config.logHistoryLines());
  }

  public Slf4jOutputSink(Ticker ticker, LogLevel level, int historyLines) {
    this.sinceStart = Stopwatch.createStarted(ticker);
    this.level = level;
    this.history = EvictingQueue.create(historyLines);
  }

  @Override
  public synchronized void write(String message, String prefix) {
    double elapsed = sinceStart.elapsed(TimeUnit.MILLISECONDS) / 1000.0;
    String line = String.format(Locale.ROOT, "%6.1f %s | %s", elapsed, prefix, MoreStrings.stripTrailingLineBreaks(message));
    history.add(line);
    level.log(LOG, line);
  }

  @Override
  public synchronized String readRecent() {
    return String.join("\n", history);
  }
}
