package shepherd.runner;

import com.google.common.io.CharStreams;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.common.io.LineProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shepherd.util.concurrent.NamedThreadFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.util.concurrent.CompletableFuture;

import static com.google.common.base.Preconditions.checkState;

/**
 * Reads one process stream line-by-line on a daemon thread, handing each line to a {@link LineCallback}.
 * <p/>
 * After the stream is exhausted the callback receives {@link LineCallback#endOfStream} exactly once, and then
 * {@link #finished} completes. A callback that throws from {@link LineCallback#line} is logged and skipped; it
 * cannot stop the pump (nor the pump of the other stream).
 */
public class StreamPump implements LineProcessor<Void> {
  private static final Logger LOG = LoggerFactory.getLogger(StreamPump.class);
  private static final NamedThreadFactory PUMP_THREADS = new NamedThreadFactory("shepherd-pump").daemonize();

  private final String name;
  private final InputStream stream;
  private final Charset charset;
  private final LineCallback callback;
  private final CompletableFuture<Void> finished = new CompletableFuture<>();
  private volatile boolean started = false;

  public StreamPump(String name, InputStream stream, Charset charset, LineCallback callback) {
    this.name = name;
    this.stream = stream;
    this.charset = charset;
    this.callback = callback;
  }

  @CanIgnoreReturnValue
  public synchronized StreamPump start() {
    checkState(!started, "pump already started", name);
    started = true;
    PUMP_THREADS.newThread(name, this::pump).start();
    return this;
  }

  /**
   * Completes after {@link LineCallback#endOfStream} has returned.
   */
  public CompletableFuture<Void> finished() {
    return finished;
  }

  public String name() {
    return name;
  }

  void pump() {
    try (Reader reader = new InputStreamReader(stream, charset)) {
      CharStreams.readLines(reader, this);
    } catch (IOException e) {
      LOG.debug("Stream {} ended with an error", name, e);
    } finally {
      try {
        callback.endOfStream();
      } catch (RuntimeException e) {
        LOG.warn("End-of-stream callback failed for {}", name, e);
      } finally {
        finished.complete(null);
      }
    }
  }

  @Override
  public boolean processLine(String line) {
    try {
      callback.line(line);
    } catch (RuntimeException e) {
      LOG.warn("Line callback failed for {}, skipping line", name, e);
    }
    return true;
  }

  @Override
  public Void getResult() {
    return null;
  }
}
