package shepherd.runner;

import shepherd.util.concurrent.Threads;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.google.common.base.Preconditions.checkState;

/**
 * Collects the lines of one stream. {@link #awaitText} blocks until the producing pump has delivered its end-of-stream,
 * which may happen after the process has already been observed to exit.
 */
public class CaptureBuffer implements LineCallback {
  private final List<String> lines = new ArrayList<>();
  private final CompletableFuture<List<String>> complete = new CompletableFuture<>();

  @Override
  public synchronized void line(String line) {
    checkState(!complete.isDone(), "line received after end of stream");
    lines.add(line);
  }

  @Override
  public synchronized void endOfStream() {
    checkState(complete.complete(List.copyOf(lines)), "end of stream delivered twice");
  }

  public boolean isComplete() {
    return complete.isDone();
  }

  public synchronized List<String> linesSoFar() {
    return List.copyOf(lines);
  }

  /**
   * Waits for the end of the stream, then returns the received lines joined with newlines and trimmed.
   */
  public String awaitText() {
    return String.join("\n", Threads.await(complete)).strip();
  }
}
