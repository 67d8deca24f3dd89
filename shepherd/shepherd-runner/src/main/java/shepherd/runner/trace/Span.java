package shepherd.runner.trace;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkState;

/**
 * A named, timed interval within a {@link Tracer}'s tree. Ends exactly once, via {@link #end} or {@link #close}.
 */
public class Span implements AutoCloseable {
  private final Tracer tracer;
  private final String name;
  private final Span parent;
  private final boolean verbose;
  private final Stopwatch stopwatch;
  private final List<Span> children = new CopyOnWriteArrayList<>();

  Span(Tracer tracer, String name, Span parent, boolean verbose, Ticker ticker) {
    this.tracer = tracer;
    this.name = name;
    this.parent = parent;
    this.verbose = verbose;
    this.stopwatch = Stopwatch.createUnstarted(ticker);
  }

  void begin() {
    stopwatch.start();
    if (verbose) tracer.output().write("(" + name + ") begin", Tracer.SPAN_PREFIX);
  }

  /**
   * Stops the clock.
   * @return the elapsed seconds
   * @throws IllegalStateException if this span has already ended
   */
  public double end() {
    double elapsed;
    synchronized (this) {
      checkState(stopwatch.isRunning(), "span already ended: %s", name);
      stopwatch.stop();
      elapsed = elapsedSeconds();
    }
    tracer.ended(this);
    if (verbose) tracer.output().write(String.format(Locale.ROOT, "(%s) end in %.2f secs.", name, elapsed), Tracer.SPAN_PREFIX);
    return elapsed;
  }

  /**
   * Ends this span if it is still running.
   */
  @Override
  public void close() {
    if (isRunning()) end();
  }

  public synchronized boolean isRunning() {
    return stopwatch.isRunning();
  }

  /**
   * Seconds elapsed so far, or in total once ended.
   */
  public synchronized double elapsedSeconds() {
    return stopwatch.elapsed(TimeUnit.MICROSECONDS) / 1_000_000.0;
  }

  public String name() {
    return name;
  }

  public Optional<Span> parent() {
    return Optional.ofNullable(parent);
  }

  public List<Span> children() {
    return List.copyOf(children);
  }

  void addChild(Span child) {
    children.add(child);
  }

  @Override
  public String toString() {
    return "Span{" + name + "}";
  }
}
