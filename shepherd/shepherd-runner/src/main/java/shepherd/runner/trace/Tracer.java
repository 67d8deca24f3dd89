package shepherd.runner.trace;

import com.google.common.base.Strings;
import com.google.common.base.Ticker;
import shepherd.runner.output.OutputSink;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records nested {@link Span Spans}. Each thread has its own current span, under which new spans are opened.
 */
@Singleton
public class Tracer {
  static final String SPAN_PREFIX = "SPN";

  private final OutputSink output;
  private final Ticker ticker;
  private final List<Span> roots = new CopyOnWriteArrayList<>();
  private final ThreadLocal<Span> current = new ThreadLocal<>();

  @Inject
  public Tracer(OutputSink output) {
    this(output, Ticker.systemTicker());
  }

  public Tracer(OutputSink output, Ticker ticker) {
    this.output = output;
    this.ticker = ticker;
  }

  /**
   * Opens a span under the calling thread's current span, and makes it current until it ends.
   */
  public Span span(String name, boolean verbose) {
    Span span = open(name, verbose);
    current.set(span);
    return span;
  }

  /**
   * Opens a span under the calling thread's current span without making it current; it may be ended from any thread.
   */
  public Span detachedSpan(String name, boolean verbose) {
    return open(name, verbose);
  }

  public Optional<Span> currentSpan() {
    return Optional.ofNullable(current.get());
  }

  public List<Span> roots() {
    return List.copyOf(roots);
  }

  /**
   * Renders every span as an indented tree, one line per span: elapsed seconds, then name.
   */
  public String renderSummary() {
    StringBuilder summary = new StringBuilder();
    roots.forEach(root -> render(root, 0, summary));
    return summary.toString();
  }

  private static void render(Span span, int depth, StringBuilder summary) {
    if (summary.length() > 0) summary.append('\n');
    summary.append(Strings.repeat("  ", depth))
            .append(String.format(Locale.ROOT, "%7.2fs %s", span.elapsedSeconds(), span.name()));
    span.children().forEach(child -> render(child, depth + 1, summary));
  }

  private Span open(String name, boolean verbose) {
    Span parent = current.get();
    Span span = new Span(this, name, parent, verbose, ticker);
    if (parent == null) {
      roots.add(span);
    } else {
      parent.addChild(span);
    }
    span.begin();
    return span;
  }

  void ended(Span span) {
    if (current.get() == span) {
      Optional<Span> parent = span.parent();
      if (parent.isPresent()) {
        current.set(parent.get());
      } else {
        current.remove();
      }
    }
  }

  OutputSink output() {
    return output;
  }
}
