package shepherd.runner.trace;

import com.google.common.base.Ticker;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import shepherd.runner.output.OutputSink;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TracerTest {
  private final AtomicLong nanos = new AtomicLong();
  private final OutputSink output = mock(OutputSink.class);
  private final Tracer tracer = new Tracer(output, new Ticker() {
    @Override
    public long read() {
      return nanos.get();
    }
  });

  @Test
  void spansNestUnderTheCurrentSpan() {
    Span outer = tracer.span("outer", false);
    Span inner = tracer.span("inner", false);

    assertThat(tracer.currentSpan()).hasValue(inner);
    assertThat(inner.parent()).hasValue(outer);
    assertThat(outer.children()).containsExactly(inner);
    assertThat(tracer.roots()).containsExactly(outer);

    inner.end();
    assertThat(tracer.currentSpan()).hasValue(outer);
    outer.end();
    assertThat(tracer.currentSpan()).isEmpty();
  }

  @Test
  void detachedSpansDoNotBecomeCurrent() {
    Span outer = tracer.span("outer", false);
    Span command = tracer.detachedSpan("1 ls", false);

    assertThat(tracer.currentSpan()).hasValue(outer);
    assertThat(outer.children()).containsExactly(command);

    command.end();
    assertThat(tracer.currentSpan()).hasValue(outer);
  }

  @Test
  void endReturnsElapsedSecondsOnce() {
    Span span = tracer.span("timed", false);
    nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(1500));

    assertThat(span.end()).isWithin(1e-9).of(1.5);
    assertThat(span.isRunning()).isFalse();
    assertThrows(IllegalStateException.class, span::end);
  }

  @Test
  void closeIsIdempotent() {
    Span span = tracer.span("closeable", false);
    try (Span ignored = span) {
      span.end();
    }
    assertThat(span.isRunning()).isFalse();
  }

  @Test
  void verboseSpansWriteBeginAndEnd() {
    try (Span ignored = tracer.span("loud", true)) {
      nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(250));
    }
    tracer.detachedSpan("quiet", false).end();

    ArgumentCaptor<String> messages = ArgumentCaptor.forClass(String.class);
    verify(output, times(2)).write(messages.capture(), eq(Tracer.SPAN_PREFIX));
    assertThat(messages.getAllValues()).containsExactly("(loud) begin", "(loud) end in 0.25 secs.").inOrder();
    verify(output, never()).write(anyString());
  }

  @Test
  void summaryIndentsChildren() {
    Span outer = tracer.span("session", false);
    nanos.addAndGet(TimeUnit.SECONDS.toNanos(1));
    Span inner = tracer.span("connect", false);
    nanos.addAndGet(TimeUnit.SECONDS.toNanos(2));
    inner.end();
    outer.end();

    assertThat(tracer.renderSummary()).isEqualTo(
            "   3.00s session\n"
            + "     2.00s connect");
  }
}
