package shepherd.runner;

import shepherd.runner.output.OutputSink;
import shepherd.util.exceptions.UncheckedInterruptedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An {@link OutputSink} which remembers every write, for assertions.
 * @see #awaitEntry
 */
public class RecordingOutputSink implements OutputSink {
  private final List<Entry> entries = new ArrayList<>();

  @Override
  public synchronized void write(String message, String prefix) {
    entries.add(new Entry(prefix, message));
    notifyAll();
  }

  @Override
  public synchronized String readRecent() {
    return entries.stream().map(Entry::toString).collect(Collectors.joining("\n"));
  }

  public synchronized List<String> messages() {
    return entries.stream().map(Entry::message).collect(Collectors.toList());
  }

  /**
   * The messages written with the given prefix (eg, a {@link Track#paddedId})
   */
  public synchronized List<String> messagesWithPrefix(String prefix) {
    return entries.stream()
            .filter(entry -> entry.prefix().equals(prefix))
            .map(Entry::message)
            .collect(Collectors.toList());
  }

  public synchronized Optional<Entry> findEntry(Predicate<Entry> predicate) {
    return entries.stream().filter(predicate).findFirst();
  }

  /**
   * Blocks until an entry matching the predicate has been written, or the timeout elapses.
   */
  public synchronized Optional<Entry> awaitEntry(Predicate<Entry> predicate, Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    Optional<Entry> found = findEntry(predicate);
    while (found.isEmpty()) {
      long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
      if (remainingMillis <= 0) break;
      try {
        wait(remainingMillis);
      } catch (InterruptedException e) {
        throw UncheckedInterruptedException.propagate(e);
      }
      found = findEntry(predicate);
    }
    return found;
  }

  public Optional<Entry> awaitMessage(String prefix, String message, Duration timeout) {
    return awaitEntry(entry -> entry.prefix().equals(prefix) && entry.message().equals(message), timeout);
  }

  public synchronized void clear() {
    entries.clear();
  }

  public record Entry(String prefix, String message) {
    @Override
    public String toString() {
      return prefix + " | " + message;
    }
  }
}
