package shepherd.runner;

import javax.inject.Singleton;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Issues strictly increasing {@link Track Tracks}, starting at 1, to concurrent callers without gaps or repeats.
 */
@Singleton
public class TrackSequencer {
  private final AtomicInteger counter = new AtomicInteger();

  public Track next() {
    return new Track(counter.incrementAndGet());
  }

  /**
   * The most recently issued id (0 if none has been issued).
   */
  public int current() {
    return counter.get();
  }
}
