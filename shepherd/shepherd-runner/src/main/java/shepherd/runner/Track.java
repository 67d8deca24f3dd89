package shepherd.runner;

import shepherd.util.strings.MoreStrings;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Correlates the log lines of one command invocation. Issued by {@link TrackSequencer}.
 */
public final class Track {
  private final int id;

  Track(int id) {
    checkArgument(id > 0, "track ids are positive", id);
    this.id = id;
  }

  public int id() {
    return id;
  }

  /**
   * The zero-padded rendering which prefixes each line of process output (eg, {@code "007"}).
   */
  public String paddedId() {
    return MoreStrings.padLeft(Integer.toString(id), 3, '0');
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Track other && other.id == id;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(id);
  }

  /**
   * The rendering which prefixes status lines (eg, {@code "[7]"}).
   */
  @Override
  public String toString() {
    return "[" + id + "]";
  }
}
