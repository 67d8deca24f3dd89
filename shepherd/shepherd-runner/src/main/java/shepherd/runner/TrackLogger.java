package shepherd.runner;

import shepherd.runner.output.OutputSink;

/**
 * Writes each line of a command's output to the {@link OutputSink}, prefixed with the command's
 * {@link Track#paddedId padded track id}.
 */
public class TrackLogger implements LineCallback {
  private final OutputSink sink;
  private final Track track;

  public TrackLogger(OutputSink sink, Track track) {
    this.sink = sink;
    this.track = track;
  }

  @Override
  public void line(String line) {
    sink.write(line, track.paddedId());
  }

  /**
   * Writes a status line: {@code "[<track>] <message>"}.
   */
  public void status(String message) {
    sink.write(track + " " + message);
  }

  public Track track() {
    return track;
  }
}
