package shepherd.runner;

import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.util.List;

/**
 * The process could not be started (eg, missing executable or permission denied). Never retried.
 */
public class SpawnFailedException extends RuntimeException {
  private final ImmutableList<String> args;

  public SpawnFailedException(List<String> args, IOException cause) {
    super("Failed to start '" + LaunchSpec.commandLine(args) + "': " + cause.getMessage(), cause);
    this.args = ImmutableList.copyOf(args);
  }

  public List<String> args() {
    return args;
  }
}
