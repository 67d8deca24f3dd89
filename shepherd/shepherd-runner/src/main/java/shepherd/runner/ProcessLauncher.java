package shepherd.runner;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * A mechanism for starting external processes, to support mocking them in tests.
 * @see JdkProcessLauncher
 */
public interface ProcessLauncher {
  /**
   * Starts the process and returns immediately, without waiting for it to exit.
   *
   * @param stdout receives the lines of stdout, if it is piped
   * @param stderr receives the lines of stderr, if it is piped (and not merged into stdout)
   * @param onComplete invoked once, after every pumped stream has reached its end
   * @throws SpawnFailedException if the process could not be started
   */
  LaunchedProcess launch(
          LaunchSpec spec,
          LineCallback stdout,
          LineCallback stderr,
          Optional<Consumer<LaunchedProcess>> onComplete
  ) throws SpawnFailedException;

  default LaunchedProcess launch(LaunchSpec spec, LineCallback stdout, LineCallback stderr) {
    return launch(spec, stdout, stderr, Optional.empty());
  }
}
