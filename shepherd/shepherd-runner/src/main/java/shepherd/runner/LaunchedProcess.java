package shepherd.runner;

import shepherd.util.exceptions.UncheckedInterruptedException;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A handle to a process started by a {@link ProcessLauncher}. The caller may wait for or poll it; it cannot be
 * started again.
 */
public class LaunchedProcess {
  private final LaunchSpec spec;
  private final Process process;
  private final CompletableFuture<Void> pumpsFinished;

  public LaunchedProcess(LaunchSpec spec, Process process, CompletableFuture<Void> pumpsFinished) {
    this.spec = spec;
    this.process = process;
    this.pumpsFinished = pumpsFinished;
  }

  public long pid() {
    return process.pid();
  }

  public boolean isAlive() {
    return process.isAlive();
  }

  /**
   * Blocks until the process exits.
   * @return the exit code
   */
  public int waitFor() {
    return UncheckedInterruptedException.propagate(process::waitFor);
  }

  /**
   * The exit code, if the process has exited.
   */
  public Optional<Integer> exitCode() {
    return process.isAlive() ? Optional.empty() : Optional.of(process.exitValue());
  }

  /**
   * Completes once every pumped stream of this process has delivered its end-of-stream.
   */
  public CompletableFuture<Void> pumpsFinished() {
    return pumpsFinished;
  }

  public CompletableFuture<LaunchedProcess> onExit() {
    return process.onExit().thenApply(exited -> this);
  }

  public Process process() {
    return process;
  }

  @Override
  public String toString() {
    return "LaunchedProcess{" + spec.commandLine() + "}";
  }
}
