package shepherd.runner;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shepherd.runner.cache.DiskCache;
import shepherd.runner.output.OutputSink;
import shepherd.runner.trace.Span;
import shepherd.runner.trace.Tracer;
import shepherd.util.concurrent.Threads;
import shepherd.util.strings.MoreStrings;

import javax.inject.Inject;
import javax.inject.Provider;
import javax.inject.Singleton;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Runs external commands for a session, logging their output to the session {@link OutputSink} under a per-command
 * {@link Track}. Three modes are offered:
 * <ul>
 *   <li>{@link #checkCall}: waits for the process, throwing {@link CommandFailedException} on a non-zero exit-code</li>
 *   <li>{@link #getOutput}: as {@link #checkCall}, and returns the (trimmed) stdout text</li>
 *   <li>{@link #popen}: returns immediately; the exit-code is logged once the process output ends</li>
 * </ul>
 * Every mode throws {@link SpawnFailedException} if the process cannot be started.
 */
@Singleton
public class CommandRunner {
  private static final Logger LOG = LoggerFactory.getLogger(CommandRunner.class);

  private final ProcessLauncher launcher;
  private final OutputSink output;
  private final Tracer tracer;
  private final TrackSequencer tracks;
  private final RunnerConfig config;
  private final KubectlCommand kubectl;
  private final Provider<DiskCache> cache;
  private volatile boolean succeeded = false;

  @Inject
  public CommandRunner(
          ProcessLauncher launcher,
          OutputSink output,
          Tracer tracer,
          TrackSequencer tracks,
          RunnerConfig config,
          KubectlCommand kubectl,
          Provider<DiskCache> cache
  ) {
    this.launcher = launcher;
    this.output = output;
    this.tracer = tracer;
    this.tracks = tracks;
    this.config = config;
    this.kubectl = kubectl;
    this.cache = cache;
  }

  public void checkCall(String... args) {
    checkCall(LaunchSpec.of(args));
  }

  public void checkCall(List<String> args) {
    checkCall(LaunchSpec.of(args));
  }

  /**
   * Runs the command to completion, logging stdout and stderr.
   * @throws CommandFailedException if the exit-code is non-zero
   */
  public void checkCall(LaunchSpec spec) {
    TrackLogger logger = new TrackLogger(output, tracks.next());
    runCommand(logger, "Running", "ran", logger, logger, spec);
  }

  public String getOutput(List<String> args) {
    return getOutput(LaunchSpec.of(args), false);
  }

  public String getOutput(LaunchSpec spec) {
    return getOutput(spec, false);
  }

  /**
   * Runs the command to completion, capturing stdout and logging stderr.
   *
   * @param reveal also log the captured stdout (always done in verbose mode)
   * @return the captured stdout lines, joined with newlines and trimmed
   * @throws CommandFailedException if the exit-code is non-zero, carrying the captured stdout
   */
  public String getOutput(LaunchSpec spec, boolean reveal) {
    checkArgument(spec.isOutputPiped(), "Captured commands must not redirect stdout: %s", spec.commandLine());
    TrackLogger logger = new TrackLogger(output, tracks.next());
    CaptureBuffer capture = new CaptureBuffer();
    LineCallback stdout = reveal || config.verbose() ? capture.andThen(logger) : capture;

    CommandFailedException failure = null;
    try {
      runCommand(logger, "Capturing", "captured", stdout, logger, spec);
    } catch (CommandFailedException e) {
      failure = e;
    }

    // the process may exit before its final lines have been pumped
    String captured = capture.awaitText();
    if (failure != null) throw failure.withOutput(captured);
    return captured;
  }

  @CanIgnoreReturnValue
  public LaunchedProcess popen(String... args) {
    return popen(LaunchSpec.of(args));
  }

  @CanIgnoreReturnValue
  public LaunchedProcess popen(List<String> args) {
    return popen(LaunchSpec.of(args));
  }

  /**
   * Starts the command and returns without waiting. Output is logged as it arrives; the exit-code is logged when
   * both output streams have ended, if the process has exited by then.
   */
  @CanIgnoreReturnValue
  public LaunchedProcess popen(LaunchSpec spec) {
    TrackLogger logger = new TrackLogger(output, tracks.next());
    logger.status("Launching: " + spec.commandLine());
    Span span = commandSpan(logger.track(), spec);
    Consumer<LaunchedProcess> onComplete = process -> {
      span.close();
      process.exitCode().ifPresent(exitCode -> logger.status("exit " + exitCode));
    };
    return launch(logger, span, spec, logger, logger, Optional.of(onComplete));
  }

  public List<String> kubectl(String context, String namespace, List<String> args) {
    return kubectl.build(context, namespace, args);
  }

  public String getKubectl(String context, String namespace, List<String> args) {
    return getOutput(kubectl(context, namespace, args));
  }

  /**
   * Captures kubectl output, optionally with stderr interleaved into the returned text.
   */
  public String getKubectl(String context, String namespace, List<String> args, boolean mergeErrorIntoOutput) {
    return getOutput(LaunchSpec.builder()
            .addAllArgs(kubectl(context, namespace, args))
            .mergeErrorIntoOutput(mergeErrorIntoOutput)
            .build());
  }

  public void checkKubectl(String context, String namespace, List<String> args) {
    checkCall(kubectl(context, namespace, args));
  }

  /**
   * Launches each configured probe command (tool versions and the like), skipping tools that are not installed.
   */
  public void reportEnvironment() {
    for (List<String> probe : config.environmentProbes()) {
      try {
        popen(probe);
      } catch (SpawnFailedException e) {
        LOG.debug("Environment probe unavailable: {}", probe, e);
      }
    }
    output.write("Java " + Runtime.version());
  }

  /**
   * Opens a verbose span under the current thread's span; use with try-with-resources.
   */
  public Span span(String name) {
    return tracer.span(name, true);
  }

  public void write(String message) {
    output.write(message);
  }

  /**
   * Waits for in-flight output to land, then returns the end of the session log.
   */
  public String readLogs() {
    Threads.sleep(config.readLogsSettleDelay());
    return output.readRecent();
  }

  public void setSuccess(boolean success) {
    succeeded = success;
    if (success) output.write("Success. Starting cleanup.");
  }

  /**
   * Writes the span timing tree to the log, if the session was marked successful.
   */
  public void writeSummary() {
    if (!succeeded) return;
    for (String line : tracer.renderSummary().split("\n")) {
      output.write(line, "SUM");
    }
  }

  public DiskCache cache() {
    return cache.get();
  }

  public RunnerConfig config() {
    return config;
  }

  private void runCommand(
          TrackLogger logger,
          String startVerb,
          String doneVerb,
          LineCallback stdout,
          LineCallback stderr,
          LaunchSpec spec
  ) {
    logger.status(startVerb + ": " + spec.commandLine());
    Span span = commandSpan(logger.track(), spec);
    LaunchedProcess process = launch(logger, span, spec, stdout, stderr, Optional.empty());
    int exitCode;
    try {
      exitCode = process.waitFor();
    } finally {
      span.close();
    }
    double spent = span.elapsedSeconds();
    if (exitCode != 0) {
      logger.status(String.format(Locale.ROOT, "exit %d in %.2f secs.", exitCode, spent));
      throw new CommandFailedException(spec.args(), exitCode);
    }
    if (spent > config.slowCommandThreshold().toNanos() / 1e9) {
      logger.status(String.format(Locale.ROOT, "%s in %.2f secs.", doneVerb, spent));
    }
  }

  private LaunchedProcess launch(
          TrackLogger logger,
          Span span,
          LaunchSpec spec,
          LineCallback stdout,
          LineCallback stderr,
          Optional<Consumer<LaunchedProcess>> onComplete
  ) {
    try {
      return launcher.launch(spec, stdout, stderr, onComplete);
    } catch (SpawnFailedException e) {
      span.close();
      logger.status(e.getMessage());
      throw e;
    }
  }

  private Span commandSpan(Track track, LaunchSpec spec) {
    return tracer.detachedSpan(MoreStrings.clip(track.id() + " " + spec.commandLine(), config.spanNameLength()), false);
  }
}
