package shepherd.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shepherd.util.concurrent.NamedThreadFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Starts processes with {@link ProcessBuilder}, pumping each piped output stream on its own daemon thread.
 * <p/>
 * The completion callback runs on a separate watcher thread once all pumps have finished. If no stream is piped,
 * it runs once the process exits instead.
 */
@Singleton
public class JdkProcessLauncher implements ProcessLauncher {
  private static final Logger LOG = LoggerFactory.getLogger(JdkProcessLauncher.class);
  private static final NamedThreadFactory WATCHER_THREADS = new NamedThreadFactory("shepherd-watcher").daemonize();

  private final Charset charset;

  @Inject
  public JdkProcessLauncher(RunnerConfig config) {
    this(config.charset());
  }

  public JdkProcessLauncher(Charset charset) {
    this.charset = charset;
  }

  @Override
  public LaunchedProcess launch(
          LaunchSpec spec,
          LineCallback stdout,
          LineCallback stderr,
          Optional<Consumer<LaunchedProcess>> onComplete
  ) throws SpawnFailedException {
    ProcessBuilder builder = new ProcessBuilder(spec.args());
    spec.workDir().ifPresent(dir -> builder.directory(dir.toFile()));
    if (!spec.inheritParentEnvironment()) builder.environment().clear();
    builder.environment().putAll(spec.environment());

    builder.redirectInput(spec.stdin().orElse(ProcessBuilder.Redirect.PIPE));
    builder.redirectOutput(spec.stdout().orElse(ProcessBuilder.Redirect.PIPE));
    if (spec.mergeErrorIntoOutput()) {
      builder.redirectErrorStream(true);
    } else {
      builder.redirectError(spec.stderr().orElse(ProcessBuilder.Redirect.PIPE));
    }

    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new SpawnFailedException(spec.args(), e);
    }

    List<StreamPump> pumps = new ArrayList<>(2);
    if (isPiped(builder.redirectOutput())) {
      pumps.add(new StreamPump(process.pid() + "-stdout", process.getInputStream(), charset, stdout).start());
    }
    if (!builder.redirectErrorStream() && isPiped(builder.redirectError())) {
      pumps.add(new StreamPump(process.pid() + "-stderr", process.getErrorStream(), charset, stderr).start());
    }

    CompletableFuture<Void> pumpsFinished = CompletableFuture.allOf(pumps.stream()
            .map(StreamPump::finished)
            .toArray(CompletableFuture[]::new));
    LaunchedProcess handle = new LaunchedProcess(spec, process, pumpsFinished);

    onComplete.ifPresent(callback -> {
      CompletableFuture<?> trigger = pumps.isEmpty() ? process.onExit() : pumpsFinished;
      Executor watcher = task -> WATCHER_THREADS.newThread(Long.toString(process.pid()), task).start();
      trigger.thenRunAsync(() -> notifyComplete(handle, callback), watcher);
    });

    // an explicitly piped stdin is left open for the caller to write
    if (spec.stdin().isEmpty()) feedInput(spec, process);
    return handle;
  }

  private void feedInput(LaunchSpec spec, Process process) {
    try (OutputStream stdin = process.getOutputStream()) {
      if (spec.input().isPresent()) {
        stdin.write(spec.input().get().getBytes(charset));
      }
    } catch (IOException e) {
      // the child exited or closed stdin; its exit-code reports the outcome
      LOG.debug("Process {} stopped reading its input", process.pid(), e);
    }
  }

  private static void notifyComplete(LaunchedProcess handle, Consumer<LaunchedProcess> callback) {
    try {
      callback.accept(handle);
    } catch (RuntimeException e) {
      LOG.warn("Completion callback failed for {}", handle, e);
    }
  }

  private static boolean isPiped(ProcessBuilder.Redirect redirect) {
    return redirect.type() == ProcessBuilder.Redirect.Type.PIPE;
  }
}
