package shepherd.runner;

import com.google.common.base.Strings;
import org.junit.jupiter.api.Test;

import java.lang.ProcessBuilder.Redirect;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdkProcessLauncherTest {
  private static final String END = "<end>";

  private final JdkProcessLauncher launcher = new JdkProcessLauncher(StandardCharsets.UTF_8);

  @Test
  void linesArriveInOrderFollowedByOneEndOfStream() throws Exception {
    RecordingCallback stdout = new RecordingCallback();
    LaunchedProcess process = launcher.launch(sh("printf 'a\\nb\\r\\nc'"), stdout, LineCallback.IGNORE);

    process.pumpsFinished().get(10, TimeUnit.SECONDS);

    assertThat(stdout.events()).containsExactly("a", "b", "c", END).inOrder();
    assertThat(process.waitFor()).isEqualTo(0);
  }

  @Test
  void completionFollowsBothEndsOfStream() throws Exception {
    RecordingCallback stdout = new RecordingCallback();
    RecordingCallback stderr = new RecordingCallback();
    AtomicInteger completions = new AtomicInteger();
    CompletableFuture<List<List<String>>> observedAtCompletion = new CompletableFuture<>();

    launcher.launch(sh("echo out; echo err >&2; sleep 0.2; echo late >&2"), stdout, stderr, Optional.of(process -> {
      completions.incrementAndGet();
      observedAtCompletion.complete(List.of(stdout.events(), stderr.events()));
    }));

    List<List<String>> observed = observedAtCompletion.get(10, TimeUnit.SECONDS);
    assertThat(observed.get(0)).containsExactly("out", END).inOrder();
    assertThat(observed.get(1)).containsExactly("err", "late", END).inOrder();

    Thread.sleep(200);
    assertThat(completions.get()).isEqualTo(1);
  }

  @Test
  void stdinIsEmptyWithoutInput() throws Exception {
    RecordingCallback stdout = new RecordingCallback();
    LaunchedProcess process = launcher.launch(LaunchSpec.of("cat"), stdout, LineCallback.IGNORE);

    assertThat(process.process().waitFor(10, TimeUnit.SECONDS)).isTrue();
    process.pumpsFinished().get(10, TimeUnit.SECONDS);
    assertThat(stdout.events()).containsExactly(END);
  }

  @Test
  void inputIsWrittenAndClosed() throws Exception {
    RecordingCallback stdout = new RecordingCallback();
    LaunchSpec spec = LaunchSpec.builder().addArgs("cat").input("hello\nworld").build();
    LaunchedProcess process = launcher.launch(spec, stdout, LineCallback.IGNORE);

    process.pumpsFinished().get(10, TimeUnit.SECONDS);
    assertThat(stdout.events()).containsExactly("hello", "world", END).inOrder();
    assertThat(process.waitFor()).isEqualTo(0);
  }

  @Test
  void missingExecutableFailsToSpawn() {
    SpawnFailedException e = assertThrows(SpawnFailedException.class,
            () -> launcher.launch(LaunchSpec.of("/definitely/not/a/binary", "--flag"), LineCallback.IGNORE, LineCallback.IGNORE));
    assertThat(e.args()).containsExactly("/definitely/not/a/binary", "--flag").inOrder();
    assertThat(e).hasMessageThat().startsWith("Failed to start '/definitely/not/a/binary --flag'");
  }

  @Test
  void completionWithoutPipedStreamsFiresOnExit() throws Exception {
    LaunchSpec spec = LaunchSpec.builder()
            .addArgs("sh", "-c", "exit 4")
            .stdout(Redirect.DISCARD)
            .stderr(Redirect.DISCARD)
            .build();
    CompletableFuture<Optional<Integer>> exitCode = new CompletableFuture<>();

    LaunchedProcess process = launcher.launch(spec, LineCallback.IGNORE, LineCallback.IGNORE,
            Optional.of(p -> exitCode.complete(p.exitCode())));

    assertThat(exitCode.get(10, TimeUnit.SECONDS)).hasValue(4);
    assertThat(process.pumpsFinished().isDone()).isTrue();
  }

  @Test
  void mergedStderrArrivesOnStdout() throws Exception {
    RecordingCallback stdout = new RecordingCallback();
    RecordingCallback stderr = new RecordingCallback();
    LaunchSpec spec = LaunchSpec.builder()
            .addArgs("sh", "-c", "echo out; sleep 0.1; echo err >&2")
            .mergeErrorIntoOutput(true)
            .build();

    launcher.launch(spec, stdout, stderr).pumpsFinished().get(10, TimeUnit.SECONDS);

    assertThat(stdout.events()).containsExactly("out", "err", END).inOrder();
    assertThat(stderr.events()).isEmpty();
  }

  @Test
  void failingCallbackDoesNotDisturbEitherPump() throws Exception {
    RecordingCallback stdout = new RecordingCallback() {
      @Override
      public void line(String line) {
        if (line.equals("b")) throw new IllegalStateException("rejected " + line);
        super.line(line);
      }
    };
    RecordingCallback stderr = new RecordingCallback();

    launcher.launch(sh("printf 'a\\nb\\nc\\n'; echo e >&2"), stdout, stderr).pumpsFinished().get(10, TimeUnit.SECONDS);

    assertThat(stdout.events()).containsExactly("a", "c", END).inOrder();
    assertThat(stderr.events()).containsExactly("e", END).inOrder();
  }

  @Test
  void environmentAndWorkDirAreApplied() throws Exception {
    RecordingCallback stdout = new RecordingCallback();
    LaunchSpec spec = LaunchSpec.builder()
            .addArgs("sh", "-c", "echo $SHEPHERD_GREETING; pwd")
            .putEnvironment("SHEPHERD_GREETING", "hi")
            .workDir(java.nio.file.Path.of("/"))
            .build();

    launcher.launch(spec, stdout, LineCallback.IGNORE).pumpsFinished().get(10, TimeUnit.SECONDS);

    assertThat(stdout.events()).containsExactly("hi", "/", END).inOrder();
  }

  @Test
  void inputUnreadByAnExitingProcessIsDropped() throws Exception {
    RecordingCallback stdout = new RecordingCallback();
    LaunchSpec spec = LaunchSpec.builder()
            .addArgs("sh", "-c", "exit 3")
            .input(Strings.repeat("x", 1 << 20))
            .build();

    LaunchedProcess process = launcher.launch(spec, stdout, LineCallback.IGNORE);

    assertThat(process.waitFor()).isEqualTo(3);
    process.pumpsFinished().get(10, TimeUnit.SECONDS);
    assertThat(stdout.events()).containsExactly(END);
  }

  private static LaunchSpec sh(String script) {
    return LaunchSpec.of("sh", "-c", script);
  }

  static class RecordingCallback implements LineCallback {
    private final List<String> events = new ArrayList<>();

    @Override
    public synchronized void line(String line) {
      events.add(line);
    }

    @Override
    public synchronized void endOfStream() {
      events.add(END);
    }

    synchronized List<String> events() {
      return List.copyOf(events);
    }
  }
}
