package shepherd.runner;

import org.immutables.value.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkState;

/**
 * A parameter-object describing an external process to be started by a {@link ProcessLauncher}.
 * @see LaunchSpec#of
 * @see LaunchSpec#builder
 */
@Value.Immutable
public abstract class LaunchSpec {
  private static final Pattern SHELL_SAFE = Pattern.compile("[\\w@%+=:,./-]+");

  public static ImmutableLaunchSpec.Builder builder() {
    return ImmutableLaunchSpec.builder();
  }

  public static LaunchSpec of(String... args) {
    return builder().addArgs(args).build();
  }

  public static LaunchSpec of(List<String> args) {
    return builder().addAllArgs(args).build();
  }

  /**
   * Renders the args for humans, single-quoting any that a POSIX shell would split or interpret.
   */
  public static String commandLine(List<String> args) {
    StringJoiner joiner = new StringJoiner(" ");
    for (String arg : args) {
      joiner.add(quote(arg));
    }
    return joiner.toString();
  }

  static String quote(String arg) {
    if (arg.isEmpty()) return "''";
    if (SHELL_SAFE.matcher(arg).matches()) return arg;
    return "'" + arg.replace("'", "'\"'\"'") + "'";
  }

  /**
   * The executable followed by its parameters
   */
  public abstract List<String> args();

  /**
   * Text written to the process stdin (which is then closed). Excludes {@link #stdin}.
   */
  public abstract Optional<String> input();

  /**
   * Working directory for the process (defaults to user.dir, aka CWD, if empty)
   */
  public abstract Optional<Path> workDir();

  /**
   * Additional environment variables for the process
   */
  public abstract Map<String, String> environment();

  /**
   * Whether the process starts from a copy of this JVM's environment before {@link #environment} is applied
   */
  @Value.Default
  public boolean inheritParentEnvironment() {
    return true;
  }

  /**
   * Overrides the stdin source. When absent (and there is no {@link #input}), the process reads an empty stream.
   */
  public abstract Optional<ProcessBuilder.Redirect> stdin();

  /**
   * Overrides the stdout destination; only a piped stdout is pumped to a {@link LineCallback}.
   */
  public abstract Optional<ProcessBuilder.Redirect> stdout();

  public abstract Optional<ProcessBuilder.Redirect> stderr();

  /**
   * Sends stderr through the stdout pipe (and its {@link LineCallback}). Excludes {@link #stderr}.
   */
  @Value.Default
  public boolean mergeErrorIntoOutput() {
    return false;
  }

  public boolean isOutputPiped() {
    return stdout().map(redirect -> redirect.type() == ProcessBuilder.Redirect.Type.PIPE).orElse(true);
  }

  @Value.Lazy
  public String commandLine() {
    return commandLine(args());
  }

  @Value.Check
  protected void check() {
    checkState(!args().isEmpty(), "args must not be empty");
    checkState(input().isEmpty() || stdin().isEmpty(), "stdin must not be redirected when input is supplied: %s", args());
    checkState(!mergeErrorIntoOutput() || stderr().isEmpty(), "stderr must not be redirected when merged into stdout: %s", args());
  }
}
