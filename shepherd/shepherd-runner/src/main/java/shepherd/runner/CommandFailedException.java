package shepherd.runner;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * The process exited with a non-zero status. When raised from a captured execution, carries the stdout text gathered
 * before the failure.
 * @see CommandRunner#checkCall
 * @see CommandRunner#getOutput
 */
public class CommandFailedException extends IllegalStateException {
  private final ImmutableList<String> args;
  private final int exitCode;
  private final Optional<String> output;

  public CommandFailedException(List<String> args, int exitCode) {
    this(args, exitCode, Optional.empty());
  }

  public CommandFailedException(List<String> args, int exitCode, Optional<String> output) {
    super(describe(args, exitCode, output));
    this.args = ImmutableList.copyOf(args);
    this.exitCode = exitCode;
    this.output = output;
  }

  private static String describe(List<String> args, int exitCode, Optional<String> output) {
    String description = String.format("Command returned exit-code %d: '%s'", exitCode, LaunchSpec.commandLine(args));
    return output.map(text -> description + "\nSTDOUT:\n" + text).orElse(description);
  }

  public List<String> args() {
    return args;
  }

  public int exitCode() {
    return exitCode;
  }

  public Optional<String> output() {
    return output;
  }

  public CommandFailedException withOutput(String capturedOutput) {
    CommandFailedException withOutput = new CommandFailedException(args, exitCode, Optional.of(capturedOutput));
    withOutput.setStackTrace(getStackTrace());
    return withOutput;
  }
}
