package shepherd.runner;

import com.google.common.collect.ImmutableList;

import javax.inject.Inject;
import java.util.List;

/**
 * Assembles kubectl argument vectors:
 * {@code [tool, ("--v=4" if verbose), "--context", context, "--namespace", namespace, *args]}.
 */
public class KubectlCommand {
  private final String executable;
  private final boolean verbose;

  @Inject
  public KubectlCommand(RunnerConfig config) {
    this(config.kubectlExecutable(), config.verbose());
  }

  public KubectlCommand(String executable, boolean verbose) {
    this.executable = executable;
    this.verbose = verbose;
  }

  public List<String> build(String context, String namespace, List<String> args) {
    ImmutableList.Builder<String> command = ImmutableList.<String>builder().add(executable);
    if (verbose) command.add("--v=4");
    return command.add("--context", context)
            .add("--namespace", namespace)
            .addAll(args)
            .build();
  }
}
