package shepherd.runner;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.shepherdproject.hojack.HojackConfigMapper;
import org.immutables.value.Value;
import shepherd.util.LogLevel;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings for a {@link CommandRunner} session, read from the {@value #CONFIG_PATH} section of the HOCON config
 * (defaults in {@code reference.conf}).
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableRunnerConfig.class)
public interface RunnerConfig {
  String CONFIG_PATH = "shepherd.runner";

  static RunnerConfig load() {
    return load(ConfigFactory.load());
  }

  static RunnerConfig load(Config config) {
    return new HojackConfigMapper().mapSubConfig(config, CONFIG_PATH, RunnerConfig.class);
  }

  static ImmutableRunnerConfig.Builder builder() {
    return ImmutableRunnerConfig.builder();
  }

  /**
   * The kubectl-compatible executable ("kubectl", or "oc" for OpenShift)
   */
  @Value.Default
  default String kubectlExecutable() {
    return "kubectl";
  }

  /**
   * Adds {@code --v=4} to kubectl commands, and echoes captured output to the log
   */
  @Value.Default
  default boolean verbose() {
    return false;
  }

  /**
   * Successful commands slower than this are logged with their duration
   */
  @Value.Default
  default Duration slowCommandThreshold() {
    return Duration.ofSeconds(1);
  }

  @Value.Default
  default String charsetName() {
    return "UTF-8";
  }

  @Value.Default
  default LogLevel outputLogLevel() {
    return LogLevel.Info;
  }

  @Value.Default
  default int logHistoryLines() {
    return 1000;
  }

  /**
   * How long {@link CommandRunner#readLogs} waits for in-flight output before reading
   */
  @Value.Default
  default Duration readLogsSettleDelay() {
    return Duration.ofSeconds(2);
  }

  @Value.Default
  default int spanNameLength() {
    return 80;
  }

  /**
   * Commands launched by {@link CommandRunner#reportEnvironment} to record tool versions
   */
  @Value.Default
  default List<List<String>> environmentProbes() {
    return List.of(
            List.of("kubectl", "version", "--short"),
            List.of("oc", "version"),
            List.of("uname", "-a")
    );
  }

  /**
   * Location of the {@link shepherd.runner.cache.DiskCache}; a leading {@code ~} means the user's home
   */
  @Value.Default
  default String cacheFile() {
    return "~/.cache/shepherd/cache.json";
  }

  @Value.Default
  default Duration cacheTtl() {
    return Duration.ofHours(12);
  }

  default Charset charset() {
    return Charset.forName(charsetName());
  }

  default Path cachePath() {
    String file = cacheFile();
    if (file.equals("~") || file.startsWith("~/")) {
      return Path.of(System.getProperty("user.home"), file.substring(1));
    }
    return Path.of(file);
  }

  @Value.Check
  default void check() {
    if (logHistoryLines() < 1) throw new IllegalStateException("logHistoryLines must be positive");
    if (spanNameLength() < 1) throw new IllegalStateException("spanNameLength must be positive");
  }
}
