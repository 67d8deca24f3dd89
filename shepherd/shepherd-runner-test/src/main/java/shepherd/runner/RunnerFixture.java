package shepherd.runner;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import shepherd.runner.output.OutputSink;
import shepherd.runner.trace.Tracer;

import java.nio.file.Path;
import java.util.Map;

/**
 * A {@link CommandRunner} which starts real processes but records its session log in a {@link RecordingOutputSink}.
 * @see RunnerExtension
 */
public class RunnerFixture {
  private final RecordingOutputSink output = new RecordingOutputSink();
  private final Injector injector;

  public RunnerFixture(Config config) {
    injector = Guice.createInjector(Modules.override(new RunnerModule(config))
            .with(binder -> binder.bind(OutputSink.class).toInstance(output)));
  }

  /**
   * A fixture with the default configuration, except that the disk cache lives under the given directory.
   */
  public static RunnerFixture withCacheDir(Path cacheDir) {
    return withOverrides(cacheDir, ConfigFactory.empty());
  }

  public static RunnerFixture withOverrides(Path cacheDir, Config overrides) {
    Config config = overrides
            .withFallback(ConfigFactory.parseMap(Map.of(
                    RunnerConfig.CONFIG_PATH + ".cacheFile", cacheDir.resolve("cache.json").toString())))
            .withFallback(ConfigFactory.load());
    return new RunnerFixture(config);
  }

  public CommandRunner runner() {
    return injector.getInstance(CommandRunner.class);
  }

  public RecordingOutputSink output() {
    return output;
  }

  public Tracer tracer() {
    return injector.getInstance(Tracer.class);
  }

  public TrackSequencer tracks() {
    return injector.getInstance(TrackSequencer.class);
  }

  public RunnerConfig config() {
    return injector.getInstance(RunnerConfig.class);
  }
}
