package shepherd.runner;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import shepherd.runner.cache.DiskCache;
import shepherd.runner.output.OutputSink;
import shepherd.runner.output.Slf4jOutputSink;

import javax.inject.Singleton;
import java.time.Clock;

/**
 * Binds a {@link CommandRunner} session: processes are started by {@link JdkProcessLauncher} and logged through
 * {@link Slf4jOutputSink}, configured from the {@value RunnerConfig#CONFIG_PATH} section of the given config.
 */
public class RunnerModule extends AbstractModule {
  private final Config config;

  public RunnerModule() {
    this(ConfigFactory.load());
  }

  public RunnerModule(Config config) {
    this.config = config;
  }

  @Override
  protected void configure() {
    bind(ProcessLauncher.class).to(JdkProcessLauncher.class);
    bind(OutputSink.class).to(Slf4jOutputSink.class);
  }

  @Provides
  @Singleton
  RunnerConfig runnerConfig() {
    return RunnerConfig.load(config);
  }

  @Provides
  @Singleton
  DiskCache diskCache(RunnerConfig runnerConfig) {
    DiskCache cache = DiskCache.load(runnerConfig.cachePath(), Clock.systemUTC());
    cache.invalidate(runnerConfig.cacheTtl());
    return cache;
  }
}
