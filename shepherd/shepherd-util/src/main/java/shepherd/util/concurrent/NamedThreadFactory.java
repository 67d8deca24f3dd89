package shepherd.util.concurrent;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names each thread {@code <prefix>-<n>}, counting per factory instance.
 * @see #daemonize
 */
public class NamedThreadFactory implements ThreadFactory {
  private final String threadNamePrefix;
  private final boolean daemon;
  private final AtomicInteger nameCounter = new AtomicInteger();

  public NamedThreadFactory(String threadNamePrefix) {
    this(threadNamePrefix, false);
  }

  private NamedThreadFactory(String threadNamePrefix, boolean daemon) {
    this.threadNamePrefix = threadNamePrefix;
    this.daemon = daemon;
  }

  /**
   * A factory whose threads will not prevent the JVM from exiting.
   */
  public NamedThreadFactory daemonize() {
    return new NamedThreadFactory(threadNamePrefix, true);
  }

  public Thread newThread(String nameSuffix, Runnable task) {
    Thread thread = new Thread(task, threadNamePrefix + "-" + nameCounter.incrementAndGet() + "-" + nameSuffix);
    thread.setDaemon(daemon);
    return thread;
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread thread = new Thread(task, threadNamePrefix + "-" + nameCounter.incrementAndGet());
    thread.setDaemon(daemon);
    return thread;
  }
}
