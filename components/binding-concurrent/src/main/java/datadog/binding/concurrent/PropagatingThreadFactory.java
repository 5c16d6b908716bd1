package datadog.binding.concurrent;

import static java.util.Objects.requireNonNull;

import datadog.binding.Bindings;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * {@link ThreadFactory} starting each thread with the inheritable bindings of the thread that
 * created it.
 *
 * <p>Thread pools create their workers lazily, from whichever thread submits a task when a worker
 * is missing, and then reuse them for unrelated tasks. Use {@link PropagatingExecutorService} to
 * propagate bindings per task instead.
 */
@ParametersAreNonnullByDefault
public final class PropagatingThreadFactory implements ThreadFactory {
  private final ThreadFactory delegate;

  private PropagatingThreadFactory(ThreadFactory delegate) {
    this.delegate = delegate;
  }

  /** Returns a factory propagating bindings to threads of the JDK default thread factory. */
  public static ThreadFactory defaultFactory() {
    return new PropagatingThreadFactory(Executors.defaultThreadFactory());
  }

  /**
   * Wraps the given thread factory to propagate bindings to the threads it creates.
   *
   * @param threadFactory the thread factory to wrap.
   * @return the propagating factory, {@code threadFactory} itself if it already propagates
   *     bindings.
   */
  public static ThreadFactory wrap(ThreadFactory threadFactory) {
    requireNonNull(threadFactory, "Thread factory cannot be null");
    if (threadFactory instanceof PropagatingThreadFactory) {
      return threadFactory;
    }
    return new PropagatingThreadFactory(threadFactory);
  }

  @Override
  public Thread newThread(Runnable task) {
    requireNonNull(task, "Task cannot be null");
    return this.delegate.newThread(Bindings.capture().wrap(task));
  }
}
