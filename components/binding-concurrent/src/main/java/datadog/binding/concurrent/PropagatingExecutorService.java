package datadog.binding.concurrent;

import static java.util.Objects.requireNonNull;

import datadog.binding.Bindings;
import datadog.binding.Snapshot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * {@link ExecutorService} running each task with the inheritable bindings of the thread that
 * submitted it.
 *
 * <p>Tasks submitted together by {@code invokeAll} or {@code invokeAny} share a single capture.
 * Lifecycle methods are delegated as-is.
 */
@ParametersAreNonnullByDefault
public final class PropagatingExecutorService implements ExecutorService {
  private final ExecutorService delegate;

  private PropagatingExecutorService(ExecutorService delegate) {
    this.delegate = delegate;
  }

  /**
   * Wraps the given executor service to propagate bindings to its tasks.
   *
   * @param executorService the executor service to wrap.
   * @return the propagating executor service, {@code executorService} itself if it already
   *     propagates bindings.
   */
  public static ExecutorService wrap(ExecutorService executorService) {
    requireNonNull(executorService, "Executor service cannot be null");
    if (executorService instanceof PropagatingExecutorService) {
      return executorService;
    }
    return new PropagatingExecutorService(executorService);
  }

  @Override
  public void execute(Runnable command) {
    requireNonNull(command, "Task cannot be null");
    this.delegate.execute(Bindings.capture().wrap(command));
  }

  @Override
  public <T> Future<T> submit(Callable<T> task) {
    requireNonNull(task, "Task cannot be null");
    return this.delegate.submit(Bindings.capture().wrap(task));
  }

  @Override
  public <T> Future<T> submit(Runnable task, T result) {
    requireNonNull(task, "Task cannot be null");
    return this.delegate.submit(Bindings.capture().wrap(task), result);
  }

  @Override
  public Future<?> submit(Runnable task) {
    requireNonNull(task, "Task cannot be null");
    return this.delegate.submit(Bindings.capture().wrap(task));
  }

  @Override
  public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks)
      throws InterruptedException {
    return this.delegate.invokeAll(wrapAll(tasks));
  }

  @Override
  public <T> List<Future<T>> invokeAll(
      Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
      throws InterruptedException {
    return this.delegate.invokeAll(wrapAll(tasks), timeout, unit);
  }

  @Override
  public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
      throws InterruptedException, ExecutionException {
    return this.delegate.invokeAny(wrapAll(tasks));
  }

  @Override
  public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
      throws InterruptedException, ExecutionException, TimeoutException {
    return this.delegate.invokeAny(wrapAll(tasks), timeout, unit);
  }

  private static <T> List<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
    requireNonNull(tasks, "Tasks cannot be null");
    Snapshot snapshot = Bindings.capture();
    List<Callable<T>> wrapped = new ArrayList<>(tasks.size());
    for (Callable<T> task : tasks) {
      requireNonNull(task, "Task cannot be null");
      wrapped.add(snapshot.wrap(task));
    }
    return wrapped;
  }

  @Override
  public void shutdown() {
    this.delegate.shutdown();
  }

  @Override
  public List<Runnable> shutdownNow() {
    return this.delegate.shutdownNow();
  }

  @Override
  public boolean isShutdown() {
    return this.delegate.isShutdown();
  }

  @Override
  public boolean isTerminated() {
    return this.delegate.isTerminated();
  }

  @Override
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return this.delegate.awaitTermination(timeout, unit);
  }

  @Override
  public String toString() {
    return "PropagatingExecutorService{" + this.delegate + '}';
  }
}
