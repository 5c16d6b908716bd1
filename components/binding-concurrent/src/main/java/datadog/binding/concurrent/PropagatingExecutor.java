package datadog.binding.concurrent;

import static java.util.Objects.requireNonNull;

import datadog.binding.Bindings;
import java.util.concurrent.Executor;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * {@link Executor} running each task with the inheritable bindings of the thread that submitted
 * it.
 *
 * <p>Bindings are captured when {@link #execute(Runnable)} is called, not when the task starts.
 */
@ParametersAreNonnullByDefault
public final class PropagatingExecutor implements Executor {
  private final Executor delegate;

  private PropagatingExecutor(Executor delegate) {
    this.delegate = delegate;
  }

  /**
   * Wraps the given executor to propagate bindings to its tasks.
   *
   * @param executor the executor to wrap.
   * @return the propagating executor, {@code executor} itself if it already propagates bindings.
   */
  public static Executor wrap(Executor executor) {
    requireNonNull(executor, "Executor cannot be null");
    if (executor instanceof PropagatingExecutor || executor instanceof PropagatingExecutorService) {
      return executor;
    }
    return new PropagatingExecutor(executor);
  }

  @Override
  public void execute(Runnable command) {
    requireNonNull(command, "Task cannot be null");
    this.delegate.execute(Bindings.capture().wrap(command));
  }

  @Override
  public String toString() {
    return "PropagatingExecutor{" + this.delegate + '}';
  }
}
