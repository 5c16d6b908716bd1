package datadog.binding.concurrent;

import static java.util.Objects.requireNonNull;

import datadog.binding.Bindings;
import datadog.binding.Snapshot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.function.Consumer;
import java.util.function.Function;
import javax.annotation.ParametersAreNonnullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parallel iteration where every sub-computation runs with the inheritable bindings of the
 * calling thread.
 *
 * <p>All sub-computations share one capture. The calling thread waits for all of them; when some
 * fail, the first failure in iteration order is rethrown with the others added as suppressed.
 */
@ParametersAreNonnullByDefault
public final class ParallelBindings {
  private static final Logger log = LoggerFactory.getLogger(ParallelBindings.class);

  private ParallelBindings() {}

  /**
   * Applies the given action to every element, in parallel on the given executor.
   *
   * @throws InterruptedException if interrupted while waiting, pending sub-computations are then
   *     cancelled.
   */
  public static <T> void forEach(
      Collection<? extends T> elements, Consumer<? super T> action, Executor executor)
      throws InterruptedException {
    requireNonNull(action, "Action cannot be null");
    ParallelBindings.<T, Object>map(
        elements,
        element -> {
          action.accept(element);
          return null;
        },
        executor);
  }

  /**
   * Maps every element with the given function, in parallel on the given executor.
   *
   * @return the results, in iteration order.
   * @throws InterruptedException if interrupted while waiting, pending sub-computations are then
   *     cancelled.
   * @throws java.util.concurrent.RejectedExecutionException if the executor rejects a
   *     sub-computation, the ones already submitted are then cancelled.
   */
  public static <T, R> List<R> map(
      Collection<? extends T> elements,
      Function<? super T, ? extends R> function,
      Executor executor)
      throws InterruptedException {
    requireNonNull(elements, "Elements cannot be null");
    requireNonNull(function, "Function cannot be null");
    requireNonNull(executor, "Executor cannot be null");
    Snapshot snapshot = Bindings.capture();
    List<FutureTask<R>> tasks = new ArrayList<>(elements.size());
    try {
      for (T element : elements) {
        Callable<R> body = () -> function.apply(element);
        FutureTask<R> task = new FutureTask<>(snapshot.wrap(body));
        tasks.add(task);
        executor.execute(task);
      }
    } catch (RuntimeException | Error e) {
      // the rejected task never ran, the accepted ones must not outlive this call
      cancel(tasks, 0);
      throw e;
    }
    List<R> results = new ArrayList<>(tasks.size());
    Throwable failure = null;
    for (int i = 0; i < tasks.size(); i++) {
      try {
        results.add(tasks.get(i).get());
      } catch (InterruptedException e) {
        cancel(tasks, i);
        throw e;
      } catch (ExecutionException | CancellationException e) {
        Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
        if (failure == null) {
          failure = cause;
        } else {
          failure.addSuppressed(cause);
        }
        results.add(null);
      }
    }
    if (failure != null) {
      throwUnchecked(failure);
    }
    return results;
  }

  private static void cancel(List<? extends FutureTask<?>> tasks, int from) {
    int cancelled = 0;
    for (int i = from; i < tasks.size(); i++) {
      if (tasks.get(i).cancel(true)) {
        cancelled++;
      }
    }
    log.debug("Cancelled {} parallel sub-computations", cancelled);
  }

  private static void throwUnchecked(Throwable failure) {
    if (failure instanceof RuntimeException) {
      throw (RuntimeException) failure;
    }
    if (failure instanceof Error) {
      throw (Error) failure;
    }
    // functions cannot throw checked exceptions, but executors may still report one
    throw new IllegalStateException("Parallel sub-computation failed", failure);
  }
}
