package datadog.binding.concurrent;

import static java.util.Objects.requireNonNull;

import datadog.binding.Bindings;
import datadog.binding.Snapshot;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * {@link CompletableFuture} helpers running asynchronous stages with the inheritable bindings of
 * the calling thread.
 *
 * <pre>{@code
 * AsyncBindings.supplyAsync(this::load, executor)
 *     .thenApplyAsync(AsyncBindings.contextual(this::render), executor);
 * }</pre>
 */
@ParametersAreNonnullByDefault
public final class AsyncBindings {
  private AsyncBindings() {}

  public static CompletableFuture<Void> runAsync(Runnable task, Executor executor) {
    requireNonNull(task, "Task cannot be null");
    return CompletableFuture.runAsync(Bindings.capture().wrap(task), executor);
  }

  public static <T> CompletableFuture<T> supplyAsync(Supplier<T> supplier, Executor executor) {
    requireNonNull(supplier, "Supplier cannot be null");
    return CompletableFuture.supplyAsync(Bindings.capture().wrapSupplier(supplier), executor);
  }

  /** Decorates the given function to apply with the bindings captured now. */
  public static <T, R> Function<T, R> contextual(Function<T, R> function) {
    requireNonNull(function, "Function cannot be null");
    Snapshot snapshot = Bindings.capture();
    return value -> snapshot.call(() -> function.apply(value));
  }

  /** Decorates the given consumer to accept with the bindings captured now. */
  public static <T> Consumer<T> contextualConsumer(Consumer<T> consumer) {
    requireNonNull(consumer, "Consumer cannot be null");
    Snapshot snapshot = Bindings.capture();
    return value -> snapshot.run(() -> consumer.accept(value));
  }
}
