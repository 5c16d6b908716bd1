package datadog.binding;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.Callable;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Immutable capture of the inheritable bindings visible to an execution unit, used to seed the
 * bindings of another execution unit.
 *
 * <p>A snapshot only references the captured frame chain, so capturing is cheap whatever the
 * number of bindings. It stays valid after the scopes that captured it have exited, or the
 * capturing thread has terminated. Bindings of non-inheritable keys are never visible through a
 * snapshot.
 *
 * <pre>{@code
 * Snapshot snapshot = Snapshot.capture();
 * executor.execute(snapshot.wrap(() -> process(TENANT.get())));
 * }</pre>
 */
@ParametersAreNonnullByDefault
public final class Snapshot {
  private static final Snapshot EMPTY = new Snapshot(BindingFrame.root());

  private final BindingFrame frame;

  private Snapshot(BindingFrame frame) {
    this.frame = frame;
  }

  /**
   * Captures the inheritable bindings of the current execution unit.
   *
   * @return the captured bindings; {@link #empty()} if there are none.
   */
  public static Snapshot capture() {
    return of(StorageProviders.storage().current().inheritable());
  }

  /** Returns the snapshot without bindings. */
  public static Snapshot empty() {
    return EMPTY;
  }

  static Snapshot of(BindingFrame inheritable) {
    return inheritable.isRoot() ? EMPTY : new Snapshot(inheritable);
  }

  public boolean isEmpty() {
    return this.frame.isRoot();
  }

  /** Returns the captured frame chain. */
  public BindingFrame frame() {
    return this.frame;
  }

  /**
   * Gets the value captured for the given key.
   *
   * @throws UnboundKeyException if the key was not bound, or is not inheritable.
   */
  @Nullable
  public <T> T get(BindingKey<T> key) {
    requireNonNull(key, "Binding key cannot be null");
    BindingFrame found = BindingFrame.find(this.frame, key);
    if (found == null) {
      throw new UnboundKeyException(key);
    }
    return found.valueOf(key);
  }

  public boolean isBound(BindingKey<?> key) {
    requireNonNull(key, "Binding key cannot be null");
    return BindingFrame.find(this.frame, key) != null;
  }

  /**
   * Runs the given body with the captured bindings installed on the current execution unit.
   *
   * <p>The bindings current before are not visible to the body, and are restored when it
   * completes, normally or not.
   *
   * @param body the code to run.
   */
  public void run(Runnable body) {
    requireNonNull(body, "Scope body cannot be null");
    ScopeRunner.install(this.frame, body);
  }

  /**
   * Calls the given body with the captured bindings installed on the current execution unit.
   *
   * @see #run(Runnable)
   */
  public <R, X extends Throwable> R call(CallableOp<? extends R, X> body) throws X {
    requireNonNull(body, "Scope body cannot be null");
    return ScopeRunner.install(this.frame, body);
  }

  /** Decorates the given task to run with the captured bindings. */
  public Runnable wrap(Runnable task) {
    requireNonNull(task, "Task cannot be null");
    return () -> run(task);
  }

  /** Decorates the given task to be called with the captured bindings. */
  public <V> Callable<V> wrap(Callable<V> task) {
    requireNonNull(task, "Task cannot be null");
    return () -> this.<V, Exception>call(task::call);
  }

  /** Decorates the given supplier to be called with the captured bindings. */
  public <V> Supplier<V> wrapSupplier(Supplier<V> supplier) {
    requireNonNull(supplier, "Supplier cannot be null");
    return () -> this.<V, RuntimeException>call(supplier::get);
  }

  @Override
  public String toString() {
    return "Snapshot{" + this.frame + '}';
  }
}
