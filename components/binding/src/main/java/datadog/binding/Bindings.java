package datadog.binding;

import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Entry points of the binding mechanism.
 *
 * <p>Values are bound to {@link BindingKey}s for the dynamic extent of a scope:
 *
 * <pre>{@code
 * Bindings.where(TENANT, "acme").with(USER, user).run(() -> {
 *   // TENANT and USER are bound here and in every method called from here
 *   Snapshot snapshot = Bindings.capture();
 *   executor.execute(snapshot.wrap(this::audit)); // TENANT only, if USER is not inheritable
 * });
 * // TENANT and USER are restored to their previous bindings here
 * }</pre>
 */
@ParametersAreNonnullByDefault
public final class Bindings {
  private Bindings() {}

  /**
   * Creates a carrier with a single pending binding.
   *
   * @throws TypeMismatchException if the value is not assignable to the key declared type.
   */
  public static <T> Carrier where(BindingKey<T> key, @Nullable T value) {
    return Carrier.empty().with(key, value);
  }

  /**
   * Resolves the given key on the current execution unit.
   *
   * @throws UnboundKeyException if no enclosing scope binds the key.
   */
  @Nullable
  public static <T> T get(BindingKey<T> key) {
    requireNonNull(key, "Binding key cannot be null");
    return key.get();
  }

  /** Resolves the given key on the current execution unit, using a default if not bound. */
  @Nullable
  public static <T> T getOrDefault(BindingKey<T> key, @Nullable T defaultValue) {
    requireNonNull(key, "Binding key cannot be null");
    return key.orElse(defaultValue);
  }

  public static boolean isBound(BindingKey<?> key) {
    requireNonNull(key, "Binding key cannot be null");
    return key.isBound();
  }

  /** Returns the frame of the current execution unit. */
  public static BindingFrame currentFrame() {
    return StorageProviders.storage().current();
  }

  /** Captures the inheritable bindings of the current execution unit. */
  public static Snapshot capture() {
    return Snapshot.capture();
  }

  /** Saves all the bindings of the current execution unit. */
  public static Continuation suspend() {
    return Continuation.suspend();
  }

  /** Runs the given body with the snapshot bindings installed on the current execution unit. */
  public static void runWith(Snapshot snapshot, Runnable body) {
    requireNonNull(snapshot, "Snapshot cannot be null");
    snapshot.run(body);
  }

  /** Calls the given body with the snapshot bindings installed on the current execution unit. */
  public static <R, X extends Throwable> R callWith(
      Snapshot snapshot, CallableOp<? extends R, X> body) throws X {
    requireNonNull(snapshot, "Snapshot cannot be null");
    return snapshot.call(body);
  }
}
