package datadog.binding;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Dynamically scoped variable that maps to a value of type {@link T}.
 *
 * <p>A key is bound to a value for the dynamic extent of a {@link Carrier#run(Runnable)} or
 * {@link Carrier#call(CallableOp)} invocation, and resolved from the current execution unit with
 * {@link #get()}, {@link #orElse(Object)} or {@link #isBound()}:
 *
 * <pre>{@code
 * static final BindingKey<String> TENANT = BindingKey.inheritable(String.class);
 *
 * Bindings.where(TENANT, "acme").run(() -> handle(request));
 * ...
 * String tenant = TENANT.get();
 * }</pre>
 *
 * <p>Keys are compared by identity rather than by name or type. Two keys declared with the same
 * name and type are distinct, so access to a binding is controlled by access to the key reference
 * itself.
 *
 * <p>Only bindings of inheritable keys are captured by {@link Snapshot}s and propagate to other
 * execution units.
 */
@ParametersAreNonnullByDefault
public final class BindingKey<T> {
  private static final AtomicInteger NEXT_INDEX = new AtomicInteger(0);

  /** The key name, for debugging purpose only. */
  private final String name;

  private final Class<T> type;
  private final boolean inheritable;

  /** The key unique index, used for hashing and naming only. */
  final int index;

  private BindingKey(@Nullable String name, Class<T> type, boolean inheritable) {
    this.type = type;
    this.inheritable = inheritable;
    this.index = NEXT_INDEX.getAndIncrement();
    this.name = name != null ? name : "key-" + this.index;
  }

  /**
   * Declares a new key.
   *
   * @param type the declared value type, primitive types are replaced by their wrapper.
   * @param inheritable whether bindings of this key are captured by snapshots.
   * @param <T> the type of the value.
   * @return the newly created unique key.
   */
  public static <T> BindingKey<T> declare(Class<T> type, boolean inheritable) {
    return declare(null, type, inheritable);
  }

  /**
   * Declares a new key with a debug name.
   *
   * @param name the key name, for debugging purpose only.
   * @param type the declared value type, primitive types are replaced by their wrapper.
   * @param inheritable whether bindings of this key are captured by snapshots.
   * @param <T> the type of the value.
   * @return the newly created unique key.
   */
  public static <T> BindingKey<T> declare(
      @Nullable String name, Class<T> type, boolean inheritable) {
    requireNonNull(type, "Binding key type cannot be null");
    return new BindingKey<>(name, wrap(type), inheritable);
  }

  /** Declares a new key whose bindings propagate to other execution units. */
  public static <T> BindingKey<T> inheritable(Class<T> type) {
    return declare(type, true);
  }

  /** Declares a new key whose bindings stay on the execution unit that made them. */
  public static <T> BindingKey<T> local(Class<T> type) {
    return declare(type, false);
  }

  public String name() {
    return this.name;
  }

  public Class<T> type() {
    return this.type;
  }

  public boolean isInheritable() {
    return this.inheritable;
  }

  /**
   * Returns the value bound to this key by the nearest enclosing scope of the current execution
   * unit.
   *
   * @return the bound value, which may be {@code null} if {@code null} was bound.
   * @throws UnboundKeyException if no enclosing scope binds this key.
   */
  @Nullable
  public T get() {
    BindingFrame frame = BindingFrame.find(StorageProviders.storage().current(), this);
    if (frame == null) {
      throw new UnboundKeyException(this);
    }
    return frame.valueOf(this);
  }

  /**
   * Returns the value bound to this key, or the given value if this key is not bound.
   *
   * @param other the value to return if this key is not bound.
   * @return the bound value if any, {@code other} otherwise.
   */
  @Nullable
  public T orElse(@Nullable T other) {
    BindingFrame frame = BindingFrame.find(StorageProviders.storage().current(), this);
    return frame != null ? frame.valueOf(this) : other;
  }

  /**
   * Returns the value bound to this key, or throws the supplied exception if not bound.
   *
   * @param exceptionSupplier supplies the exception to throw if this key is not bound.
   * @param <X> the type of the exception.
   * @return the bound value.
   * @throws X if this key is not bound.
   */
  @Nullable
  public <X extends Throwable> T orElseThrow(Supplier<? extends X> exceptionSupplier) throws X {
    requireNonNull(exceptionSupplier, "Exception supplier cannot be null");
    BindingFrame frame = BindingFrame.find(StorageProviders.storage().current(), this);
    if (frame == null) {
      throw exceptionSupplier.get();
    }
    return frame.valueOf(this);
  }

  /** Returns {@code true} if an enclosing scope of the current execution unit binds this key. */
  public boolean isBound() {
    return BindingFrame.find(StorageProviders.storage().current(), this) != null;
  }

  /**
   * Checks the given value can be bound to this key.
   *
   * @throws TypeMismatchException if the value is not assignable to the declared type.
   */
  @Nullable
  T check(@Nullable Object value) {
    if (value != null && !this.type.isInstance(value)) {
      throw new TypeMismatchException(this, value);
    }
    return this.type.cast(value);
  }

  @SuppressWarnings("unchecked")
  private static <T> Class<T> wrap(Class<T> type) {
    if (!type.isPrimitive()) {
      return type;
    }
    if (type == int.class) return (Class<T>) Integer.class;
    if (type == long.class) return (Class<T>) Long.class;
    if (type == boolean.class) return (Class<T>) Boolean.class;
    if (type == double.class) return (Class<T>) Double.class;
    if (type == float.class) return (Class<T>) Float.class;
    if (type == char.class) return (Class<T>) Character.class;
    if (type == byte.class) return (Class<T>) Byte.class;
    if (type == short.class) return (Class<T>) Short.class;
    throw new IllegalArgumentException("Cannot bind values of type " + type.getName());
  }

  @Override
  public int hashCode() {
    return this.index;
  }

  // we want identity equality, so no need to override equals()

  @Override
  public String toString() {
    String suffix = this.inheritable ? ", inheritable>" : ">";
    return this.name + '<' + this.type.getSimpleName() + suffix;
  }
}
