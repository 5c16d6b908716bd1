package datadog.binding;

import static java.util.Arrays.copyOf;
import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Immutable set of pending bindings, applied for the dynamic extent of {@link #run(Runnable)} or
 * {@link #call(CallableOp)}.
 *
 * <p>Adding a binding with {@link #with(BindingKey, Object)} creates a new carrier, leaving the
 * original one untouched, so carriers can be kept and reused as templates:
 *
 * <pre>{@code
 * Carrier request = Carrier.empty().with(TENANT, tenant).with(USER, user);
 * request.run(() -> handle(payload));
 * }</pre>
 *
 * <p>Values are checked against the declared type of their key as they are added, never later at
 * resolution time.
 */
@ParametersAreNonnullByDefault
public final class Carrier {
  private static final Carrier EMPTY = new Carrier(new BindingKey<?>[0], new Object[0]);

  private final BindingKey<?>[] keys;
  private final Object[] values;

  private Carrier(BindingKey<?>[] keys, Object[] values) {
    this.keys = keys;
    this.values = values;
  }

  /**
   * Returns the carrier without pending bindings.
   *
   * @return the empty carrier.
   */
  public static Carrier empty() {
    return EMPTY;
  }

  /**
   * Creates a copy of this carrier with the given binding added.
   *
   * <p>A binding already pending for the same key is replaced, keeping its position.
   *
   * @param key the key to bind.
   * @param value the value to bind the key to, may be {@code null}.
   * @param <T> the type of the value.
   * @return a new carrier with the binding added.
   * @throws TypeMismatchException if the value is not assignable to the key declared type.
   */
  public <T> Carrier with(BindingKey<T> key, @Nullable T value) {
    requireNonNull(key, "Binding key cannot be null");
    T checked = key.check(value);
    int index = indexOf(key);
    if (index >= 0) {
      Object[] newValues = this.values.clone();
      newValues[index] = checked;
      return new Carrier(this.keys, newValues);
    }
    int length = this.keys.length;
    BindingKey<?>[] newKeys = copyOf(this.keys, length + 1);
    Object[] newValues = copyOf(this.values, length + 1);
    newKeys[length] = key;
    newValues[length] = checked;
    return new Carrier(newKeys, newValues);
  }

  /**
   * Gets the value pending for the given key.
   *
   * @param key the key to look for.
   * @param <T> the type of the value.
   * @return the pending value.
   * @throws UnboundKeyException if this carrier has no pending binding for the key.
   */
  @Nullable
  @SuppressWarnings("unchecked")
  public <T> T get(BindingKey<T> key) {
    requireNonNull(key, "Binding key cannot be null");
    int index = indexOf(key);
    if (index < 0) {
      throw new UnboundKeyException(key);
    }
    return (T) this.values[index];
  }

  public boolean contains(BindingKey<?> key) {
    return indexOf(key) >= 0;
  }

  public int size() {
    return this.keys.length;
  }

  public boolean isEmpty() {
    return this.keys.length == 0;
  }

  /**
   * Runs the given body with the pending bindings applied to the current execution unit.
   *
   * <p>The bindings are visible to the body and everything it calls on this execution unit. The
   * previous bindings are restored when the body completes, normally or not.
   *
   * @param body the code to run.
   */
  public void run(Runnable body) {
    requireNonNull(body, "Scope body cannot be null");
    ScopeRunner.run(this, body);
  }

  /**
   * Calls the given body with the pending bindings applied to the current execution unit.
   *
   * @param body the code to call.
   * @param <R> the type of the result.
   * @param <X> the type of the exception thrown by the body.
   * @return the result of the body.
   * @throws X the exception thrown by the body, unchanged.
   * @see #run(Runnable)
   */
  public <R, X extends Throwable> R call(CallableOp<? extends R, X> body) throws X {
    requireNonNull(body, "Scope body cannot be null");
    return ScopeRunner.call(this, body);
  }

  /** Creates the frame holding the pending bindings on top of the given parent frame. */
  BindingFrame pushOnto(BindingFrame parent) {
    if (this.keys.length == 0) {
      return parent;
    }
    // Carrier arrays are never mutated, so the frame can share them
    return BindingFrame.push(parent, this.keys, this.values);
  }

  private int indexOf(BindingKey<?> key) {
    for (int i = 0; i < this.keys.length; i++) {
      if (this.keys[i] == key) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("Carrier{");
    for (int i = 0; i < this.keys.length; i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(this.keys[i].name()).append('=').append(this.values[i]);
    }
    return builder.append('}').toString();
  }
}
