package datadog.binding;

/**
 * Thrown when a value is added to a {@link Carrier} for a {@link BindingKey} whose declared type
 * the value is not assignable to. The binding fails immediately, so the scope body never runs.
 */
public final class TypeMismatchException extends ClassCastException {
  private static final long serialVersionUID = 1L;

  private final transient BindingKey<?> key;
  private final Class<?> valueType;

  TypeMismatchException(BindingKey<?> key, Object value) {
    super(
        "Cannot bind value of type "
            + value.getClass().getName()
            + " to key "
            + key.name()
            + " declared as "
            + key.type().getName());
    this.key = key;
    this.valueType = value.getClass();
  }

  /** Returns the key the value was bound to. */
  public BindingKey<?> key() {
    return this.key;
  }

  /** Returns the runtime type of the rejected value. */
  public Class<?> valueType() {
    return this.valueType;
  }
}
