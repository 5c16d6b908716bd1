package datadog.binding;

import java.util.NoSuchElementException;

/** Thrown when resolving a {@link BindingKey} that no enclosing scope binds. */
public final class UnboundKeyException extends NoSuchElementException {
  private static final long serialVersionUID = 1L;

  private final transient BindingKey<?> key;

  UnboundKeyException(BindingKey<?> key) {
    super("No binding for key " + key.name());
    this.key = key;
  }

  /** Returns the key that could not be resolved. */
  public BindingKey<?> key() {
    return this.key;
  }
}
