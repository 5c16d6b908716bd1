package datadog.binding;

import static java.util.Objects.requireNonNull;

import javax.annotation.ParametersAreNonnullByDefault;

/**
 * All the bindings of a logical task, inheritable or not, saved when the task suspends so it can
 * resume on another worker.
 *
 * <p>Unlike a {@link Snapshot}, a continuation is meant for the same logical task, not for the
 * units it spawns.
 */
@ParametersAreNonnullByDefault
public final class Continuation {
  private final BindingFrame frame;

  private Continuation(BindingFrame frame) {
    this.frame = frame;
  }

  /** Saves the current frame of the current execution unit. */
  public static Continuation suspend() {
    return new Continuation(StorageProviders.storage().current());
  }

  public BindingFrame frame() {
    return this.frame;
  }

  /** Resumes the task body on the current worker with the saved bindings. */
  public void run(Runnable body) {
    requireNonNull(body, "Scope body cannot be null");
    ScopeRunner.install(this.frame, body);
  }

  /** Resumes the task body on the current worker with the saved bindings. */
  public <R, X extends Throwable> R call(CallableOp<? extends R, X> body) throws X {
    requireNonNull(body, "Scope body cannot be null");
    return ScopeRunner.install(this.frame, body);
  }

  /** Returns the inheritable part of the saved bindings. */
  public Snapshot snapshot() {
    return Snapshot.of(this.frame.inheritable());
  }

  @Override
  public String toString() {
    return "Continuation{" + this.frame + '}';
  }
}
