package datadog.binding;

/**
 * Scope body returning a result and possibly throwing a checked exception.
 *
 * @param <R> the type of the result.
 * @param <X> the type of the exception thrown, {@link RuntimeException} if none.
 */
@FunctionalInterface
public interface CallableOp<R, X extends Throwable> {
  R call() throws X;
}
