package datadog.binding;

/**
 * Observes frames becoming current on an execution unit.
 *
 * <p>Listeners are called on the execution unit that enters or exits the scope, and must not
 * enter scopes themselves. Exceptions thrown by a listener are logged and ignored.
 *
 * @see ScopeListeners#add(ScopeListener)
 */
public interface ScopeListener {
  /**
   * Called once a scope made its frame current.
   *
   * @param previous the frame that was current before the scope.
   * @param current the frame made current by the scope.
   */
  default void onScopeEntered(BindingFrame previous, BindingFrame current) {}

  /**
   * Called once a scope restored the frame that was current before it.
   *
   * @param exited the frame the scope made current.
   * @param restored the frame made current again.
   */
  default void onScopeExited(BindingFrame exited, BindingFrame restored) {}
}
