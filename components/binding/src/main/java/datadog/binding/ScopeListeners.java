package datadog.binding;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Registry of the {@link ScopeListener}s notified by every scope. */
public final class ScopeListeners {
  private static final Logger log = LoggerFactory.getLogger(ScopeListeners.class);

  private static final List<ScopeListener> LISTENERS = new CopyOnWriteArrayList<>();

  private ScopeListeners() {}

  public static void add(ScopeListener listener) {
    requireNonNull(listener, "Scope listener cannot be null");
    LISTENERS.add(listener);
  }

  public static boolean remove(ScopeListener listener) {
    return LISTENERS.remove(listener);
  }

  static void notifyEntered(BindingFrame previous, BindingFrame current) {
    if (LISTENERS.isEmpty()) {
      return;
    }
    for (ScopeListener listener : LISTENERS) {
      try {
        listener.onScopeEntered(previous, current);
      } catch (Throwable t) {
        log.debug("Error notifying scope listener {}", listener, t);
      }
    }
  }

  static void notifyExited(BindingFrame exited, BindingFrame restored) {
    if (LISTENERS.isEmpty()) {
      return;
    }
    for (ScopeListener listener : LISTENERS) {
      try {
        listener.onScopeExited(exited, restored);
      } catch (Throwable t) {
        log.debug("Error notifying scope listener {}", listener, t);
      }
    }
  }
}
