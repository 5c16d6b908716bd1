package datadog.binding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Push, invoke and pop protocol shared by carriers, snapshots and continuations.
 *
 * <p>The frame current on entry is always restored before control returns to the caller, whether
 * the body completes normally, throws, or is interrupted.
 */
final class ScopeRunner {
  private static final Logger log = LoggerFactory.getLogger(ScopeRunner.class);

  private static final int DEPTH_WARN_THRESHOLD = BindingConfig.get().depthWarnThreshold();

  private ScopeRunner() {}

  static void run(Carrier carrier, Runnable body) {
    FrameStorage storage = StorageProviders.storage();
    BindingFrame previous = storage.current();
    BindingFrame frame = carrier.pushOnto(previous);
    checkDepth(previous, frame);
    enter(storage, frame);
    try {
      ScopeListeners.notifyEntered(previous, frame);
      body.run();
    } finally {
      exit(storage, frame, previous);
    }
  }

  static <R, X extends Throwable> R call(Carrier carrier, CallableOp<? extends R, X> body)
      throws X {
    FrameStorage storage = StorageProviders.storage();
    BindingFrame previous = storage.current();
    BindingFrame frame = carrier.pushOnto(previous);
    checkDepth(previous, frame);
    enter(storage, frame);
    try {
      ScopeListeners.notifyEntered(previous, frame);
      return body.call();
    } finally {
      exit(storage, frame, previous);
    }
  }

  /** Runs the body with the given frame installed in place of the current one. */
  static void install(BindingFrame frame, Runnable body) {
    FrameStorage storage = StorageProviders.storage();
    BindingFrame previous = enter(storage, frame);
    try {
      ScopeListeners.notifyEntered(previous, frame);
      body.run();
    } finally {
      exit(storage, frame, previous);
    }
  }

  /** Calls the body with the given frame installed in place of the current one. */
  static <R, X extends Throwable> R install(BindingFrame frame, CallableOp<? extends R, X> body)
      throws X {
    FrameStorage storage = StorageProviders.storage();
    BindingFrame previous = enter(storage, frame);
    try {
      ScopeListeners.notifyEntered(previous, frame);
      return body.call();
    } finally {
      exit(storage, frame, previous);
    }
  }

  private static BindingFrame enter(FrameStorage storage, BindingFrame frame) {
    return storage.swap(frame);
  }

  private static void exit(FrameStorage storage, BindingFrame frame, BindingFrame previous) {
    BindingFrame current = storage.swap(previous);
    if (current != frame) {
      log.debug(
          "Current frame {} was not the one entered by the exiting scope {}, restoring {}",
          current,
          frame,
          previous);
    }
    ScopeListeners.notifyExited(frame, previous);
  }

  private static void checkDepth(BindingFrame previous, BindingFrame frame) {
    if (DEPTH_WARN_THRESHOLD > 0
        && frame != previous
        && frame.depth() == DEPTH_WARN_THRESHOLD + 1) {
      log.warn(
          "Binding frame depth exceeded {}, scopes are likely entered recursively without bound",
          DEPTH_WARN_THRESHOLD);
    }
  }
}
