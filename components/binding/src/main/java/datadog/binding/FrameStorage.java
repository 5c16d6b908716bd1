package datadog.binding;

/**
 * Holds the <i>current</i> {@link BindingFrame} of each execution unit.
 *
 * <p>The default storage tracks one frame per {@link Thread}. Hosts where a logical task may be
 * suspended and resumed on another worker can register a storage keyed on the task instead.
 *
 * <p>Only the scope protocol writes the current frame, using {@link #swap(BindingFrame)} in
 * matched pairs.
 */
public interface FrameStorage {
  /**
   * Returns the frame of the current execution unit.
   *
   * @return the current frame; {@link BindingFrame#root()} if there is none.
   */
  BindingFrame current();

  /**
   * Makes the given frame current for the current execution unit.
   *
   * @param frame the frame to make current.
   * @return the previously current frame; {@link BindingFrame#root()} if there was none.
   */
  BindingFrame swap(BindingFrame frame);

  /**
   * Replaces the default thread-based storage with the given one.
   *
   * <p>The storage is selected the first time bindings are entered or resolved, and stays fixed
   * afterwards. Registering after that point is ignored, unless {@link #allowTesting()} was
   * called before the selection.
   *
   * @param storage the storage holding the current frames.
   */
  static void register(FrameStorage storage) {
    StorageProviders.customStorage = storage;
  }

  /**
   * Makes the selected storage follow every later {@link #register(FrameStorage)} call, so tests
   * can switch storages within one JVM.
   *
   * @return {@code false} when a storage was already selected and cannot be switched anymore.
   */
  static boolean allowTesting() {
    return TestFrameStorage.register();
  }
}
