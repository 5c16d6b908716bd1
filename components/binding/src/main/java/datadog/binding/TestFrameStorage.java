package datadog.binding;

/**
 * Storage selected once for the whole JVM that forwards to whichever storage was registered last,
 * the thread-based one when none was.
 */
final class TestFrameStorage implements FrameStorage {
  private static final FrameStorage TEST_INSTANCE = new TestFrameStorage();

  private TestFrameStorage() {}

  static boolean register() {
    // only effective while no storage has been selected yet
    StorageProviders.customStorage = TEST_INSTANCE;
    return StorageProviders.storage() == TEST_INSTANCE;
  }

  @Override
  public BindingFrame current() {
    return delegate().current();
  }

  @Override
  public BindingFrame swap(BindingFrame frame) {
    return delegate().swap(frame);
  }

  private static FrameStorage delegate() {
    FrameStorage registered = StorageProviders.customStorage;
    return registered == null || registered == TEST_INSTANCE
        ? ThreadLocalFrameStorage.INSTANCE
        : registered;
  }
}
