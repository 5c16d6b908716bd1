package datadog.binding;

import de.thetaphi.forbiddenapis.SuppressForbidden;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Provides the {@link FrameStorage} implementation. */
final class StorageProviders {
  private static final Logger log = LoggerFactory.getLogger(StorageProviders.class);

  @SuppressFBWarnings("MS_SHOULD_BE_FINAL")
  static volatile FrameStorage customStorage;

  private StorageProviders() {}

  private static final class ProvidedStorage {
    static final FrameStorage INSTANCE = select();
  }

  static FrameStorage storage() {
    return ProvidedStorage.INSTANCE; // locked on first use
  }

  private static FrameStorage select() {
    FrameStorage custom = customStorage;
    if (custom != null) {
      return custom;
    }
    String className = BindingConfig.get().storageClassName();
    if (className != null) {
      FrameStorage configured = instantiate(className);
      if (configured != null) {
        return configured;
      }
    }
    return ThreadLocalFrameStorage.INSTANCE;
  }

  @SuppressForbidden
  private static FrameStorage instantiate(String className) {
    try {
      Class<?> storageClass = Class.forName(className);
      return (FrameStorage) storageClass.getConstructor().newInstance();
    } catch (ReflectiveOperationException | ClassCastException | LinkageError e) {
      log.warn(
          "Failed to instantiate frame storage {}, falling back to thread-local storage",
          className,
          e);
      return null;
    }
  }
}
