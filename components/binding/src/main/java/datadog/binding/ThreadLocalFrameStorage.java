package datadog.binding;

/**
 * Default storage: each thread owns its current frame. Threads start at the root frame and never
 * see the frame of the thread that started them.
 */
final class ThreadLocalFrameStorage implements FrameStorage {
  static final FrameStorage INSTANCE = new ThreadLocalFrameStorage();

  // single-slot array, swapped in place
  private static final ThreadLocal<BindingFrame[]> CURRENT_HOLDER =
      ThreadLocal.withInitial(() -> new BindingFrame[] {BindingFrame.root()});

  @Override
  public BindingFrame current() {
    return CURRENT_HOLDER.get()[0];
  }

  @Override
  public BindingFrame swap(BindingFrame frame) {
    BindingFrame[] holder = CURRENT_HOLDER.get();
    BindingFrame previous = holder[0];
    holder[0] = frame;
    return previous;
  }
}
