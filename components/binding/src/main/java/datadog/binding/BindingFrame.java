package datadog.binding;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import javax.annotation.ParametersAreNonnullByDefault;

/**
 * Immutable set of bindings established by a single binding operation, linked to its enclosing
 * frame.
 *
 * <p>Frames form a persistent singly-linked chain ending at the {@link #root()} frame. A chain is
 * never copied: execution units, snapshots and continuations share it by reference. Once
 * constructed, neither the bindings of a frame nor its parent ever change.
 */
@ParametersAreNonnullByDefault
public final class BindingFrame {
  private static final BindingKey<?>[] NO_KEYS = new BindingKey<?>[0];
  private static final Object[] NO_VALUES = new Object[0];

  private static final BindingFrame ROOT = new BindingFrame(NO_KEYS, NO_VALUES, null);

  static {
    ROOT.inheritable = ROOT;
  }

  /** Bound keys, in binding order. */
  private final BindingKey<?>[] keys;

  /** Bound values, sharing indexes with {@link #keys}. */
  private final Object[] values;

  @Nullable private final BindingFrame parent;
  private final int depth;

  /**
   * Memoized inheritable projection of the chain ending at this frame. Racy initialization is
   * fine: every thread computes an equivalent chain.
   */
  private volatile BindingFrame inheritable;

  private BindingFrame(BindingKey<?>[] keys, Object[] values, @Nullable BindingFrame parent) {
    this.keys = keys;
    this.values = values;
    this.parent = parent;
    this.depth = parent == null ? 0 : parent.depth + 1;
  }

  /**
   * Returns the root frame.
   *
   * @return the frame without bindings that all chains extend.
   */
  public static BindingFrame root() {
    return ROOT;
  }

  /** Creates a child frame of the given parent, taking ownership of the given arrays. */
  static BindingFrame push(BindingFrame parent, BindingKey<?>[] keys, Object[] values) {
    return new BindingFrame(keys, values, parent);
  }

  /**
   * Finds the nearest frame binding the given key.
   *
   * @param from the frame to start the walk from.
   * @param key the key to look for.
   * @return the nearest frame binding the key; {@code null} if none does.
   */
  @Nullable
  static BindingFrame find(BindingFrame from, BindingKey<?> key) {
    for (BindingFrame frame = from; frame != null; frame = frame.parent) {
      if (frame.indexOf(key) >= 0) {
        return frame;
      }
    }
    return null;
  }

  /** Returns the value this frame binds to the given key, which must be bound by this frame. */
  @Nullable
  @SuppressWarnings("unchecked")
  <T> T valueOf(BindingKey<T> key) {
    return (T) this.values[indexOf(key)];
  }

  private int indexOf(BindingKey<?> key) {
    BindingKey<?>[] keys = this.keys;
    for (int i = 0; i < keys.length; i++) {
      if (keys[i] == key) {
        return i;
      }
    }
    return -1;
  }

  /** Returns the enclosing frame; {@code null} for the root frame. */
  @Nullable
  public BindingFrame parent() {
    return this.parent;
  }

  /** Returns the number of frames between this frame and the root frame. */
  public int depth() {
    return this.depth;
  }

  public boolean isRoot() {
    return this.parent == null;
  }

  /** Returns the number of bindings established by this frame alone. */
  public int size() {
    return this.keys.length;
  }

  /** Returns the keys bound by this frame alone, in binding order. */
  public List<BindingKey<?>> keys() {
    return unmodifiableList(asList(this.keys));
  }

  /** Returns {@code true} if this frame or one of its ancestors binds the given key. */
  public boolean binds(BindingKey<?> key) {
    return find(this, key) != null;
  }

  /**
   * Returns the chain visible to other execution units: the same chain restricted to bindings of
   * inheritable keys.
   *
   * <p>Frames binding only inheritable keys on top of an already inheritable parent are shared
   * as-is, so a chain made only of inheritable bindings is its own projection. Frames without any
   * inheritable binding are left out of the projection.
   */
  BindingFrame inheritable() {
    BindingFrame projection = this.inheritable;
    if (projection != null) {
      return projection;
    }
    // Collect the frames whose projection is unknown, then project them from the root side
    List<BindingFrame> pending = new ArrayList<>();
    BindingFrame frame = this;
    while (frame.inheritable == null) {
      pending.add(frame);
      frame = frame.parent;
    }
    projection = frame.inheritable;
    for (int i = pending.size() - 1; i >= 0; i--) {
      BindingFrame current = pending.get(i);
      projection = current.projectOnto(projection);
      current.inheritable = projection;
    }
    return projection;
  }

  private BindingFrame projectOnto(BindingFrame projectedParent) {
    int count = 0;
    for (BindingKey<?> key : this.keys) {
      if (key.isInheritable()) {
        count++;
      }
    }
    if (count == 0) {
      return projectedParent;
    }
    if (count == this.keys.length && projectedParent == this.parent) {
      return this;
    }
    BindingKey<?>[] keys = new BindingKey<?>[count];
    Object[] values = new Object[count];
    int j = 0;
    for (int i = 0; i < this.keys.length; i++) {
      if (this.keys[i].isInheritable()) {
        keys[j] = this.keys[i];
        values[j] = this.values[i];
        j++;
      }
    }
    BindingFrame projected = new BindingFrame(keys, values, projectedParent);
    projected.inheritable = projected;
    return projected;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("BindingFrame{depth=").append(this.depth);
    for (int i = 0; i < this.keys.length; i++) {
      builder.append(", ").append(this.keys[i].name()).append('=').append(this.values[i]);
    }
    return builder.append('}').toString();
  }
}
