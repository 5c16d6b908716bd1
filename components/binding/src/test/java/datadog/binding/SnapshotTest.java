package datadog.binding;

import static datadog.binding.CarrierTest.LOCAL_KEY;
import static datadog.binding.CarrierTest.NUMBER_KEY;
import static datadog.binding.CarrierTest.STRING_KEY;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Phaser;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SnapshotTest {
  static final BindingKey<Integer> K = BindingKey.declare("k", Integer.class, true);

  private ExecutorService executor;

  @BeforeEach
  void init() {
    assertSame(BindingFrame.root(), Bindings.currentFrame());
    this.executor = Executors.newSingleThreadExecutor();
  }

  @Test
  void testEmptySnapshot() {
    Snapshot snapshot = Bindings.capture();
    assertSame(Snapshot.empty(), snapshot);
    assertTrue(snapshot.isEmpty());
    assertFalse(snapshot.isBound(STRING_KEY));
    assertThrows(UnboundKeyException.class, () -> snapshot.get(STRING_KEY));
    // Test only non-inheritable bindings capture nothing
    Bindings.where(LOCAL_KEY, true).run(() -> assertTrue(Bindings.capture().isEmpty()));
  }

  @Test
  void testEndToEnd() throws Exception {
    AtomicReference<Snapshot> captured = new AtomicReference<>();
    Bindings.where(K, 1)
        .run(
            () -> {
              Bindings.where(K, 2).run(() -> assertEquals(2, K.get()));
              assertEquals(1, K.get());
              captured.set(Bindings.capture());
              // Test later rebinding on the capturing unit does not affect the snapshot
              Bindings.where(K, 3)
                  .run(
                      () -> {
                        assertEquals(3, K.get());
                        Future<Integer> other =
                            this.executor.submit(captured.get().wrap((Callable<Integer>) K::get));
                        assertDoesNotThrow(() -> assertEquals(1, other.get()));
                      });
            });
    // Test the snapshot outlives the capturing scopes
    Snapshot snapshot = captured.get();
    assertEquals(1, snapshot.get(K));
    assertEquals(1, this.executor.submit(snapshot.wrap((Callable<Integer>) K::get)).get());
    assertFalse(K.isBound());
  }

  @Test
  void testNonInheritableExclusion() throws Exception {
    Snapshot snapshot =
        Bindings.where(STRING_KEY, "inherited")
            .with(LOCAL_KEY, true)
            .call(
                () -> {
                  // Test non-inheritable binding is readable on the originating unit
                  assertTrue(LOCAL_KEY.get());
                  return Bindings.capture();
                });
    assertFalse(snapshot.isBound(LOCAL_KEY));
    assertTrue(snapshot.isBound(STRING_KEY));
    Future<Boolean> localBound =
        this.executor.submit(snapshot.wrap((Callable<Boolean>) LOCAL_KEY::isBound));
    Future<String> inherited = this.executor.submit(snapshot.wrap(() -> STRING_KEY.get()));
    assertFalse(localBound.get());
    assertEquals("inherited", inherited.get());
  }

  @Test
  void testNonInheritableShadowDoesNotHideInheritedBinding() {
    BindingKey<String> local = BindingKey.declare("local", String.class, false);
    Bindings.where(STRING_KEY, "outer")
        .run(
            () ->
                Bindings.where(local, "hidden")
                    .with(NUMBER_KEY, 7)
                    .run(
                        () -> {
                          Snapshot snapshot = Bindings.capture();
                          assertEquals("outer", snapshot.get(STRING_KEY));
                          assertEquals(7, snapshot.get(NUMBER_KEY));
                          assertFalse(snapshot.isBound(local));
                          // Test projected chain keeps only the inheritable bindings
                          assertEquals(2, snapshot.frame().depth());
                          assertEquals(1, snapshot.frame().size());
                        }));
  }

  @Test
  void testShadowingIsPreserved() {
    Bindings.where(STRING_KEY, "outer")
        .run(
            () ->
                Bindings.where(STRING_KEY, "inner")
                    .run(
                        () -> {
                          Snapshot snapshot = Bindings.capture();
                          assertEquals("inner", snapshot.get(STRING_KEY));
                          snapshot.run(() -> assertEquals("inner", STRING_KEY.get()));
                        }));
  }

  @Test
  void testInheritableChainIsShared() {
    Bindings.where(STRING_KEY, "value")
        .run(
            () ->
                Bindings.where(NUMBER_KEY, 1)
                    .run(
                        () -> {
                          // Test capture does not copy an inheritable-only chain
                          Snapshot snapshot = Bindings.capture();
                          assertSame(Bindings.currentFrame(), snapshot.frame());
                          assertSame(snapshot.frame(), Bindings.capture().frame());
                        }));
  }

  @Test
  void testRepeatedCaptureIsMemoized() {
    Bindings.where(LOCAL_KEY, false)
        .with(STRING_KEY, "value")
        .run(
            () -> {
              Snapshot first = Bindings.capture();
              Snapshot second = Bindings.capture();
              assertSame(first.frame(), second.frame());
            });
  }

  @Test
  void testSnapshotReplacesCurrentBindings() {
    Snapshot snapshot = Bindings.where(STRING_KEY, "captured").call(Bindings::capture);
    Bindings.where(NUMBER_KEY, 5)
        .run(
            () -> {
              snapshot.run(
                  () -> {
                    assertEquals("captured", STRING_KEY.get());
                    assertFalse(NUMBER_KEY.isBound(), "installed snapshot should replace frame");
                    // Test scopes nest on top of an installed snapshot
                    Bindings.where(NUMBER_KEY, 6).run(() -> assertEquals(6, NUMBER_KEY.get()));
                  });
              assertEquals(5, NUMBER_KEY.get());
              assertFalse(STRING_KEY.isBound());
            });
  }

  @Test
  void testRestoreAfterSnapshotBodyFails() {
    Snapshot snapshot = Bindings.where(STRING_KEY, "captured").call(Bindings::capture);
    assertThrows(
        IllegalStateException.class,
        () ->
            Bindings.runWith(
                snapshot,
                () -> {
                  throw new IllegalStateException();
                }));
    assertFalse(STRING_KEY.isBound());
    assertEquals(
        "captured", Bindings.callWith(snapshot, () -> STRING_KEY.get()), "snapshot is reusable");
  }

  @Test
  void testWrapSupplier() {
    Supplier<String> supplier =
        Bindings.where(STRING_KEY, "supplied")
            .call(() -> Bindings.capture().wrapSupplier(STRING_KEY::get));
    assertEquals("supplied", CompletableFuture.supplyAsync(supplier, this.executor).join());
  }

  @Test
  void testSnapshotOutlivesCapturingThread() throws Exception {
    AtomicReference<Snapshot> captured = new AtomicReference<>();
    Thread thread =
        new Thread(
            () ->
                Bindings.where(STRING_KEY, "from-dead-thread")
                    .run(() -> captured.set(Bindings.capture())));
    thread.start();
    thread.join();
    assertFalse(thread.isAlive());
    Future<String> resolved = this.executor.submit(captured.get().wrap(() -> STRING_KEY.get()));
    assertEquals("from-dead-thread", resolved.get());
  }

  @Test
  void testNoHappensAfterLeakage() {
    /*
     * Two units share a snapshot. Each rebinds the key on top of it while the other checks it
     * still sees the captured value. A Phaser orders the steps.
     */
    Snapshot snapshot = Bindings.where(K, 0).call(Bindings::capture);
    Phaser phaser = new Phaser(2);
    Future<?> other =
        this.executor.submit(
            snapshot.wrap(
                () -> {
                  try {
                    phaser.arriveAndAwaitAdvance();
                    Bindings.where(K, 2)
                        .run(
                            () -> {
                              phaser.arriveAndAwaitAdvance();
                              assertEquals(2, K.get());
                              phaser.arriveAndAwaitAdvance();
                            });
                  } finally {
                    phaser.arriveAndDeregister();
                  }
                }));
    snapshot.run(
        () -> {
          phaser.arriveAndAwaitAdvance();
          Bindings.where(K, 1)
              .run(
                  () -> {
                    phaser.arriveAndAwaitAdvance();
                    assertEquals(1, K.get());
                    phaser.arriveAndAwaitAdvance();
                  });
          assertEquals(0, K.get());
        });
    assertDoesNotThrow(() -> other.get());
    assertEquals(0, snapshot.get(K));
  }

  @Test
  void testNullArguments() {
    Snapshot snapshot = Snapshot.empty();
    assertThrows(NullPointerException.class, () -> snapshot.run(null));
    assertThrows(NullPointerException.class, () -> snapshot.wrap((Runnable) null));
    assertThrows(NullPointerException.class, () -> Bindings.runWith(null, () -> {}));
  }

  @AfterEach
  void tearDown() {
    this.executor.shutdownNow();
    assertSame(BindingFrame.root(), Bindings.currentFrame());
  }
}
