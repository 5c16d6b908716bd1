package datadog.binding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class CarrierTest {
  static final BindingKey<String> STRING_KEY = BindingKey.declare("string-key", String.class, true);
  static final BindingKey<Number> NUMBER_KEY = BindingKey.declare("number-key", Number.class, true);
  static final BindingKey<Boolean> LOCAL_KEY =
      BindingKey.declare("local-key", Boolean.class, false);

  @Test
  void testEmpty() {
    Carrier empty = Carrier.empty();
    assertSame(empty, Carrier.empty(), "Empty carrier should be consistent");
    assertTrue(empty.isEmpty());
    assertEquals(0, empty.size());
    assertFalse(empty.contains(STRING_KEY));
  }

  @Test
  void testWithIsImmutable() {
    Carrier template = Carrier.empty().with(STRING_KEY, "value");
    Carrier derived = template.with(NUMBER_KEY, 1);
    // Test the template is not mutated
    assertEquals(1, template.size());
    assertFalse(template.contains(NUMBER_KEY));
    assertTrue(Carrier.empty().isEmpty(), "Empty carrier should be immutable");
    // Test derived carrier has both bindings
    assertEquals(2, derived.size());
    assertEquals("value", derived.get(STRING_KEY));
    assertEquals(1, derived.get(NUMBER_KEY));
  }

  @Test
  void testLastWriteWins() {
    Carrier first = Carrier.empty().with(STRING_KEY, "first").with(NUMBER_KEY, 1);
    Carrier second = first.with(STRING_KEY, "second");
    assertEquals(2, second.size(), "rebinding a pending key should not add a binding");
    assertEquals("second", second.get(STRING_KEY));
    assertEquals("first", first.get(STRING_KEY), "the original carrier should be untouched");
    second.run(() -> assertEquals("second", STRING_KEY.get()));
  }

  @Test
  void testSubtypeValues() {
    Carrier carrier = Carrier.empty().with(NUMBER_KEY, 1.5d);
    assertEquals(1.5d, carrier.get(NUMBER_KEY));
  }

  @Test
  void testNullValues() {
    Carrier carrier = Carrier.empty().with(STRING_KEY, null);
    assertTrue(carrier.contains(STRING_KEY));
    assertNull(carrier.get(STRING_KEY));
    carrier.run(
        () -> {
          assertTrue(STRING_KEY.isBound(), "null should be a valid binding");
          assertNull(STRING_KEY.get());
          assertNull(STRING_KEY.orElse("default"));
        });
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void testTypeMismatch() {
    BindingKey raw = STRING_KEY;
    AtomicBoolean invoked = new AtomicBoolean();
    TypeMismatchException exception =
        assertThrows(
            TypeMismatchException.class,
            () -> Carrier.empty().with(raw, 42).run(() -> invoked.set(true)));
    assertSame(STRING_KEY, exception.key());
    assertSame(Integer.class, exception.valueType());
    assertFalse(invoked.get(), "the scope body should never run");
    assertFalse(STRING_KEY.isBound());
    // Type mismatch is also a class cast failure
    assertThrows(ClassCastException.class, () -> Bindings.where(raw, new Object()));
  }

  @Test
  void testGetUnboundKey() {
    Carrier carrier = Carrier.empty().with(STRING_KEY, "value");
    UnboundKeyException exception =
        assertThrows(UnboundKeyException.class, () -> carrier.get(LOCAL_KEY));
    assertSame(LOCAL_KEY, exception.key());
  }

  @Test
  void testNullArguments() {
    assertThrows(NullPointerException.class, () -> Carrier.empty().with(null, "value"));
    assertThrows(NullPointerException.class, () -> Carrier.empty().run(null));
    assertThrows(NullPointerException.class, () -> Carrier.empty().call(null));
  }

  @Test
  void testToString() {
    Carrier carrier = Carrier.empty().with(STRING_KEY, "value").with(LOCAL_KEY, true);
    assertEquals("Carrier{string-key=value, local-key=true}", carrier.toString());
  }
}
