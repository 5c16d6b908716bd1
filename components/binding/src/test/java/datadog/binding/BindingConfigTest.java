package datadog.binding;

import static datadog.binding.BindingConfig.DEFAULT_DEPTH_WARN_THRESHOLD;
import static datadog.binding.BindingConfig.DEPTH_WARN_THRESHOLD;
import static datadog.binding.BindingConfig.STORAGE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BindingConfigTest {
  private final Map<String, String> properties = new HashMap<>();
  private final Map<String, String> environment = new HashMap<>();

  private BindingConfig config() {
    return new BindingConfig(this.properties::get, this.environment::get);
  }

  @Test
  void testDefaults() {
    BindingConfig config = config();
    assertEquals(DEFAULT_DEPTH_WARN_THRESHOLD, config.depthWarnThreshold());
    assertNull(config.storageClassName());
  }

  @Test
  void testSystemProperties() {
    this.properties.put(DEPTH_WARN_THRESHOLD, "42");
    this.properties.put(STORAGE, "com.example.TaskFrameStorage");
    BindingConfig config = config();
    assertEquals(42, config.depthWarnThreshold());
    assertEquals("com.example.TaskFrameStorage", config.storageClassName());
  }

  @Test
  void testEnvironmentVariables() {
    this.environment.put("DD_BINDING_DEPTH_WARN_THRESHOLD", "7");
    this.environment.put("DD_BINDING_STORAGE", "com.example.TaskFrameStorage");
    BindingConfig config = config();
    assertEquals(7, config.depthWarnThreshold());
    assertEquals("com.example.TaskFrameStorage", config.storageClassName());
  }

  @Test
  void testSystemPropertiesTakePrecedence() {
    this.properties.put(DEPTH_WARN_THRESHOLD, "1");
    this.environment.put("DD_BINDING_DEPTH_WARN_THRESHOLD", "2");
    assertEquals(1, config().depthWarnThreshold());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", "many", "1.5", "99999999999"})
  void testInvalidValuesFallBackToDefault(String value) {
    this.properties.put(DEPTH_WARN_THRESHOLD, value);
    assertEquals(DEFAULT_DEPTH_WARN_THRESHOLD, config().depthWarnThreshold());
  }

  @Test
  void testValuesAreTrimmed() {
    this.properties.put(DEPTH_WARN_THRESHOLD, " 0 ");
    this.properties.put(STORAGE, "   ");
    BindingConfig config = config();
    assertEquals(0, config.depthWarnThreshold());
    assertNull(config.storageClassName());
  }

  @Test
  void testToEnvironmentName() {
    assertEquals(
        "DD_BINDING_DEPTH_WARN_THRESHOLD", BindingConfig.toEnvironmentName(DEPTH_WARN_THRESHOLD));
    assertEquals("DD_SOME_DASHED_NAME", BindingConfig.toEnvironmentName("dd.some-dashed.name"));
  }

  @Test
  void testGlobalConfig() {
    assertNotNull(BindingConfig.get());
    assertEquals(BindingConfig.get(), BindingConfig.get());
  }
}
