package datadog.binding;

import static java.util.Locale.ROOT;

import de.thetaphi.forbiddenapis.SuppressForbidden;
import java.util.function.UnaryOperator;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration of the binding mechanism.
 *
 * <p>Each setting is read from a system property, then from the matching environment variable
 * ({@code dd.binding.depth.warn.threshold} is also {@code DD_BINDING_DEPTH_WARN_THRESHOLD}), then
 * falls back to its default. Settings are read once, when the mechanism is first used.
 */
public final class BindingConfig {
  private static final Logger log = LoggerFactory.getLogger(BindingConfig.class);

  /** Frame depth above which entering a scope logs a warning; zero or less disables it. */
  public static final String DEPTH_WARN_THRESHOLD = "dd.binding.depth.warn.threshold";

  /** Class name of the {@link FrameStorage} to use, with a public no-arg constructor. */
  public static final String STORAGE = "dd.binding.storage";

  static final int DEFAULT_DEPTH_WARN_THRESHOLD = 1000;

  private static final class Holder {
    static final BindingConfig INSTANCE =
        new BindingConfig(BindingConfig::systemProperty, BindingConfig::environmentVariable);
  }

  private final int depthWarnThreshold;
  @Nullable private final String storageClassName;

  BindingConfig(UnaryOperator<String> properties, UnaryOperator<String> environment) {
    this.depthWarnThreshold =
        parseInt(
            DEPTH_WARN_THRESHOLD,
            read(DEPTH_WARN_THRESHOLD, properties, environment),
            DEFAULT_DEPTH_WARN_THRESHOLD);
    this.storageClassName = read(STORAGE, properties, environment);
  }

  public static BindingConfig get() {
    return Holder.INSTANCE;
  }

  public int depthWarnThreshold() {
    return this.depthWarnThreshold;
  }

  @Nullable
  public String storageClassName() {
    return this.storageClassName;
  }

  /** Converts a property name to its environment variable name. */
  static String toEnvironmentName(String property) {
    return property.replace('.', '_').replace('-', '_').toUpperCase(ROOT);
  }

  @Nullable
  private static String read(
      String property, UnaryOperator<String> properties, UnaryOperator<String> environment) {
    String value = trimToNull(properties.apply(property));
    if (value == null) {
      value = trimToNull(environment.apply(toEnvironmentName(property)));
    }
    return value;
  }

  private static int parseInt(String property, @Nullable String value, int defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value '{}' for {}, using default {}", value, property, defaultValue);
      return defaultValue;
    }
  }

  @Nullable
  private static String trimToNull(@Nullable String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  @Nullable
  private static String systemProperty(String name) {
    try {
      return System.getProperty(name);
    } catch (SecurityException e) {
      return null;
    }
  }

  @Nullable
  @SuppressForbidden
  private static String environmentVariable(String name) {
    try {
      return System.getenv(name);
    } catch (SecurityException e) {
      return null;
    }
  }

  @Override
  public String toString() {
    return "BindingConfig{depthWarnThreshold="
        + this.depthWarnThreshold
        + ", storageClassName="
        + this.storageClassName
        + '}';
  }
}
