package datadog.internal.api;

import java.util.Locale;
import java.util.Properties;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves configuration keys against the available sources, in order: explicit {@link
 * Properties} (when given), system properties ({@code dd.<key>}) and environment variables
 * ({@code DD_<KEY>}).
 */
public class ConfigProvider {
  private static final Logger log = LoggerFactory.getLogger(ConfigProvider.class);

  private static final String PROPERTY_PREFIX = "dd.";
  private static final String ENV_PREFIX = "DD_";

  @Nullable private final Properties properties;
  private final boolean useSystemSources;

  private ConfigProvider(@Nullable Properties properties, boolean useSystemSources) {
    this.properties = properties;
    this.useSystemSources = useSystemSources;
  }

  public static ConfigProvider getInstance() {
    return new ConfigProvider(null, true);
  }

  /** Only the given properties are consulted, keys are used without prefix. */
  public static ConfigProvider withPropertiesOverride(Properties properties) {
    return new ConfigProvider(properties, false);
  }

  @Nullable
  public String getString(String key) {
    if (properties != null) {
      String value = properties.getProperty(key);
      if (value != null) {
        return value;
      }
    }
    if (!useSystemSources) {
      return null;
    }
    String value = systemProperty(PROPERTY_PREFIX + key);
    if (value == null) {
      value = environmentVariable(toEnvVar(key));
    }
    return value;
  }

  public String getString(String key, String defaultValue) {
    String value = getString(key);
    return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    String trimmed = value.trim();
    return "1".equals(trimmed) || Boolean.parseBoolean(trimmed);
  }

  public int getInteger(String key, int defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid integer configuration for {}: '{}', using {}", key, value, defaultValue);
      return defaultValue;
    }
  }

  public float getFloat(String key, float defaultValue) {
    String value = getString(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Float.parseFloat(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid float configuration for {}: '{}', using {}", key, value, defaultValue);
      return defaultValue;
    }
  }

  static String toEnvVar(String key) {
    return ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  @Nullable
  private static String systemProperty(String name) {
    try {
      return System.getProperty(name);
    } catch (SecurityException ignored) {
      return null;
    }
  }

  @Nullable
  private static String environmentVariable(String name) {
    try {
      return System.getenv(name);
    } catch (SecurityException ignored) {
      return null;
    }
  }
}
