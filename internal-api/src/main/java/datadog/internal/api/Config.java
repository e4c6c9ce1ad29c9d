package datadog.internal.api;

import static datadog.internal.api.ConfigDefaults.DEFAULT_AGENT_TIMEOUT;
import static datadog.internal.api.ConfigDefaults.DEFAULT_AGENT_URL;
import static datadog.internal.api.ConfigDefaults.DEFAULT_DATA_STREAMS_BUCKET_DURATION;
import static datadog.internal.api.ConfigDefaults.DEFAULT_DATA_STREAMS_ENABLED;
import static datadog.internal.api.ConfigDefaults.DEFAULT_DATA_STREAMS_RETRY_ATTEMPTS;
import static datadog.internal.api.ConfigDefaults.DEFAULT_SERVICE_NAME;
import static datadog.internal.api.config.GeneralConfig.DATA_STREAMS_BUCKET_DURATION_SECONDS;
import static datadog.internal.api.config.GeneralConfig.DATA_STREAMS_ENABLED;
import static datadog.internal.api.config.GeneralConfig.DATA_STREAMS_RETRY_ATTEMPTS;
import static datadog.internal.api.config.GeneralConfig.ENV;
import static datadog.internal.api.config.GeneralConfig.HOSTNAME;
import static datadog.internal.api.config.GeneralConfig.SERVICE_NAME;
import static datadog.internal.api.config.GeneralConfig.VERSION;
import static datadog.internal.api.config.TracerConfig.TRACE_AGENT_TIMEOUT;
import static datadog.internal.api.config.TracerConfig.TRACE_AGENT_URL;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable configuration snapshot.
 *
 * <p>Keys can be found in {@link datadog.internal.api.config.GeneralConfig} and {@link
 * datadog.internal.api.config.TracerConfig}.
 */
public class Config {
  private static final Logger log = LoggerFactory.getLogger(Config.class);

  private final String serviceName;
  @Nullable private final String env;
  @Nullable private final String version;
  private final String hostName;
  private final String agentUrl;
  private final int agentTimeout;
  private final boolean dataStreamsEnabled;
  private final float dataStreamsBucketDurationSeconds;
  private final int dataStreamsRetryAttempts;

  private Config(final ConfigProvider configProvider) {
    serviceName = configProvider.getString(SERVICE_NAME, DEFAULT_SERVICE_NAME);
    env = emptyToNull(configProvider.getString(ENV));
    version = emptyToNull(configProvider.getString(VERSION));
    hostName = configProvider.getString(HOSTNAME, HostNameHolder.getHostName());
    agentUrl = configProvider.getString(TRACE_AGENT_URL, DEFAULT_AGENT_URL);
    agentTimeout = configProvider.getInteger(TRACE_AGENT_TIMEOUT, DEFAULT_AGENT_TIMEOUT);

    dataStreamsEnabled =
        configProvider.getBoolean(DATA_STREAMS_ENABLED, DEFAULT_DATA_STREAMS_ENABLED);
    float bucketDuration =
        configProvider.getFloat(
            DATA_STREAMS_BUCKET_DURATION_SECONDS, DEFAULT_DATA_STREAMS_BUCKET_DURATION);
    // the duration is used at millisecond precision, anything rounding to zero is invalid
    if (Math.round(bucketDuration * 1000) < 1) {
      log.warn(
          "Invalid {} {}, using {}",
          DATA_STREAMS_BUCKET_DURATION_SECONDS,
          bucketDuration,
          DEFAULT_DATA_STREAMS_BUCKET_DURATION);
      bucketDuration = DEFAULT_DATA_STREAMS_BUCKET_DURATION;
    }
    dataStreamsBucketDurationSeconds = bucketDuration;
    dataStreamsRetryAttempts =
        Math.max(
            1,
            configProvider.getInteger(
                DATA_STREAMS_RETRY_ATTEMPTS, DEFAULT_DATA_STREAMS_RETRY_ATTEMPTS));
  }

  public String getServiceName() {
    return serviceName;
  }

  @Nullable
  public String getEnv() {
    return env;
  }

  @Nullable
  public String getVersion() {
    return version;
  }

  public String getHostName() {
    return hostName;
  }

  public String getAgentUrl() {
    return agentUrl;
  }

  public int getAgentTimeout() {
    return agentTimeout;
  }

  public boolean isDataStreamsEnabled() {
    return dataStreamsEnabled;
  }

  public float getDataStreamsBucketDurationSeconds() {
    return dataStreamsBucketDurationSeconds;
  }

  public long getDataStreamsBucketDurationNanoseconds() {
    // Rounds to the nearest millisecond before converting to nanos
    int milliseconds = Math.round(dataStreamsBucketDurationSeconds * 1000);
    return TimeUnit.MILLISECONDS.toNanos(milliseconds);
  }

  public int getDataStreamsRetryAttempts() {
    return dataStreamsRetryAttempts;
  }

  public WellKnownTags getWellKnownTags() {
    return new WellKnownTags(hostName, env, serviceName, version, "java");
  }

  @Nullable
  private static String emptyToNull(@Nullable String value) {
    return value == null || value.trim().isEmpty() ? null : value.trim();
  }

  static class HostNameHolder {
    static final String hostName = initHostName();

    static String getHostName() {
      return hostName;
    }

    private static String initHostName() {
      try {
        return InetAddress.getLocalHost().getHostName();
      } catch (UnknownHostException | SecurityException e) {
        log.debug("Unable to resolve the local host name", e);
        return "";
      }
    }
  }

  private static final Config INSTANCE = new Config(ConfigProvider.getInstance());

  public static Config get() {
    return INSTANCE;
  }

  /** Builds a config from the given properties only, keys are used without prefix. */
  public static Config get(final Properties properties) {
    if (properties == null || properties.isEmpty()) {
      return INSTANCE;
    }
    return new Config(ConfigProvider.withPropertiesOverride(properties));
  }

  @Override
  public String toString() {
    return "Config{"
        + "serviceName='"
        + serviceName
        + '\''
        + ", env='"
        + env
        + '\''
        + ", version='"
        + version
        + '\''
        + ", hostName='"
        + hostName
        + '\''
        + ", agentUrl='"
        + agentUrl
        + '\''
        + ", agentTimeout="
        + agentTimeout
        + ", dataStreamsEnabled="
        + dataStreamsEnabled
        + ", dataStreamsBucketDurationSeconds="
        + dataStreamsBucketDurationSeconds
        + ", dataStreamsRetryAttempts="
        + dataStreamsRetryAttempts
        + '}';
  }
}
