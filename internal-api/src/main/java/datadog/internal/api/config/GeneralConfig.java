package datadog.internal.api.config;

/**
 * Keys for general settings. Each key can be set as a system property prefixed with {@code dd.}
 * or as an environment variable prefixed with {@code DD_}, upper-cased, with dots and dashes
 * replaced by underscores.
 */
public final class GeneralConfig {

  public static final String SERVICE_NAME = "service.name";
  public static final String ENV = "env";
  public static final String VERSION = "version";
  public static final String HOSTNAME = "hostname";

  public static final String DATA_STREAMS_ENABLED = "data.streams.enabled";
  public static final String DATA_STREAMS_BUCKET_DURATION_SECONDS =
      "data.streams.bucket_duration_seconds";
  public static final String DATA_STREAMS_RETRY_ATTEMPTS = "data.streams.retry.attempts";

  private GeneralConfig() {}
}
