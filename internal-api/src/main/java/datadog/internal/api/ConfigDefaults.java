package datadog.internal.api;

public final class ConfigDefaults {

  static final String DEFAULT_SERVICE_NAME = "unnamed-java-service";
  static final String DEFAULT_AGENT_URL = "http://localhost:8126";
  static final int DEFAULT_AGENT_TIMEOUT = 1; // seconds

  static final boolean DEFAULT_DATA_STREAMS_ENABLED = true;
  static final float DEFAULT_DATA_STREAMS_BUCKET_DURATION = 10; // seconds
  static final int DEFAULT_DATA_STREAMS_RETRY_ATTEMPTS = 3;

  private ConfigDefaults() {}
}
