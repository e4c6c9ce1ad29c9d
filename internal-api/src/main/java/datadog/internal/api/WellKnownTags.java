package datadog.internal.api;

import javax.annotation.Nullable;

/** Process-level identity attached to every payload. */
public final class WellKnownTags {

  private final String hostname;
  @Nullable private final String env;
  private final String service;
  @Nullable private final String version;
  private final String language;

  public WellKnownTags(
      String hostname,
      @Nullable String env,
      String service,
      @Nullable String version,
      String language) {
    this.hostname = hostname;
    this.env = env;
    this.service = service;
    this.version = version;
    this.language = language;
  }

  public String getHostname() {
    return hostname;
  }

  @Nullable
  public String getEnv() {
    return env;
  }

  public String getService() {
    return service;
  }

  @Nullable
  public String getVersion() {
    return version;
  }

  public String getLanguage() {
    return language;
  }

  @Override
  public String toString() {
    return "WellKnownTags{"
        + "hostname='"
        + hostname
        + "', env='"
        + env
        + "', service='"
        + service
        + "', version='"
        + version
        + "', language='"
        + language
        + "'}";
  }
}
