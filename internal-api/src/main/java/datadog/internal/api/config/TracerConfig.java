package datadog.internal.api.config;

/** Keys for the connection to the collecting agent. */
public final class TracerConfig {

  public static final String TRACE_AGENT_URL = "trace.agent.url";
  public static final String TRACE_AGENT_TIMEOUT = "trace.agent.timeout";

  private TracerConfig() {}
}
