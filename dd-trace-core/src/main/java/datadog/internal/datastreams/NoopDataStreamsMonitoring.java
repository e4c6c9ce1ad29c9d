package datadog.internal.datastreams;

import datadog.internal.api.time.SystemTimeSource;
import datadog.internal.api.time.TimeSource;
import java.io.IOException;
import java.util.List;

/** Used when data streams monitoring is disabled: pathways still propagate, nothing is recorded. */
public class NoopDataStreamsMonitoring implements DataStreamsMonitoring {
  private final TimeSource timeSource;
  private final String service;
  private final String env;

  public NoopDataStreamsMonitoring(String service, String env) {
    this(SystemTimeSource.INSTANCE, service, env);
  }

  NoopDataStreamsMonitoring(TimeSource timeSource, String service, String env) {
    this.timeSource = timeSource;
    this.service = service;
    this.env = env;
  }

  @Override
  public void start() {}

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public PathwayContext newPathwayContext() {
    return DefaultPathwayContext.newPathway(timeSource, service, env);
  }

  @Override
  public PathwayContext decode(byte[] data) {
    try {
      return DefaultPathwayContext.decode(timeSource, service, env, data);
    } catch (IOException e) {
      return newPathwayContext();
    }
  }

  @Override
  public PathwayContext decodeBase64(String data) {
    try {
      return DefaultPathwayContext.decodeBase64(timeSource, service, env, data);
    } catch (IOException e) {
      return newPathwayContext();
    }
  }

  @Override
  public PathwayContext setCheckpoint(List<String> tags) {
    PathwayContext pathwayContext = newPathwayContext();
    pathwayContext.setCheckpoint(tags, this::add);
    return pathwayContext;
  }

  @Override
  public void add(StatsPoint statsPoint) {}

  @Override
  public void trackProduce(String topic, int partition, long offset) {}

  @Override
  public void trackProduce(String topic, int partition, long offset, long timestampNanos) {}

  @Override
  public void trackCommit(String group, String topic, int partition, long offset) {}

  @Override
  public void trackCommit(
      String group, String topic, int partition, long offset, long timestampNanos) {}

  @Override
  public void flush() {}

  @Override
  public void clear() {}

  @Override
  public void close() {}
}
