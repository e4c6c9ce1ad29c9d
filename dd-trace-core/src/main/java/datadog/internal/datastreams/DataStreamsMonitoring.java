package datadog.internal.datastreams;

import java.util.List;

/**
 * Collects pathway checkpoints and offsets into time buckets and reports them to the agent.
 *
 * <p>Recording methods never block on network I/O and never throw because of reporting failures.
 */
public interface DataStreamsMonitoring extends AutoCloseable {

  void start();

  /** Whether points are still recorded. */
  boolean isEnabled();

  PathwayContext newPathwayContext();

  /**
   * Reads a propagated pathway and makes it the current pathway of the calling thread. Malformed
   * data yields a new pathway instead.
   */
  PathwayContext decode(byte[] data);

  /** Same as {@link #decode(byte[])} for the base64 form of the propagated value. */
  PathwayContext decodeBase64(String data);

  /**
   * Checkpoints the current pathway of the calling thread, starting a new pathway if the thread
   * has none yet.
   */
  PathwayContext setCheckpoint(List<String> tags);

  /** Records one checkpoint into the bucket containing its timestamp. */
  void add(StatsPoint statsPoint);

  void trackProduce(String topic, int partition, long offset);

  void trackProduce(String topic, int partition, long offset, long timestampNanos);

  void trackCommit(String group, String topic, int partition, long offset);

  void trackCommit(String group, String topic, int partition, long offset, long timestampNanos);

  /** Drains every bucket and reports it. */
  void flush();

  /** Drops every bucket without reporting it. */
  void clear();

  @Override
  void close();
}
