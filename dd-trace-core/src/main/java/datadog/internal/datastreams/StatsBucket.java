package datadog.internal.datastreams;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics of one time window. Not thread-safe: buckets are only touched under the lock of their
 * {@link DefaultDataStreamsMonitoring}, or after being drained from it.
 */
public class StatsBucket {
  private final long startTimeNanos;
  private final long bucketDurationNanos;
  private final Map<PathwayAggregationKey, StatsGroup> keyToGroup = new HashMap<>();
  private final Map<TopicPartition, Long> latestProduceOffsets = new HashMap<>();
  private final Map<TopicPartitionGroup, Long> latestCommitOffsets = new HashMap<>();

  public StatsBucket(long startTimeNanos, long bucketDurationNanos) {
    this.startTimeNanos = startTimeNanos;
    this.bucketDurationNanos = bucketDurationNanos;
  }

  public void addPoint(StatsPoint statsPoint) {
    keyToGroup
        .computeIfAbsent(
            PathwayAggregationKey.of(statsPoint),
            key ->
                new StatsGroup(
                    statsPoint.getEdgeTags(), statsPoint.getHash(), statsPoint.getParentHash()))
        .add(statsPoint.getPathwayLatencyNano(), statsPoint.getEdgeLatencyNano());
  }

  public void addProduceOffset(TopicPartition key, long offset) {
    latestProduceOffsets.merge(key, offset, Math::max);
  }

  public void addCommitOffset(TopicPartitionGroup key, long offset) {
    latestCommitOffsets.merge(key, offset, Math::max);
  }

  public long getStartTimeNanos() {
    return startTimeNanos;
  }

  public long getBucketDurationNanos() {
    return bucketDurationNanos;
  }

  public Collection<StatsGroup> getGroups() {
    return keyToGroup.values();
  }

  public Map<TopicPartition, Long> getLatestProduceOffsets() {
    return latestProduceOffsets;
  }

  public Map<TopicPartitionGroup, Long> getLatestCommitOffsets() {
    return latestCommitOffsets;
  }

  /** Commit offsets first, then produce offsets. */
  public List<Backlog> getBacklogs() {
    List<Backlog> backlogs =
        new ArrayList<>(latestCommitOffsets.size() + latestProduceOffsets.size());
    for (Map.Entry<TopicPartitionGroup, Long> entry : latestCommitOffsets.entrySet()) {
      backlogs.add(new Backlog(entry.getKey().toBacklogTags(), entry.getValue()));
    }
    for (Map.Entry<TopicPartition, Long> entry : latestProduceOffsets.entrySet()) {
      backlogs.add(new Backlog(entry.getKey().toBacklogTags(), entry.getValue()));
    }
    return backlogs;
  }

  @Override
  public String toString() {
    return "StatsBucket{start="
        + startTimeNanos
        + ", groups="
        + keyToGroup.size()
        + ", produceOffsets="
        + latestProduceOffsets.size()
        + ", commitOffsets="
        + latestCommitOffsets.size()
        + '}';
  }
}
