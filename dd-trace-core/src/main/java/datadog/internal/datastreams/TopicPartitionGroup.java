package datadog.internal.datastreams;

import java.util.Arrays;
import java.util.List;

/** Key of the latest committed offset of a consumer group. */
public final class TopicPartitionGroup {
  private final String group;
  private final String topic;
  private final int partition;

  public TopicPartitionGroup(String group, String topic, int partition) {
    this.group = group;
    this.topic = topic;
    this.partition = partition;
  }

  public String getGroup() {
    return group;
  }

  public String getTopic() {
    return topic;
  }

  public int getPartition() {
    return partition;
  }

  List<String> toBacklogTags() {
    return Arrays.asList(
        "type:kafka_commit",
        "consumer_group:" + group,
        "topic:" + topic,
        "partition:" + partition);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * group.hashCode() + topic.hashCode()) + partition;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TopicPartitionGroup
        && this.partition == ((TopicPartitionGroup) obj).partition
        && this.topic.equals(((TopicPartitionGroup) obj).topic)
        && this.group.equals(((TopicPartitionGroup) obj).group);
  }

  @Override
  public String toString() {
    return group + "/" + topic + "-" + partition;
  }
}
