package datadog.internal.datastreams;

import java.util.Arrays;
import java.util.List;

/** Key of the latest produce offset. */
public final class TopicPartition {
  private final String topic;
  private final int partition;

  public TopicPartition(String topic, int partition) {
    this.topic = topic;
    this.partition = partition;
  }

  public String getTopic() {
    return topic;
  }

  public int getPartition() {
    return partition;
  }

  List<String> toBacklogTags() {
    return Arrays.asList("type:kafka_produce", "topic:" + topic, "partition:" + partition);
  }

  @Override
  public int hashCode() {
    return 31 * topic.hashCode() + partition;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TopicPartition
        && this.partition == ((TopicPartition) obj).partition
        && this.topic.equals(((TopicPartition) obj).topic);
  }

  @Override
  public String toString() {
    return topic + "-" + partition;
  }
}
