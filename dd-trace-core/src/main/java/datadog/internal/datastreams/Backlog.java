package datadog.internal.datastreams;

import java.util.List;

/** An offset high-water mark, ready to be serialized. */
public final class Backlog {
  private final List<String> tags;
  private final long value;

  Backlog(List<String> tags, long value) {
    this.tags = tags;
    this.value = value;
  }

  public List<String> getTags() {
    return tags;
  }

  public long getValue() {
    return value;
  }

  @Override
  public String toString() {
    return "Backlog{tags=" + tags + ", value=" + value + '}';
  }
}
