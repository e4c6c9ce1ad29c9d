package datadog.internal.datastreams;

import java.util.List;

/** One checkpoint, as recorded by a {@link PathwayContext}. Latencies are in nanoseconds. */
public final class StatsPoint {
  private final List<String> edgeTags;
  private final long hash;
  private final long parentHash;
  private final long timestampNanos;
  private final long pathwayLatencyNano;
  private final long edgeLatencyNano;

  public StatsPoint(
      List<String> edgeTags,
      long hash,
      long parentHash,
      long timestampNanos,
      long pathwayLatencyNano,
      long edgeLatencyNano) {
    this.edgeTags = edgeTags;
    this.hash = hash;
    this.parentHash = parentHash;
    this.timestampNanos = timestampNanos;
    this.pathwayLatencyNano = pathwayLatencyNano;
    this.edgeLatencyNano = edgeLatencyNano;
  }

  public List<String> getEdgeTags() {
    return edgeTags;
  }

  public long getHash() {
    return hash;
  }

  public long getParentHash() {
    return parentHash;
  }

  public long getTimestampNanos() {
    return timestampNanos;
  }

  public long getPathwayLatencyNano() {
    return pathwayLatencyNano;
  }

  public long getEdgeLatencyNano() {
    return edgeLatencyNano;
  }

  @Override
  public String toString() {
    return "StatsPoint{"
        + "edgeTags="
        + edgeTags
        + ", hash="
        + Long.toUnsignedString(hash)
        + ", parentHash="
        + Long.toUnsignedString(parentHash)
        + ", timestampNanos="
        + timestampNanos
        + ", pathwayLatencyNano="
        + pathwayLatencyNano
        + ", edgeLatencyNano="
        + edgeLatencyNano
        + '}';
  }
}
