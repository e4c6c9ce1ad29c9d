package datadog.internal.datastreams;

/** Stats are aggregated per edge tags, hash and parent hash within a bucket. */
final class PathwayAggregationKey {
  private final String edgeTags;
  private final long hash;
  private final long parentHash;

  PathwayAggregationKey(String edgeTags, long hash, long parentHash) {
    this.edgeTags = edgeTags;
    this.hash = hash;
    this.parentHash = parentHash;
  }

  static PathwayAggregationKey of(StatsPoint point) {
    return new PathwayAggregationKey(
        String.join(",", point.getEdgeTags()), point.getHash(), point.getParentHash());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PathwayAggregationKey)) {
      return false;
    }
    PathwayAggregationKey that = (PathwayAggregationKey) o;
    return hash == that.hash && parentHash == that.parentHash && edgeTags.equals(that.edgeTags);
  }

  @Override
  public int hashCode() {
    int result = edgeTags.hashCode();
    result = 31 * result + Long.hashCode(hash);
    result = 31 * result + Long.hashCode(parentHash);
    return result;
  }

  @Override
  public String toString() {
    return "PathwayAggregationKey{" + edgeTags + ", " + hash + ", " + parentHash + '}';
  }
}
