package datadog.internal.datastreams;

import static datadog.internal.util.FNV64Hash.Version.v1;

import datadog.internal.util.FNV64Hash;
import java.util.List;

/** Rolling FNV-1 hashes identifying a pathway: one per node, chained through parent hashes. */
public final class PathwayHashes {

  private PathwayHashes() {}

  /** Hash of the node identity: service, env and the already sorted edge tags, concatenated. */
  public static long nodeHash(String service, String env, List<String> sortedTags) {
    long hash = FNV64Hash.generateHash(service, v1);
    hash = FNV64Hash.continueHash(hash, env, v1);
    for (String tag : sortedTags) {
      hash = FNV64Hash.continueHash(hash, tag, v1);
    }
    return hash;
  }

  /** Chains a node hash to its parent, both taken as 8 byte little-endian values. */
  public static long pathwayHash(long nodeHash, long parentHash) {
    byte[] bytes = new byte[16];
    System.arraycopy(VarintCodec.toBytesLE(nodeHash), 0, bytes, 0, 8);
    System.arraycopy(VarintCodec.toBytesLE(parentHash), 0, bytes, 8, 8);
    return FNV64Hash.generateHash(bytes, v1);
  }
}
