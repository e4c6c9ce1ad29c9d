package datadog.internal.util;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Calculates the FNV 64 bit hash. Longs should be treated as though they were unsigned
 *
 * <p>http://www.isthe.com/chongo/tech/comp/fnv/index.html#FNV-1
 */
public final class FNV64Hash {
  static final long FNV_INIT = 0xcbf29ce484222325L;
  private static final long FNV_PRIME = 0x100000001b3L;

  public enum Version {
    v1,
    v1A
  }

  private FNV64Hash() {}

  public static long generateHash(String data, Version version) {
    return generateHash(data.getBytes(UTF_8), version);
  }

  public static long generateHash(byte[] data, Version version) {
    return continueHash(FNV_INIT, data, 0, data.length, version);
  }

  public static long generateHash(byte[] data, int start, int length, Version version) {
    return continueHash(FNV_INIT, data, start, length, version);
  }

  public static long continueHash(long currentHash, String data, Version version) {
    byte[] bytes = data.getBytes(UTF_8);
    return continueHash(currentHash, bytes, 0, bytes.length, version);
  }

  public static long continueHash(
      long currentHash, byte[] data, int start, int length, Version version) {
    long hash = currentHash;
    int end = start + length;
    if (version == Version.v1) {
      for (int i = start; i < end; i++) {
        hash *= FNV_PRIME;
        hash ^= 0xffL & data[i];
      }
    } else {
      for (int i = start; i < end; i++) {
        hash ^= 0xffL & data[i];
        hash *= FNV_PRIME;
      }
    }
    return hash;
  }
}
