package datadog.internal.datastreams;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.datadoghq.sketch.ddsketch.encoding.ByteArrayInput;
import com.datadoghq.sketch.ddsketch.encoding.GrowingByteArrayOutput;
import datadog.internal.api.time.TimeSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DefaultPathwayContext implements PathwayContext {
  private static final Logger log = LoggerFactory.getLogger(DefaultPathwayContext.class);

  static final String DEFAULT_ENV = "none";

  private final TimeSource timeSource;
  private final String service;
  private final String env;
  private final GrowingByteArrayOutput outputBuffer =
      GrowingByteArrayOutput.withInitialCapacity(20);

  // pathwayStartNanos is nanoseconds since epoch
  // latencies are measured on nano ticks, which are monotonic but not comparable across JVMs
  private long pathwayStartNanos;
  private long pathwayStartNanoTicks;
  private long edgeStartNanoTicks;
  private long hash;

  private DefaultPathwayContext(
      TimeSource timeSource,
      String service,
      @Nullable String env,
      long pathwayStartNanos,
      long pathwayStartNanoTicks,
      long edgeStartNanoTicks,
      long hash) {
    this.timeSource = timeSource;
    this.service = service;
    this.env = env == null || env.isEmpty() ? DEFAULT_ENV : env;
    this.pathwayStartNanos = pathwayStartNanos;
    this.pathwayStartNanoTicks = pathwayStartNanoTicks;
    this.edgeStartNanoTicks = edgeStartNanoTicks;
    this.hash = hash;
  }

  /** A pathway with no parent, starting now. */
  public static DefaultPathwayContext newPathway(
      TimeSource timeSource, String service, @Nullable String env) {
    long nanoTicks = timeSource.getNanoTicks();
    return new DefaultPathwayContext(
        timeSource, service, env, timeSource.getCurrentTimeNanos(), nanoTicks, nanoTicks, 0);
  }

  @Override
  public synchronized long getHash() {
    return hash;
  }

  @Override
  public synchronized long getPathwayStartMillis() {
    return TimeUnit.NANOSECONDS.toMillis(pathwayStartNanos);
  }

  @Override
  public synchronized long getEdgeStartMillis() {
    return getPathwayStartMillis()
        + TimeUnit.NANOSECONDS.toMillis(edgeStartNanoTicks - pathwayStartNanoTicks);
  }

  @Override
  public synchronized StatsPoint setCheckpoint(
      List<String> tags, Consumer<StatsPoint> pointConsumer) {
    long nowNanos = timeSource.getCurrentTimeNanos();
    long nanoTicks = timeSource.getNanoTicks();

    List<String> sortedTags = new ArrayList<>(tags);
    Collections.sort(sortedTags);

    long nodeHash = PathwayHashes.nodeHash(service, env, sortedTags);
    long parentHash = hash;
    long newHash = PathwayHashes.pathwayHash(nodeHash, parentHash);

    StatsPoint point =
        new StatsPoint(
            Collections.unmodifiableList(sortedTags),
            newHash,
            parentHash,
            nowNanos,
            nanoTicks - pathwayStartNanoTicks,
            nanoTicks - edgeStartNanoTicks);
    edgeStartNanoTicks = nanoTicks;
    hash = newHash;

    pointConsumer.accept(point);
    return point;
  }

  /** {@code [hash: 8 bytes LE][pathway start millis: varint][edge start millis: varint]}. */
  @Override
  public synchronized byte[] encode() throws IOException {
    outputBuffer.clear();
    VarintCodec.writeLongLE(outputBuffer, hash);
    long pathwayStartMillis = getPathwayStartMillis();
    VarintCodec.writeSignedVarLong(outputBuffer, pathwayStartMillis);
    VarintCodec.writeSignedVarLong(outputBuffer, getEdgeStartMillis());
    return outputBuffer.trimmedCopy();
  }

  @Override
  public String encodeBase64() throws IOException {
    return new String(Base64.getEncoder().encode(encode()), ISO_8859_1);
  }

  /**
   * Reads a pathway propagated by an upstream service.
   *
   * @throws IOException if {@code data} is truncated
   */
  static DefaultPathwayContext decode(
      TimeSource timeSource, String service, @Nullable String env, byte[] data)
      throws IOException {
    ByteArrayInput input = ByteArrayInput.wrap(data);
    long hash;
    long pathwayStartMillis;
    long edgeStartMillis;
    try {
      hash = VarintCodec.readLongLE(input);
      pathwayStartMillis = VarintCodec.readSignedVarLong(input);
      edgeStartMillis = VarintCodec.readSignedVarLong(input);
    } catch (IndexOutOfBoundsException e) {
      throw new IOException("Truncated pathway context of " + data.length + " bytes", e);
    }
    long pathwayStartNanos = TimeUnit.MILLISECONDS.toNanos(pathwayStartMillis);

    // Convert the start time to the current JVM's nano clock
    long nanosSinceStart = timeSource.getCurrentTimeNanos() - pathwayStartNanos;
    long pathwayStartNanoTicks = timeSource.getNanoTicks() - nanosSinceStart;
    long edgeStartNanoTicks =
        pathwayStartNanoTicks + TimeUnit.MILLISECONDS.toNanos(edgeStartMillis - pathwayStartMillis);

    DefaultPathwayContext context =
        new DefaultPathwayContext(
            timeSource,
            service,
            env,
            pathwayStartNanos,
            pathwayStartNanoTicks,
            edgeStartNanoTicks,
            hash);
    log.debug("Decoded {}", context);
    return context;
  }

  static DefaultPathwayContext decodeBase64(
      TimeSource timeSource, String service, @Nullable String env, String base64)
      throws IOException {
    byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(base64.getBytes(UTF_8));
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid base64 pathway context", e);
    }
    return decode(timeSource, service, env, bytes);
  }

  @Override
  public synchronized String toString() {
    return "PathwayContext[ Hash "
        + Long.toUnsignedString(hash)
        + ", Start: "
        + pathwayStartNanos
        + ", StartTicks: "
        + pathwayStartNanoTicks
        + ", Edge Start Ticks: "
        + edgeStartNanoTicks
        + "]";
  }
}
