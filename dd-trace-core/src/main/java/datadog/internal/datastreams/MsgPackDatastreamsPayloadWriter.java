package datadog.internal.datastreams;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

import datadog.internal.api.WellKnownTags;
import datadog.internal.common.sink.Sink;
import datadog.internal.datastreams.histogram.Histogram;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.List;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePacker;

/**
 * Encodes drained buckets as the MessagePack document the agent expects on {@code
 * /v0.1/pipeline_stats} and hands it to a {@link Sink}.
 */
public class MsgPackDatastreamsPayloadWriter implements DatastreamsPayloadWriter {
  private static final byte[] ENV = "Env".getBytes(ISO_8859_1);
  private static final byte[] VERSION = "Version".getBytes(ISO_8859_1);
  private static final byte[] LANG = "Lang".getBytes(ISO_8859_1);
  private static final byte[] TRACER_VERSION = "TracerVersion".getBytes(ISO_8859_1);
  private static final byte[] HOSTNAME = "Hostname".getBytes(ISO_8859_1);
  private static final byte[] STATS = "Stats".getBytes(ISO_8859_1);
  private static final byte[] START = "Start".getBytes(ISO_8859_1);
  private static final byte[] DURATION = "Duration".getBytes(ISO_8859_1);
  private static final byte[] PATHWAY_LATENCY = "PathwayLatency".getBytes(ISO_8859_1);
  private static final byte[] EDGE_LATENCY = "EdgeLatency".getBytes(ISO_8859_1);
  private static final byte[] SERVICE = "Service".getBytes(ISO_8859_1);
  private static final byte[] EDGE_TAGS = "EdgeTags".getBytes(ISO_8859_1);
  private static final byte[] BACKLOGS = "Backlogs".getBytes(ISO_8859_1);
  private static final byte[] HASH = "Hash".getBytes(ISO_8859_1);
  private static final byte[] PARENT_HASH = "ParentHash".getBytes(ISO_8859_1);
  private static final byte[] BACKLOG_VALUE = "Value".getBytes(ISO_8859_1);
  private static final byte[] BACKLOG_TAGS = "Tags".getBytes(ISO_8859_1);

  private final MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
  private final Sink sink;
  private final WellKnownTags wellKnownTags;
  private final String tracerVersion;

  public MsgPackDatastreamsPayloadWriter(
      Sink sink, WellKnownTags wellKnownTags, String tracerVersion) {
    this.sink = sink;
    this.wellKnownTags = wellKnownTags;
    this.tracerVersion = tracerVersion;
  }

  @Override
  public synchronized void writePayload(Collection<StatsBucket> data) {
    ByteBuffer payload;
    try {
      packer.clear();
      writeDocument(data, packer);
      payload = ByteBuffer.wrap(packer.toByteArray());
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to encode data streams payload", e);
    } finally {
      packer.clear();
    }
    sink.accept(data.size(), payload);
  }

  private void writeDocument(Collection<StatsBucket> data, MessagePacker writer)
      throws IOException {
    String env = wellKnownTags.getEnv();
    String version = wellKnownTags.getVersion();
    boolean hasEnv = env != null && !env.isEmpty();
    boolean hasVersion = version != null && !version.isEmpty();
    writer.packMapHeader(5 + (hasEnv ? 1 : 0) + (hasVersion ? 1 : 0));

    /* 1 */
    writeKey(writer, SERVICE);
    writer.packString(wellKnownTags.getService());

    /* 2 */
    writeKey(writer, TRACER_VERSION);
    writer.packString(tracerVersion);

    /* 3 */
    writeKey(writer, LANG);
    writer.packString(wellKnownTags.getLanguage());

    /* 4 */
    writeKey(writer, HOSTNAME);
    writer.packString(wellKnownTags.getHostname());

    /* 5 */
    writeKey(writer, STATS);
    writer.packArrayHeader(data.size());
    for (StatsBucket bucket : data) {
      writer.packMapHeader(4);

      writeKey(writer, START);
      writer.packLong(bucket.getStartTimeNanos());

      writeKey(writer, DURATION);
      writer.packLong(bucket.getBucketDurationNanos());

      writeKey(writer, STATS);
      writeBucket(bucket, writer);

      writeKey(writer, BACKLOGS);
      writeBacklogs(bucket.getBacklogs(), writer);
    }

    if (hasEnv) {
      /* 6 */
      writeKey(writer, ENV);
      writer.packString(env);
    }

    if (hasVersion) {
      /* 7 */
      writeKey(writer, VERSION);
      writer.packString(version);
    }
  }

  private static void writeBucket(StatsBucket bucket, MessagePacker packer) throws IOException {
    Collection<StatsGroup> groups = bucket.getGroups();
    packer.packArrayHeader(groups.size());
    for (StatsGroup group : groups) {
      packer.packMapHeader(5);

      /* 1 */
      writeKey(packer, EDGE_TAGS);
      writeTags(group.getEdgeTags(), packer);

      /* 2 */
      writeKey(packer, HASH);
      writeUnsignedLong(packer, group.getHash());

      /* 3 */
      writeKey(packer, PARENT_HASH);
      writeUnsignedLong(packer, group.getParentHash());

      /* 4 */
      writeKey(packer, PATHWAY_LATENCY);
      writeHistogram(packer, group.getPathwayLatency());

      /* 5 */
      writeKey(packer, EDGE_LATENCY);
      writeHistogram(packer, group.getEdgeLatency());
    }
  }

  private static void writeBacklogs(List<Backlog> backlogs, MessagePacker packer)
      throws IOException {
    packer.packArrayHeader(backlogs.size());
    for (Backlog backlog : backlogs) {
      packer.packMapHeader(2);

      writeKey(packer, BACKLOG_TAGS);
      writeTags(backlog.getTags(), packer);

      writeKey(packer, BACKLOG_VALUE);
      packer.packLong(backlog.getValue());
    }
  }

  private static void writeTags(List<String> tags, MessagePacker packer) throws IOException {
    packer.packArrayHeader(tags.size());
    for (String tag : tags) {
      packer.packString(tag);
    }
  }

  private static void writeKey(MessagePacker packer, byte[] key) throws IOException {
    packer.packRawStringHeader(key.length);
    packer.writePayload(key);
  }

  private static void writeUnsignedLong(MessagePacker packer, long value) throws IOException {
    if (value >= 0) {
      packer.packLong(value);
    } else {
      packer.packBigInteger(new BigInteger(Long.toUnsignedString(value)));
    }
  }

  private static void writeHistogram(MessagePacker packer, Histogram histogram)
      throws IOException {
    ByteBuffer serialized = histogram.serialize();
    packer.packBinaryHeader(serialized.remaining());
    if (serialized.hasArray()) {
      packer.writePayload(
          serialized.array(),
          serialized.arrayOffset() + serialized.position(),
          serialized.remaining());
    } else {
      byte[] bytes = new byte[serialized.remaining()];
      serialized.get(bytes);
      packer.writePayload(bytes);
    }
  }
}
