package datadog.internal.datastreams;

import com.datadoghq.sketch.ddsketch.encoding.ByteArrayInput;
import com.datadoghq.sketch.ddsketch.encoding.GrowingByteArrayOutput;
import com.datadoghq.sketch.ddsketch.encoding.VarEncodingHelper;
import java.io.IOException;

/**
 * Fixed 64-bit little-endian and variable length integer encodings used by the pathway wire format.
 *
 * <p>Signed values are zig-zag encoded before being written as unsigned varints, so small negative
 * numbers stay short.
 */
public final class VarintCodec {

  private VarintCodec() {}

  public static void writeLongLE(GrowingByteArrayOutput output, long value) {
    output.writeLongLE(value);
  }

  public static long readLongLE(ByteArrayInput input) throws IOException {
    return input.readLongLE();
  }

  public static void writeUnsignedVarLong(GrowingByteArrayOutput output, long value)
      throws IOException {
    VarEncodingHelper.encodeUnsignedVarLong(output, value);
  }

  public static long readUnsignedVarLong(ByteArrayInput input) throws IOException {
    return VarEncodingHelper.decodeUnsignedVarLong(input);
  }

  public static void writeSignedVarLong(GrowingByteArrayOutput output, long value)
      throws IOException {
    VarEncodingHelper.encodeSignedVarLong(output, value);
  }

  public static long readSignedVarLong(ByteArrayInput input) throws IOException {
    return VarEncodingHelper.decodeSignedVarLong(input);
  }

  /** Eight bytes, least significant first. */
  public static byte[] toBytesLE(long value) {
    byte[] bytes = new byte[8];
    for (int i = 0; i < 8; i++) {
      bytes[i] = (byte) (value >>> (8 * i));
    }
    return bytes;
  }
}
