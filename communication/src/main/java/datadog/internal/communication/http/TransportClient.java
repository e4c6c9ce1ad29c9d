package datadog.internal.communication.http;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

/** Sends one payload to a fixed agent endpoint. */
public interface TransportClient {

  /**
   * Performs a single POST attempt of the msgpack {@code payload}, gzip-compressed on the wire.
   *
   * @throws IOException on transport failure (connection refused, timeout, I/O error)
   */
  TransportResponse send(List<ByteBuffer> payload) throws IOException;

  /** Describes the target, for logs. */
  String endpoint();
}
