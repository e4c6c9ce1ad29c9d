package datadog.internal.common.sink;

import java.nio.ByteBuffer;

public interface Sink {

  /** Delivers one serialized payload. Failures are reported to listeners, never thrown. */
  void accept(int messageCount, ByteBuffer buffer);

  void register(EventListener listener);
}
