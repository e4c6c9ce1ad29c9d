package datadog.internal.datastreams;

import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;

public interface PathwayContext {
  String PROPAGATION_KEY = "dd-pathway-ctx";
  String PROPAGATION_KEY_BASE64 = "dd-pathway-ctx-base64";

  long getHash();

  long getPathwayStartMillis();

  long getEdgeStartMillis();

  /**
   * Advances the pathway by one node and reports the resulting point.
   *
   * @param tags edge tags, in any order
   * @param pointConsumer receives the point before this method returns
   * @return the recorded point
   */
  StatsPoint setCheckpoint(List<String> tags, Consumer<StatsPoint> pointConsumer);

  byte[] encode() throws IOException;

  String encodeBase64() throws IOException;
}
