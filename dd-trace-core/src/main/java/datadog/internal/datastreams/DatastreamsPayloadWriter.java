package datadog.internal.datastreams;

import java.util.Collection;

public interface DatastreamsPayloadWriter {
  void writePayload(Collection<StatsBucket> data);
}
