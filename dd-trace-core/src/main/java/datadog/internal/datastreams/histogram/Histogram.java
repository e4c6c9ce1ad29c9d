package datadog.internal.datastreams.histogram;

import com.datadoghq.sketch.ddsketch.DDSketch;
import java.nio.ByteBuffer;

/** Latency distribution backed by a {@link DDSketch}. Not thread-safe. */
public final class Histogram {
  private final DDSketch sketch;

  Histogram(DDSketch sketch) {
    this.sketch = sketch;
  }

  public void accept(double value) {
    sketch.accept(value);
  }

  public double getCount() {
    return sketch.getCount();
  }

  /** Protobuf encoding of the sketch, as expected by the agent. */
  public ByteBuffer serialize() {
    return sketch.serialize();
  }
}
