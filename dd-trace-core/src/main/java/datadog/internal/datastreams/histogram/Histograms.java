package datadog.internal.datastreams.histogram;

import com.datadoghq.sketch.ddsketch.DDSketches;

public final class Histograms {

  static final double LATENCY_RELATIVE_ACCURACY = 0.00775;
  static final int LATENCY_MAX_BINS = 2048;

  private Histograms() {}

  /** Log-collapsing sketch used for pathway and edge latencies. */
  public static Histogram newLogHistogram() {
    return newHistogram(LATENCY_RELATIVE_ACCURACY, LATENCY_MAX_BINS);
  }

  public static Histogram newHistogram(double relativeAccuracy, int maxNumBins) {
    return new Histogram(DDSketches.logarithmicCollapsingLowestDense(relativeAccuracy, maxNumBins));
  }
}
