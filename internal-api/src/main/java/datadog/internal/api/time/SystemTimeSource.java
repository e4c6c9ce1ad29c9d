package datadog.internal.api.time;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

public final class SystemTimeSource implements TimeSource {
  public static final TimeSource INSTANCE = new SystemTimeSource();

  /** Start time in nanoseconds measured up to a millisecond accuracy */
  private final long startTimeNano;
  /** Nanosecond ticks value when this source was created */
  private final long startNanoTicks;

  private SystemTimeSource() {
    startTimeNano = MILLISECONDS.toNanos(System.currentTimeMillis());
    startNanoTicks = System.nanoTime();
  }

  @Override
  public long getNanoTicks() {
    return System.nanoTime();
  }

  @Override
  public long getCurrentTimeMillis() {
    return System.currentTimeMillis();
  }

  /**
   * Timestamp in nanoseconds, anchored on the creation time (millisecond precision) and advanced
   * with the monotonic clock, so differences between two readings are nanosecond accurate.
   */
  @Override
  public long getCurrentTimeNanos() {
    return startTimeNano + Math.max(0, getNanoTicks() - startNanoTicks);
  }
}
