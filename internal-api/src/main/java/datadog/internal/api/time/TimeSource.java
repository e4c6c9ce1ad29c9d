package datadog.internal.api.time;

/** Source of wall-clock and monotonic time, replaceable in tests. */
public interface TimeSource {
  /** Monotonic ticks in nanoseconds, only meaningful as differences. */
  long getNanoTicks();

  long getCurrentTimeMillis();

  /** Wall-clock time in nanoseconds since the epoch. */
  long getCurrentTimeNanos();
}
