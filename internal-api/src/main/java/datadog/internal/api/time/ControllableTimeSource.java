package datadog.internal.api.time;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/** Manually driven {@link TimeSource}, wall clock and ticks move together. */
public class ControllableTimeSource implements TimeSource {
  private volatile long currentTime = 0;

  public void advance(long nanosIncrement) {
    currentTime += nanosIncrement;
  }

  public void set(long nanos) {
    currentTime = nanos;
  }

  @Override
  public long getNanoTicks() {
    return currentTime;
  }

  @Override
  public long getCurrentTimeMillis() {
    return NANOSECONDS.toMillis(currentTime);
  }

  @Override
  public long getCurrentTimeNanos() {
    return currentTime;
  }
}
