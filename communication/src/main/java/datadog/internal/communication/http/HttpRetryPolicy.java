package datadog.internal.communication.http;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.ThreadLocalRandom;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A policy which encapsulates retry rules for HTTP calls.
 *
 * <p>Only transport failures are retried: connection errors, I/O errors and timeouts. A response
 * from the server, whatever its status, ends the retry loop. Waits between attempts grow
 * exponentially and are jittered: the n-th wait is picked uniformly in {@code [0, initialDelay *
 * delayFactor^(n-1)]}.
 *
 * <p>Instances of this class are not thread-safe and not reusable: each HTTP call requires its own
 * instance.
 */
@NotThreadSafe
public class HttpRetryPolicy implements AutoCloseable {

  static final double GOLDEN_RATIO = 1.618;

  private int retriesLeft;
  private double delayBound;
  private boolean interrupted;
  private final double delayFactor;
  private final boolean jitter;

  private HttpRetryPolicy(int retriesLeft, double delay, double delayFactor, boolean jitter) {
    this.retriesLeft = retriesLeft;
    this.delayBound = delay;
    this.delayFactor = delayFactor;
    this.jitter = jitter;
  }

  public boolean shouldRetry(Exception e) {
    if (retriesLeft <= 0) {
      return false;
    }
    if (e instanceof InterruptedIOException && !(e instanceof SocketTimeoutException)) {
      // the calling thread was interrupted, give up
      return false;
    }
    if (e instanceof IOException) {
      retriesLeft--;
      return true;
    }
    return false;
  }

  int retriesLeft() {
    return retriesLeft;
  }

  long getBackoffDelay() {
    double bound = delayBound;
    delayBound = delayBound * delayFactor;
    if (jitter) {
      return (long) (ThreadLocalRandom.current().nextDouble() * bound);
    }
    return (long) bound;
  }

  public void backoff() throws IOException {
    long delay = getBackoffDelay();
    if (delay <= 0) {
      return;
    }
    try {
      Thread.sleep(delay);
    } catch (InterruptedException e) {
      interrupted = true;
      throw new InterruptedIOException("thread interrupted");
    }
  }

  @Override
  public void close() {
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  public static class Factory {
    public static final Factory NEVER_RETRY = new Factory(1, 0, 0, false);

    private final int maxAttempts;
    private final double initialDelay;
    private final double delayFactor;
    private final boolean jitter;

    /**
     * @param maxAttempts total number of attempts, including the first one
     * @param initialDelay upper bound of the first wait, in milliseconds
     * @param delayFactor growth of the bound between consecutive waits
     * @param jitter whether waits are picked at random below the bound
     */
    public Factory(int maxAttempts, double initialDelay, double delayFactor, boolean jitter) {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
      }
      this.maxAttempts = maxAttempts;
      this.initialDelay = initialDelay;
      this.delayFactor = delayFactor;
      this.jitter = jitter;
    }

    /**
     * Jittered exponential policy whose accumulated waits stay well below {@code intervalMillis},
     * so that retrying one flush never overlaps the next one.
     */
    public static Factory withinInterval(int maxAttempts, long intervalMillis) {
      double initialDelay =
          0.618 * intervalMillis / Math.pow(GOLDEN_RATIO, Math.max(1, maxAttempts)) / 2;
      return new Factory(maxAttempts, initialDelay, GOLDEN_RATIO, true);
    }

    public HttpRetryPolicy create() {
      return new HttpRetryPolicy(maxAttempts - 1, initialDelay, delayFactor, jitter);
    }
  }
}
