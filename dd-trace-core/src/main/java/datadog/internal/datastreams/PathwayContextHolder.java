package datadog.internal.datastreams;

import javax.annotation.Nullable;

/** Tracks the pathway each thread is currently part of. */
final class PathwayContextHolder {
  private final ThreadLocal<PathwayContext> current = new ThreadLocal<>();

  @Nullable
  PathwayContext get() {
    return current.get();
  }

  void set(PathwayContext pathwayContext) {
    current.set(pathwayContext);
  }
}
