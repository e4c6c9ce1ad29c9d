package datadog.internal.context;

/**
 * Controls the lifetime of an {@link ExecutionContext} made current by {@link
 * ExecutionContexts#enterScope}. Closing restores the previously current context and dispatches
 * {@code context.ended.<identifier>}, once, however many times it is closed.
 */
public interface ContextScope extends AutoCloseable {
  /** Returns the context controlled by this scope. */
  ExecutionContext context();

  /** Ends the context; use with try-with-resources so error unwinding also ends it. */
  @Override
  void close();
}
