package datadog.internal.context;

/** Tracks the current {@link ExecutionContext} of each execution unit. */
public interface ExecutionContextManager {
  /**
   * Returns the context attached to the current execution unit.
   *
   * @return the attached context; the process root if there is none.
   */
  ExecutionContext current();

  /**
   * Makes the given context current for the calling execution unit.
   *
   * @param context the context to attach.
   * @return a scope to be closed when the context ends.
   */
  ContextScope attach(ExecutionContext context);

  /** The process-wide root every execution unit starts from. */
  ExecutionContext root();
}
