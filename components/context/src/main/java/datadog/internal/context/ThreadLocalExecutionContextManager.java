package datadog.internal.context;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link ExecutionContextManager} that uses a {@link ThreadLocal} to track context per thread. */
final class ThreadLocalExecutionContextManager implements ExecutionContextManager {
  private static final Logger log =
      LoggerFactory.getLogger(ThreadLocalExecutionContextManager.class);

  private final ExecutionContext root = ExecutionContext.root();

  private final ThreadLocal<ExecutionContext[]> currentHolder =
      ThreadLocal.withInitial(() -> new ExecutionContext[] {root});

  @Override
  public ExecutionContext root() {
    return root;
  }

  @Override
  public ExecutionContext current() {
    return currentHolder.get()[0];
  }

  @Override
  public ContextScope attach(ExecutionContext context) {
    ExecutionContext[] holder = currentHolder.get();
    ExecutionContext previous = holder[0];
    holder[0] = context;
    return new ContextScope() {
      private final AtomicBoolean closed = new AtomicBoolean();

      @Override
      public ExecutionContext context() {
        return context;
      }

      @Override
      public void close() {
        if (!closed.compareAndSet(false, true)) {
          return;
        }
        if (holder[0] == context) {
          holder[0] = previous;
        } else {
          log.debug(
              "{} ended while {} was current, current context left unchanged", context, holder[0]);
        }
        // listeners registered by the enclosing scope observe the end
        holder[0].eventHub().dispatch(context.endedEventName());
      }
    };
  }
}
