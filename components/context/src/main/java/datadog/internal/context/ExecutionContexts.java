package datadog.internal.context;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Entry point to the execution context tree of the process.
 *
 * <p>Every thread starts at the shared {@link #rootContext() root}. {@link #enterScope} pushes a
 * new context below the thread's current one, and closing the returned {@link ContextScope} pops
 * it. The event functions act on the hub of the calling thread's current context.
 *
 * <pre>{@code
 * try (ContextScope scope = ExecutionContexts.enterScope("kafka.consume", data)) {
 *   Object value = ExecutionContexts.getItem("topic");
 * }
 * }</pre>
 */
public final class ExecutionContexts {
  private static final ExecutionContextManager MANAGER = new ThreadLocalExecutionContextManager();

  private ExecutionContexts() {}

  public static ExecutionContext rootContext() {
    return MANAGER.root();
  }

  public static ExecutionContext currentContext() {
    return MANAGER.current();
  }

  /** Creates a detached context whose parent is the calling thread's current context. */
  public static ExecutionContext createContext(String identifier) {
    return createContext(identifier, null, null);
  }

  /**
   * Creates a context without making it current.
   *
   * @param parent the parent, or {@code null} for the calling thread's current context.
   * @param initialData own data applied after the parent's data has been copied.
   * @throws IllegalArgumentException when asked for a second root below a parent.
   */
  public static ExecutionContext createContext(
      String identifier, @Nullable ExecutionContext parent, @Nullable Map<String, ?> initialData) {
    if (ExecutionContext.ROOT_CONTEXT_ID.equals(identifier)) {
      throw new IllegalArgumentException("Cannot create a root context with a parent");
    }
    return new ExecutionContext(
        identifier, parent != null ? parent : MANAGER.current(), initialData);
  }

  public static ContextScope enterScope(String identifier) {
    return enterScope(identifier, null, null);
  }

  public static ContextScope enterScope(String identifier, @Nullable Map<String, ?> initialData) {
    return enterScope(identifier, null, initialData);
  }

  /**
   * Creates a context below {@code parent} (or the current context) and makes it current until the
   * returned scope is closed. The new context is listed among the children of its parent, unless
   * that parent is the process root.
   */
  public static ContextScope enterScope(
      String identifier, @Nullable ExecutionContext parent, @Nullable Map<String, ?> initialData) {
    ExecutionContext context = createContext(identifier, parent, initialData);
    ExecutionContext linked = context.parent();
    if (linked != null && !linked.isRoot()) {
      linked.recordChild(context);
    }
    return MANAGER.attach(context);
  }

  @Nullable
  public static Object getItem(String key) {
    return MANAGER.current().getItem(key);
  }

  @Nullable
  public static Object getItem(String key, @Nullable ExecutionContext context) {
    return (context != null ? context : MANAGER.current()).getItem(key);
  }

  public static List<Object> getItems(List<String> keys) {
    return MANAGER.current().getItems(keys);
  }

  public static void setItem(String key, @Nullable Object value) {
    setItem(key, value, null);
  }

  public static void setItem(
      String key, @Nullable Object value, @Nullable ExecutionContext context) {
    (context != null ? context : MANAGER.current()).setItem(key, value);
  }

  public static void setItems(Map<String, ?> keysValues) {
    MANAGER.current().setItems(keysValues);
  }

  public static boolean hasListeners(String eventName) {
    return MANAGER.current().eventHub().hasListeners(eventName);
  }

  public static void on(String eventName, EventListener listener) {
    MANAGER.current().eventHub().subscribe(eventName, listener);
  }

  public static DispatchResult dispatch(String eventName, Object... args) {
    return MANAGER.current().eventHub().dispatch(eventName, args);
  }

  /** Clears the hubs of the current context and all of its ancestors. */
  public static void resetListeners() {
    ExecutionContext current = MANAGER.current();
    while (current != null) {
      current.eventHub().reset();
      current = current.parent();
    }
  }
}
