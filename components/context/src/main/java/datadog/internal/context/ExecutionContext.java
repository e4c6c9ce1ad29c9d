package datadog.internal.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.annotation.Nullable;

/**
 * Node of the execution context tree: a named unit of operation-local state with its own {@link
 * EventHub}.
 *
 * <p>Attaching a parent copies the parent's accumulated data into this context at attach time, so
 * later changes to the parent's existing keys are not visible here. Lookups check this context's
 * own data first and then walk the parent chain, never reading the data of the root context.
 *
 * <p>Parent and child links are append-only and can be read from any thread. Own data is meant to
 * be written by the execution unit the context belongs to.
 */
public final class ExecutionContext {
  public static final String ROOT_CONTEXT_ID = "__root";
  static final String CONTEXT_ENDED_PREFIX = "context.ended.";

  private final String identifier;
  private final Map<String, Object> data = Collections.synchronizedMap(new HashMap<>());
  private final List<ExecutionContext> parents = new CopyOnWriteArrayList<>();
  private final List<ExecutionContext> children = new CopyOnWriteArrayList<>();
  private final EventHub eventHub = new EventHub();

  ExecutionContext(String identifier) {
    this.identifier = Objects.requireNonNull(identifier, "identifier");
  }

  ExecutionContext(
      String identifier,
      @Nullable ExecutionContext parent,
      @Nullable Map<String, ?> initialData) {
    this(identifier);
    if (parent != null) {
      addParent(parent);
    }
    if (initialData != null) {
      data.putAll(initialData);
    }
  }

  static ExecutionContext root() {
    return new ExecutionContext(ROOT_CONTEXT_ID);
  }

  public String getIdentifier() {
    return identifier;
  }

  public boolean isRoot() {
    return ROOT_CONTEXT_ID.equals(identifier);
  }

  public List<ExecutionContext> parents() {
    return Collections.unmodifiableList(parents);
  }

  /** The first parent attached, or {@code null} for the root and for detached contexts. */
  @Nullable
  public ExecutionContext parent() {
    return parents.isEmpty() ? null : parents.get(0);
  }

  public List<ExecutionContext> children() {
    return Collections.unmodifiableList(children);
  }

  public EventHub eventHub() {
    return eventHub;
  }

  /**
   * Attaches a parent and merges a copy of its data into this context.
   *
   * @throws IllegalStateException if this is the root context.
   */
  public void addParent(ExecutionContext parent) {
    Objects.requireNonNull(parent, "parent");
    if (isRoot()) {
      throw new IllegalStateException("Cannot add parent to root context");
    }
    parents.add(parent);
    if (parent.isRoot()) {
      return;
    }
    Map<String, Object> snapshot;
    synchronized (parent.data) {
      snapshot = new HashMap<>(parent.data);
    }
    data.putAll(snapshot);
  }

  /** Records the child and attaches this context as one of its parents. */
  public void addChild(ExecutionContext child) {
    Objects.requireNonNull(child, "child");
    child.addParent(this);
    children.add(child);
  }

  // the parent link is already set by the constructor
  void recordChild(ExecutionContext child) {
    children.add(child);
  }

  @Nullable
  public Object getItem(String key) {
    ExecutionContext current = this;
    while (current != null && !current.isRoot()) {
      synchronized (current.data) {
        if (current.data.containsKey(key)) {
          return current.data.get(key);
        }
      }
      current = current.parent();
    }
    return null;
  }

  /** One value per key, {@code null} where absent, in the order of {@code keys}. */
  public List<Object> getItems(List<String> keys) {
    List<Object> values = new ArrayList<>(keys.size());
    for (String key : keys) {
      values.add(getItem(key));
    }
    return values;
  }

  /** Sets the value in this context's own data only, never in an ancestor. */
  public void setItem(String key, @Nullable Object value) {
    Objects.requireNonNull(key, "key");
    data.put(key, value);
  }

  public void setItems(Map<String, ?> keysValues) {
    for (Map.Entry<String, ?> entry : keysValues.entrySet()) {
      setItem(entry.getKey(), entry.getValue());
    }
  }

  String endedEventName() {
    return CONTEXT_ENDED_PREFIX + identifier;
  }

  @Override
  public String toString() {
    return "ExecutionContext '" + identifier + "'";
  }
}
