package datadog.internal.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publish/subscribe registry owned by one {@link ExecutionContext}.
 *
 * <p>Registration and dispatch share a single lock. Dispatch copies the listeners registered for
 * the event while holding it, then invokes that snapshot without the lock, so listeners added or
 * a {@link #reset()} performed while a dispatch is in flight do not affect that dispatch.
 */
public final class EventHub {
  private static final Logger log = LoggerFactory.getLogger(EventHub.class);

  private final Object lock = new Object();
  private Map<String, List<EventListener>> listeners = new HashMap<>();

  public boolean hasListeners(String eventName) {
    synchronized (lock) {
      List<EventListener> registered = listeners.get(eventName);
      return registered != null && !registered.isEmpty();
    }
  }

  /** Appends the listener; dispatch order follows registration order. */
  public void subscribe(String eventName, EventListener listener) {
    Objects.requireNonNull(eventName, "eventName");
    Objects.requireNonNull(listener, "listener");
    synchronized (lock) {
      listeners.computeIfAbsent(eventName, name -> new ArrayList<>()).add(listener);
    }
  }

  /** Drops every registration. */
  public void reset() {
    synchronized (lock) {
      listeners = new HashMap<>();
    }
  }

  /**
   * Invokes each listener registered for the event exactly once. Errors thrown by a listener are
   * captured into the result and do not prevent the remaining listeners from running.
   */
  public DispatchResult dispatch(String eventName, Object... args) {
    List<EventListener> snapshot;
    synchronized (lock) {
      List<EventListener> registered = listeners.get(eventName);
      snapshot = registered == null ? Collections.emptyList() : new ArrayList<>(registered);
    }
    if (snapshot.isEmpty()) {
      return DispatchResult.EMPTY;
    }

    log.debug("Dispatching event {} to {} listeners", eventName, snapshot.size());
    Object[] arguments = args == null ? new Object[0] : args;
    List<Object> results = new ArrayList<>(snapshot.size());
    List<Throwable> errors = new ArrayList<>(snapshot.size());
    for (EventListener listener : snapshot) {
      Object result = null;
      Throwable error = null;
      try {
        result = listener.onEvent(arguments);
      } catch (Throwable t) {
        log.debug("Listener {} for event {} threw", listener, eventName, t);
        error = t;
      }
      results.add(result);
      errors.add(error);
    }
    return new DispatchResult(results, errors);
  }
}
