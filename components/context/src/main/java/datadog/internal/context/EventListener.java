package datadog.internal.context;

/**
 * Callback registered on an {@link EventHub} under an event name. Producers and consumers agree on
 * the meaning and order of {@code args} out of band, per event name.
 */
@FunctionalInterface
public interface EventListener {
  /**
   * @param args the arguments passed to {@link EventHub#dispatch(String, Object...)}.
   * @return an optional result, collected into the {@link DispatchResult}.
   * @throws Exception captured by the hub, it never reaches the dispatcher.
   */
  Object onEvent(Object... args) throws Exception;
}
