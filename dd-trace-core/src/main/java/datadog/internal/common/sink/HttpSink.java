package datadog.internal.common.sink;

import static datadog.internal.common.sink.EventListener.EventType.BAD_PAYLOAD;
import static datadog.internal.common.sink.EventListener.EventType.DOWNGRADED;
import static datadog.internal.common.sink.EventListener.EventType.ERROR;
import static datadog.internal.common.sink.EventListener.EventType.OK;

import datadog.internal.communication.http.HttpRetryPolicy;
import datadog.internal.communication.http.TransportClient;
import datadog.internal.communication.http.TransportResponse;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends payloads synchronously through a {@link TransportClient}, retrying transport failures
 * according to a {@link HttpRetryPolicy}. Responses are never retried: they are mapped to events
 * for the registered listeners.
 */
public final class HttpSink implements Sink, EventListener {

  private static final Logger log = LoggerFactory.getLogger(HttpSink.class);

  private final TransportClient client;
  private final HttpRetryPolicy.Factory retryPolicyFactory;
  private final List<EventListener> listeners = new CopyOnWriteArrayList<>();

  public HttpSink(TransportClient client, HttpRetryPolicy.Factory retryPolicyFactory) {
    this.client = client;
    this.retryPolicyFactory = retryPolicyFactory;
  }

  @Override
  public void accept(int messageCount, ByteBuffer buffer) {
    int size = buffer.remaining();
    List<ByteBuffer> payload = Collections.singletonList(buffer);
    try (HttpRetryPolicy retryPolicy = retryPolicyFactory.create()) {
      handleResponse(sendWithRetries(payload, retryPolicy), messageCount, size);
    } catch (IOException e) {
      log.error(
          "Failed to submit {} bucket(s) of pathway stats to the Datadog agent at {}, dropping {}B",
          messageCount,
          client.endpoint(),
          size,
          e);
      onEvent(ERROR, String.valueOf(e.getMessage()));
    }
  }

  private TransportResponse sendWithRetries(List<ByteBuffer> payload, HttpRetryPolicy retryPolicy)
      throws IOException {
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return client.send(payload);
      } catch (IOException e) {
        if (!retryPolicy.shouldRetry(e)) {
          throw e;
        }
        log.debug("Attempt {} to reach {} failed, retrying", attempt, client.endpoint(), e);
      }
      retryPolicy.backoff();
    }
  }

  private void handleResponse(TransportResponse response, int messageCount, int size) {
    int code = response.code();
    if (code == 404) {
      log.error(
          "Datadog agent at {} does not support data streams monitoring. Upgrade to 7.34+",
          client.endpoint());
      onEvent(DOWNGRADED, "could not find endpoint");
    } else if (code >= 400 && code < 500) {
      log.error(
          "Failed to send data streams payload, {} response from Datadog agent at {}: {}",
          code,
          client.endpoint(),
          response.message());
      onEvent(BAD_PAYLOAD, response.message());
    } else if (code >= 500) {
      log.error(
          "Failed to send data streams payload, {} response from Datadog agent at {}: {}",
          code,
          client.endpoint(),
          response.message());
      onEvent(ERROR, response.message());
    } else {
      log.debug("Sent {} bucket(s), {}B to {}", messageCount, size, client.endpoint());
      onEvent(OK, "");
    }
  }

  @Override
  public void onEvent(EventType eventType, String message) {
    for (EventListener listener : listeners) {
      listener.onEvent(eventType, message);
    }
  }

  @Override
  public void register(EventListener listener) {
    this.listeners.add(listener);
  }
}
