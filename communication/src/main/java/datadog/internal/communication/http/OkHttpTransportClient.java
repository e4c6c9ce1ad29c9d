package datadog.internal.communication.http;

import static datadog.internal.communication.http.OkHttpUtils.CONTENT_ENCODING;
import static datadog.internal.communication.http.OkHttpUtils.buildHttpClient;
import static datadog.internal.communication.http.OkHttpUtils.gzippedMsgpackRequestBodyOf;
import static datadog.internal.communication.http.OkHttpUtils.prepareRequest;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public final class OkHttpTransportClient implements TransportClient {

  private final OkHttpClient client;
  private final HttpUrl url;
  private final Map<String, String> headers;

  public OkHttpTransportClient(String agentUrl, String path, long timeoutSeconds) {
    this(
        agentUrl,
        path,
        buildHttpClient(HttpUrl.get(agentUrl), TimeUnit.SECONDS.toMillis(timeoutSeconds)));
  }

  OkHttpTransportClient(String agentUrl, String path, OkHttpClient client) {
    this(client, HttpUrl.get(agentUrl).resolve(path), Collections.emptyMap());
  }

  public OkHttpTransportClient(OkHttpClient client, HttpUrl url, Map<String, String> headers) {
    if (url == null) {
      throw new IllegalArgumentException("invalid endpoint url");
    }
    this.client = client;
    this.url = url;
    this.headers = new HashMap<>(headers);
    this.headers.put(CONTENT_ENCODING, "gzip");
  }

  @Override
  public TransportResponse send(List<ByteBuffer> payload) throws IOException {
    Request request =
        prepareRequest(url, headers).post(gzippedMsgpackRequestBodyOf(payload)).build();
    try (Response response = client.newCall(request).execute()) {
      if (response.isSuccessful()) {
        return new TransportResponse(response.code(), response.message());
      }
      ResponseBody body = response.body();
      String message = body != null ? body.string() : response.message();
      return new TransportResponse(response.code(), message);
    }
  }

  @Override
  public String endpoint() {
    return url.toString();
  }
}
