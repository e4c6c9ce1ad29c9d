package datadog.internal.communication.http;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

import datadog.internal.api.TracerInfo;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import okhttp3.ConnectionPool;
import okhttp3.ConnectionSpec;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okio.BufferedSink;
import okio.GzipSink;
import okio.Okio;

public final class OkHttpUtils {

  static final String DATADOG_META_LANG = "Datadog-Meta-Lang";
  static final String DATADOG_META_TRACER_VERSION = "Datadog-Meta-Tracer-Version";
  static final String CONTENT_ENCODING = "Content-Encoding";

  private OkHttpUtils() {}

  public static OkHttpClient buildHttpClient(final HttpUrl url, final long timeoutMillis) {
    final OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(timeoutMillis, MILLISECONDS)
            .writeTimeout(timeoutMillis, MILLISECONDS)
            .readTimeout(timeoutMillis, MILLISECONDS)
            // retries are driven by HttpRetryPolicy, not by the client
            .retryOnConnectionFailure(false)
            // a single short-lived connection, so no lingering non-daemon threads keep the JVM up
            .connectionPool(new ConnectionPool(1, 1, SECONDS));

    if (isPlainHttp(url)) {
      // force clear text when using http to avoid failures for JVMs without TLS
      builder.connectionSpecs(Collections.singletonList(ConnectionSpec.CLEARTEXT));
    }
    return builder.build();
  }

  public static Request.Builder prepareRequest(final HttpUrl url, Map<String, String> headers) {
    final Request.Builder builder =
        new Request.Builder()
            .url(url)
            .addHeader(DATADOG_META_LANG, "java")
            .addHeader(DATADOG_META_TRACER_VERSION, TracerInfo.VERSION);

    for (Map.Entry<String, String> e : headers.entrySet()) {
      builder.addHeader(e.getKey(), e.getValue());
    }
    return builder;
  }

  public static RequestBody gzippedMsgpackRequestBodyOf(List<ByteBuffer> buffers) {
    return new GZipByteBufferRequestBody(buffers);
  }

  public static boolean isPlainHttp(final HttpUrl url) {
    return url != null && "http".equalsIgnoreCase(url.scheme());
  }

  private static class ByteBufferRequestBody extends RequestBody {

    private static final MediaType MSGPACK = MediaType.get("application/msgpack");

    private final List<ByteBuffer> buffers;

    private ByteBufferRequestBody(List<ByteBuffer> buffers) {
      this.buffers = buffers;
    }

    @Override
    public long contentLength() {
      long length = 0;
      for (ByteBuffer buffer : buffers) {
        length += buffer.remaining();
      }
      return length;
    }

    @Override
    public MediaType contentType() {
      return MSGPACK;
    }

    @Override
    public void writeTo(BufferedSink sink) throws IOException {
      // duplicates keep the body replayable across retries
      for (ByteBuffer buffer : buffers) {
        ByteBuffer slice = buffer.duplicate();
        while (slice.hasRemaining()) {
          sink.write(slice);
        }
      }
    }
  }

  private static final class GZipByteBufferRequestBody extends ByteBufferRequestBody {
    private GZipByteBufferRequestBody(List<ByteBuffer> buffers) {
      super(buffers);
    }

    @Override
    public long contentLength() {
      return -1;
    }

    @Override
    public void writeTo(BufferedSink sink) throws IOException {
      BufferedSink gzipSink = Okio.buffer(new GzipSink(sink));
      super.writeTo(gzipSink);
      gzipSink.close();
    }
  }
}
