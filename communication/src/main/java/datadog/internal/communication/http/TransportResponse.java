package datadog.internal.communication.http;

/** Status of one request to the agent, detached from the underlying connection. */
public final class TransportResponse {
  private final int code;
  private final String message;

  public TransportResponse(int code, String message) {
    this.code = code;
    this.message = message == null ? "" : message;
  }

  public int code() {
    return code;
  }

  /** Response body for failures, or status message when the body could not be read. */
  public String message() {
    return message;
  }

  public boolean isSuccessful() {
    return code >= 200 && code < 300;
  }

  @Override
  public String toString() {
    return "TransportResponse{code=" + code + ", message='" + message + "'}";
  }
}
