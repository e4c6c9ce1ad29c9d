package datadog.internal.api;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TracerInfo {
  private static final Logger log = LoggerFactory.getLogger(TracerInfo.class);

  public static final String VERSION;

  static {
    String v;
    try (InputStream in =
        TracerInfo.class.getResourceAsStream("/datadog/internal/api/tracer.version")) {
      if (in == null) {
        v = "unknown";
      } else {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, UTF_8))) {
          String line = br.readLine();
          v = line == null || line.trim().isEmpty() ? "unknown" : line.trim();
        }
      }
    } catch (final Exception e) {
      log.debug("Unable to read the tracer version", e);
      v = "unknown";
    }
    VERSION = v;
  }

  private TracerInfo() {}
}
