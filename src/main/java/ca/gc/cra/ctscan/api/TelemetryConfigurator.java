package ca.gc.cra.ctscan.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies telemetry settings into the {@code otel.*} system properties read by the metrics bootstrap.
 * Must run before the metrics adapter is created.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}. Blank values
   * leave the corresponding property untouched.
   *
   * @param settings effective configuration
   * @throws IllegalArgumentException if a value is invalid
   */
  static void configureMetrics(Map<String, String> settings) {
    if (settings == null || settings.isEmpty()) {
      return;
    }
    String exporter = trimmed(settings.get("metricsExporter"));
    if (!exporter.isEmpty()) {
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      System.setProperty("otel.metrics.exporter", normalized);
      log.debug("Metrics exporter set to {}", normalized);
    }
    String endpoint = trimmed(settings.get("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
      log.debug("OTLP endpoint set to {}", endpoint);
    }
    String attributes = trimmed(settings.get("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      if (attributes.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
        throw new IllegalArgumentException(
            "otelResourceAttributes length must be <= " + MAX_RESOURCE_ATTRIBUTES_LENGTH);
      }
      for (int i = 0; i < attributes.length(); i++) {
        char c = attributes.charAt(i);
        if (c < 0x20 || c > 0x7E) {
          throw new IllegalArgumentException("otelResourceAttributes must contain printable ASCII characters");
        }
      }
      System.setProperty("otel.resource.attributes", attributes);
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
