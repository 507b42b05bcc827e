package ca.gc.cra.ctscan.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened default configuration per CLI mode; the lowest-precedence source for {@link ConfigMerger}.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "metricsExporter", "",
      "otelEndpoint", "",
      "otelResourceAttributes", "",
      "verbose", "false");

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common telemetry defaults.
   *
   * @param mode CLI mode; only {@code report} is supported
   * @return unmodifiable map of defaults
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    if (!"report".equals(normalized)) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.put("logKey", "");
    defaults.put("in", "");
    defaults.put("scanBatchSize", Integer.toString(ReportConfig.DEFAULT_SCAN_BATCH_SIZE));
    defaults.put("queueCapacity", Integer.toString(ReportConfig.DEFAULT_QUEUE_CAPACITY));
    defaults.put("storeMode", StoreMode.FILE.name());
    defaults.put("out", ReportConfig.defaultOutput().toString());
    defaults.put("kafkaBootstrap", "");
    defaults.put("kafkaTopic", ReportConfig.DEFAULT_KAFKA_TOPIC);
    return Map.copyOf(defaults);
  }
}
