package ca.gc.cra.ctscan.config;

import ca.gc.cra.ctscan.validation.Net;
import ca.gc.cra.ctscan.validation.Numbers;
import ca.gc.cra.ctscan.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for the {@code report} CLI: which log is scanned, where results come from and which
 * certificate store receives them.
 *
 * @param logKey identifier of the scanned log, stored with every certificate
 * @param input NDJSON file of scan results
 * @param scanBatchSize results per batch handed to the report
 * @param queueCapacity batches buffered between scanning and the store writer
 * @param storeMode certificate store backend
 * @param output NDJSON output file in {@link StoreMode#FILE} mode
 * @param kafkaBootstrap Kafka bootstrap servers, required in {@link StoreMode#KAFKA} mode
 * @param kafkaTopic Kafka topic receiving batches
 * @since 0.1.0
 */
public record ReportConfig(
    String logKey,
    Path input,
    int scanBatchSize,
    int queueCapacity,
    StoreMode storeMode,
    Path output,
    Optional<String> kafkaBootstrap,
    String kafkaTopic) {
  static final int DEFAULT_QUEUE_CAPACITY = 10;
  static final int MAX_QUEUE_CAPACITY = 65_536;
  static final int DEFAULT_SCAN_BATCH_SIZE = 1_000;
  static final int MAX_SCAN_BATCH_SIZE = 100_000;
  static final String DEFAULT_KAFKA_TOPIC = "ctscan.certs";

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException if a value is out of range or Kafka mode lacks bootstrap servers
   */
  public ReportConfig {
    logKey = Strings.requireNonBlank("logKey", logKey);
    Objects.requireNonNull(input, "input");
    Numbers.requireRange("scanBatchSize", scanBatchSize, 1, MAX_SCAN_BATCH_SIZE);
    Numbers.requireRange("queueCapacity", queueCapacity, 1, MAX_QUEUE_CAPACITY);
    Objects.requireNonNull(storeMode, "storeMode");
    Objects.requireNonNull(output, "output");
    kafkaBootstrap = Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap")
        .map(value -> Net.validateBootstrapServers("kafkaBootstrap", value));
    kafkaTopic = Strings.sanitizeTopic("kafkaTopic", kafkaTopic);
    if (storeMode == StoreMode.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when storeMode=KAFKA");
    }
  }

  /**
   * Builds a configuration from a flat key/value map such as the merged CLI, YAML and default sources.
   *
   * @param options configuration keys; {@code logKey} and {@code in} are required
   * @return validated configuration
   * @throws IllegalArgumentException if a required key is missing or a value is invalid
   */
  public static ReportConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String logKey = options.get("logKey");
    if (logKey == null || logKey.isBlank()) {
      throw new IllegalArgumentException("logKey is required");
    }
    String in = options.get("in");
    if (in == null || in.isBlank()) {
      throw new IllegalArgumentException("in is required (NDJSON scan results)");
    }
    String out = options.get("out");
    return new ReportConfig(
        logKey,
        parsePath("in", in),
        parseInt(options, "scanBatchSize", DEFAULT_SCAN_BATCH_SIZE, MAX_SCAN_BATCH_SIZE),
        parseInt(options, "queueCapacity", DEFAULT_QUEUE_CAPACITY, MAX_QUEUE_CAPACITY),
        StoreMode.fromString(options.get("storeMode")),
        out == null || out.isBlank() ? defaultOutput() : parsePath("out", out),
        optionalString(options.get("kafkaBootstrap")),
        optionalString(options.get("kafkaTopic")).orElse(DEFAULT_KAFKA_TOPIC));
  }

  static Path defaultOutput() {
    return Path.of(System.getProperty("user.home", "."), ".ctscan", "out", "certs.ndjson");
  }

  private static int parseInt(Map<String, String> options, String key, int fallback, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseIntInRange(key, raw, 1, max);
  }

  private static Optional<String> optionalString(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static Path parsePath(String key, String raw) {
    try {
      return Path.of(raw.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }
}
