package ca.gc.cra.ctscan.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Certificate store backends the reporter can write to.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum StoreMode {
  /** Keep batches in memory; nothing is persisted. */
  MEMORY,
  /** Append NDJSON records to a local file. */
  FILE,
  /** Publish one message per batch to Apache Kafka. */
  KAFKA;

  /**
   * Parses a store mode, defaulting to {@link #FILE} when blank.
   *
   * @param value text such as {@code "file"} or {@code "kafka"}
   * @return parsed mode
   * @throws IllegalArgumentException if the value does not name a mode
   */
  public static StoreMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return FILE;
    }
    try {
      return StoreMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown storeMode: " + value, ex);
    }
  }
}
