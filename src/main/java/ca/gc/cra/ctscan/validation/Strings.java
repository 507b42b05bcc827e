package ca.gc.cra.ctscan.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation for identifiers such as log keys and Kafka topics.
 * <p><strong>Why:</strong> Log keys end up in store records and message keys; control characters or
 * blank values would corrupt them.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final int MAX_TOPIC_LENGTH = 249;

  private Strings() {}

  /**
   * Ensures a value is present, not blank and free of control characters.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name parameter name for diagnostics
   * @param topic candidate topic
   * @return trimmed topic matching {@code [A-Za-z0-9._-]{1,249}}
   * @throws NullPointerException if {@code topic} is {@code null}
   * @throws IllegalArgumentException if the topic is blank, too long or uses other characters
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (sanitized.length() > MAX_TOPIC_LENGTH) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + MAX_TOPIC_LENGTH);
    }
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(
          label(name) + " must only contain letters, digits, dot, underscore, or hyphen");
    }
    return sanitized;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
