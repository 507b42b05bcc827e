package ca.gc.cra.ctscan.logging;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Helpers that keep operator-supplied text short enough for log lines.
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {}

  /**
   * Truncates {@code value} to at most {@code maxBytes} UTF-8 bytes, marking the cut.
   * A code point split by the limit is dropped.
   *
   * @param value text to shorten; {@code null} becomes {@code <null>}
   * @param maxBytes byte budget; must be positive
   * @return {@code value} unchanged when it fits, otherwise the prefix plus {@code ...(N bytes)}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    String prefix;
    try {
      prefix = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.IGNORE)
          .onUnmappableCharacter(CodingErrorAction.IGNORE)
          .decode(ByteBuffer.wrap(bytes, 0, maxBytes))
          .toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "...(" + bytes.length + " bytes)";
  }
}
