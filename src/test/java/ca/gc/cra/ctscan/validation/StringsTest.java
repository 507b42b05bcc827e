package ca.gc.cra.ctscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("argon2024", Strings.requireNonBlank("logKey", "  argon2024 "));
  }

  @Test
  void requireNonBlankRejectsNullBlankAndControlCharacters() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("logKey", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("logKey", "   "));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("logKey", "log\nkey"));
    assertEquals("logKey must not contain control characters", ex.getMessage());
  }

  @Test
  void sanitizeTopicEnforcesKafkaNaming() {
    assertEquals("ctscan.certs_v2-a", Strings.sanitizeTopic("kafkaTopic", " ctscan.certs_v2-a "));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("kafkaTopic", "certs/out"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("kafkaTopic", "a".repeat(250)));
  }
}
