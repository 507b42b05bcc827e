package ca.gc.cra.ctscan.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsPreservingOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"logKey=argon", " in = scan.ndjson ", "", "out=a=b"});

    assertEquals(List.of("logKey", "in", "out"), List.copyOf(map.keySet()));
    assertEquals("scan.ndjson", map.get("in"));
    assertEquals("a=b", map.get("out"));
  }

  @Test
  void rejectsMalformedArguments() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"logKey"}));
    assertEquals("argument must be key=value (was 'logKey')", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"logKey="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"log key=a"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"logKey=a\u0007"}));
  }

  @Test
  void cliInputSeparatesFlagsFromPairs() {
    CliInput input = CliInput.parse(new String[] {"-v", "logKey=a", "--DRY-RUN", "-h"});

    assertTrue(input.verbose());
    assertTrue(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertFalse(input.hasFlag("--force"));
    assertEquals(1, input.keyValueArgs().length);
  }

  @Test
  void configPathIsExtractedAndRemoved() {
    Map<String, String> args = new HashMap<>(Map.of("config", " ctscan.yaml ", "logKey", "a"));

    assertEquals("ctscan.yaml", ConfigCliUtils.extractConfigPath(args));
    assertFalse(args.containsKey("config"));
    assertNull(ConfigCliUtils.extractConfigPath(new HashMap<>()));
    assertTrue(ConfigCliUtils.parseBoolean(Map.of("verbose", " TRUE "), "verbose"));
  }
}
