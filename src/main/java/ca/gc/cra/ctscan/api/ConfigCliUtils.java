package ca.gc.cra.ctscan.api;

import java.util.Map;

/**
 * Helpers shared by CLIs that combine {@code key=value} arguments with a YAML file.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes {@code config} (or {@code --config}) from {@code args} and returns its value.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String found = null;
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (found == null && value != null && !value.isBlank()) {
        found = value.trim();
      }
    }
    return found;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
