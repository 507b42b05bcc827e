package ca.gc.cra.ctscan.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active CLI mode
   * @param yaml settings loaded from the YAML file, if any
   * @param cli {@code key=value} overrides from the command line; may be {@code null}
   * @param defaults defaults for the mode; may be {@code null}
   * @param warn receives a message for each CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlValues.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String storeMode = effective.get("storeMode");
    if (storeMode != null && storeMode.trim().equalsIgnoreCase(StoreMode.KAFKA.name())) {
      String bootstrap = effective.get("kafkaBootstrap");
      if (bootstrap == null || bootstrap.isBlank()) {
        throw new IllegalArgumentException("kafkaBootstrap is required when storeMode=KAFKA");
      }
    }
  }
}
