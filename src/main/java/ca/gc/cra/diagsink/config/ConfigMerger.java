package ca.gc.cra.diagsink.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing per-mode requirements.
 * <p>Keys that no command reads are kept but reported through the warning callback, so a misspelt
 * {@code rotatebytes} does not silently fall back to the default threshold.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn receives a message when a CLI key overrides a YAML key or a key is unknown
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Consumer<String> sink = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        sink.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }
    Set<String> known = DefaultsForMode.knownKeys();
    for (String key : merged.keySet()) {
      if (!known.contains(key)) {
        sink.accept("Unknown configuration key ignored: " + key);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    if ("record".equals(normalizedMode) && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required for record");
    }
    StoreMode storeMode = StoreMode.fromString(effective.get("storeMode"));
    if (storeMode == StoreMode.S3 && trim(effective.get("bucket")).isEmpty()) {
      throw new IllegalArgumentException("bucket is required when storeMode=S3");
    }
    if (storeMode == StoreMode.DIRECTORY && trim(effective.get("storeDir")).isEmpty()) {
      throw new IllegalArgumentException("storeDir is required when storeMode=DIRECTORY");
    }
    if ("upload".equals(normalizedMode) && storeMode == StoreMode.NONE) {
      throw new IllegalArgumentException("upload requires storeMode S3 or DIRECTORY");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
