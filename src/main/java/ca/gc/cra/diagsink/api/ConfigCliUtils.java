package ca.gc.cra.diagsink.api;

import ca.gc.cra.diagsink.config.ConfigMerger;
import ca.gc.cra.diagsink.config.DefaultsForMode;
import ca.gc.cra.diagsink.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Resolves the effective {@code key=value} configuration shared by the {@code record} and
 * {@code upload} commands: CLI arguments, then the optional YAML file, then mode defaults.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Parses the CLI arguments, loads the YAML file named by {@code config=PATH} and merges both
   * over the defaults of {@code mode}.
   *
   * @param input parsed command line
   * @param mode {@code record} or {@code upload}
   * @param warn receives override warnings
   * @return merged configuration, without the {@code config} key
   * @throws IllegalArgumentException for malformed arguments, a missing file or invalid YAML
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(CliInput input, String mode, Consumer<String> warn)
      throws IOException {
    Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), warn);
  }

  /**
   * A plan-only run is requested by {@code --dry-run} or {@code dryRun=true}.
   *
   * @param input parsed command line
   * @param effective merged configuration
   * @return {@code true} when nothing should be recorded or uploaded
   */
  static boolean isDryRun(CliInput input, Map<String, String> effective) {
    if (input.hasFlag("--dry-run")) {
      return true;
    }
    String value = effective.get("dryRun");
    return value != null && Boolean.parseBoolean(value.trim());
  }

  static String extractConfigPath(Map<String, String> args) {
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }
}
