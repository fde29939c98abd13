package ca.gc.cra.diagsink.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads sink configuration from YAML. The {@code common} section applies to every command and the
 * section named after the active command ({@code record} or {@code upload}) overrides it. Nested
 * keys are flattened with dots; a list of scalars becomes a comma separated value.
 * <pre>
 * common:
 *   out: /var/tmp/bench
 *   hostId: bench01
 * record:
 *   rotateBytes: 50000000
 *   kafkaBootstrap: broker:9092
 * upload:
 *   otelResourceAttributes: [service.name=diagsink, env=perf]
 * </pre>
 */
public final class YamlConfigLoader {
  private static final Set<String> SECTIONS = Set.of("common", "record", "upload");
  private static final int MAX_ALIASES = 16;

  private YamlConfigLoader() {}

  /**
   * Loads the sections that apply to {@code mode}.
   *
   * @param path YAML file
   * @param mode command whose section overrides {@code common}
   * @return flat key/value map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException for malformed YAML, unknown sections or unsupported values
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String command = mode.trim().toLowerCase(Locale.ROOT);

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : asMap(document, path.getFileName().toString()).entrySet()) {
      String name = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(name)) {
        throw new IllegalArgumentException(
            "Unknown YAML section '" + entry.getKey() + "'; expected one of common, record, upload");
      }
      sections.put(name, entry.getValue());
    }

    Map<String, String> flattened = new LinkedHashMap<>();
    for (String name : List.of("common", command)) {
      Object section = sections.get(name);
      if (section != null) {
        flatten(asMap(section, name), "", flattened);
      }
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Yaml newYaml() {
    LoaderOptions options = new LoaderOptions();
    options.setMaxAliasesForCollections(MAX_ALIASES);
    options.setAllowDuplicateKeys(false);
    return new Yaml(new SafeConstructor(options));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(key, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, key), key, target);
      } else if (value instanceof List<?> items) {
        target.put(key, joinScalars(key, items));
      } else {
        target.put(key, value.toString());
      }
    }
  }

  private static String joinScalars(String key, List<?> items) {
    List<String> parts = new ArrayList<>(items.size());
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException("Only lists of scalars are supported for key " + key);
      }
      parts.add(item.toString().trim());
    }
    return String.join(",", parts);
  }
}
