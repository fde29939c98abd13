package ca.gc.cra.diagsink.config;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();
  private static final Set<String> KNOWN_KEYS = buildKnownKeys();

  private DefaultsForMode() {}

  /**
   * Returns defaults for the requested mode merged with common defaults.
   *
   * @param mode {@code record} or {@code upload}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "record" -> buildRecordDefaults();
      case "upload" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  /**
   * Every key read by any command, plus {@code dryRun}.
   *
   * @return unmodifiable key set
   */
  public static Set<String> knownKeys() {
    return KNOWN_KEYS;
  }

  private static Set<String> buildKnownKeys() {
    Set<String> keys = new HashSet<>(COMMON_DEFAULTS.keySet());
    keys.addAll(buildRecordDefaults().keySet());
    keys.add("dryRun");
    return Set.copyOf(keys);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("otelExportIntervalMs", "30000");
    map.put("out", ".");
    map.put("fileBase", SinkConfig.DEFAULT_FILE_BASE);
    map.put("hostId", "");
    map.put("storePrefix", "");
    map.put("storeMode", StoreMode.S3.name());
    map.put("bucket", SinkConfig.DEFAULT_BUCKET);
    map.put("s3Region", "");
    map.put("s3Endpoint", "");
    map.put("createBucket", "true");
    map.put("storeDir", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRecordDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("rotateBytes", Long.toString(SinkConfig.DEFAULT_ROTATE_BYTES));
    map.put("checkIntervalMs", Long.toString(SinkConfig.DEFAULT_CHECK_INTERVAL_MS));
    map.put("reclaimIntervalMs", "");
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", SinkConfig.DEFAULT_KAFKA_TOPIC);
    return map;
  }
}
