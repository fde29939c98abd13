package ca.gc.cra.diagsink.config;

import ca.gc.cra.diagsink.validation.Net;
import ca.gc.cra.diagsink.validation.Numbers;
import ca.gc.cra.diagsink.validation.Strings;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for one diagnostics sink.
 * <p><strong>Why:</strong> Collects CLI, YAML and default values into typed fields before any file
 * or network resource is opened.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param outputDirectory directory holding local segments
 * @param fileBase base segment file name
 * @param rotateBytes size threshold that triggers rotation
 * @param checkInterval rotation monitor tick
 * @param reclaimInterval minimum time between reclaim passes
 * @param hostId host identifier used in object names
 * @param storePrefix optional object key prefix; empty when unset
 * @param storeMode upload destination
 * @param bucket S3 bucket
 * @param s3Region optional S3 region override
 * @param s3Endpoint optional S3 endpoint override
 * @param createBucket whether to create the bucket when missing
 * @param storeDirectory target directory for {@link StoreMode#DIRECTORY}
 * @param kafkaBootstrap optional Kafka bootstrap servers for the event source
 * @param kafkaTopic latency event topic
 * @since 0.1.0
 */
public record SinkConfig(
    Path outputDirectory,
    String fileBase,
    long rotateBytes,
    Duration checkInterval,
    Duration reclaimInterval,
    String hostId,
    String storePrefix,
    StoreMode storeMode,
    String bucket,
    Optional<String> s3Region,
    Optional<String> s3Endpoint,
    boolean createBucket,
    Optional<Path> storeDirectory,
    Optional<String> kafkaBootstrap,
    String kafkaTopic) {

  public static final String DEFAULT_FILE_BASE = "BenchmarkDiagnostics.out";
  public static final long DEFAULT_ROTATE_BYTES = 100_000_000L;
  public static final long DEFAULT_CHECK_INTERVAL_MS = 5_000L;
  public static final String DEFAULT_BUCKET = "diagnostics";
  public static final String DEFAULT_KAFKA_TOPIC = "benchmark.latency";

  static final long MIN_ROTATE_BYTES = 1L;
  static final long MIN_INTERVAL_MS = 10L;
  static final long MAX_INTERVAL_MS = 3_600_000L;
  private static final int MAX_PREFIX_LENGTH = 512;

  public SinkConfig {
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    fileBase = Strings.requireNonBlank("fileBase", fileBase);
    if (fileBase.indexOf('/') >= 0 || fileBase.indexOf('\\') >= 0) {
      throw new IllegalArgumentException("fileBase must be a file name, not a path");
    }
    Numbers.requireRange("rotateBytes", rotateBytes, MIN_ROTATE_BYTES, Long.MAX_VALUE);
    Objects.requireNonNull(checkInterval, "checkInterval");
    Objects.requireNonNull(reclaimInterval, "reclaimInterval");
    hostId = Strings.requireHostId("hostId", hostId);
    storePrefix = storePrefix == null ? "" : storePrefix.trim();
    storeMode = storeMode == null ? StoreMode.S3 : storeMode;
    bucket = Strings.requireBucketName("bucket", bucket == null || bucket.isBlank() ? DEFAULT_BUCKET : bucket);
    s3Region = Objects.requireNonNullElse(s3Region, Optional.empty());
    s3Endpoint = Objects.requireNonNullElse(s3Endpoint, Optional.empty());
    storeDirectory = Objects.requireNonNullElse(storeDirectory, Optional.empty());
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.empty());
    kafkaTopic = Strings.sanitizeTopic("kafkaTopic", kafkaTopic == null ? DEFAULT_KAFKA_TOPIC : kafkaTopic);
    if (storeMode == StoreMode.DIRECTORY && storeDirectory.isEmpty()) {
      throw new IllegalArgumentException("storeDir is required when storeMode=DIRECTORY");
    }
  }

  /**
   * Returns defaults: segments in the working directory, 100 MB rotation, 5 s checks, S3 upload.
   *
   * @return default configuration
   */
  public static SinkConfig defaults() {
    Duration interval = Duration.ofMillis(DEFAULT_CHECK_INTERVAL_MS);
    return new SinkConfig(
        Path.of(".").toAbsolutePath().normalize(),
        DEFAULT_FILE_BASE,
        DEFAULT_ROTATE_BYTES,
        interval,
        interval,
        defaultHostId(),
        "",
        StoreMode.S3,
        DEFAULT_BUCKET,
        Optional.empty(),
        Optional.empty(),
        true,
        Optional.empty(),
        Optional.empty(),
        DEFAULT_KAFKA_TOPIC);
  }

  /**
   * Builds a configuration from flat key/value pairs; missing keys take defaults.
   *
   * @param args flattened configuration; {@code null} yields defaults
   * @return validated configuration
   * @throws IllegalArgumentException if any value is invalid
   */
  public static SinkConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : args;
    SinkConfig defaults = defaults();

    Path out = parseOptionalPath("out", kv.get("out")).orElse(defaults.outputDirectory());
    String fileBase = nonBlankOr(kv.get("fileBase"), defaults.fileBase());
    long rotateBytes = Numbers.parseBoundedLong(
        "rotateBytes", kv.get("rotateBytes"), DEFAULT_ROTATE_BYTES, MIN_ROTATE_BYTES, Long.MAX_VALUE);
    long checkMs = Numbers.parseBoundedLong(
        "checkIntervalMs", kv.get("checkIntervalMs"), DEFAULT_CHECK_INTERVAL_MS, MIN_INTERVAL_MS, MAX_INTERVAL_MS);
    long reclaimMs = Numbers.parseBoundedLong(
        "reclaimIntervalMs", kv.get("reclaimIntervalMs"), checkMs, 0L, MAX_INTERVAL_MS);
    String hostId = nonBlankOr(kv.get("hostId"), defaults.hostId());
    String prefix = kv.get("storePrefix");
    if (prefix != null && !prefix.isBlank()) {
      prefix = Strings.requirePrintableAscii("storePrefix", prefix, MAX_PREFIX_LENGTH);
    }
    StoreMode storeMode = StoreMode.fromString(kv.get("storeMode"));
    String bucket = nonBlankOr(kv.get("bucket"), DEFAULT_BUCKET);
    Optional<String> region = optionalText(kv.get("s3Region")).map(v -> v.toLowerCase(Locale.ROOT));
    Optional<String> endpoint = optionalText(kv.get("s3Endpoint"))
        .map(v -> Net.validateHttpEndpoint("s3Endpoint", v));
    boolean createBucket = parseBoolean(kv.get("createBucket"), true);
    Optional<Path> storeDir = parseOptionalPath("storeDir", kv.get("storeDir"));
    Optional<String> bootstrap = optionalText(kv.get("kafkaBootstrap")).map(Net::validateBootstrapServers);
    String topic = nonBlankOr(kv.get("kafkaTopic"), DEFAULT_KAFKA_TOPIC);

    return new SinkConfig(
        out,
        fileBase,
        rotateBytes,
        Duration.ofMillis(checkMs),
        Duration.ofMillis(reclaimMs),
        hostId,
        prefix,
        storeMode,
        bucket,
        region,
        endpoint,
        createBucket,
        storeDir,
        bootstrap,
        topic);
  }

  /**
   * Resolves the local host name, replacing characters that are not valid in object names.
   *
   * @return host identifier; {@code "localhost"} when the name cannot be resolved
   */
  static String defaultHostId() {
    String name;
    try {
      name = InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      name = System.getenv("HOSTNAME");
    }
    if (name == null || name.isBlank()) {
      return "localhost";
    }
    String cleaned = name.trim().replaceAll("[^A-Za-z0-9._-]", "-");
    return cleaned.isEmpty() ? "localhost" : cleaned;
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static String nonBlankOr(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  private static Optional<String> optionalText(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static Optional<Path> parseOptionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
