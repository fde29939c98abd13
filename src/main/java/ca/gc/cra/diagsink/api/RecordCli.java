package ca.gc.cra.diagsink.api;

import ca.gc.cra.diagsink.application.port.LatencyEventSource;
import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.application.port.ObjectStorePort;
import ca.gc.cra.diagsink.application.sink.DiagnosticSink;
import ca.gc.cra.diagsink.config.CompositionRoot;
import ca.gc.cra.diagsink.config.SinkConfig;
import ca.gc.cra.diagsink.config.StoreMode;
import ca.gc.cra.diagsink.domain.segment.UploadReport;
import ca.gc.cra.diagsink.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.diagsink.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records latency events from Kafka into rotating segments until the JVM is asked to stop, then
 * drains the sink and uploads every segment.
 *
 * @since 0.1.0
 */
public final class RecordCli {
  private static final Logger log = LoggerFactory.getLogger(RecordCli.class);
  private static final Duration FINALIZE_TIMEOUT = Duration.ofMinutes(10);
  private static final String SUMMARY_USAGE =
      "usage: record kafkaBootstrap=HOST:PORT [kafkaTopic=TOPIC] [out=DIR] [fileBase=NAME] "
          + "[rotateBytes=N] [checkIntervalMs=N] [reclaimIntervalMs=N] [hostId=ID] [storePrefix=P] "
          + "[storeMode=S3|DIRECTORY|NONE] [bucket=NAME] [storeDir=DIR] [config=PATH] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      diagsink record

      Usage:
        record kafkaBootstrap=localhost:9092 [options]

      Required:
        kafkaBootstrap=HOST:PORT   Kafka bootstrap servers supplying latency events

      Optional (validated):
        kafkaTopic=TOPIC           Latency event topic (default benchmark.latency)
        out=DIR                    Segment directory (default .)
        fileBase=NAME              Base segment file name (default BenchmarkDiagnostics.out)
        rotateBytes=N              Rotate once the active segment reaches N bytes (default 100000000)
        checkIntervalMs=N          Rotation check interval (default 5000)
        reclaimIntervalMs=N        Minimum time between closing retired segments (default checkIntervalMs)
        hostId=ID                  Host identifier in object names (default local host name)
        storePrefix=PREFIX         Object key prefix
        storeMode=S3|DIRECTORY|NONE  Upload destination on shutdown; NONE keeps segments local
        bucket=NAME                S3 bucket (default diagnostics)
        s3Region=REGION            S3 region override
        s3Endpoint=URL             S3 endpoint override (path-style access)
        createBucket=true|false    Create the bucket when missing (default true)
        storeDir=DIR               Target directory when storeMode=DIRECTORY
        config=PATH                YAML file with common/record sections
        --dry-run                  Validate inputs and print plan without recording
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        otelExportIntervalMs=MS    Metrics export period (default 30000)
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        Stop recording with SIGINT or SIGTERM; segments are uploaded before the JVM exits.
        Rerun with the upload command to retry segments that failed to upload.
      """;

  private RecordCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the record CLI logic using structured logging and exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for record CLI");
    }

    SinkConfig config;
    TelemetrySettings telemetry;
    boolean dryRun;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(input, "record", log::warn);
      dryRun = ConfigCliUtils.isDryRun(input, effective);
      telemetry = TelemetryConfigurator.fromConfig(effective);
      config = SinkConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid record arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    if (dryRun) {
      printDryRunPlan(config, telemetry);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = TelemetryConfigurator.createMetrics(telemetry);
    CountDownLatch stopRequested = new CountDownLatch(1);
    CountDownLatch finalized = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      stopRequested.countDown();
      awaitFinalization(finalized);
    }, "diagsink-shutdown"));

    try {
      log.info(
          "Configured record pipeline: topic={}, out={}, rotateBytes={}, storeMode={}",
          config.kafkaTopic(),
          config.outputDirectory(),
          config.rotateBytes(),
          config.storeMode());
      return record(new CompositionRoot(config, metrics), stopRequested);
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Record configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Record pipeline I/O failure in {}", config.outputDirectory(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in record pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in record pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      TelemetryConfigurator.closeMetrics(metrics);
      finalized.countDown();
    }
  }

  /**
   * Runs one recording session until {@code stopRequested} is released, then finalizes the sink.
   *
   * @param root component factory
   * @param stopRequested released when the process should stop recording
   * @return outcome of the session
   * @throws Exception if wiring, recording or uploading fails
   */
  static ExitCode record(CompositionRoot root, CountDownLatch stopRequested) throws Exception {
    SinkConfig config = root.config();
    try (ObjectStorePort store = root.objectStore()) {
      // Resolved before the sink so a wiring error never leaves the base segment open.
      LatencyEventSource source = root.kafkaEventSource();
      DiagnosticSink sink;
      try {
        sink = root.diagnosticSink(store);
      } catch (Exception ex) {
        closeAfterFailure(source, ex);
        throw ex;
      }
      boolean interrupted = false;
      try (source) {
        source.subscribe(sink);
        sink.start();
        source.start();
        log.info("Recording diagnostics into {}; stop the process to upload", config.outputDirectory());
        stopRequested.await();
        log.info("Shutdown requested; finalizing diagnostics");
      } catch (InterruptedException ex) {
        // Flag restored after finalizing so the upload is not cut short.
        interrupted = true;
        log.warn("Recording interrupted; finalizing diagnostics");
      } catch (Exception ex) {
        sink.close();
        throw ex;
      }

      ExitCode outcome = finish(config, store, sink);
      if (interrupted) {
        Thread.currentThread().interrupt();
        return ExitCode.INTERRUPTED;
      }
      return outcome;
    }
  }

  private static void closeAfterFailure(LatencyEventSource source, Exception failure) {
    try {
      source.close();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      failure.addSuppressed(ex);
    } catch (Exception ex) {
      failure.addSuppressed(ex);
    }
  }

  private static ExitCode finish(SinkConfig config, ObjectStorePort store, DiagnosticSink sink)
      throws IOException {
    if (sink.droppedCount() > 0) {
      log.warn("{} diagnostics record(s) were dropped during the run", sink.droppedCount());
    }
    if (config.storeMode() == StoreMode.NONE) {
      sink.close();
      log.info("Upload disabled; segments kept in {}", config.outputDirectory());
      return ExitCode.SUCCESS;
    }
    UploadReport report = sink.uploadDiagnostics();
    CliPrinter.printUploadReport(report, store.describe());
    if (!report.isComplete()) {
      log.error(
          "{} of {} segment(s) failed to upload to {}; rerun upload to retry",
          report.failed().size(),
          report.attempted(),
          store.describe());
    }
    return ExitCode.forUpload(report);
  }

  private static void awaitFinalization(CountDownLatch finalized) {
    try {
      if (!finalized.await(FINALIZE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Diagnostics finalization did not complete within {} s", FINALIZE_TIMEOUT.toSeconds());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Shutdown hook interrupted before diagnostics were finalized");
    }
  }

  private static void printDryRunPlan(SinkConfig config, TelemetrySettings telemetry) {
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Kafka bootstrap", config.kafkaBootstrap().orElse("<none>"));
    rows.put("Kafka topic", config.kafkaTopic());
    rows.put("Segment directory", config.outputDirectory().toString());
    rows.put("Base file", config.fileBase());
    rows.put("Rotate bytes", Long.toString(config.rotateBytes()));
    rows.put("Check interval", config.checkInterval().toMillis() + " ms");
    rows.put("Reclaim interval", config.reclaimInterval().toMillis() + " ms");
    rows.put("Host id", config.hostId());
    rows.put("Store mode", config.storeMode().name());
    rows.put("Destination", describeDestination(config));
    rows.put("Store prefix", config.storePrefix().isEmpty() ? "<none>" : config.storePrefix());
    rows.put("Metrics exporter", telemetry.exporter().isEmpty() ? "<environment>" : telemetry.exporter());
    CliPrinter.printPlan(
        "Record dry-run: no events will be consumed.", rows, "Re-run without --dry-run to record diagnostics.");
  }

  static String describeDestination(SinkConfig config) {
    return switch (config.storeMode()) {
      case S3 -> "s3://" + config.bucket() + config.s3Endpoint().map(e -> " via " + e).orElse("");
      case DIRECTORY -> config.storeDirectory().map(Path::toString).orElse("<unset>");
      case NONE -> "<disabled>";
    };
  }
}
