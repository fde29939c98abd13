package ca.gc.cra.diagsink.api;

import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.application.port.ObjectStorePort;
import ca.gc.cra.diagsink.application.sink.SegmentCatalog;
import ca.gc.cra.diagsink.config.CompositionRoot;
import ca.gc.cra.diagsink.config.SinkConfig;
import ca.gc.cra.diagsink.domain.segment.RemoteObjectName;
import ca.gc.cra.diagsink.domain.segment.UploadReport;
import ca.gc.cra.diagsink.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.diagsink.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads the segments an earlier {@code record} run left in a directory.
 * <p>Used after a crash, or to retry segments that failed to upload. Uploads overwrite objects of the
 * same name, so rerunning is safe.</p>
 *
 * @since 0.1.0
 */
public final class UploadCli {
  private static final Logger log = LoggerFactory.getLogger(UploadCli.class);
  private static final String SUMMARY_USAGE =
      "usage: upload [out=DIR] [fileBase=NAME] [hostId=ID] [storePrefix=P] [storeMode=S3|DIRECTORY] "
          + "[bucket=NAME] [s3Region=REGION] [s3Endpoint=URL] [storeDir=DIR] [config=PATH] [--dry-run]";
  private static final String HELP_TEXT = """
      diagsink upload

      Usage:
        upload out=./diagnostics [options]

      Optional (validated):
        out=DIR                    Segment directory (default .)
        fileBase=NAME              Base segment file name (default BenchmarkDiagnostics.out)
        hostId=ID                  Host identifier in object names (default local host name)
        storePrefix=PREFIX         Object key prefix
        storeMode=S3|DIRECTORY     Upload destination (default S3)
        bucket=NAME                S3 bucket (default diagnostics)
        s3Region=REGION            S3 region override
        s3Endpoint=URL             S3 endpoint override (path-style access)
        createBucket=true|false    Create the bucket when missing (default true)
        storeDir=DIR               Target directory when storeMode=DIRECTORY
        config=PATH                YAML file with common/upload sections
        --dry-run                  List the planned object names without uploading
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private UploadCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for upload CLI");
    }

    SinkConfig config;
    TelemetrySettings telemetry;
    boolean dryRun;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(input, "upload", log::warn);
      dryRun = ConfigCliUtils.isDryRun(input, effective);
      telemetry = TelemetryConfigurator.fromConfig(effective);
      config = SinkConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid upload arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    if (!Files.isDirectory(config.outputDirectory())) {
      log.error("Segment directory does not exist: {}", config.outputDirectory());
      return ExitCode.IO_ERROR;
    }

    if (dryRun) {
      return printDryRunPlan(config);
    }

    MetricsPort metrics = TelemetryConfigurator.createMetrics(telemetry);
    CompositionRoot root = new CompositionRoot(config, metrics);
    try (ObjectStorePort store = root.objectStore()) {
      UploadReport report = root.segmentUploader(store).uploadAll();
      CliPrinter.printUploadReport(report, store.describe());
      return ExitCode.forUpload(report);
    } catch (IllegalArgumentException ex) {
      log.error("Upload configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Upload I/O failure while reading {}", config.outputDirectory(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during upload", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception during upload", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      TelemetryConfigurator.closeMetrics(metrics);
    }
  }

  private static ExitCode printDryRunPlan(SinkConfig config) {
    SegmentCatalog catalog = new SegmentCatalog(
        config.outputDirectory(), new CompositionRoot(config, MetricsPort.NO_OP).naming());
    List<SegmentCatalog.Entry> entries;
    try {
      entries = catalog.list();
    } catch (IOException ex) {
      log.error("Unable to list segments in {}", config.outputDirectory(), ex);
      return ExitCode.IO_ERROR;
    }
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Segment directory", config.outputDirectory().toString());
    rows.put("Destination", RecordCli.describeDestination(config));
    rows.put("Segments", Integer.toString(entries.size()));
    CliPrinter.printPlan("Upload dry-run: nothing will be uploaded.", rows, null);
    for (SegmentCatalog.Entry entry : entries) {
      RemoteObjectName name = RemoteObjectName.of(config.storePrefix(), config.hostId(), entry.sequence());
      CliPrinter.println("  " + entry.path().getFileName() + " -> " + name);
    }
    CliPrinter.println(" Re-run without --dry-run to upload.");
    return ExitCode.SUCCESS;
  }
}
