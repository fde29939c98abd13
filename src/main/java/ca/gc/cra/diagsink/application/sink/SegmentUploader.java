package ca.gc.cra.diagsink.application.sink;

import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.application.port.ObjectStorePort;
import ca.gc.cra.diagsink.domain.segment.RemoteObjectName;
import ca.gc.cra.diagsink.domain.segment.UploadReport;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Uploads every local segment of a catalog to an object store.
 * <p><strong>Why:</strong> A failed file must not stop the batch; the report lists each outcome so
 * the caller can rerun the upload, which overwrites objects that already made it.</p>
 * <p><strong>Role:</strong> Stateless upload step used by {@link UploadCoordinator} and by the
 * {@code upload} CLI for leftovers of an interrupted run.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; run one batch at a time.</p>
 *
 * @since 0.1.0
 */
public final class SegmentUploader {
  private static final Logger log = LoggerFactory.getLogger(SegmentUploader.class);

  private final SegmentCatalog catalog;
  private final ObjectStorePort store;
  private final MetricsPort metrics;
  private final String hostId;
  private final String prefix;

  /**
   * Creates an uploader.
   *
   * @param catalog local segments to upload
   * @param store destination store
   * @param metrics metrics sink
   * @param hostId host identifier used in object names; must not be blank
   * @param prefix optional object key prefix; may be {@code null}
   */
  public SegmentUploader(
      SegmentCatalog catalog, ObjectStorePort store, MetricsPort metrics, String hostId, String prefix) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.hostId = Objects.requireNonNull(hostId, "hostId");
    if (hostId.isBlank()) {
      throw new IllegalArgumentException("hostId must not be blank");
    }
    this.prefix = prefix == null ? "" : prefix;
  }

  /**
   * Uploads all local segments in sequence order.
   *
   * @return per-file outcomes
   * @throws IOException if the segment directory cannot be listed
   */
  public UploadReport uploadAll() throws IOException {
    return uploadAll(Set.of());
  }

  /**
   * Uploads all local segments in sequence order, skipping those still being written.
   *
   * @param openSequences sequences whose handle is still open; each is reported as a failure
   * @return per-file outcomes
   * @throws IOException if the segment directory cannot be listed
   */
  public UploadReport uploadAll(Set<Long> openSequences) throws IOException {
    Objects.requireNonNull(openSequences, "openSequences");
    List<SegmentCatalog.Entry> entries = catalog.list();
    if (entries.isEmpty()) {
      log.info("No diagnostics segments found in {}", catalog.directory());
      return UploadReport.empty();
    }
    List<RemoteObjectName> succeeded = new ArrayList<>();
    List<UploadReport.Failure> failed = new ArrayList<>();
    int total = entries.size();
    for (int i = 0; i < total; i++) {
      SegmentCatalog.Entry entry = entries.get(i);
      log.info("Uploading {} of {} file: {}", i + 1, total, entry.path());
      RemoteObjectName name = null;
      try {
        name = RemoteObjectName.of(prefix, hostId, entry.sequence());
        if (openSequences.contains(entry.sequence())) {
          throw new IOException("Segment " + entry.path() + " is still open; buffered records may be missing");
        }
        long bytes = Files.size(entry.path());
        store.put(name.value(), entry.path());
        succeeded.add(name);
        metrics.increment(MetricsPort.UPLOAD_SUCCEEDED);
        metrics.observe(MetricsPort.UPLOAD_BYTES, bytes);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        failed.add(new UploadReport.Failure(entry.path(), name, ie));
        metrics.increment(MetricsPort.UPLOAD_FAILED);
        log.error("Upload of {} interrupted", entry.path(), ie);
      } catch (Exception ex) {
        failed.add(new UploadReport.Failure(entry.path(), name, ex));
        metrics.increment(MetricsPort.UPLOAD_FAILED);
        log.error("Failed to upload {} to {} as {}", entry.path(), store.describe(), name, ex);
      }
    }
    log.info(
        "Uploaded {} of {} diagnostics segment(s) to {}", succeeded.size(), total, store.describe());
    return new UploadReport(succeeded, failed);
  }
}
