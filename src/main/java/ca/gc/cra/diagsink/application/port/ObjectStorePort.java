package ca.gc.cra.diagsink.application.port;

import java.nio.file.Path;

/**
 * <strong>What:</strong> Output port for remote object storage.
 * <p><strong>Why:</strong> Decouples the upload stage from the storage SDK and its credentials.</p>
 * <p><strong>Role:</strong> Sink-side port implemented by the S3 and directory adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store the file contents under the given object name.</li>
 *   <li>Overwrite an existing object of the same name, so re-running an upload after a partial
 *   failure is never rejected as a duplicate.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from a single upload thread; adapters need not be thread-safe.</p>
 * <p><strong>Performance:</strong> Synchronous network call per file; no retries are expected at this layer.</p>
 *
 * @since 0.1.0
 */
public interface ObjectStorePort extends AutoCloseable {
  /**
   * Uploads a local file.
   *
   * @param objectName destination object key; must not be blank
   * @param source local file to upload; must exist
   * @throws Exception if the upload fails
   */
  void put(String objectName, Path source) throws Exception;

  /**
   * Describes the destination for log lines (bucket, directory).
   *
   * @return human readable destination
   */
  String describe();

  /**
   * Releases client resources.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
