package ca.gc.cra.diagsink.infrastructure.storage;

import ca.gc.cra.diagsink.application.port.ObjectStorePort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * {@link ObjectStorePort} that copies segments into a local directory. Object names map to relative
 * paths; existing files are replaced. Used for offline runs and tests.
 *
 * @since 0.1.0
 */
public final class DirectoryObjectStoreAdapter implements ObjectStorePort {
  private final Path root;

  /**
   * Creates an adapter rooted at {@code root}, creating the directory if needed.
   *
   * @param root target directory
   * @throws IOException if the directory cannot be created
   */
  public DirectoryObjectStoreAdapter(Path root) throws IOException {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    Files.createDirectories(this.root);
  }

  @Override
  public void put(String objectName, Path source) throws IOException {
    Objects.requireNonNull(objectName, "objectName");
    Objects.requireNonNull(source, "source");
    Path target = root.resolve(objectName).normalize();
    if (!target.startsWith(root) || target.equals(root)) {
      throw new IllegalArgumentException("object name escapes store directory: " + objectName);
    }
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
  }

  @Override
  public String describe() {
    return root.toString();
  }

  public Path root() {
    return root;
  }
}
