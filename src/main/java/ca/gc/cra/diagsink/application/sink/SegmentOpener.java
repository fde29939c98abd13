package ca.gc.cra.diagsink.application.sink;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Opens the byte stream backing a segment file.
 */
@FunctionalInterface
interface SegmentOpener {
  int BUFFER_BYTES = 64 * 1024;

  /**
   * Opens {@code path} for writing.
   *
   * @param path segment file
   * @param append {@code true} to keep existing content, {@code false} to truncate
   * @return stream positioned at the end of the retained content
   * @throws IOException if the file cannot be opened
   */
  OutputStream open(Path path, boolean append) throws IOException;

  /** Buffered file streams; the base segment appends, rotated segments truncate stale files. */
  SegmentOpener FILES = (path, append) -> {
    OutputStream raw = append
        ? Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)
        : Files.newOutputStream(
            path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
    return new BufferedOutputStream(raw, BUFFER_BYTES);
  };
}
