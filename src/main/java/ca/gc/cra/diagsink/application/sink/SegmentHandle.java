package ca.gc.cra.diagsink.application.sink;

import ca.gc.cra.diagsink.domain.segment.SegmentInfo;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One open segment file. Writes and close share the instance monitor so a line is either fully
 * written before close or rejected after it.
 */
final class SegmentHandle implements Closeable {
  private static final int NEWLINE = '\n';

  private final Path path;
  private final long sequence;
  private final OutputStream out;

  private volatile long size;
  private boolean acceptingWrites = true;
  private boolean closed;

  SegmentHandle(Path path, long sequence, OutputStream out, long initialSize) {
    this.path = Objects.requireNonNull(path, "path");
    this.sequence = sequence;
    this.out = Objects.requireNonNull(out, "out");
    this.size = Math.max(0L, initialSize);
  }

  /**
   * Writes one record followed by a newline.
   *
   * @return {@code false} when the handle no longer accepts writes; nothing was written
   * @throws IOException if the underlying stream fails
   */
  synchronized boolean write(byte[] record) throws IOException {
    if (!acceptingWrites) {
      return false;
    }
    out.write(record);
    out.write(NEWLINE);
    size += record.length + 1L;
    return true;
  }

  synchronized void flush() throws IOException {
    if (acceptingWrites) {
      out.flush();
    }
  }

  /**
   * Closes the file. The first attempt stops further writes; the handle only counts as closed once
   * the stream closes cleanly, so a failed close can be retried.
   */
  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    acceptingWrites = false;
    out.close();
    closed = true;
  }

  synchronized boolean isClosed() {
    return closed;
  }

  Path path() {
    return path;
  }

  long sequence() {
    return sequence;
  }

  SegmentInfo info() {
    return new SegmentInfo(path, sequence, size);
  }

  @Override
  public String toString() {
    return "segment#" + sequence + "(" + path + ")";
  }
}
