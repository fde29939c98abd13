package ca.gc.cra.diagsink.application.sink;

import ca.gc.cra.diagsink.domain.segment.SegmentNaming;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * Lists the local segments of one sink directory in increasing sequence order.
 *
 * @since 0.1.0
 */
public final class SegmentCatalog {
  private final Path directory;
  private final SegmentNaming naming;

  public SegmentCatalog(Path directory, SegmentNaming naming) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.naming = Objects.requireNonNull(naming, "naming");
  }

  /**
   * Lists regular files whose names match the segment naming pattern.
   *
   * @return entries sorted by sequence; empty when the directory does not exist
   * @throws IOException if the directory cannot be read
   */
  public List<Entry> list() throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    List<Entry> entries = new ArrayList<>();
    try (Stream<Path> files = Files.list(directory)) {
      files.filter(Files::isRegularFile).forEach(path -> {
        OptionalLong sequence = naming.sequenceOf(path.getFileName().toString());
        if (sequence.isPresent()) {
          entries.add(new Entry(path, sequence.getAsLong()));
        }
      });
    }
    entries.sort(Comparator.comparingLong(Entry::sequence));
    return List.copyOf(entries);
  }

  public Path directory() {
    return directory;
  }

  public SegmentNaming naming() {
    return naming;
  }

  /**
   * A local segment file.
   *
   * @param path file path
   * @param sequence sequence index parsed from the file name
   */
  public record Entry(Path path, long sequence) {
    public Entry {
      Objects.requireNonNull(path, "path");
    }
  }
}
