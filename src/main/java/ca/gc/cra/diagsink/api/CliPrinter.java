package ca.gc.cra.diagsink.api;

import ca.gc.cra.diagsink.domain.segment.UploadReport;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Console output for usage text, dry-run plans and upload summaries.
 * <p>Diagnostics go to the log (stderr); only operator-facing results are printed here.</p>
 */
public final class CliPrinter {
  private static final int LABEL_WIDTH = 18;
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a dry-run plan: a heading, one aligned {@code label : value} row per entry, then a footer.
   *
   * @param heading first line
   * @param rows labels mapped to values, printed in iteration order
   * @param footer closing hint; skipped when blank
   */
  public static void printPlan(String heading, Map<String, String> rows, String footer) {
    PrintWriter out = writer();
    out.println(heading);
    rows.forEach((label, value) -> out.println(" " + padRight(label) + ": " + value));
    if (footer != null && !footer.isBlank()) {
      out.println(" " + footer);
    }
  }

  /**
   * Prints the outcome of an upload batch, one line per failed segment.
   *
   * @param report batch outcome
   * @param destination store description, for example {@code s3://diagnostics}
   */
  public static void printUploadReport(UploadReport report, String destination) {
    PrintWriter out = writer();
    out.println("Uploaded " + report.succeeded().size() + " of " + report.attempted()
        + " segment(s) to " + destination);
    for (UploadReport.Failure failure : report.failed()) {
      String target = failure.objectName() == null ? "(no object name)" : failure.objectName().value();
      out.println(" FAILED " + failure.path().getFileName() + " -> " + target
          + ": " + failure.error().getMessage());
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static String padRight(String label) {
    StringBuilder sb = new StringBuilder(label);
    while (sb.length() < LABEL_WIDTH) {
      sb.append(' ');
    }
    return sb.toString();
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
