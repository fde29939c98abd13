package ca.gc.cra.diagsink.api;

import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.diagsink.domain.segment.RemoteObjectName;
import ca.gc.cra.diagsink.domain.segment.UploadReport;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CliPrinterTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void reportListsFailuresWithAndWithoutObjectName() {
    UploadReport report = new UploadReport(
        List.of(new RemoteObjectName("h-h-0.out")),
        List.of(
            new UploadReport.Failure(Path.of("Diag.out-0"), new RemoteObjectName("h-h-1.out"),
                new IOException("denied")),
            new UploadReport.Failure(Path.of("Diag.out-1"), null, new IOException("no key"))));

    CliPrinter.printUploadReport(report, "dir:/tmp/remote");

    String out = buffer.toString();
    assertTrue(out.contains("Uploaded 1 of 3 segment(s) to dir:/tmp/remote"), out);
    assertTrue(out.contains(" FAILED Diag.out-0 -> h-h-1.out: denied"), out);
    assertTrue(out.contains(" FAILED Diag.out-1 -> (no object name): no key"), out);
  }
}
