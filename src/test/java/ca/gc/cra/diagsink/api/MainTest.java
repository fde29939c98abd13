package ca.gc.cra.diagsink.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("record"));
    assertTrue(buffer.toString().contains("upload"));
  }

  @Test
  void missingOrUnknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay"}));
    assertTrue(buffer.toString().contains("usage: diagsink"));
  }

  @Test
  void subcommandHelpIsForwarded() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"upload", "--help"}));
    assertTrue(buffer.toString().contains("diagsink upload"));
  }
}
