package ca.gc.cra.diagsink.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.config.CompositionRoot;
import ca.gc.cra.diagsink.config.SinkConfig;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RecordCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RecordCli.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingBootstrapReturnsUsageAndInvalidArgs() {
    ExitCode code = RecordCli.run(new String[] {"out=" + tempDir, "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: record"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("kafkaBootstrap is required"));
    assertTrue(logged);
  }

  @Test
  void dryRunPrintsPlanWithoutCreatingSegments() {
    Path out = tempDir.resolve("segments");

    ExitCode code = RecordCli.run(new String[] {
        "kafkaBootstrap=localhost:9092",
        "out=" + out,
        "rotateBytes=1000",
        "storeMode=NONE",
        "metricsExporter=none",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Record dry-run"));
    assertTrue(text.contains("localhost:9092"));
    assertTrue(text.contains("<disabled>"));
    assertFalse(Files.exists(out), "dry-run should not create the segment directory");
  }

  @Test
  void yamlSuppliesSettingsAndCliOverrides() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("diagsink.yaml"), """
        common:
          hostId: yaml-host
        record:
          kafkaBootstrap: broker:9092
          rotateBytes: 4096
        """);

    ExitCode code = RecordCli.run(new String[] {
        "config=" + yaml, "hostId=cli-host", "out=" + tempDir.resolve("segments"), "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("broker:9092"));
    assertTrue(text.contains("4096"));
    assertTrue(text.contains("cli-host"));
  }

  @Test
  void sourceWiringFailureOpensNoSegment() {
    Path out = tempDir.resolve("segments");
    CompositionRoot root = new CompositionRoot(
        SinkConfig.fromMap(Map.of("out", out.toString(), "storeMode", "NONE")), MetricsPort.NO_OP);

    IllegalStateException ex = assertThrows(
        IllegalStateException.class, () -> RecordCli.record(root, new CountDownLatch(0)));

    assertTrue(ex.getMessage().contains("kafkaBootstrap"));
    assertFalse(Files.exists(out), "no segment should be opened when the source cannot be wired");
  }

  @Test
  void missingConfigFileIsInvalid() {
    ExitCode code = RecordCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")});
    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void malformedArgumentIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, RecordCli.run(new String[] {"kafkaBootstrap"}));
  }
}
