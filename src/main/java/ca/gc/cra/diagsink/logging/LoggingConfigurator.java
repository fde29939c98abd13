package ca.gc.cra.diagsink.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Raises sink logging verbosity from the command line.
 * <p><strong>Why:</strong> Rotation, reclaim and per-file upload decisions log at DEBUG; operators flip
 * them on with {@code --verbose} instead of editing {@code logback.xml}. Only the sink's own loggers
 * move to DEBUG: the Kafka client and AWS SDK stay at the levels {@code logback.xml} gives them,
 * since their DEBUG output would bury the sink's.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger hierarchy raised by {@link #enableVerboseLogging()}. */
  public static final String SINK_LOGGER = "ca.gc.cra.diagsink";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the {@value #SINK_LOGGER} hierarchy to DEBUG within the running JVM.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
          factory.getClass().getName());
      return false;
    }
    Logger sink = context.getLogger(SINK_LOGGER);
    if (!Level.DEBUG.equals(sink.getLevel())) {
      sink.setLevel(Level.DEBUG);
      log.debug("DEBUG logging enabled for {}", SINK_LOGGER);
    }
    return true;
  }
}
