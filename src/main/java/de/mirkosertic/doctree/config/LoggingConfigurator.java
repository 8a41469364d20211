package de.mirkosertic.doctree.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches logback to the daemon setup when doctree runs detached from a terminal.
 * <p>
 * {@code logback-daemon.xml} writes a rolling file below {@code ~/.doctree/log} and finds that
 * directory through the {@value #LOG_DIR_PROPERTY} system property. Without the daemon profile
 * logback loads {@code logback.xml} by itself and logs to the console.
 * <p>
 * Runs before logging is set up, so problems go to {@code System.err}.
 */
public final class LoggingConfigurator {

    static final String LOG_DIR_PROPERTY = "doctree.log.dir";
    static final String DAEMON_CONFIG = "logback-daemon.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param daemonMode true if running detached from a terminal
     */
    public static void configure(final boolean daemonMode) {
        if (!daemonMode) {
            return;
        }

        final Path logDir = logDirectory();
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Cannot create log directory " + logDir + ": " + e.getMessage());
        }
        System.setProperty(LOG_DIR_PROPERTY, logDir.toString());

        if (!apply(DAEMON_CONFIG)) {
            System.err.println("Warning: " + DAEMON_CONFIG + " not applied, logging to the console");
        }
    }

    static Path logDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    /**
     * Replace the running logback configuration with a classpath resource.
     *
     * @return false if the resource is missing, in which case nothing changes, or invalid
     */
    static boolean apply(final String resource) {
        final URL url = LoggingConfigurator.class.getClassLoader().getResource(resource);
        if (url == null) {
            System.err.println("Warning: " + resource + " is not on the classpath");
            return false;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(url);
            return true;
        } catch (final JoranException e) {
            System.err.println("Warning: Invalid logback configuration " + resource + ": " + e.getMessage());
            return false;
        }
    }
}
