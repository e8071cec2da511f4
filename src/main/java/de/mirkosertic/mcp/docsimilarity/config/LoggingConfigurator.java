package de.mirkosertic.mcp.docsimilarity.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to file-only output when the server runs in deployed mode.
 * <p>
 * stdout carries the MCP JSON-RPC stream, so a deployed server must not log to the console.
 * The development profile keeps the classpath logback.xml, which writes to stderr.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is used.
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        final Path logDirectory = getLogDirectory();
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
        }
        loadConfiguration(DEPLOYED_CONFIG);
    }

    public static Path getLogDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    static boolean loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return false;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
            return true;
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
            return false;
        }
    }
}
