package de.mirkosertic.mcp.docsimilarity.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp taken from the Maven-filtered build-info.properties.
 * Outside a packaged build (IDE, unfiltered resources) the values fall back to "dev" and "unknown".
 */
public record BuildInfo(String version, String buildTimestamp) {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String BUILD_INFO_FILE = "build-info.properties";
    static final String DEFAULT_VERSION = "dev";
    static final String DEFAULT_TIMESTAMP = "unknown";

    private static final BuildInfo CURRENT = load(BUILD_INFO_FILE);

    public static BuildInfo current() {
        return CURRENT;
    }

    static BuildInfo load(final String resourceName) {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (input == null) {
                logger.debug("{} not found, using development defaults", resourceName);
                return new BuildInfo(DEFAULT_VERSION, DEFAULT_TIMESTAMP);
            }
            final Properties props = new Properties();
            props.load(input);
            return new BuildInfo(
                    resolved(props.getProperty("build.version"), DEFAULT_VERSION),
                    resolved(props.getProperty("build.timestamp"), DEFAULT_TIMESTAMP));
        } catch (final IOException e) {
            logger.warn("Failed to read {}, using development defaults", resourceName, e);
            return new BuildInfo(DEFAULT_VERSION, DEFAULT_TIMESTAMP);
        }
    }

    // An unfiltered placeholder such as ${project.version} counts as missing
    private static String resolved(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.contains("${")) {
            return fallback;
        }
        return value.trim();
    }
}
