package de.mirkosertic.mcp.docsimilarity.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationConfigTest {

    private static final String TEST_PROPERTY = "docsimilarity.test.value";

    @AfterEach
    void clearProperty() {
        System.clearProperty(TEST_PROPERTY);
    }

    @Test
    void shouldProvideDefaults() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThat(config.getThreadPoolSize()).isGreaterThanOrEqualTo(1);
        assertThat(config.getDefaultThreshold()).isEqualTo(0.70);
        assertThat(config.getMinDocuments()).isEqualTo(2);
        assertThat(config.getMaxDocuments()).isEqualTo(100);
        assertThat(config.getMaxDocumentLength()).isEqualTo(50_000);
        assertThat(config.getMinFiles()).isEqualTo(2);
        assertThat(config.getMaxFiles()).isEqualTo(5);
        assertThat(config.getMaxFileSize()).isEqualTo(10L * 1024 * 1024);
        assertThat(config.getMaxTotalSize()).isEqualTo(50L * 1024 * 1024);
        assertThat(config.getMaxContentLength()).isEqualTo(-1L);
        assertThat(config.isDeployedMode()).isFalse();
    }

    @Test
    void shouldApplyYamlOverrides() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                similarity:
                  analysis:
                    thread-pool-size: 3
                  sentence:
                    default-threshold: 0.55
                  extraction:
                    max-content-length: 1000
                  limits:
                    min-documents: 3
                    max-documents: 10
                    max-document-length: 500
                    min-files: 1
                    max-files: 8
                    max-file-size: 2048
                    max-total-size: 4096
                """);

        assertThat(config.getThreadPoolSize()).isEqualTo(3);
        assertThat(config.getDefaultThreshold()).isEqualTo(0.55);
        assertThat(config.getMaxContentLength()).isEqualTo(1000L);
        assertThat(config.getMinDocuments()).isEqualTo(3);
        assertThat(config.getMaxDocuments()).isEqualTo(10);
        assertThat(config.getMaxDocumentLength()).isEqualTo(500);
        assertThat(config.getMinFiles()).isEqualTo(1);
        assertThat(config.getMaxFiles()).isEqualTo(8);
        assertThat(config.getMaxFileSize()).isEqualTo(2048L);
        assertThat(config.getMaxTotalSize()).isEqualTo(4096L);
    }

    @Test
    void shouldKeepDefaultsForMissingOrInvalidValues() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                similarity:
                  analysis:
                    thread-pool-size: 0
                  sentence:
                    default-threshold: not-a-number
                  limits:
                    max-files: lots
                """);

        assertThat(config.getThreadPoolSize()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.getDefaultThreshold()).isEqualTo(0.70);
        assertThat(config.getMaxFiles()).isEqualTo(5);
        assertThat(config.getMaxDocuments()).isEqualTo(100);
    }

    @Test
    void shouldIgnoreUnrelatedYaml() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("other:\n  key: value\n");

        assertThat(config.getMaxDocuments()).isEqualTo(100);
        assertThat(ApplicationConfig.fromYaml("").getMaxFiles()).isEqualTo(5);
    }

    @Test
    void shouldResolvePlaceholdersFromSystemProperties() {
        System.setProperty(TEST_PROPERTY, "7");

        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                similarity:
                  limits:
                    max-files: ${docsimilarity.test.value:3}
                    min-files: ${docsimilarity.test.missing:4}
                """);

        assertThat(config.getMaxFiles()).isEqualTo(7);
        assertThat(config.getMinFiles()).isEqualTo(4);
    }

    @Test
    void shouldResolveVariablesInsideText() {
        System.setProperty(TEST_PROPERTY, "middle");

        assertThat(ApplicationConfig.resolveVariables("a-${docsimilarity.test.value}-b")).isEqualTo("a-middle-b");
        assertThat(ApplicationConfig.resolveVariables("${docsimilarity.test.missing:fallback}")).isEqualTo("fallback");
        assertThat(ApplicationConfig.resolveVariables("plain")).isEqualTo("plain");
        assertThat(ApplicationConfig.resolveVariables("${unterminated")).isEqualTo("${unterminated");
    }

    @Test
    void shouldPlaceUserConfigInHomeDirectory() {
        assertThat(ApplicationConfig.getUserConfigPath().toString())
                .startsWith(System.getProperty("user.home"))
                .endsWith("config.yaml");
        assertThat(ApplicationConfig.getUserConfigPath().getParent()).isEqualTo(ApplicationConfig.getConfigDirectory());
    }

    @Test
    void shouldIgnoreDefaultThresholdOutsideUnitRange() {
        final ApplicationConfig tooLarge = ApplicationConfig.fromYaml("""
                similarity:
                  sentence:
                    default-threshold: 70
                """);
        final ApplicationConfig negative = ApplicationConfig.fromYaml("""
                similarity:
                  sentence:
                    default-threshold: -0.1
                """);
        final ApplicationConfig notANumber = ApplicationConfig.fromYaml("""
                similarity:
                  sentence:
                    default-threshold: .NaN
                """);

        assertThat(tooLarge.getDefaultThreshold()).isEqualTo(0.70);
        assertThat(negative.getDefaultThreshold()).isEqualTo(0.70);
        assertThat(notANumber.getDefaultThreshold()).isEqualTo(0.70);
    }

    @Test
    void shouldAcceptDefaultThresholdBounds() {
        final ApplicationConfig zero = ApplicationConfig.fromYaml("""
                similarity:
                  sentence:
                    default-threshold: 0.0
                """);
        final ApplicationConfig one = ApplicationConfig.fromYaml("""
                similarity:
                  sentence:
                    default-threshold: 1
                """);

        assertThat(zero.getDefaultThreshold()).isEqualTo(0.0);
        assertThat(one.getDefaultThreshold()).isEqualTo(1.0);
    }
}
