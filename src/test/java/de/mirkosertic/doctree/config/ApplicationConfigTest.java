package de.mirkosertic.doctree.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @Test
    @DisplayName("Should read every setting from YAML")
    void shouldReadYaml() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                doctree:
                  store:
                    base-path: /data/xochitl
                  index:
                    read-pool-size: 8
                  watch:
                    enabled: false
                    debounce-ms: 750
                    poll-interval-ms: 100
                """);

        assertThat(config.getBasePath()).isEqualTo(Path.of("/data/xochitl"));
        assertThat(config.getReadPoolSize()).isEqualTo(8);
        assertThat(config.isWatchEnabled()).isFalse();
        assertThat(config.getWatchDebounceMs()).isEqualTo(750);
        assertThat(config.getWatchPollIntervalMs()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should fall back to defaults for missing settings")
    void shouldApplyDefaults() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                doctree:
                  store:
                    base-path: /data/xochitl
                """);

        assertThat(config.getReadPoolSize()).isEqualTo(4);
        assertThat(config.isWatchEnabled()).isTrue();
        assertThat(config.getWatchDebounceMs()).isEqualTo(2000);
        assertThat(config.getWatchPollIntervalMs()).isEqualTo(500);
    }

    @Test
    @DisplayName("Should pick a default store when no base path is configured")
    void shouldDefaultBasePath() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("doctree: {}");

        assertThat(config.getBasePath()).isIn(
                Path.of(ApplicationConfig.DEVICE_BASE_PATH), Path.of(ApplicationConfig.DEVELOPMENT_BASE_PATH));
    }

    @Test
    @DisplayName("Should resolve placeholders with their default value")
    void shouldResolvePlaceholderDefault() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                doctree:
                  store:
                    base-path: "${DOCTREE_TEST_UNSET_VARIABLE:/srv/store}"
                """);

        assertThat(config.getBasePath()).isEqualTo(Path.of("/srv/store"));
    }

    @Test
    @DisplayName("Should let the environment override the YAML base path")
    void shouldPreferEnvironmentOverYaml() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                doctree:
                  store:
                    base-path: /data/xochitl
                """, "/from/env");

        assertThat(config.getBasePath()).isEqualTo(Path.of("/from/env"));
    }

    @Test
    @DisplayName("Should let the system property override the environment")
    void shouldPreferSystemPropertyOverEnvironment() {
        final String previous = System.getProperty(ApplicationConfig.PROP_BASE_PATH);
        System.setProperty(ApplicationConfig.PROP_BASE_PATH, "/from/property");
        try {
            final ApplicationConfig config = ApplicationConfig.fromYaml("""
                    doctree:
                      store:
                        base-path: /data/xochitl
                    """, "/from/env");

            assertThat(config.getBasePath()).isEqualTo(Path.of("/from/property"));
        } finally {
            if (previous == null) {
                System.clearProperty(ApplicationConfig.PROP_BASE_PATH);
            } else {
                System.setProperty(ApplicationConfig.PROP_BASE_PATH, previous);
            }
        }
    }

    @Test
    @DisplayName("Should clamp an invalid pool size to one thread")
    void shouldClampPoolSize() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                doctree:
                  index:
                    read-pool-size: 0
                """);

        assertThat(config.getReadPoolSize()).isEqualTo(1);
    }
}
