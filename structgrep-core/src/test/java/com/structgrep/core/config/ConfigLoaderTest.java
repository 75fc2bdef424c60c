package com.structgrep.core.config;

import com.structgrep.core.match.MatchingOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            jobs: 3
            timeoutSeconds: 2.5
            maxTargetBytes: 4096
            matching:
              normalizeNumericLiterals: true
              commutativeOperators: true
            exclude:
              - "build/**"
              - "*Generated.java"
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.jobs()).isEqualTo(3);
        assertThat(config.timeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.maxTargetBytes()).isEqualTo(4096L);
        assertThat(config.matching()).isEqualTo(new MatchingOptions(true, false, true));
        assertThat(config.exclude()).containsExactly("build/**", "*Generated.java");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            jobs: 2
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.jobs()).isEqualTo(2);
        assertThat(config.timeoutSeconds()).isEqualTo(EngineConfig.DEFAULT_TIMEOUT_SECONDS);
        assertThat(config.maxTargetBytes()).isEqualTo(EngineConfig.DEFAULT_MAX_TARGET_BYTES);
        assertThat(config.matching()).isEqualTo(MatchingOptions.defaults());
        assertThat(config.exclude()).isEmpty();
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        Path nonExistentFile = tempDir.resolve("nonexistent.yaml");

        EngineConfig config = ConfigLoader.load(nonExistentFile);

        assertThat(config).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            jobs: [not, a, number
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            jobs: 1
            colour: blue
            """);

        assertThat(ConfigLoader.load(configFile).jobs()).isEqualTo(1);
    }

    @Test
    void loadOrDefaults_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.loadOrDefaults(null)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void timeout_zeroOrNegative_meansUnlimited() {
        assertThat(EngineConfig.defaults().withTimeoutSeconds(0).timeout()).isNull();
        assertThat(EngineConfig.defaults().withTimeoutSeconds(-1).timeout()).isNull();
        assertThat(EngineConfig.defaults().timeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void timeout_subMillisecond_isKeptInNanoseconds() {
        assertThat(EngineConfig.defaults().withTimeoutSeconds(0.0004).timeout()).isEqualTo(Duration.ofNanos(400_000));
        assertThat(EngineConfig.defaults().withTimeoutSeconds(1e-12).timeout()).isEqualTo(Duration.ofNanos(1));
    }

    @Test
    void jobs_belowOne_meansOnePerProcessor() {
        assertThat(EngineConfig.defaults().withJobs(0).jobs()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }
}
