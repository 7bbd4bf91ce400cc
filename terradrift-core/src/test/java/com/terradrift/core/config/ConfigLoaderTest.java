package com.terradrift.core.config;

import com.terradrift.core.compare.MatchingStrategy;
import com.terradrift.core.model.AttributePath;
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
        Path configFile = tempDir.resolve("terradrift.yaml");
        Files.writeString(configFile, """
            aws:
              region: eu-west-1

            check:
              attributes:
                - instance_type
                - tags.Name
              matching: greedy
              resourceType: aws_instance
              definitionMatchAttribute: tags.Service

            run:
              concurrency: 8
              output: json

            retry:
              maxElapsedMillis: 5000
              baseDelayMillis: 100
              multiplier: 2.0

            cache:
              ttlSeconds: 60
            """);

        TerraDriftConfig config = ConfigLoader.load(configFile);

        assertThat(config.aws().region()).isEqualTo("eu-west-1");
        assertThat(config.check().attributes()).containsExactly("instance_type", "tags.Name");
        assertThat(config.check().toComparisonOptions().matching()).isEqualTo(MatchingStrategy.GREEDY);
        assertThat(config.check().toLookup().definitionMatchAttribute())
            .isEqualTo(AttributePath.parse("tags.Service"));
        assertThat(config.run().concurrencyOrDefault()).isEqualTo(8);
        assertThat(config.run().outputOrDefault()).isEqualTo("json");
        assertThat(config.retry().toRetryPolicy().baseDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.retry().toRetryPolicy().multiplier()).isEqualTo(2.0);
        assertThat(config.cache().ttl()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void load_partialYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("terradrift.yaml");
        Files.writeString(configFile, """
            run:
              concurrency: 2
            """);

        TerraDriftConfig config = ConfigLoader.load(configFile);

        assertThat(config.run().concurrencyOrDefault()).isEqualTo(2);
        assertThat(config.run().outputOrDefault()).isEqualTo("text");
        assertThat(config.aws().region()).isNull();
        assertThat(config.check().toComparisonOptions().matching()).isEqualTo(MatchingStrategy.BIPARTITE);
        assertThat(config.cache().ttl()).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("terradrift.yaml");
        Files.writeString(configFile, """
            aws:
              region: us-east-1
              profile: ops
            notifications:
              slack: true
            """);

        TerraDriftConfig config = ConfigLoader.load(configFile);

        assertThat(config.aws().region()).isEqualTo("us-east-1");
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        TerraDriftConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(TerraDriftConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("terradrift.yaml");
        Files.writeString(configFile, """
            run:
              concurrency: [unclosed
            """);

        TerraDriftConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(TerraDriftConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("terradrift.yaml");
        Files.writeString(configFile, "");

        TerraDriftConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(TerraDriftConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() {
        TerraDriftConfig config = ConfigLoader.load(tempDir);

        assertThat(config).isEqualTo(TerraDriftConfig.defaults());
    }
}
