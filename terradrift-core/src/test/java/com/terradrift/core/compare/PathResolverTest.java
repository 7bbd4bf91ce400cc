package com.terradrift.core.compare;

import com.terradrift.core.model.AttributePath;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.normalize.ConfigNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PathResolver}.
 */
class PathResolverTest {

    @Test
    void resolve_nestedKey_returnsValue() {
        ConfigValue tree = ConfigNormalizer.normalize(Map.of("tags", Map.of("Name", "x")));

        assertThat(PathResolver.resolve(tree, "tags.Name")).contains(ConfigValue.of("x"));
    }

    @Test
    void resolve_missingNestedKey_returnsEmpty() {
        ConfigValue tree = ConfigNormalizer.normalize(Map.of("tags", Map.of()));

        assertThat(PathResolver.resolve(tree, "tags.Name")).isEmpty();
    }

    @Test
    void resolve_emptyTree_returnsEmpty() {
        ConfigValue tree = ConfigNormalizer.normalize(Map.of());

        assertThat(PathResolver.resolve(tree, "tags.Name")).isEmpty();
    }

    @Test
    void resolve_throughListOrScalar_returnsEmpty() {
        ConfigValue tree = ConfigNormalizer.normalize(Map.of(
            "devices", List.of(Map.of("size", 8)),
            "ami", "ami-1"));

        assertThat(PathResolver.resolve(tree, "devices.size")).isEmpty();
        assertThat(PathResolver.resolve(tree, "devices.0")).isEmpty();
        assertThat(PathResolver.resolve(tree, "ami.id")).isEmpty();
    }

    @Test
    void resolve_nonMapRoot_returnsEmpty() {
        assertThat(PathResolver.resolve(ConfigValue.of("x"), "a")).isEmpty();
        assertThat(PathResolver.resolve(ConfigValue.nullValue(), "a")).isEmpty();
        assertThat(PathResolver.resolve(ConfigValue.list(), "a")).isEmpty();
    }

    @Test
    void resolve_storedNull_isPresent() {
        ConfigValue tree = ConfigNormalizer.normalize(Map.of("key_name", java.util.Optional.empty()));

        assertThat(PathResolver.resolve(tree, "key_name")).contains(ConfigValue.nullValue());
    }

    @Test
    void resolve_unresolvablePath_returnsEmpty() {
        ConfigValue tree = ConfigNormalizer.normalize(Map.of("", "empty-key"));

        assertThat(PathResolver.resolve(tree, AttributePath.parse(""))).isEmpty();
        assertThat(PathResolver.resolve(tree, "tags..Name")).isEmpty();
    }

    @Test
    void resolve_wholeSubtree_returnsMap() {
        ConfigValue tree = ConfigNormalizer.normalize(Map.of("tags", Map.of("Name", "x", "Env", "dev")));

        assertThat(PathResolver.resolve(tree, "tags"))
            .contains(ConfigNormalizer.normalize(Map.of("Name", "x", "Env", "dev")));
    }
}
