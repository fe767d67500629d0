package com.rstfmt.core.parser;

import com.rstfmt.core.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MarkupRegistry}.
 */
class MarkupRegistryTest {

    @Test
    void defaults_coverAdmonitionsCodeAndSphinxDirectives() {
        MarkupRegistry registry = MarkupRegistry.defaults();

        assertThat(registry.directive("note")).isEqualTo(DirectiveType.ADMONITION);
        assertThat(registry.directive("Danger")).isEqualTo(DirectiveType.ADMONITION);
        assertThat(registry.directive("code-block")).isEqualTo(DirectiveType.CODE);
        assertThat(registry.directive("image")).isEqualTo(DirectiveType.IMAGE);
        assertThat(registry.directive("toctree")).isEqualTo(DirectiveType.OPAQUE);
        assertThat(registry.directive("mermaid")).isNull();
    }

    @Test
    void withDirectives_addsOpaqueWithoutOverridingBuiltIns() {
        MarkupRegistry registry = MarkupRegistry.defaults().withDirectives(List.of("Mermaid", "note"));

        assertThat(registry.directive("mermaid")).isEqualTo(DirectiveType.OPAQUE);
        assertThat(registry.directive("note")).isEqualTo(DirectiveType.ADMONITION);
    }

    @Test
    void roles_standardAndRegistered() {
        MarkupRegistry registry = MarkupRegistry.defaults().withRoles(List.of("meth"));

        assertThat(registry.standardRole("strong")).isEqualTo(NodeKind.STRONG);
        assertThat(registry.standardRole("t")).isEqualTo(NodeKind.TITLE_REFERENCE);
        assertThat(registry.standardRole("ref")).isNull();
        assertThat(registry.isKnownRole("ref")).isTrue();
        assertThat(registry.isKnownRole("METH")).isTrue();
        assertThat(registry.isKnownRole("doc")).isFalse();
    }
}
