package com.bpmnnarrator.core.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NarrativeOptions}.
 */
class NarrativeOptionsTest {

    @Test
    void defaults_matchDocumentedValues() {
        NarrativeOptions options = NarrativeOptions.defaults();

        assertThat(options.showLinkEvents()).isFalse();
        assertThat(options.startEventPolicy()).isEqualTo(StartEventPolicy.PREFIXED);
        assertThat(options.renderMergeGateways()).isFalse();
        assertThat(options.renderDisconnectedRoots()).isFalse();
        assertThat(options.inferLanesFromDiagram()).isTrue();
        assertThat(options.includeMessageFlows()).isTrue();
        assertThat(options.includeOrphanAnnotations()).isTrue();
        assertThat(options.indent()).isEqualTo("    ");
    }

    @Test
    void withers_changeOnlyTheirField() {
        NarrativeOptions options = NarrativeOptions.defaults()
            .withShowLinkEvents(true)
            .withStartEventPolicy(StartEventPolicy.SEQUENTIAL);

        assertThat(options.showLinkEvents()).isTrue();
        assertThat(options.startEventPolicy()).isEqualTo(StartEventPolicy.SEQUENTIAL);
        assertThat(options.renderMergeGateways()).isFalse();
        assertThat(options.indent()).isEqualTo(NarrativeOptions.DEFAULT_INDENT);
    }
}
