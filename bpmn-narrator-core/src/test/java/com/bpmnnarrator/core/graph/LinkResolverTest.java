package com.bpmnnarrator.core.graph;

import com.bpmnnarrator.core.ProcessFixture;
import com.bpmnnarrator.core.model.Diagnostic;
import com.bpmnnarrator.core.model.DiagnosticType;
import com.bpmnnarrator.core.model.EdgeOrigin;
import com.bpmnnarrator.core.model.FlowEdge;
import com.bpmnnarrator.core.model.ProcessDefinition;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LinkResolver}.
 */
class LinkResolverTest {

    private final LinkResolver resolver = new LinkResolver();

    private static FlowGraph graph(ProcessDefinition process) {
        return new FlowGraphBuilder().build(process);
    }

    @Test
    void resolve_matchingNames_addsLinkEdge() {
        // Given
        FlowGraph graph = graph(ProcessFixture.process("Links")
            .start("S").linkThrow("LT", "A").linkCatch("LC", "A").task("T", "Continuar")
            .flow("S", "LT").flow("LC", "T")
            .build());

        // When
        LinkResolution resolution = resolver.resolve(graph);

        // Then
        assertThat(resolution.targets()).containsEntry("LT", "LC");
        assertThat(resolution.isResolved("LT")).isTrue();
        assertThat(resolution.isResolved("LC")).isTrue();
        assertThat(resolution.diagnostics()).isEmpty();

        FlowEdge edge = graph.outgoing("LT").get(0);
        assertThat(edge.targetId()).isEqualTo("LC");
        assertThat(edge.origin()).isEqualTo(EdgeOrigin.LINK);
        assertThat(edge.id()).isEqualTo("link_LT_LC");
    }

    @Test
    void resolve_severalThrowsToOneCatch_resolvesAll() {
        // Given
        FlowGraph graph = graph(ProcessFixture.process("Links")
            .start("S").linkThrow("LT1", "Fim").linkThrow("LT2", "Fim").linkCatch("LC", "Fim")
            .flow("S", "LT1")
            .build());

        // When
        LinkResolution resolution = resolver.resolve(graph);

        // Then
        assertThat(resolution.targets()).containsEntry("LT1", "LC").containsEntry("LT2", "LC");
        assertThat(graph.inDegree("LC")).isEqualTo(2);
        assertThat(resolution.detachedCatches()).isEmpty();
    }

    @Test
    void resolve_throwWithoutCatch_reportsUnmatched() {
        // Given
        FlowGraph graph = graph(ProcessFixture.process("Links")
            .start("S").linkThrow("LT", "Perdido")
            .flow("S", "LT")
            .build());

        // When
        LinkResolution resolution = resolver.resolve(graph);

        // Then
        assertThat(resolution.unmatchedThrows()).containsExactly("LT");
        assertThat(graph.outgoing("LT")).isEmpty();
        assertThat(resolution.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(DiagnosticType.UNMATCHED_LINK);
            assertThat(d.message()).isEqualTo("Link sem correspondência: disparo 'Perdido' (LT)");
        });
    }

    @Test
    void resolve_catchWithoutThrow_reportsDetachedCatch() {
        // Given
        FlowGraph graph = graph(ProcessFixture.process("Links")
            .start("S").linkCatch("LC", "Sozinho").task("T", "Continuar")
            .flow("LC", "T")
            .build());

        // When
        LinkResolution resolution = resolver.resolve(graph);

        // Then
        assertThat(resolution.detachedCatches()).containsExactly("LC");
        assertThat(resolution.isResolved("LC")).isFalse();
        assertThat(resolution.diagnostics()).extracting(Diagnostic::message)
            .containsExactly("Link sem correspondência: captura 'Sozinho' (LC)");
    }

    @Test
    void resolve_duplicateCatchNames_usesFirstAndReportsAmbiguity() {
        // Given
        FlowGraph graph = graph(ProcessFixture.process("Links")
            .start("S").linkThrow("LT", "X").linkCatch("LC1", "X").linkCatch("LC2", "X")
            .flow("S", "LT")
            .build());

        // When
        LinkResolution resolution = resolver.resolve(graph);

        // Then
        assertThat(resolution.targets()).containsEntry("LT", "LC1");
        assertThat(resolution.detachedCatches()).containsExactly("LC2");
        assertThat(resolution.diagnostics()).extracting(Diagnostic::type)
            .containsExactly(DiagnosticType.AMBIGUOUS_LINK);
        assertThat(resolution.diagnostics().get(0).message()).startsWith("Link ambíguo: 'X' possui 2 eventos de captura");
    }

    @Test
    void resolve_namesAreCaseSensitive() {
        // Given
        FlowGraph graph = graph(ProcessFixture.process("Links")
            .start("S").linkThrow("LT", "Pagamento").linkCatch("LC", "pagamento")
            .flow("S", "LT")
            .build());

        // When
        LinkResolution resolution = resolver.resolve(graph);

        // Then
        assertThat(resolution.unmatchedThrows()).containsExactly("LT");
        assertThat(resolution.detachedCatches()).containsExactly("LC");
        assertThat(resolution.diagnostics()).hasSize(2);
    }
}
