package com.bpmnnarrator.core.parser;

import com.bpmnnarrator.core.model.ElementKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ElementClassifier}.
 */
class ElementClassifierTest {

    @Test
    void classify_taskVariants_areTasks() {
        for (String tag : new String[] {"task", "userTask", "serviceTask", "sendTask", "receiveTask",
            "manualTask", "scriptTask", "businessRuleTask"}) {
            assertThat(ElementClassifier.classify(tag, "")).as(tag).contains(ElementKind.TASK);
        }
    }

    @Test
    void classify_intermediateEventWithLinkDefinition_isLinkEvent() {
        assertThat(ElementClassifier.classify("intermediateThrowEvent", "link")).contains(ElementKind.LINK_THROW_EVENT);
        assertThat(ElementClassifier.classify("intermediateCatchEvent", "link")).contains(ElementKind.LINK_CATCH_EVENT);
        assertThat(ElementClassifier.classify("intermediateCatchEvent", "timer")).contains(ElementKind.INTERMEDIATE_EVENT);
        assertThat(ElementClassifier.classify("endEvent", "link")).contains(ElementKind.END_EVENT);
    }

    @Test
    void classify_gatewaysAndSubProcesses() {
        assertThat(ElementClassifier.classify("exclusiveGateway", "")).contains(ElementKind.EXCLUSIVE_GATEWAY);
        assertThat(ElementClassifier.classify("parallelGateway", "")).contains(ElementKind.PARALLEL_GATEWAY);
        assertThat(ElementClassifier.classify("eventBasedGateway", "")).contains(ElementKind.EVENT_BASED_GATEWAY);
        assertThat(ElementClassifier.classify("callActivity", "")).contains(ElementKind.SUB_PROCESS);
    }

    @Test
    void classify_unknownTag_isEmpty() {
        assertThat(ElementClassifier.classify("customWidget", "")).isEmpty();
        assertThat(ElementClassifier.isNonFlowTag("textAnnotation")).isTrue();
        assertThat(ElementClassifier.isNonFlowTag("task")).isFalse();
    }

    @Test
    void table_isOrderedAndComplete() {
        assertThat(ElementClassifier.table()).containsKeys("startEvent", "endEvent", "boundaryEvent", "complexGateway");
        assertThat(ElementClassifier.table().keySet()).first().isEqualTo("task");
    }
}
