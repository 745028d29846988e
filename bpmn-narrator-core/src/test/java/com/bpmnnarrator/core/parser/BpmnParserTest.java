package com.bpmnnarrator.core.parser;

import com.bpmnnarrator.core.error.BpmnParseException;
import com.bpmnnarrator.core.error.MalformedGraphException;
import com.bpmnnarrator.core.model.BpmnDocument;
import com.bpmnnarrator.core.model.DiagnosticType;
import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.model.ProcessDefinition;
import com.bpmnnarrator.core.model.ProcessElement;
import com.bpmnnarrator.core.model.SequenceFlow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BpmnParser}.
 */
class BpmnParserTest {

    @TempDir
    Path tempDir;

    private static BpmnDocument parse(String body) {
        return parse(new BpmnParser(), body);
    }

    private static BpmnDocument parse(BpmnParser parser, String body) {
        String xml = """
            <?xml version="1.0" encoding="UTF-8"?>
            <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL"
                              xmlns:bpmndi="http://www.omg.org/spec/BPMN/20100524/DI"
                              xmlns:dc="http://www.omg.org/spec/DD/20100524/DC"
                              id="Definitions_1">
            %s
            </bpmn:definitions>
            """.formatted(body);
        return parser.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "teste");
    }

    private static Map<String, ProcessElement> byId(ProcessDefinition process) {
        return process.elements().stream().collect(Collectors.toMap(ProcessElement::id, Function.identity()));
    }

    @Test
    void parse_simpleProcess_classifiesElementsInDocumentOrder() {
        // When
        BpmnDocument document = parse("""
            <bpmn:process id="P1" name="Compra">
              <bpmn:startEvent id="S" name="Início" />
              <bpmn:userTask id="T" name="Aprovar" />
              <bpmn:exclusiveGateway id="G" default="F3" />
              <bpmn:endEvent id="E" />
              <bpmn:sequenceFlow id="F1" sourceRef="S" targetRef="T" />
              <bpmn:sequenceFlow id="F2" sourceRef="T" targetRef="G" />
              <bpmn:sequenceFlow id="F3" sourceRef="G" targetRef="E" />
            </bpmn:process>
            """);

        // Then
        assertThat(document.name()).isEqualTo("teste");
        assertThat(document.processes()).singleElement().satisfies(process -> {
            assertThat(process.id()).isEqualTo("P1");
            assertThat(process.name()).isEqualTo("Compra");
            assertThat(process.elements()).extracting(ProcessElement::kind).containsExactly(
                ElementKind.START_EVENT, ElementKind.TASK, ElementKind.EXCLUSIVE_GATEWAY, ElementKind.END_EVENT);
            assertThat(process.elements().get(1).tagName()).isEqualTo("userTask");
            assertThat(process.elements().get(2).defaultFlowId()).isEqualTo("F3");
            assertThat(process.flows()).extracting(SequenceFlow::id).containsExactly("F1", "F2", "F3");
        });
        assertThat(document.diagnostics()).isEmpty();
    }

    @Test
    void parse_flowWithoutIdAndWithCondition_generatesIdAndReadsCondition() {
        // When
        BpmnDocument document = parse("""
            <bpmn:process id="P1">
              <bpmn:startEvent id="S" />
              <bpmn:endEvent id="E" />
              <bpmn:sequenceFlow sourceRef="S" targetRef="E">
                <bpmn:conditionExpression>${total &gt; 100}</bpmn:conditionExpression>
              </bpmn:sequenceFlow>
            </bpmn:process>
            """);

        // Then
        SequenceFlow flow = document.processes().get(0).flows().get(0);
        assertThat(flow.id()).isEqualTo("sequenceFlow#1");
        assertThat(flow.conditionExpression()).isEqualTo("${total > 100}");
    }

    @Test
    void parse_flowWithoutIdNextToLookalikeDeclaredId_keepsIdsDistinct() {
        // When
        BpmnDocument document = parse("""
            <bpmn:process id="P1">
              <bpmn:startEvent id="S" />
              <bpmn:exclusiveGateway id="G" default="sequenceFlow_1" />
              <bpmn:task id="A" />
              <bpmn:endEvent id="E" />
              <bpmn:sequenceFlow sourceRef="S" targetRef="G" />
              <bpmn:sequenceFlow id="sequenceFlow_1" sourceRef="G" targetRef="E" />
              <bpmn:sequenceFlow id="F3" sourceRef="G" targetRef="A" name="Sim" />
            </bpmn:process>
            """);

        // Then
        assertThat(document.processes().get(0).flows()).extracting(SequenceFlow::id)
            .containsExactly("sequenceFlow#1", "sequenceFlow_1", "F3")
            .doesNotHaveDuplicates();
        assertThat(document.processes().get(0).elements().get(1).defaultFlowId()).isEqualTo("sequenceFlow_1");
    }

    @Test
    void parse_eventDefinitions_setFlavourAndLinkName() {
        // When
        BpmnDocument document = parse("""
            <bpmn:process id="P1">
              <bpmn:task id="T" name="Aguardar" />
              <bpmn:boundaryEvent id="B" name="48h" attachedToRef="T">
                <bpmn:timerEventDefinition id="TD" />
              </bpmn:boundaryEvent>
              <bpmn:intermediateThrowEvent id="LT" name="Ir para pagamento">
                <bpmn:linkEventDefinition id="LD1" name="Pagamento" />
              </bpmn:intermediateThrowEvent>
              <bpmn:intermediateCatchEvent id="LC" name="Pagamento">
                <bpmn:linkEventDefinition id="LD2" />
              </bpmn:intermediateCatchEvent>
              <bpmn:intermediateCatchEvent id="M" name="Resposta">
                <bpmn:messageEventDefinition id="MD" />
              </bpmn:intermediateCatchEvent>
            </bpmn:process>
            """);

        // Then
        Map<String, ProcessElement> elements = byId(document.processes().get(0));
        assertThat(elements.get("B").kind()).isEqualTo(ElementKind.BOUNDARY_EVENT);
        assertThat(elements.get("B").eventDefinition()).isEqualTo("timer");
        assertThat(elements.get("B").attachedToRef()).isEqualTo("T");
        assertThat(elements.get("LT").kind()).isEqualTo(ElementKind.LINK_THROW_EVENT);
        assertThat(elements.get("LT").linkName()).isEqualTo("Pagamento");
        assertThat(elements.get("LC").kind()).isEqualTo(ElementKind.LINK_CATCH_EVENT);
        assertThat(elements.get("LC").linkName()).isEqualTo("Pagamento");
        assertThat(elements.get("M").kind()).isEqualTo(ElementKind.INTERMEDIATE_EVENT);
        assertThat(elements.get("M").eventDefinition()).isEqualTo("message");
    }

    @Test
    void parse_subProcess_isOpaque() {
        // When
        BpmnDocument document = parse("""
            <bpmn:process id="P1">
              <bpmn:subProcess id="SP" name="Conferir estoque">
                <bpmn:startEvent id="Inner_S" />
                <bpmn:task id="Inner_T" />
              </bpmn:subProcess>
            </bpmn:process>
            """);

        // Then
        assertThat(document.processes().get(0).elements()).extracting(ProcessElement::id).containsExactly("SP");
    }

    @Test
    void parse_unrecognizedElement_isSkippedWithDiagnostic() {
        // When
        BpmnDocument document = parse("""
            <bpmn:process id="P1">
              <bpmn:startEvent id="S" />
              <bpmn:customWidget id="W" />
            </bpmn:process>
            """);

        // Then
        assertThat(document.processes().get(0).elements()).extracting(ProcessElement::id).containsExactly("S");
        assertThat(document.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(DiagnosticType.UNRECOGNIZED_ELEMENT);
            assertThat(d.message()).isEqualTo("Elemento não reconhecido ignorado: customWidget (W)");
        });
    }

    @Test
    void parse_unnamedProcess_usesParticipantNameAsTitle() {
        // When
        BpmnDocument document = parse("""
            <bpmn:collaboration id="C">
              <bpmn:participant id="Pool_1" name="Financeiro" processRef="P1" />
              <bpmn:participant id="Pool_2" name="Banco" />
              <bpmn:messageFlow id="MF" name="Boleto" sourceRef="Pool_2" targetRef="S" />
            </bpmn:collaboration>
            <bpmn:process id="P1">
              <bpmn:startEvent id="S" />
            </bpmn:process>
            """);

        // Then
        assertThat(document.processes().get(0).name()).isEqualTo("Financeiro");
        assertThat(document.participants()).hasSize(2);
        assertThat(document.messageFlows()).singleElement().satisfies(flow -> {
            assertThat(flow.name()).isEqualTo("Boleto");
            assertThat(flow.sourceRef()).isEqualTo("Pool_2");
            assertThat(flow.targetRef()).isEqualTo("S");
        });
    }

    @Test
    void parse_nestedLanes_innermostLaneWins() {
        // When
        BpmnDocument document = parse("""
            <bpmn:process id="P1">
              <bpmn:laneSet id="LS">
                <bpmn:lane id="L_Empresa" name="Empresa">
                  <bpmn:flowNodeRef>T1</bpmn:flowNodeRef>
                  <bpmn:flowNodeRef>T2</bpmn:flowNodeRef>
                  <bpmn:childLaneSet id="CLS">
                    <bpmn:lane id="L_Compras" name="Compras">
                      <bpmn:flowNodeRef>T1</bpmn:flowNodeRef>
                    </bpmn:lane>
                  </bpmn:childLaneSet>
                </bpmn:lane>
              </bpmn:laneSet>
              <bpmn:task id="T1" name="Cotar" />
              <bpmn:task id="T2" name="Aprovar" />
            </bpmn:process>
            """);

        // Then
        Map<String, ProcessElement> elements = byId(document.processes().get(0));
        assertThat(elements.get("T1").details().actor()).isEqualTo("Compras");
        assertThat(elements.get("T2").details().actor()).isEqualTo("Empresa");
    }

    private static final String LANES_WITH_SHAPES = """
        <bpmn:process id="P1">
          <bpmn:laneSet id="LS">
            <bpmn:lane id="L_Empresa" name="Empresa">
              <bpmn:childLaneSet id="CLS">
                <bpmn:lane id="L_Compras" name="Compras" />
                <bpmn:lane id="L_Fiscal" name="Fiscal" />
              </bpmn:childLaneSet>
            </bpmn:lane>
          </bpmn:laneSet>
          <bpmn:task id="T_Dentro" name="Cotar" />
          <bpmn:task id="T_Fora" name="Arquivar" />
        </bpmn:process>
        <bpmndi:BPMNDiagram id="D">
          <bpmndi:BPMNPlane id="Plane" bpmnElement="P1">
            <bpmndi:BPMNShape id="L_Empresa_di" bpmnElement="L_Empresa">
              <dc:Bounds x="0" y="0" width="1000" height="400" />
            </bpmndi:BPMNShape>
            <bpmndi:BPMNShape id="L_Compras_di" bpmnElement="L_Compras">
              <dc:Bounds x="30" y="0" width="970" height="200" />
            </bpmndi:BPMNShape>
            <bpmndi:BPMNShape id="L_Fiscal_di" bpmnElement="L_Fiscal">
              <dc:Bounds x="30" y="200" width="970" height="200" />
            </bpmndi:BPMNShape>
            <bpmndi:BPMNShape id="T_Dentro_di" bpmnElement="T_Dentro">
              <dc:Bounds x="100" y="250" width="100" height="80" />
            </bpmndi:BPMNShape>
            <bpmndi:BPMNShape id="T_Fora_di" bpmnElement="T_Fora">
              <dc:Bounds x="1200" y="50" width="100" height="80" />
            </bpmndi:BPMNShape>
          </bpmndi:BPMNPlane>
        </bpmndi:BPMNDiagram>
        """;

    @Test
    void parse_elementWithoutLaneRef_actorInferredFromDiagram() {
        // When
        BpmnDocument document = parse(LANES_WITH_SHAPES);

        // Then
        Map<String, ProcessElement> elements = byId(document.processes().get(0));
        assertThat(elements.get("T_Dentro").details().actor()).isEqualTo("Fiscal");
        assertThat(elements.get("T_Fora").details().actor()).isNull();
    }

    @Test
    void parse_laneInferenceDisabled_leavesActorEmpty() {
        // When
        BpmnDocument document = parse(new BpmnParser(false), LANES_WITH_SHAPES);

        // Then
        assertThat(byId(document.processes().get(0)).get("T_Dentro").details().actor()).isNull();
    }

    @Test
    void parse_elementStraddlingSiblingLanes_isMarkedAmbiguous() {
        // When
        BpmnDocument document = parse("""
            <bpmn:process id="P1">
              <bpmn:laneSet id="LS">
                <bpmn:lane id="L_A" name="Atendimento" />
                <bpmn:lane id="L_B" name="Backoffice" />
              </bpmn:laneSet>
              <bpmn:task id="T" name="Encaminhar" />
            </bpmn:process>
            <bpmndi:BPMNDiagram id="D">
              <bpmndi:BPMNPlane id="Plane" bpmnElement="P1">
                <bpmndi:BPMNShape id="L_A_di" bpmnElement="L_A">
                  <dc:Bounds x="0" y="0" width="500" height="200" />
                </bpmndi:BPMNShape>
                <bpmndi:BPMNShape id="L_B_di" bpmnElement="L_B">
                  <dc:Bounds x="0" y="200" width="500" height="200" />
                </bpmndi:BPMNShape>
                <bpmndi:BPMNShape id="T_di" bpmnElement="T">
                  <dc:Bounds x="100" y="160" width="100" height="80" />
                </bpmndi:BPMNShape>
              </bpmndi:BPMNPlane>
            </bpmndi:BPMNDiagram>
            """);

        // Then
        assertThat(document.processes().get(0).elements().get(0).details().actor())
            .isEqualTo("Atendimento" + LaneResolver.AMBIGUOUS_SUFFIX);
    }

    @Test
    void parse_associations_attachSystemsDocumentsAndAnnotations() {
        // When
        BpmnDocument document = parse("""
            <bpmn:process id="P1">
              <bpmn:task id="T" name="Emitir nota">
                <bpmn:dataInputAssociation id="DIA">
                  <bpmn:sourceRef>Ref_Pedido</bpmn:sourceRef>
                </bpmn:dataInputAssociation>
              </bpmn:task>
              <bpmn:dataObject id="Obj_Pedido" name="Pedido" />
              <bpmn:dataObjectReference id="Ref_Pedido" dataObjectRef="Obj_Pedido" />
              <bpmn:dataStoreReference id="Ref_SAP" name="SAP" />
              <bpmn:textAnnotation id="A1"><bpmn:text>Até às 18h</bpmn:text></bpmn:textAnnotation>
              <bpmn:textAnnotation id="A2"><bpmn:text>Sem dono</bpmn:text></bpmn:textAnnotation>
              <bpmn:association id="AS1" sourceRef="A1" targetRef="T" />
              <bpmn:association id="AS2" sourceRef="T" targetRef="Ref_SAP" />
            </bpmn:process>
            """);

        // Then
        ProcessElement task = document.processes().get(0).elements().get(0);
        assertThat(task.details().documents()).containsExactly("Pedido");
        assertThat(task.details().systems()).containsExactly("SAP");
        assertThat(task.details().annotations()).containsExactly("Até às 18h");
        assertThat(document.orphanAnnotations()).containsExactly("Sem dono");
    }

    @Test
    void parse_elementWithoutId_throwsMalformedGraph() {
        assertThatThrownBy(() -> parse("""
            <bpmn:process id="P1">
              <bpmn:task name="Sem id" />
            </bpmn:process>
            """))
            .isInstanceOf(MalformedGraphException.class)
            .hasMessageContaining("without id");
    }

    @Test
    void parse_duplicateIds_throwsMalformedGraph() {
        assertThatThrownBy(() -> parse("""
            <bpmn:process id="P1">
              <bpmn:task id="T" />
              <bpmn:task id="T" />
            </bpmn:process>
            """))
            .isInstanceOf(MalformedGraphException.class)
            .hasMessageContaining("Duplicate element id: T");
    }

    @Test
    void parse_nonBpmnRoot_throwsParseException() {
        byte[] xml = "<project><name>x</name></project>".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new BpmnParser().parse(new ByteArrayInputStream(xml), "pom"))
            .isInstanceOf(BpmnParseException.class)
            .hasMessageContaining("Not a BPMN 2.0 document");
    }

    @Test
    void parse_malformedXml_throwsParseException() {
        byte[] xml = "<bpmn:definitions xmlns:bpmn=\"http://www.omg.org/spec/BPMN/20100524/MODEL\">"
            .getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new BpmnParser().parse(new ByteArrayInputStream(xml), "quebrado"))
            .isInstanceOf(BpmnParseException.class)
            .hasMessageContaining("Malformed XML in quebrado");
    }

    @Test
    void parse_doctype_isRejected() {
        byte[] xml = """
            <?xml version="1.0"?>
            <!DOCTYPE definitions [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
            <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL">&xxe;</bpmn:definitions>
            """.getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new BpmnParser().parse(new ByteArrayInputStream(xml), "xxe"))
            .isInstanceOf(BpmnParseException.class);
    }

    @Test
    void parse_file_usesStemAsName() throws IOException {
        // Given
        Path file = tempDir.resolve("pedido.bpmn");
        Files.writeString(file, """
            <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL">
              <bpmn:process id="P1"><bpmn:startEvent id="S" /></bpmn:process>
            </bpmn:definitions>
            """);

        // When
        BpmnDocument document = new BpmnParser().parse(file);

        // Then
        assertThat(document.name()).isEqualTo("pedido");
    }

    @Test
    void parse_missingFile_throwsParseException() {
        assertThatThrownBy(() -> new BpmnParser().parse(tempDir.resolve("missing.bpmn")))
            .isInstanceOf(BpmnParseException.class)
            .hasMessageContaining("missing.bpmn");
    }
}
