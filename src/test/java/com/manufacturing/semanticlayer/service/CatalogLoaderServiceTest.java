package com.manufacturing.semanticlayer.service;

import com.manufacturing.semanticlayer.entity.*;
import com.manufacturing.semanticlayer.exception.CatalogIntegrityException;
import com.manufacturing.semanticlayer.exception.OperationCancelledException;
import com.manufacturing.semanticlayer.graph.*;
import com.manufacturing.semanticlayer.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CatalogLoaderServiceTest {

    @Mock
    private CatalogTableRepository tableRepository;
    @Mock
    private CatalogRelationshipRepository relationshipRepository;
    @Mock
    private CatalogIntentRepository intentRepository;
    @Mock
    private CatalogPerspectiveRepository perspectiveRepository;
    @Mock
    private CatalogConceptRepository conceptRepository;
    @Mock
    private CatalogConceptFieldRepository conceptFieldRepository;
    @Mock
    private IntentPerspectiveLinkRepository intentPerspectiveRepository;
    @Mock
    private PerspectiveConceptLinkRepository perspectiveConceptRepository;
    @Mock
    private IntentConceptLinkRepository intentConceptRepository;

    @InjectMocks
    private CatalogLoaderService loader;

    private List<CatalogRelationship> relationships;
    private List<IntentPerspectiveLink> intentPerspectives;
    private List<CatalogConceptField> conceptFields;

    @BeforeEach
    void setUp() {
        when(tableRepository.findAllByOrderByTableNameAsc()).thenReturn(List.of(
                table("customer"), table("equipment"), table("non_conformant_materials"),
                table("order"), table("product"), table("product_defects")));

        CatalogRelationship produces = CatalogRelationship.builder()
                .edgeId(1L)
                .fromTable("equipment")
                .toTable("product")
                .relationshipType("produces")
                .joinColumn("equipment_id")
                .weight(1.0)
                .naturalLanguageAlias("made on")
                .fewShotExample("SELECT 1")
                .build();
        relationships = new ArrayList<>(List.of(
                produces,
                relationship(2L, "product", "order", "ordered_in", "product_id", null),
                relationship(3L, "order", "customer", "placed_by", "customer_id", 1.0),
                relationship(4L, "product_defects", "product", "defect_of", "product_id", 1.0),
                relationship(5L, "non_conformant_materials", "product", "used_in", "product_id", 2.0)));
        when(relationshipRepository.findAllByOrderByEdgeIdAsc()).thenReturn(relationships);

        when(intentRepository.findAllByOrderByIntentIdAsc()).thenReturn(List.of(
                new CatalogIntent(1L, "quality-review", null),
                new CatalogIntent(2L, "cost-review", null)));
        when(perspectiveRepository.findAllByOrderByPerspectiveIdAsc()).thenReturn(List.of(
                new CatalogPerspective(1L, "Quality", null),
                new CatalogPerspective(2L, "Finance", null)));
        when(conceptRepository.findAllByOrderByConceptIdAsc()).thenReturn(List.of(
                new CatalogConcept(1L, "MATERIAL_NON_CONFORMANCE", null),
                new CatalogConcept(2L, "PRODUCTION_DEFECT", null),
                new CatalogConcept(3L, "FINANCIAL_LIABILITY_NCM", null)));

        conceptFields = new ArrayList<>(List.of(
                new CatalogConceptField(1L, "non_conformant_materials", "severity", true, "ncm"),
                new CatalogConceptField(2L, "product_defects", "cost_impact", true, "pd"),
                new CatalogConceptField(2L, "product_defects", "severity", true, "pd"),
                new CatalogConceptField(3L, "non_conformant_materials", "cost_impact", true, "ncm")));
        when(conceptFieldRepository.findAllByOrderByConceptIdAscTableNameAscFieldNameAsc()).thenReturn(conceptFields);

        intentPerspectives = new ArrayList<>(List.of(
                new IntentPerspectiveLink(1L, 1L, 1.0),
                new IntentPerspectiveLink(2L, 2L, 1.0)));
        when(intentPerspectiveRepository.findAllByOrderByIntentIdAscPerspectiveIdAsc()).thenReturn(intentPerspectives);

        when(perspectiveConceptRepository.findAllByOrderByPerspectiveIdAscConceptIdAsc()).thenReturn(List.of(
                new PerspectiveConceptLink(1L, 1L, 1.0, "NCM severity is authoritative"),
                new PerspectiveConceptLink(1L, 2L, 0.0, "Defect severity is secondary"),
                new PerspectiveConceptLink(2L, 2L, 0.0, null),
                new PerspectiveConceptLink(2L, 3L, 1.0, null)));
        when(intentConceptRepository.findAllByOrderByIntentIdAscConceptIdAsc()).thenReturn(List.of(
                new IntentConceptLink(2L, 3L, 1, "Cost reviews track liability")));
    }

    @Test
    void testLoadSchemaGraph() {
        GraphModel schema = loader.loadSchemaGraph(OperationDeadline.none());

        assertEquals(CatalogLoaderService.SCHEMA_GRAPH_NAME, schema.getName());
        assertTrue(schema.isSealed());
        assertEquals(6, schema.nodeCount());
        assertEquals(5, schema.edgeCount());

        GraphEdge produces = schema.getEdge("equipment", "product").orElseThrow();
        assertEquals(EdgeType.RELATES_TO, produces.getType());
        assertEquals("produces", produces.getRelationshipKind());
        assertEquals("equipment_id", produces.getJoinColumn());
        assertEquals("made on", produces.getMetadata().get(GraphEdge.NATURAL_LANGUAGE_ALIAS));
        assertEquals("SELECT 1", produces.getMetadata().get(GraphEdge.FEW_SHOT_EXAMPLE));
        assertFalse(produces.getMetadata().containsKey(GraphEdge.CONTEXT));

        assertEquals(1.0, schema.getEdge("product", "order").orElseThrow().getWeight());
    }

    @Test
    void testLoadSemanticGraph() {
        GraphModel semantic = loader.loadSemanticGraph(OperationDeadline.none());
        GraphSummary summary = semantic.summary();

        assertTrue(semantic.isSealed());
        assertEquals(2L, summary.getNodesByKind().get(NodeKind.INTENT));
        assertEquals(2L, summary.getNodesByKind().get(NodeKind.PERSPECTIVE));
        assertEquals(3L, summary.getNodesByKind().get(NodeKind.CONCEPT));
        assertEquals(4L, summary.getNodesByKind().get(NodeKind.FIELD));
        assertEquals(2L, summary.getEdgesByType().get(EdgeType.OPERATES_WITHIN));
        assertEquals(4L, summary.getEdgesByType().get(EdgeType.USES_DEFINITION));
        assertEquals(4L, summary.getEdgesByType().get(EdgeType.CAN_MEAN));
        assertEquals(1L, summary.getEdgesByType().get(EdgeType.ELEVATES));

        GraphEdge suppressed = semantic.getDirectedEdge("perspective:Quality", "concept:PRODUCTION_DEFECT")
                .orElseThrow();
        assertEquals(Elevation.SUPPRESSES, suppressed.getElevation());
        assertEquals(0.0, suppressed.getElevationWeight());
        assertEquals("Defect severity is secondary", suppressed.getRationale());

        GraphEdge canMean = semantic.getDirectedEdge("field:non_conformant_materials.severity",
                "concept:MATERIAL_NON_CONFORMANCE").orElseThrow();
        assertTrue(canMean.isPrimaryField());
        assertEquals("ncm", canMean.getTableAlias());

        GraphNode intent = semantic.requireNode("intent:cost-review");
        assertEquals(2L, intent.getCatalogId());
    }

    @Test
    void testLoadedGraphsAnswerQueries() {
        CatalogGraphs graphs = loader.loadAll(OperationDeadline.none());

        assertEquals(CatalogGraphs.Origin.CATALOG, graphs.getOrigin());
        assertEquals(List.of("equipment", "product", "order", "customer"),
                new JoinPathResolver().resolve(graphs.getSchemaGraph(), "equipment", "customer").getTables());
        assertEquals("non_conformant_materials", new ConceptElevationResolver()
                .resolve(graphs.getSemanticGraph(), "quality-review", "severity").getTable());
    }

    @Test
    void testDanglingRelationshipIsReportedWithRowKeys() {
        relationships.add(relationship(9L, "order", "invoice", "billed_as", "invoice_id", 1.0));

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> loader.loadSchemaGraph(OperationDeadline.none()));

        assertEquals(1, e.getViolations().size());
        String violation = e.getViolations().get(0);
        assertTrue(violation.contains("edge_id=9"));
        assertTrue(violation.contains("to_table=invoice"));
        assertTrue(violation.contains("unknown table 'invoice'"));
    }

    @Test
    void testAllViolationsAreCollected() {
        relationships.add(relationship(9L, "order", "invoice", "billed_as", "invoice_id", 1.0));
        relationships.add(relationship(10L, "customer", "equipment", "visits", "customer_id", 0.0));

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> loader.loadSchemaGraph(OperationDeadline.none()));

        assertEquals(2, e.getViolations().size());
        assertTrue(e.getViolations().get(1).contains("weight 0.0"));
    }

    @Test
    void testReverseRelationshipWithSameJoinIsRejected() {
        relationships.add(relationship(11L, "product", "equipment", "produces", "equipment_id", 1.0));

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> loader.loadSchemaGraph(OperationDeadline.none()));

        assertTrue(e.getViolations().get(0).contains("reverse"));
    }

    @Test
    void testReverseRelationshipWithOtherJoinIsKept() {
        relationships.add(relationship(11L, "product", "equipment", "maintained_by", "maintenance_id", 1.0));

        assertEquals(6, loader.loadSchemaGraph(OperationDeadline.none()).edgeCount());
    }

    @Test
    void testDanglingAssociationIsReported() {
        intentPerspectives.add(new IntentPerspectiveLink(1L, 99L, 1.0));

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> loader.loadSemanticGraph(OperationDeadline.none()));

        assertEquals(1, e.getViolations().size());
        assertTrue(e.getViolations().get(0).contains("schema_intent_perspectives[intent_id=1, perspective_id=99]"));
        assertTrue(e.getViolations().get(0).contains("unknown perspective id 99"));
    }

    @Test
    void testOutOfRangeWeightsAreReported() {
        intentPerspectives.add(new IntentPerspectiveLink(1L, 2L, 1.5));
        when(intentConceptRepository.findAllByOrderByIntentIdAscConceptIdAsc()).thenReturn(List.of(
                new IntentConceptLink(1L, 1L, 2, null)));

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> loader.loadSemanticGraph(OperationDeadline.none()));

        assertEquals(2, e.getViolations().size());
        assertTrue(e.getViolations().get(0).contains("outside [0, 1]"));
        assertTrue(e.getViolations().get(1).contains("must be -1, 0 or 1"));
    }

    @Test
    void testDuplicateIntentNameIsReported() {
        when(intentRepository.findAllByOrderByIntentIdAsc()).thenReturn(List.of(
                new CatalogIntent(1L, "quality-review", null),
                new CatalogIntent(2L, "cost-review", null),
                new CatalogIntent(3L, "quality-review", null)));

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> loader.loadSemanticGraph(OperationDeadline.none()));

        assertTrue(e.getViolations().get(0).contains("schema_intents[intent_id=3]"));
        assertTrue(e.getViolations().get(0).contains("duplicate intent name 'quality-review'"));
    }

    @Test
    void testSecondPrimaryFieldPerTableIsReported() {
        conceptFields.add(new CatalogConceptField(1L, "non_conformant_materials", "severity_code", true, "ncm"));

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> loader.loadSemanticGraph(OperationDeadline.none()));

        assertTrue(e.getViolations().get(0).contains("second primary field"));
    }

    @Test
    void testCancelledDeadlineStopsBeforeReading() {
        OperationDeadline deadline = OperationDeadline.after(Duration.ofMinutes(1));
        deadline.cancel();

        assertThrows(OperationCancelledException.class, () -> loader.loadAll(deadline));
        verify(tableRepository, never()).findAllByOrderByTableNameAsc();
    }

    private static CatalogTable table(String name) {
        return CatalogTable.builder().tableName(name).tableType("fact").build();
    }

    private static CatalogRelationship relationship(Long id, String from, String to, String kind,
                                                    String joinColumn, Double weight) {
        return CatalogRelationship.builder()
                .edgeId(id)
                .fromTable(from)
                .toTable(to)
                .relationshipType(kind)
                .joinColumn(joinColumn)
                .weight(weight)
                .build();
    }
}
