package com.manufacturing.semanticlayer.service;

import com.manufacturing.semanticlayer.entity.*;
import com.manufacturing.semanticlayer.exception.CatalogIntegrityException;
import com.manufacturing.semanticlayer.exception.DuplicateEdgeException;
import com.manufacturing.semanticlayer.exception.DuplicateNodeException;
import com.manufacturing.semanticlayer.graph.*;
import com.manufacturing.semanticlayer.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

/**
 * Builds the schema graph and the semantic graph from the catalog relations.
 *
 * Reads are ordered by primary key so two runs over the same catalog build the
 * same graph. Node relations are read before the edge and association
 * relations that reference them. Every integrity violation is collected and
 * reported together; a graph is only returned when there are none.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogLoaderService {

    public static final String SCHEMA_GRAPH_NAME = "schema";
    public static final String SEMANTIC_GRAPH_NAME = "semantic";

    private final CatalogTableRepository tableRepository;
    private final CatalogRelationshipRepository relationshipRepository;
    private final CatalogIntentRepository intentRepository;
    private final CatalogPerspectiveRepository perspectiveRepository;
    private final CatalogConceptRepository conceptRepository;
    private final CatalogConceptFieldRepository conceptFieldRepository;
    private final IntentPerspectiveLinkRepository intentPerspectiveRepository;
    private final PerspectiveConceptLinkRepository perspectiveConceptRepository;
    private final IntentConceptLinkRepository intentConceptRepository;

    @Transactional(readOnly = true)
    public CatalogGraphs loadAll(OperationDeadline deadline) {
        GraphModel schemaGraph = loadSchemaGraph(deadline);
        GraphModel semanticGraph = loadSemanticGraph(deadline);
        return new CatalogGraphs(schemaGraph, semanticGraph, Instant.now(), CatalogGraphs.Origin.CATALOG);
    }

    /**
     * Tables become nodes keyed by table name, relationships become RELATES_TO edges.
     */
    @Transactional(readOnly = true)
    public GraphModel loadSchemaGraph(OperationDeadline deadline) {
        long startTime = System.currentTimeMillis();
        List<String> violations = new ArrayList<>();
        GraphModel graph = GraphModel.directed(SCHEMA_GRAPH_NAME);

        deadline.checkpoint("reading schema_nodes");
        for (CatalogTable table : tableRepository.findAllByOrderByTableNameAsc()) {
            if (isBlank(table.getTableName())) {
                violations.add("schema_nodes row with blank table_name");
                continue;
            }
            addNode(graph, GraphNode.table(table.getTableName(), table.getTableType(), table.getDescription()),
                    "schema_nodes[table_name=" + table.getTableName() + "]", violations);
        }

        deadline.checkpoint("reading schema_edges");
        for (CatalogRelationship relationship : relationshipRepository.findAllByOrderByEdgeIdAsc()) {
            String row = "schema_edges[edge_id=" + relationship.getEdgeId()
                    + ", from_table=" + relationship.getFromTable()
                    + ", to_table=" + relationship.getToTable() + "]";
            boolean valid = requireNode(graph, relationship.getFromTable(), "table", row, violations);
            valid &= requireNode(graph, relationship.getToTable(), "table", row, violations);

            double weight = relationship.getWeight() != null ? relationship.getWeight() : 1.0;
            if (!(weight > 0.0) || Double.isInfinite(weight)) {
                violations.add(row + ": weight " + weight + " must be a positive finite number");
                valid = false;
            }
            if (!valid) {
                continue;
            }
            if (duplicatesReverse(graph, relationship)) {
                violations.add(row + ": repeats the reverse relationship "
                        + relationship.getToTable() + " -> " + relationship.getFromTable());
                continue;
            }
            addEdge(graph, toSchemaEdge(relationship, weight), row, violations);
        }

        failOnViolations(violations);
        log.info("Schema graph built: {} tables, {} relationships in {}ms",
                graph.nodeCount(), graph.edgeCount(), System.currentTimeMillis() - startTime);
        return graph.seal();
    }

    /**
     * Intents, perspectives, concepts and fields become nodes; the concept-field
     * and the three association relations become edges.
     */
    @Transactional(readOnly = true)
    public GraphModel loadSemanticGraph(OperationDeadline deadline) {
        long startTime = System.currentTimeMillis();
        List<String> violations = new ArrayList<>();
        GraphModel graph = GraphModel.directed(SEMANTIC_GRAPH_NAME);

        deadline.checkpoint("reading schema_intents");
        Map<Long, String> intentIds = new HashMap<>();
        for (CatalogIntent intent : intentRepository.findAllByOrderByIntentIdAsc()) {
            String row = "schema_intents[intent_id=" + intent.getIntentId() + "]";
            if (isBlank(intent.getIntentName())) {
                violations.add(row + ": blank intent_name");
                continue;
            }
            GraphNode node = GraphNode.intent(intent.getIntentId(), intent.getIntentName(), intent.getDescription());
            intentIds.put(intent.getIntentId(), node.getId());
            addNode(graph, node, row, violations);
        }

        deadline.checkpoint("reading schema_perspectives");
        Map<Long, String> perspectiveIds = new HashMap<>();
        for (CatalogPerspective perspective : perspectiveRepository.findAllByOrderByPerspectiveIdAsc()) {
            String row = "schema_perspectives[perspective_id=" + perspective.getPerspectiveId() + "]";
            if (isBlank(perspective.getPerspectiveName())) {
                violations.add(row + ": blank perspective_name");
                continue;
            }
            GraphNode node = GraphNode.perspective(perspective.getPerspectiveId(),
                    perspective.getPerspectiveName(), perspective.getDescription());
            perspectiveIds.put(perspective.getPerspectiveId(), node.getId());
            addNode(graph, node, row, violations);
        }

        deadline.checkpoint("reading schema_concepts");
        Map<Long, String> conceptIds = new HashMap<>();
        for (CatalogConcept concept : conceptRepository.findAllByOrderByConceptIdAsc()) {
            String row = "schema_concepts[concept_id=" + concept.getConceptId() + "]";
            if (isBlank(concept.getConceptName())) {
                violations.add(row + ": blank concept_name");
                continue;
            }
            GraphNode node = GraphNode.concept(concept.getConceptId(), concept.getConceptName(), concept.getDescription());
            conceptIds.put(concept.getConceptId(), node.getId());
            addNode(graph, node, row, violations);
        }

        deadline.checkpoint("reading schema_concept_fields");
        List<CatalogConceptField> conceptFields = conceptFieldRepository.findAllByOrderByConceptIdAscTableNameAscFieldNameAsc();
        for (CatalogConceptField field : conceptFields) {
            if (isBlank(field.getTableName()) || isBlank(field.getFieldName())) {
                continue; // reported with the CAN_MEAN edge below
            }
            String fieldId = NodeKind.fieldId(field.getTableName(), field.getFieldName());
            if (!graph.containsNode(fieldId)) {
                graph.addNode(GraphNode.field(field.getTableName(), field.getFieldName()));
            }
        }

        deadline.checkpoint("reading schema_intent_perspectives");
        for (IntentPerspectiveLink link : intentPerspectiveRepository.findAllByOrderByIntentIdAscPerspectiveIdAsc()) {
            String row = "schema_intent_perspectives[intent_id=" + link.getIntentId()
                    + ", perspective_id=" + link.getPerspectiveId() + "]";
            String intentId = resolveId(intentIds, link.getIntentId(), "intent", row, violations);
            String perspectiveId = resolveId(perspectiveIds, link.getPerspectiveId(), "perspective", row, violations);
            Double weight = link.getIntentFactorWeight();
            if (weight != null && !inUnitInterval(weight)) {
                violations.add(row + ": intent_factor_weight " + weight + " outside [0, 1]");
                continue;
            }
            if (intentId == null || perspectiveId == null) {
                continue;
            }
            addEdge(graph, GraphEdge.builder()
                    .from(intentId)
                    .to(perspectiveId)
                    .type(EdgeType.OPERATES_WITHIN)
                    .weight(weight)
                    .build(), row, violations);
        }

        deadline.checkpoint("reading schema_perspective_concepts");
        for (PerspectiveConceptLink link : perspectiveConceptRepository.findAllByOrderByPerspectiveIdAscConceptIdAsc()) {
            String row = "schema_perspective_concepts[perspective_id=" + link.getPerspectiveId()
                    + ", concept_id=" + link.getConceptId() + "]";
            String perspectiveId = resolveId(perspectiveIds, link.getPerspectiveId(), "perspective", row, violations);
            String conceptId = resolveId(conceptIds, link.getConceptId(), "concept", row, violations);
            Double elevationWeight = link.getElevationWeight();
            if (elevationWeight != null && !inUnitInterval(elevationWeight)) {
                violations.add(row + ": elevation_weight " + elevationWeight + " outside [0, 1]");
                continue;
            }
            if (perspectiveId == null || conceptId == null) {
                continue;
            }
            addEdge(graph, GraphEdge.builder()
                    .from(perspectiveId)
                    .to(conceptId)
                    .type(EdgeType.USES_DEFINITION)
                    .elevation(Elevation.fromElevationWeight(elevationWeight))
                    .elevationWeight(elevationWeight)
                    .rationale(link.getCollisionResolution())
                    .build(), row, violations);
        }

        Set<String> primaryKeys = new HashSet<>();
        for (CatalogConceptField field : conceptFields) {
            String row = "schema_concept_fields[concept_id=" + field.getConceptId()
                    + ", table_name=" + field.getTableName() + ", field_name=" + field.getFieldName() + "]";
            String conceptId = resolveId(conceptIds, field.getConceptId(), "concept", row, violations);
            if (isBlank(field.getTableName()) || isBlank(field.getFieldName())) {
                violations.add(row + ": blank table_name or field_name");
                continue;
            }
            if (Boolean.TRUE.equals(field.getPrimary())
                    && !primaryKeys.add(field.getConceptId() + "|" + field.getTableName())) {
                violations.add(row + ": second primary field for concept " + field.getConceptId()
                        + " in table " + field.getTableName());
                continue;
            }
            if (conceptId == null) {
                continue;
            }
            addEdge(graph, GraphEdge.builder()
                    .from(NodeKind.fieldId(field.getTableName(), field.getFieldName()))
                    .to(conceptId)
                    .type(EdgeType.CAN_MEAN)
                    .primary(Boolean.TRUE.equals(field.getPrimary()))
                    .tableAlias(field.getTableAlias())
                    .build(), row, violations);
        }

        deadline.checkpoint("reading schema_intent_concepts");
        for (IntentConceptLink link : intentConceptRepository.findAllByOrderByIntentIdAscConceptIdAsc()) {
            String row = "schema_intent_concepts[intent_id=" + link.getIntentId()
                    + ", concept_id=" + link.getConceptId() + "]";
            String intentId = resolveId(intentIds, link.getIntentId(), "intent", row, violations);
            String conceptId = resolveId(conceptIds, link.getConceptId(), "concept", row, violations);
            Integer weight = link.getIntentFactorWeight();
            if (weight == null || weight < -1 || weight > 1) {
                violations.add(row + ": intent_factor_weight " + weight + " must be -1, 0 or 1");
                continue;
            }
            if (intentId == null || conceptId == null) {
                continue;
            }
            addEdge(graph, GraphEdge.builder()
                    .from(intentId)
                    .to(conceptId)
                    .type(EdgeType.forElevation(Elevation.fromIntentWeight(weight)))
                    .weight(weight.doubleValue())
                    .rationale(link.getExplanation())
                    .build(), row, violations);
        }

        failOnViolations(violations);
        GraphSummary summary = graph.summary();
        log.info("Semantic graph built: {} nodes {}, {} edges {} in {}ms",
                summary.getNodeCount(), summary.getNodesByKind(),
                summary.getEdgeCount(), summary.getEdgesByType(),
                System.currentTimeMillis() - startTime);
        return graph.seal();
    }

    private GraphEdge toSchemaEdge(CatalogRelationship relationship, double weight) {
        GraphEdge.GraphEdgeBuilder edge = GraphEdge.builder()
                .from(relationship.getFromTable())
                .to(relationship.getToTable())
                .type(EdgeType.RELATES_TO)
                .relationshipKind(relationship.getRelationshipType())
                .joinColumn(relationship.getJoinColumn())
                .weight(weight);
        putIfPresent(edge, GraphEdge.JOIN_COLUMN_DESCRIPTION, relationship.getJoinColumnDescription());
        putIfPresent(edge, GraphEdge.NATURAL_LANGUAGE_ALIAS, relationship.getNaturalLanguageAlias());
        putIfPresent(edge, GraphEdge.FEW_SHOT_EXAMPLE, relationship.getFewShotExample());
        putIfPresent(edge, GraphEdge.CONTEXT, relationship.getContext());
        return edge.build();
    }

    private static void putIfPresent(GraphEdge.GraphEdgeBuilder edge, String key, String value) {
        if (value != null) {
            edge.metadataEntry(key, value);
        }
    }

    /**
     * A reverse edge is only a separate relationship when it differs in kind or join column.
     */
    private static boolean duplicatesReverse(GraphModel graph, CatalogRelationship relationship) {
        return graph.getDirectedEdge(relationship.getToTable(), relationship.getFromTable())
                .filter(reverse -> Objects.equals(reverse.getRelationshipKind(), relationship.getRelationshipType())
                        && Objects.equals(reverse.getJoinColumn(), relationship.getJoinColumn()))
                .isPresent();
    }

    private static void addNode(GraphModel graph, GraphNode node, String row, List<String> violations) {
        try {
            graph.addNode(node);
        } catch (DuplicateNodeException e) {
            violations.add(row + ": duplicate " + node.getKind().name().toLowerCase()
                    + " name '" + node.getName() + "'");
        }
    }

    private static void addEdge(GraphModel graph, GraphEdge edge, String row, List<String> violations) {
        try {
            graph.addEdge(edge);
        } catch (DuplicateEdgeException e) {
            violations.add(row + ": duplicate edge " + edge.getFrom() + " -> " + edge.getTo());
        }
    }

    private static boolean requireNode(GraphModel graph, String id, String what, String row, List<String> violations) {
        if (id == null || !graph.containsNode(id)) {
            violations.add(row + ": references unknown " + what + " '" + id + "'");
            return false;
        }
        return true;
    }

    private static String resolveId(Map<Long, String> ids, Long catalogId, String what, String row,
                                    List<String> violations) {
        String id = catalogId == null ? null : ids.get(catalogId);
        if (id == null) {
            violations.add(row + ": references unknown " + what + " id " + catalogId);
        }
        return id;
    }

    private static void failOnViolations(List<String> violations) {
        if (!violations.isEmpty()) {
            log.error("Catalog integrity check failed: {}", violations);
            throw new CatalogIntegrityException(violations);
        }
    }

    private static boolean inUnitInterval(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
