package com.manufacturing.semanticlayer.service;

import com.manufacturing.semanticlayer.dto.ConceptResolution;
import com.manufacturing.semanticlayer.dto.ConceptScore;
import com.manufacturing.semanticlayer.dto.IntentComparison;
import com.manufacturing.semanticlayer.exception.AmbiguousResolutionException;
import com.manufacturing.semanticlayer.exception.NoApplicableConceptException;
import com.manufacturing.semanticlayer.exception.SemanticLayerException;
import com.manufacturing.semanticlayer.exception.UnknownNodeException;
import com.manufacturing.semanticlayer.graph.EdgeType;
import com.manufacturing.semanticlayer.graph.GraphEdge;
import com.manufacturing.semanticlayer.graph.GraphModel;
import com.manufacturing.semanticlayer.graph.GraphNode;
import com.manufacturing.semanticlayer.graph.NodeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Picks the authoritative (table, column) for a field name that can mean
 * several concepts, from the point of view of one intent.
 *
 * <pre>
 * score(concept) = perspectiveElevation(concept) + intentDirectWeight(concept)
 * </pre>
 *
 * perspectiveElevation is the highest elevation weight among the perspectives
 * the intent engages (OPERATES_WITHIN weight &gt; 0 or absent) that use the
 * concept; intentDirectWeight is the -1/0/+1 weight of a direct intent edge.
 * Equal scores fall back to the smallest table alias of each concept's
 * CAN_MEAN edges, then to the concept name unless the policy is
 * {@link TieBreakPolicy#STRICT}.
 */
@Service
@Slf4j
public class ConceptElevationResolver {

    private static final double EPSILON = 1e-9;

    private static final Set<EdgeType> INTENT_CONCEPT_TYPES =
            EnumSet.of(EdgeType.ELEVATES, EdgeType.SUPPRESSES, EdgeType.NEUTRAL);

    private static final Comparator<String> ALIAS_ORDER = Comparator.nullsLast(Comparator.naturalOrder());

    public ConceptResolution resolve(GraphModel semanticGraph, String intentName, String fieldName) {
        return resolve(semanticGraph, intentName, fieldName, null, TieBreakPolicy.LEXICOGRAPHIC);
    }

    public ConceptResolution resolve(GraphModel semanticGraph, String intentName, String fieldName,
                                     String tableScope, TieBreakPolicy policy) {
        String intentId = NodeKind.INTENT.idFor(intentName);
        if (!semanticGraph.containsNode(intentId)) {
            throw new UnknownNodeException(intentId, "intent '" + intentName + "'");
        }

        Map<String, List<GraphEdge>> meaningsByConcept = meaningsOf(semanticGraph, fieldName);
        if (meaningsByConcept.isEmpty()) {
            throw new NoApplicableConceptException(intentName, fieldName);
        }

        Map<String, GraphEdge> engaged = engagedPerspectives(semanticGraph, intentId);

        List<Scored> scored = new ArrayList<>();
        meaningsByConcept.forEach((conceptId, meanings) ->
                scored.add(score(semanticGraph, intentId, conceptId, meanings, engaged)));
        scored.sort(Comparator.comparingDouble((Scored s) -> -s.score)
                .thenComparing(s -> s.tableAlias, ALIAS_ORDER)
                .thenComparing(s -> s.conceptName));

        Scored winner = scored.get(0);
        List<Scored> tied = scored.stream()
                .filter(s -> sameScore(s.score, winner.score))
                .collect(Collectors.toList());
        List<Scored> tiedOnAlias = tied.stream()
                .filter(s -> Objects.equals(s.tableAlias, winner.tableAlias))
                .collect(Collectors.toList());
        if (policy == TieBreakPolicy.STRICT && tiedOnAlias.size() > 1) {
            throw new AmbiguousResolutionException(intentName, fieldName,
                    "concepts tie on score " + winner.score + " and table alias " + winner.tableAlias,
                    tiedOnAlias.stream().map(s -> s.conceptName).collect(Collectors.toList()));
        }
        if (tied.size() > 1) {
            log.debug("Score tie {} for field '{}' under intent '{}' broken by {} in favour of {}",
                    tied.stream().map(s -> s.conceptName).collect(Collectors.toList()), fieldName, intentName,
                    tiedOnAlias.size() > 1 ? "concept name" : "table alias", winner.conceptName);
        }

        GraphEdge meaning = selectTable(semanticGraph, intentName, fieldName, tableScope, winner);
        GraphNode field = semanticGraph.requireNode(meaning.getFrom());
        Scored runnerUp = scored.size() > 1 ? scored.get(1) : null;

        ConceptResolution resolution = ConceptResolution.builder()
                .intent(intentName)
                .fieldName(fieldName)
                .concept(winner.conceptName)
                .table(field.getTableName())
                .column(field.getColumnName())
                .tableAlias(meaning.getTableAlias())
                .score(winner.score)
                .decidingPerspective(winner.perspectiveName())
                .decidingEdge(decidingEdge(winner))
                .rationale(rationale(intentName, winner, runnerUp, tied.size() > 1, tiedOnAlias.size() > 1))
                .candidates(scored.stream().map(Scored::toScore).collect(Collectors.toList()))
                .build();
        log.debug("Resolved '{}' under intent '{}' to {}.{} ({})", fieldName, intentName,
                resolution.getTable(), resolution.getColumn(), resolution.getConcept());
        return resolution;
    }

    /**
     * Resolves the field under every intent of the graph, in intent name order.
     * Per-intent failures are reported in the result rather than thrown.
     */
    public List<IntentComparison> compareIntents(GraphModel semanticGraph, String fieldName,
                                                 String tableScope, TieBreakPolicy policy) {
        List<IntentComparison> comparisons = new ArrayList<>();
        for (GraphNode intent : semanticGraph.nodes(NodeKind.INTENT)) {
            try {
                comparisons.add(IntentComparison.builder()
                        .intent(intent.getName())
                        .resolution(resolve(semanticGraph, intent.getName(), fieldName, tableScope, policy))
                        .build());
            } catch (SemanticLayerException e) {
                log.debug("Intent '{}' cannot resolve '{}': {}", intent.getName(), fieldName, e.getMessage());
                comparisons.add(IntentComparison.builder()
                        .intent(intent.getName())
                        .error(e.getMessage())
                        .errorType(e.getClass().getSimpleName())
                        .build());
            }
        }
        return comparisons;
    }

    /**
     * CAN_MEAN edges of every field whose column name matches, grouped by concept id.
     */
    private static Map<String, List<GraphEdge>> meaningsOf(GraphModel graph, String fieldName) {
        Map<String, List<GraphEdge>> byConcept = new TreeMap<>();
        for (GraphNode field : graph.nodes(NodeKind.FIELD)) {
            if (!fieldName.equals(field.getColumnName())) {
                continue;
            }
            for (GraphEdge edge : graph.outgoing(field.getId())) {
                if (edge.getType() == EdgeType.CAN_MEAN) {
                    byConcept.computeIfAbsent(edge.getTo(), k -> new ArrayList<>()).add(edge);
                }
            }
        }
        return byConcept;
    }

    private static Map<String, GraphEdge> engagedPerspectives(GraphModel graph, String intentId) {
        Map<String, GraphEdge> engaged = new TreeMap<>();
        for (GraphEdge edge : graph.outgoing(intentId)) {
            if (edge.getType() == EdgeType.OPERATES_WITHIN && (edge.getWeight() == null || edge.getWeight() > 0.0)) {
                engaged.put(edge.getTo(), edge);
            }
        }
        return engaged;
    }

    private static Scored score(GraphModel graph, String intentId, String conceptId,
                                List<GraphEdge> meanings, Map<String, GraphEdge> engaged) {
        Scored scored = new Scored();
        scored.conceptId = conceptId;
        scored.conceptName = graph.requireNode(conceptId).getName();
        scored.meanings = meanings;
        scored.tableAlias = meanings.stream()
                .map(GraphEdge::getTableAlias)
                .min(ALIAS_ORDER)
                .orElse(null);

        // engaged is ordered by perspective id, so the first maximum is the smallest name
        for (String perspectiveId : engaged.keySet()) {
            Optional<GraphEdge> uses = graph.getDirectedEdge(perspectiveId, conceptId)
                    .filter(edge -> edge.getType() == EdgeType.USES_DEFINITION);
            if (uses.isEmpty()) {
                continue;
            }
            double elevation = uses.get().getElevationWeight() != null ? uses.get().getElevationWeight() : 0.0;
            if (scored.perspectiveEdge == null || elevation > scored.perspectiveElevation) {
                scored.perspectiveElevation = elevation;
                scored.perspectiveEdge = uses.get();
                scored.perspective = graph.requireNode(perspectiveId);
            }
        }

        graph.getDirectedEdge(intentId, conceptId)
                .filter(edge -> INTENT_CONCEPT_TYPES.contains(edge.getType()))
                .ifPresent(edge -> {
                    scored.intentEdge = edge;
                    scored.intentDirectWeight = edge.weightOr(0.0);
                });

        scored.score = scored.perspectiveElevation + scored.intentDirectWeight;
        return scored;
    }

    private static GraphEdge selectTable(GraphModel graph, String intentName, String fieldName,
                                         String tableScope, Scored winner) {
        List<GraphEdge> candidates = winner.meanings;
        if (tableScope != null) {
            candidates = candidates.stream()
                    .filter(edge -> tableScope.equals(graph.requireNode(edge.getFrom()).getTableName()))
                    .collect(Collectors.toList());
            if (candidates.isEmpty()) {
                throw new AmbiguousResolutionException(intentName, fieldName,
                        "concept " + winner.conceptName + " has no field in table scope '" + tableScope + "'",
                        fieldNames(graph, winner.meanings));
            }
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        List<GraphEdge> primaries = candidates.stream()
                .filter(GraphEdge::isPrimaryField)
                .collect(Collectors.toList());
        if (primaries.size() == 1) {
            return primaries.get(0);
        }
        throw new AmbiguousResolutionException(intentName, fieldName,
                "concept " + winner.conceptName + (primaries.isEmpty()
                        ? " has no primary field among its tables; pass a table scope"
                        : " has a primary field in several tables; pass a table scope"),
                fieldNames(graph, primaries.isEmpty() ? candidates : primaries));
    }

    private static List<String> fieldNames(GraphModel graph, List<GraphEdge> meanings) {
        return meanings.stream()
                .map(edge -> graph.requireNode(edge.getFrom()).getName())
                .sorted()
                .collect(Collectors.toList());
    }

    private static String decidingEdge(Scored winner) {
        GraphEdge edge;
        if (winner.intentEdge != null
                && (winner.perspectiveEdge == null || Math.abs(winner.intentDirectWeight) > winner.perspectiveElevation)) {
            edge = winner.intentEdge;
        } else {
            edge = winner.perspectiveEdge;
        }
        return edge == null ? null : edge.getFrom() + " -[" + edge.getType() + "]-> " + edge.getTo();
    }

    private static String rationale(String intentName, Scored winner, Scored runnerUp,
                                    boolean tied, boolean tiedOnAlias) {
        StringBuilder text = new StringBuilder();
        if (winner.perspective != null) {
            text.append("Intent '").append(intentName).append("' operates within perspective '")
                    .append(winner.perspective.getName()).append("', which ")
                    .append(winner.perspectiveEdge.getElevation() != null
                            ? winner.perspectiveEdge.getElevation().name().toLowerCase() : "uses")
                    .append(' ').append(winner.conceptName)
                    .append(" (elevation ").append(winner.perspectiveElevation).append(")");
            if (winner.perspectiveEdge.getRationale() != null) {
                text.append(": ").append(winner.perspectiveEdge.getRationale());
            }
            text.append(". ");
        } else {
            text.append("No perspective engaged by intent '").append(intentName)
                    .append("' defines ").append(winner.conceptName).append(". ");
        }
        if (winner.intentEdge != null) {
            text.append("Direct intent edge ").append(winner.intentEdge.getType())
                    .append(" (").append(formatWeight(winner.intentDirectWeight)).append(")");
            if (winner.intentEdge.getRationale() != null) {
                text.append(": ").append(winner.intentEdge.getRationale());
            }
            text.append(". ");
        }
        text.append("Score ").append(winner.score);
        if (runnerUp != null) {
            text.append(" vs ").append(runnerUp.conceptName).append(' ').append(runnerUp.score);
        }
        if (tied) {
            text.append("; tie broken by ").append(tiedOnAlias ? "concept name" : "table alias");
        }
        return text.append('.').toString();
    }

    private static String formatWeight(double weight) {
        return weight > 0 ? "+" + (int) weight : String.valueOf((int) weight);
    }

    private static boolean sameScore(double a, double b) {
        return Math.abs(a - b) <= EPSILON;
    }

    private static final class Scored {
        String conceptId;
        String conceptName;
        List<GraphEdge> meanings;
        String tableAlias;
        double perspectiveElevation;
        double intentDirectWeight;
        double score;
        GraphNode perspective;
        GraphEdge perspectiveEdge;
        GraphEdge intentEdge;

        String perspectiveName() {
            return perspective == null ? null : perspective.getName();
        }

        ConceptScore toScore() {
            return ConceptScore.builder()
                    .concept(conceptName)
                    .score(score)
                    .perspectiveElevation(perspectiveElevation)
                    .intentDirectWeight(intentDirectWeight)
                    .decidingPerspective(perspectiveName())
                    .tableAlias(tableAlias)
                    .build();
        }
    }
}
