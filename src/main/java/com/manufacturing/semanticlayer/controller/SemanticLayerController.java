package com.manufacturing.semanticlayer.controller;

import com.manufacturing.semanticlayer.dto.ConceptResolution;
import com.manufacturing.semanticlayer.dto.GraphStatus;
import com.manufacturing.semanticlayer.dto.IntentComparison;
import com.manufacturing.semanticlayer.dto.JoinPath;
import com.manufacturing.semanticlayer.service.SemanticLayerService;
import com.manufacturing.semanticlayer.store.StoredGraphInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API over the schema and semantic graphs
 */
@RestController
@RequestMapping("/api/semantic")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Semantic Layer", description = "Join paths, concept disambiguation and graph lifecycle")
public class SemanticLayerController {

    private final SemanticLayerService semanticLayerService;

    @Operation(
        summary = "Resolve a join path",
        description = "Shortest path between two tables; equal-cost paths resolve to the smallest table sequence "
            + "in canonical (name-ascending endpoint) order, reversed when source sorts after target"
    )
    @GetMapping("/join-path")
    public JoinPath joinPath(
            @Parameter(description = "Table the query starts from") @RequestParam String source,
            @Parameter(description = "Table to reach") @RequestParam String target) {
        return semanticLayerService.resolveJoinPath(source, target);
    }

    @Operation(
        summary = "Resolve an ambiguous field",
        description = "Picks the authoritative table and column for a field name under the given intent"
    )
    @GetMapping("/concept")
    public ConceptResolution concept(
            @RequestParam String intent,
            @RequestParam String field,
            @Parameter(description = "Restrict the winning concept to this table")
            @RequestParam(required = false) String table) {
        return semanticLayerService.resolveConcept(intent, field, table);
    }

    /**
     * How each intent would resolve the same field
     */
    @Operation(summary = "Compare a field's resolution across all intents")
    @GetMapping("/concept/compare")
    public List<IntentComparison> compare(
            @RequestParam String field,
            @RequestParam(required = false) String table) {
        return semanticLayerService.compareIntents(field, table);
    }

    @Operation(summary = "Summary of the graphs being served")
    @GetMapping("/graph/summary")
    public GraphStatus summary() {
        return semanticLayerService.summary();
    }

    @Operation(summary = "Rebuild both graphs from the relational catalog")
    @PostMapping("/graph/rebuild")
    public GraphStatus rebuild() {
        log.info("Graph rebuild requested");
        return semanticLayerService.rebuild();
    }

    @Operation(
        summary = "Persist both graphs to the graph store",
        description = "Writes under a staging name and swaps it in; a failed write leaves the stored graphs unchanged"
    )
    @PostMapping("/graph/persist")
    public List<StoredGraphInfo> persist(
            @Parameter(description = "Replace existing stored graphs (default from configuration)")
            @RequestParam(required = false) Boolean overwrite) {
        log.info("Graph persist requested (overwrite={})", overwrite);
        return semanticLayerService.publish(overwrite);
    }

    @Operation(summary = "Serve the graphs last persisted to the graph store")
    @PostMapping("/graph/restore")
    public GraphStatus restore() {
        log.info("Graph restore requested");
        return semanticLayerService.restore();
    }
}
