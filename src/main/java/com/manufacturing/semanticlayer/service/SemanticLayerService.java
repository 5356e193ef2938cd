package com.manufacturing.semanticlayer.service;

import com.manufacturing.semanticlayer.config.SemanticGraphProperties;
import com.manufacturing.semanticlayer.dto.ConceptResolution;
import com.manufacturing.semanticlayer.dto.GraphStatus;
import com.manufacturing.semanticlayer.dto.IntentComparison;
import com.manufacturing.semanticlayer.dto.JoinPath;
import com.manufacturing.semanticlayer.graph.CatalogGraphs;
import com.manufacturing.semanticlayer.store.StoredGraphInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point used by the SQL-generation layer and the REST API: join paths,
 * concept resolution, and lifecycle of the served graphs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SemanticLayerService {

    private final SemanticGraphRegistry registry;
    private final JoinPathResolver joinPathResolver;
    private final ConceptElevationResolver conceptElevationResolver;
    private final GraphPersistenceService graphPersistenceService;
    private final SemanticGraphProperties properties;

    // one publish at a time, so two overwrites of the same store name never interleave
    private final ReentrantLock publishLock = new ReentrantLock();

    public JoinPath resolveJoinPath(String sourceTable, String targetTable) {
        return joinPathResolver.resolve(registry.current().getSchemaGraph(), sourceTable, targetTable);
    }

    public ConceptResolution resolveConcept(String intentName, String fieldName, String tableScope) {
        return conceptElevationResolver.resolve(registry.current().getSemanticGraph(),
                intentName, fieldName, blankToNull(tableScope), properties.getTieBreakPolicy());
    }

    public List<IntentComparison> compareIntents(String fieldName, String tableScope) {
        return conceptElevationResolver.compareIntents(registry.current().getSemanticGraph(),
                fieldName, blankToNull(tableScope), properties.getTieBreakPolicy());
    }

    public GraphStatus summary() {
        return GraphStatus.of(registry.current());
    }

    public GraphStatus rebuild() {
        return GraphStatus.of(registry.rebuildFromCatalog());
    }

    public GraphStatus restore() {
        return GraphStatus.of(registry.restoreFromStore());
    }

    /**
     * Persists the served schema and semantic graphs under their configured
     * store names, schema first.
     *
     * <p>Each graph is replaced atomically, the pair is not: when the semantic
     * graph fails after the schema graph was stored, the new schema graph sits
     * next to the previously stored semantic graph until the next publish.
     *
     * @param overwrite replace stored graphs of the same name; null uses the configured default
     */
    public List<StoredGraphInfo> publish(Boolean overwrite) {
        boolean replace = overwrite != null ? overwrite : properties.isOverwrite();
        CatalogGraphs graphs = registry.current();
        publishLock.lock();
        try {
            OperationDeadline deadline = registry.newDeadline();
            StoredGraphInfo schema = graphPersistenceService.persist(graphs.getSchemaGraph(),
                    properties.getSchemaStoreName(), properties.getWriteBatchSize(), replace, deadline);
            StoredGraphInfo semantic;
            try {
                semantic = graphPersistenceService.persist(graphs.getSemanticGraph(),
                        properties.getSemanticStoreName(), properties.getWriteBatchSize(), replace, deadline);
            } catch (RuntimeException e) {
                log.error("Publishing '{}' failed after '{}' was already stored; the stored pair is out of step: {}",
                        properties.getSemanticStoreName(), schema.getStoreName(), e.getMessage());
                throw e;
            }
            return List.of(schema, semantic);
        } catch (RuntimeException e) {
            log.error("Publishing graphs failed: {}", e.getMessage());
            throw e;
        } finally {
            publishLock.unlock();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
