package com.manufacturing.semanticlayer.service;

import com.manufacturing.semanticlayer.config.SemanticGraphProperties;
import com.manufacturing.semanticlayer.exception.GraphNotLoadedException;
import com.manufacturing.semanticlayer.graph.CatalogGraphs;
import com.manufacturing.semanticlayer.graph.GraphModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the graph pair currently served. Readers take a snapshot with
 * {@link #current()}; rebuilds construct new graphs and swap the reference,
 * so in-flight queries keep the snapshot they started with.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SemanticGraphRegistry {

    private final CatalogLoaderService catalogLoaderService;
    private final GraphPersistenceService graphPersistenceService;
    private final SemanticGraphProperties properties;

    private final AtomicReference<CatalogGraphs> current = new AtomicReference<>();

    public CatalogGraphs current() {
        CatalogGraphs graphs = current.get();
        if (graphs == null) {
            throw new GraphNotLoadedException();
        }
        return graphs;
    }

    public Optional<CatalogGraphs> peek() {
        return Optional.ofNullable(current.get());
    }

    public CatalogGraphs rebuildFromCatalog() {
        CatalogGraphs graphs = catalogLoaderService.loadAll(newDeadline());
        swap(graphs);
        return graphs;
    }

    public CatalogGraphs restoreFromStore() {
        OperationDeadline deadline = newDeadline();
        GraphModel schemaGraph = graphPersistenceService.load(properties.getSchemaStoreName(), true, deadline);
        GraphModel semanticGraph = graphPersistenceService.load(properties.getSemanticStoreName(), true, deadline);
        CatalogGraphs graphs = new CatalogGraphs(schemaGraph, semanticGraph, Instant.now(), CatalogGraphs.Origin.STORE);
        swap(graphs);
        return graphs;
    }

    public OperationDeadline newDeadline() {
        return OperationDeadline.after(properties.getOperationTimeout());
    }

    private void swap(CatalogGraphs graphs) {
        CatalogGraphs previous = current.getAndSet(graphs);
        log.info("Serving graphs from {}: schema {} nodes / {} edges, semantic {} nodes / {} edges (replaced {})",
                graphs.getOrigin(),
                graphs.getSchemaGraph().nodeCount(), graphs.getSchemaGraph().edgeCount(),
                graphs.getSemanticGraph().nodeCount(), graphs.getSemanticGraph().edgeCount(),
                previous == null ? "nothing" : "snapshot built " + previous.getBuiltAt());
    }
}
