package com.manufacturing.semanticlayer.scheduler;

import com.manufacturing.semanticlayer.config.SemanticGraphProperties;
import com.manufacturing.semanticlayer.service.SemanticGraphRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic rebuild of the served graphs from the catalog
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GraphRefreshScheduler {

    private final SemanticGraphRegistry registry;
    private final SemanticGraphProperties properties;

    /**
     * Nightly by default. A failed rebuild keeps the previous graphs in service.
     */
    @Scheduled(cron = "${semantic.graph.refresh-cron:0 0 3 * * *}")
    public void scheduledRefresh() {
        if (!properties.isRefreshEnabled()) {
            log.debug("Scheduled graph refresh disabled");
            return;
        }
        log.info("=== Starting scheduled graph refresh ===");

        try {
            registry.rebuildFromCatalog();
            log.info("=== Graph refresh completed ===");
        } catch (Exception e) {
            log.error("=== Graph refresh failed, still serving previous graphs: {} ===", e.getMessage(), e);
        }
    }
}
