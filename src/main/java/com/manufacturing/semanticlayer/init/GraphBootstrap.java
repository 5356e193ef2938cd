package com.manufacturing.semanticlayer.init;

import com.manufacturing.semanticlayer.config.SemanticGraphProperties;
import com.manufacturing.semanticlayer.service.SemanticGraphRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Loads the graphs at startup, after the dev seeder has run.
 * A failure leaves the service up without graphs; queries answer 503 until a
 * rebuild or restore succeeds.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class GraphBootstrap implements CommandLineRunner {

    private final SemanticGraphRegistry registry;
    private final SemanticGraphProperties properties;

    @Override
    public void run(String... args) {
        if (!properties.isLoadOnStartup()) {
            log.info("Graph load on startup disabled");
            return;
        }

        try {
            if (properties.getStartupSource() == SemanticGraphProperties.GraphSource.STORE) {
                registry.restoreFromStore();
            } else {
                registry.rebuildFromCatalog();
            }
        } catch (Exception e) {
            log.error("Startup graph load from {} failed: {}", properties.getStartupSource(), e.getMessage(), e);
        }
    }
}
