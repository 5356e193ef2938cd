package com.manufacturing.semanticlayer.config;

import com.manufacturing.semanticlayer.service.TieBreakPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "semantic.graph")
public class SemanticGraphProperties {

    /** Name of the stored schema (table/relationship) graph. */
    private String schemaStoreName = "manufacturing_schema";

    /** Name of the stored semantic (intent/perspective/concept/field) graph. */
    private String semanticStoreName = "manufacturing_semantic_layer";

    private int writeBatchSize = 1000;
    private boolean overwrite = false;

    /** Deadline applied to catalog loads and graph store I/O. */
    private Duration operationTimeout = Duration.ofSeconds(30);

    private boolean loadOnStartup = true;
    private GraphSource startupSource = GraphSource.CATALOG;

    private boolean refreshEnabled = false;
    private String refreshCron = "0 0 3 * * *";

    private TieBreakPolicy tieBreakPolicy = TieBreakPolicy.LEXICOGRAPHIC;

    public enum GraphSource {
        CATALOG,
        STORE
    }
}
