package com.manufacturing.semanticlayer.init;

import com.manufacturing.semanticlayer.entity.*;
import com.manufacturing.semanticlayer.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds the catalog with a small manufacturing schema
 * Only runs in 'dev' profile
 *
 * Covers the equipment -> product -> order -> customer chain and the
 * severity / cost_impact collision between non-conformant materials and
 * production defects.
 */
@Component
@Profile("dev")
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class CatalogSeeder implements CommandLineRunner {

    private final CatalogTableRepository tableRepository;
    private final CatalogRelationshipRepository relationshipRepository;
    private final CatalogIntentRepository intentRepository;
    private final CatalogPerspectiveRepository perspectiveRepository;
    private final CatalogConceptRepository conceptRepository;
    private final CatalogConceptFieldRepository conceptFieldRepository;
    private final IntentPerspectiveLinkRepository intentPerspectiveRepository;
    private final PerspectiveConceptLinkRepository perspectiveConceptRepository;
    private final IntentConceptLinkRepository intentConceptRepository;

    @Override
    public void run(String... args) {
        if (tableRepository.count() > 0) {
            log.info("Catalog already has data, skipping seeding");
            return;
        }

        log.info("Seeding manufacturing catalog...");

        tableRepository.saveAll(List.of(
            table("equipment", "dimension", "Machines and production lines"),
            table("product", "dimension", "Manufactured products"),
            table("order", "fact", "Customer orders"),
            table("customer", "dimension", "Customers placing orders"),
            table("suppliers", "dimension", "Raw material suppliers"),
            table("non_conformant_materials", "fact", "Incoming material failing inspection (NCM)"),
            table("product_defects", "fact", "Defects found on finished products")
        ));

        relationshipRepository.saveAll(List.of(
            CatalogRelationship.builder()
                .edgeId(1L).fromTable("equipment").toTable("product")
                .relationshipType("produces").joinColumn("equipment_id").weight(1.0)
                .joinColumnDescription("product.equipment_id references the line that built it")
                .naturalLanguageAlias("made on")
                .fewShotExample("SELECT p.* FROM product p JOIN equipment e ON p.equipment_id = e.equipment_id")
                .build(),
            CatalogRelationship.builder()
                .edgeId(2L).fromTable("product").toTable("order")
                .relationshipType("ordered_in").joinColumn("product_id").weight(1.0)
                .naturalLanguageAlias("bought in")
                .build(),
            CatalogRelationship.builder()
                .edgeId(3L).fromTable("order").toTable("customer")
                .relationshipType("placed_by").joinColumn("customer_id").weight(1.0)
                .context("Every order has exactly one customer")
                .build(),
            CatalogRelationship.builder()
                .edgeId(4L).fromTable("product_defects").toTable("product")
                .relationshipType("defect_of").joinColumn("product_id").weight(1.0)
                .build(),
            CatalogRelationship.builder()
                .edgeId(5L).fromTable("non_conformant_materials").toTable("suppliers")
                .relationshipType("supplied_by").joinColumn("supplier_id").weight(1.0)
                .build(),
            CatalogRelationship.builder()
                .edgeId(6L).fromTable("non_conformant_materials").toTable("product")
                .relationshipType("used_in").joinColumn("product_id").weight(2.0)
                .joinColumnDescription("Set only when the material reached production")
                .build()
        ));

        intentRepository.saveAll(List.of(
            new CatalogIntent(1L, "quality-review", "Root-cause and containment of quality issues"),
            new CatalogIntent(2L, "cost-review", "Financial exposure of quality issues")
        ));
        perspectiveRepository.saveAll(List.of(
            new CatalogPerspective(1L, "Quality", "Quality engineering view"),
            new CatalogPerspective(2L, "Finance", "Cost and liability view")
        ));
        conceptRepository.saveAll(List.of(
            new CatalogConcept(1L, "MATERIAL_NON_CONFORMANCE", "Supplier material outside specification"),
            new CatalogConcept(2L, "PRODUCTION_DEFECT", "Defect introduced during production"),
            new CatalogConcept(3L, "FINANCIAL_LIABILITY_NCM", "Cost recoverable from suppliers for NCM")
        ));

        conceptFieldRepository.saveAll(List.of(
            new CatalogConceptField(1L, "non_conformant_materials", "severity", true, "ncm"),
            new CatalogConceptField(2L, "product_defects", "severity", true, "pd"),
            new CatalogConceptField(2L, "product_defects", "cost_impact", true, "pd"),
            new CatalogConceptField(3L, "non_conformant_materials", "cost_impact", true, "ncm")
        ));

        intentPerspectiveRepository.saveAll(List.of(
            new IntentPerspectiveLink(1L, 1L, 1.0),
            new IntentPerspectiveLink(2L, 2L, 1.0)
        ));
        perspectiveConceptRepository.saveAll(List.of(
            new PerspectiveConceptLink(1L, 1L, 1.0, "Quality reads severity from the NCM record"),
            new PerspectiveConceptLink(1L, 2L, 0.0, "Defect severity is secondary for material issues"),
            new PerspectiveConceptLink(2L, 2L, 0.0, "Defect cost is an estimate"),
            new PerspectiveConceptLink(2L, 3L, 1.0, "Finance books NCM cost_impact as supplier liability")
        ));
        intentConceptRepository.saveAll(List.of(
            new IntentConceptLink(2L, 3L, 1, "Cost reviews track recoverable liability")
        ));

        log.info("Seeded {} tables, {} relationships, {} concepts",
                tableRepository.count(), relationshipRepository.count(), conceptRepository.count());
    }

    private static CatalogTable table(String name, String type, String description) {
        return CatalogTable.builder()
                .tableName(name)
                .tableType(type)
                .description(description)
                .build();
    }
}
