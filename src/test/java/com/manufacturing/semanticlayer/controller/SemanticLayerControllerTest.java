package com.manufacturing.semanticlayer.controller;

import com.manufacturing.semanticlayer.dto.ConceptResolution;
import com.manufacturing.semanticlayer.dto.IntentComparison;
import com.manufacturing.semanticlayer.dto.JoinPath;
import com.manufacturing.semanticlayer.exception.*;
import com.manufacturing.semanticlayer.graph.TestGraphs;
import com.manufacturing.semanticlayer.service.ConceptElevationResolver;
import com.manufacturing.semanticlayer.service.JoinPathResolver;
import com.manufacturing.semanticlayer.service.SemanticLayerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SemanticLayerControllerTest {

    private SemanticLayerService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = mock(SemanticLayerService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new SemanticLayerController(service))
                .setControllerAdvice(new SemanticLayerExceptionHandler())
                .build();
    }

    @Test
    void testJoinPath() throws Exception {
        JoinPath path = new JoinPathResolver().resolve(TestGraphs.manufacturingSchema(), "equipment", "customer");
        when(service.resolveJoinPath("equipment", "customer")).thenReturn(path);

        mockMvc.perform(get("/api/semantic/join-path").param("source", "equipment").param("target", "customer"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tables.length()").value(4))
                .andExpect(jsonPath("$.tables[3]").value("customer"))
                .andExpect(jsonPath("$.steps[0].relationshipKind").value("produces"))
                .andExpect(jsonPath("$.steps[0].joinColumn").value("equipment_id"))
                .andExpect(jsonPath("$.totalCost").value(3.0));
    }

    @Test
    void testConcept() throws Exception {
        ConceptResolution resolution = new ConceptElevationResolver()
                .resolve(TestGraphs.manufacturingSemantics().build(), "quality-review", "severity");
        when(service.resolveConcept("quality-review", "severity", null)).thenReturn(resolution);

        mockMvc.perform(get("/api/semantic/concept").param("intent", "quality-review").param("field", "severity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.concept").value("MATERIAL_NON_CONFORMANCE"))
                .andExpect(jsonPath("$.table").value("non_conformant_materials"))
                .andExpect(jsonPath("$.column").value("severity"))
                .andExpect(jsonPath("$.decidingPerspective").value("Quality"))
                .andExpect(jsonPath("$.candidates.length()").value(2));
    }

    @Test
    void testCompare() throws Exception {
        when(service.compareIntents("severity", "product_defects")).thenReturn(List.of(
                IntentComparison.builder()
                        .intent("quality-review")
                        .error("no field")
                        .errorType("AmbiguousResolutionException")
                        .build()));

        mockMvc.perform(get("/api/semantic/concept/compare").param("field", "severity")
                        .param("table", "product_defects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].intent").value("quality-review"))
                .andExpect(jsonPath("$[0].errorType").value("AmbiguousResolutionException"));
    }

    @Test
    void testAmbiguousResolutionListsCandidates() throws Exception {
        when(service.resolveConcept("planning", "quantity", null)).thenThrow(new AmbiguousResolutionException(
                "planning", "quantity", "primary field in several tables",
                List.of("order.quantity", "order_line.quantity")));

        mockMvc.perform(get("/api/semantic/concept").param("intent", "planning").param("field", "quantity"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("AmbiguousResolutionException"))
                .andExpect(jsonPath("$.details.field").value("quantity"))
                .andExpect(jsonPath("$.candidates[0]").value("order.quantity"))
                .andExpect(jsonPath("$.candidates[1]").value("order_line.quantity"));
    }

    @Test
    void testNoPath() throws Exception {
        when(service.resolveJoinPath("equipment", "warehouse"))
                .thenThrow(new NoPathException("equipment", "warehouse"));

        mockMvc.perform(get("/api/semantic/join-path").param("source", "equipment").param("target", "warehouse"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.sourceTable").value("equipment"))
                .andExpect(jsonPath("$.details.targetTable").value("warehouse"));
    }

    @Test
    void testUnknownIntent() throws Exception {
        when(service.resolveConcept("audit", "severity", null))
                .thenThrow(new UnknownNodeException("intent:audit", "intent 'audit'"));

        mockMvc.perform(get("/api/semantic/concept").param("intent", "audit").param("field", "severity"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.nodeId").value("intent:audit"));
    }

    @Test
    void testGraphNotLoaded() throws Exception {
        when(service.summary()).thenThrow(new GraphNotLoadedException());

        mockMvc.perform(get("/api/semantic/graph/summary"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void testRebuildRejectedCatalog() throws Exception {
        when(service.rebuild()).thenThrow(new CatalogIntegrityException(
                List.of("schema_edges[edge_id=9, from_table=order, to_table=invoice]: references unknown table 'invoice'")));

        mockMvc.perform(post("/api/semantic/graph/rebuild"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.violations[0]").value(
                        "schema_edges[edge_id=9, from_table=order, to_table=invoice]: references unknown table 'invoice'"));
    }

    @Test
    void testPersistFailure() throws Exception {
        when(service.publish(false)).thenThrow(new PartialWriteException("manufacturing_schema", "edges", 3,
                new IllegalStateException("write failed")));

        mockMvc.perform(post("/api/semantic/graph/persist").param("overwrite", "false"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.details.storeName").value("manufacturing_schema"))
                .andExpect(jsonPath("$.details.batchIndex").value(3));

        verify(service).publish(false);
    }

    @Test
    void testStoreUnavailableOnRestore() throws Exception {
        when(service.restore()).thenThrow(new StoreUnavailableException("manufacturing_schema", "read",
                new IllegalStateException("Connection refused")));

        mockMvc.perform(post("/api/semantic/graph/restore"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.details.storeName").value("manufacturing_schema"));
    }
}
