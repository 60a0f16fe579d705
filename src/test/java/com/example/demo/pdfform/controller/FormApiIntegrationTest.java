package com.example.demo.pdfform.controller;

import com.example.demo.pdfform.support.TestWiring;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST endpoints against the fixture catalog in a temporary data directory.
 * Nothing here reaches the network.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class FormApiIntegrationTest {

    @TempDir
    static Path dataDir;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @DynamicPropertySource
    static void dataDirProperties(DynamicPropertyRegistry registry) {
        registry.add("pdfform.data-dir", () -> dataDir.toString());
        registry.add("pdfform.catalog-file", () -> "test_forms.csv");
    }

    @BeforeAll
    static void copyCatalog() throws IOException {
        Path catalogDir = Files.createDirectories(dataDir.resolve("catalog"));
        Files.copy(TestWiring.CATALOG_FIXTURE, catalogDir.resolve("test_forms.csv"));
    }

    @Test
    public void testBrowseRegion() throws Exception {
        mockMvc.perform(get("/api/forms/browse").param("region", "NSW"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regions.length()").value(3))
                .andExpect(jsonPath("$.forms.length()").value(2))
                .andExpect(jsonPath("$.forms[0].form_code").value("TF01"));
    }

    @Test
    public void testBrowseUnknownRegionIs404() throws Exception {
        mockMvc.perform(get("/api/forms/browse").param("region", "WA"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.stage").value("filter_forms"));
    }

    @Test
    public void testDownloadWithoutSourceIs400() throws Exception {
        mockMvc.perform(post("/api/forms/download")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"formCode\": \"VT1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NO_SOURCE"))
                .andExpect(jsonPath("$.stage").value("check_url"));
    }

    @Test
    public void testInspectMissingPdfIs404() throws Exception {
        mockMvc.perform(post("/api/forms/inspect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                Map.of("pdfPath", dataDir.resolve("missing.pdf").toString()))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("DOCUMENT_NOT_FOUND"));
    }

    @Test
    public void testFillNeedsATemplate() throws Exception {
        mockMvc.perform(post("/api/forms/fill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flatten\": true}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testWorkflowIsAcceptedOrRejected() throws Exception {
        mockMvc.perform(post("/api/forms/workflow")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("rejected"));

        mockMvc.perform(post("/api/forms/workflow")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"formCode\": \"NOPE\", \"outputDir\": \"" + jsonPathOf(dataDir.resolve("wf")) + "\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.formCode").value("NOPE"));
    }

    @Test
    public void testCaseLifecycle() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/cases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"formCode\": \"F3520\", \"caseName\": \"Smith purchase\", \"entityName\": \"acme\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.case.form_reference.form_code").value("F3520"))
                .andReturn();
        JsonNode body = objectMapper.readTree(created.getResponse().getContentAsString());
        String caseId = body.path("case").path("case_metadata").path("case_id").asText();
        assertTrue(caseId.startsWith("acme_F3520_"), caseId);
        assertTrue(Files.exists(Path.of(body.path("path").asText())));

        mockMvc.perform(put("/api/cases/{caseId}/fields", caseId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"Name\": \"Alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fields.Name").value("Alice"));

        mockMvc.perform(get("/api/cases/{caseId}", caseId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.case_metadata.entity_name").value("acme"));

        mockMvc.perform(post("/api/cases/{caseId}/validate", caseId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true));

        mockMvc.perform(post("/api/cases/{caseId}/fill", caseId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CANNOT_RESOLVE_DOCUMENT"));
    }

    @Test
    public void testCaseWithPathLikeEntityIsRejected() throws Exception {
        mockMvc.perform(post("/api/cases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"formCode\": \"F3520\", \"caseName\": \"x\", \"entityName\": \"../../escaped\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_CASE"))
                .andExpect(jsonPath("$.stage").value("create"));
    }

    @Test
    public void testUnknownCaseIs404() throws Exception {
        mockMvc.perform(get("/api/cases/{caseId}", "nobody_X_20240101_000000.000000"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void testEventStreamStartsAsync() throws Exception {
        mockMvc.perform(get("/api/events").param("pattern", "case.*"))
                .andExpect(request().asyncStarted());
    }

    private static String jsonPathOf(Path path) {
        return path.toString().replace("\\", "\\\\");
    }
}
