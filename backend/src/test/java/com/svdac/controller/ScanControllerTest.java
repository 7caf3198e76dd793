package com.svdac.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.svdac.config.SvDacProperties;
import com.svdac.service.ReportExportService;
import com.svdac.testing.TestComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ScanControllerTest {

    private static final String SOURCE = "always @(posedge clk) bad_s1 <= other_s2;\n";

    private MockMvc mockMvc;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        SvDacProperties properties = new SvDacProperties();
        ScanController controller = new ScanController(
                TestComponents.scanService(properties),
                TestComponents.ruleService(properties),
                new ReportExportService(new ObjectMapper().findAndRegisterModules()),
                properties);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void shouldListDefaultRules() throws Exception {
        mockMvc.perform(get("/api/rules/default"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(36))
                .andExpect(jsonPath("$[0].left").value("r1"));
    }

    @Test
    void shouldCompileEmbeddedRules() throws Exception {
        mockMvc.perform(post("/api/rules/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"// DACrule: s0-1 = s0-1 -- OKcomb\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].left").value("s1"))
                .andExpect(jsonPath("$[1].assign").value("BLOCKING"))
                .andExpect(jsonPath("$[1].ignore").value("OKcomb"));
    }

    @Test
    void shouldRejectMisalignedRules() throws Exception {
        mockMvc.perform(post("/api/rules/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"// DACrule: s0-3 = s0-2\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void shouldRejectRangeBeyondInteger() throws Exception {
        mockMvc.perform(post("/api/rules/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"// DACrule: s0-99999999999 = s0-99999999999\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void shouldCheckUploadedFile() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "top.sv", "text/plain", SOURCE.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/scan/file").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalViolations").value(1))
                .andExpect(jsonPath("$.violations[0].operand").value("other_s2"));
    }

    @Test
    void shouldRejectUnsupportedUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "notes.txt", "text/plain", SOURCE.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/scan/file").file(file))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldScanDirectory() throws Exception {
        Files.writeString(tempDir.resolve("top.sv"), SOURCE);

        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"repoPath\": \"" + tempDir.toString().replace("\\", "\\\\") + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalFiles").value(1))
                .andExpect(jsonPath("$.totalViolations").value(1));
    }

    @Test
    void shouldRequireRepoPath() throws Exception {
        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRefuseExportBeforeAnyScan() throws Exception {
        mockMvc.perform(get("/api/report/export/markdown"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldExportLatestReport() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "top.sv", "text/plain", SOURCE.getBytes(StandardCharsets.UTF_8));
        mockMvc.perform(multipart("/api/scan/file").file(file))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/report/export/markdown"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("svdac-report-")))
                .andExpect(content().string(containsString("other_s2")));
    }
}
