package com.svdac.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.svdac.model.ScanOptions;
import com.svdac.model.ScanReport;
import com.svdac.testing.TestComponents;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportExportServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ReportExportService exportService = new ReportExportService(objectMapper);
    private final ScanService scanService = TestComponents.scanService();

    @Test
    void shouldRenderViolationsGroupedByFile() {
        ScanReport report = scanService.scanContent(
                "always @(posedge clk) bad_s1 <= other_s2;\n", "top.sv", ScanOptions.defaults(), List.of("解码提示"));

        ReportExportService.ExportPayload payload = exportService.exportMarkdown(report);
        String markdown = new String(payload.content(), StandardCharsets.UTF_8);

        assertTrue(payload.filename().startsWith("svdac-report-"));
        assertTrue(payload.filename().endsWith(".md"));
        assertTrue(markdown.startsWith("# 域赋值检查报告"));
        assertTrue(markdown.contains("### `top.sv` (1 项)"));
        assertTrue(markdown.contains("`s1 <= [s0]`"));
        assertTrue(markdown.contains("`other_s2`"));
        assertTrue(markdown.contains("- 解码提示"));
    }

    @Test
    void shouldRenderCleanReport() {
        ScanReport report = scanService.scanContent("assign a_s0 = b_s0;\n", "ok.sv", ScanOptions.defaults(), List.of());

        String markdown = exportService.buildMarkdown(report);

        assertTrue(markdown.contains("**所有赋值均符合域规则**"));
        assertFalse(markdown.contains("## 违规详情"));
    }

    @Test
    void shouldExportJson() throws Exception {
        ScanReport report = scanService.scanContent(
                "always @(posedge clk) bad_s1 <= other_s2;\n", "top.sv", ScanOptions.defaults(), List.of());

        ReportExportService.ExportPayload payload = exportService.exportJson(report);
        JsonNode json = objectMapper.readTree(payload.content());

        assertTrue(payload.filename().endsWith(".json"));
        assertEquals(1, json.get("totalViolations").asInt());
        assertEquals("other_s2", json.get("violations").get(0).get("operand").asText());
        assertEquals("NONBLOCKING", json.get("violations").get(0).get("rule").get("assign").asText());
    }
}
