package com.svdac.service;

import com.svdac.config.SvDacProperties;
import com.svdac.exception.RuleRangeMismatchException;
import com.svdac.model.DacRule;
import com.svdac.model.ScanOptions;
import com.svdac.model.ScanReport;
import com.svdac.model.Violation;
import com.svdac.testing.TestComponents;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScanServiceTest {

    private static final String ONE_VIOLATION = """
            module m;
              always @(posedge clk) begin
                data_s1 <= data_s0;
                bad_s1 <= other_s2;
              end
            endmodule
            """;

    private final ScanService scanService = TestComponents.scanService();

    @TempDir
    Path tempDir;

    @Test
    void shouldCheckContentAgainstDefaultRules() {
        ScanReport report = scanService.scanContent(ONE_VIOLATION, "m.sv", ScanOptions.defaults(), List.of());

        assertEquals(1, report.getTotalFiles());
        assertEquals(1, report.getTotalPasses());
        assertEquals(1, report.getTotalViolations());
        Violation v = report.getViolations().get(0);
        assertEquals("other_s2", v.getOperand());
        assertEquals(4, v.getLineNumber());
        assertEquals("s1 <= [s0]", v.getRule().describe());
        assertFalse(report.isStoppedEarly());
    }

    @Test
    void shouldUseEmbeddedRulesAndSkipIgnoredLines() {
        String content = """
                // DACrule: s0-1 = s0-1 -- OKcomb
                // DACrule: s1 <= s0 -- OKreg
                assign a_s0 = b_s0;
                assign c_s1 = d_s0; // OKcomb
                always @(posedge clk) e_s1 <= f_s0;
                always @(posedge clk) g_s1 <= h_s2; // OKreg
                """;

        ScanReport report = scanService.scanContent(content, "rules.sv", ScanOptions.defaults(), List.of());

        assertEquals(2, report.getTotalPasses());
        assertEquals(0, report.getTotalViolations());
    }

    @Test
    void shouldSuppressStatementsMatchingDeclaredException() {
        String statement = "always @(posedge clk) q_s1 <= i_srst ? 1'b0 : d_s0;\n";

        ScanReport withException = scanService.scanContent(
                "// DACexception: srst\n" + statement, "rst.sv", ScanOptions.defaults(), List.of());
        ScanReport withoutException = scanService.scanContent(
                statement, "rst.sv", ScanOptions.defaults(), List.of());

        assertEquals(0, withException.getTotalViolations());
        assertEquals(0, withException.getTotalPasses());
        assertEquals(1, withoutException.getTotalViolations());
        assertEquals("i_srst", withoutException.getViolations().get(0).getOperand());
    }

    @Test
    void shouldSuppressLinesCarryingRuleIgnoreTag() {
        String content = """
                // DACrule: s2 <= s1, r1 -- s2exception
                always @(posedge clk) data_s2 <= data_s1 + other_sig; // s2exception
                always @(posedge clk) next_s2 <= data_s1 + calc_r1;
                """;

        ScanReport report = scanService.scanContent(content, "tag.sv", ScanOptions.defaults(), List.of());

        assertEquals(0, report.getTotalViolations());
        assertEquals(2, report.getTotalPasses());
    }

    @Test
    void shouldFailOnMisalignedRuleRanges() {
        assertThrows(RuleRangeMismatchException.class,
                () -> scanService.scanContent("// DACrule: s0-3 = s0-2\n", "bad.sv", ScanOptions.defaults(), List.of()));
    }

    @Test
    void shouldScanDirectoryRecursively() throws Exception {
        Files.createDirectories(tempDir.resolve("rtl"));
        Files.createDirectories(tempDir.resolve("build"));
        Files.writeString(tempDir.resolve("rtl/a.sv"), ONE_VIOLATION);
        Files.writeString(tempDir.resolve("rtl/b.v"), "assign x_s0 = y_s0;\n");
        Files.writeString(tempDir.resolve("build/c.sv"), ONE_VIOLATION);
        Files.writeString(tempDir.resolve("notes.txt"), "bad_s1 <= other_s2;\n");

        ScanReport report = scanService.scan(tempDir.toString(), ScanOptions.defaults());

        assertEquals(List.of("rtl/a.sv", "rtl/b.v"), report.getScannedFiles());
        assertEquals(1, report.getTotalViolations());
        assertEquals(2, report.getTotalPasses());
        assertEquals("rtl/a.sv", report.getViolations().get(0).getFileName());
    }

    @Test
    void shouldStopScanningAtFirstViolation() throws Exception {
        Files.writeString(tempDir.resolve("a.sv"), ONE_VIOLATION);
        Files.writeString(tempDir.resolve("b.sv"), ONE_VIOLATION);

        ScanReport report = scanService.scan(tempDir.toString(), new ScanOptions(true, false));

        assertTrue(report.isStoppedEarly());
        assertEquals(1, report.getTotalFiles());
        assertEquals(1, report.getTotalViolations());
    }

    @Test
    void shouldCapStoredViolations() {
        SvDacProperties properties = new SvDacProperties();
        properties.setMaxViolations(1);
        ScanService capped = TestComponents.scanService(properties);

        ScanReport report = capped.scanContent(
                "always @(posedge clk) begin a_s1 <= x; b_s1 <= y; end\n", "cap.sv", ScanOptions.defaults(), List.of());

        assertTrue(report.isLimitReached());
        assertEquals(2, report.getTotalViolations());
        assertEquals(1, report.getViolations().size());
    }

    @Test
    void shouldNotifyListenerAsViolationsAreFound() {
        List<DacRule> compiled = new ArrayList<>();
        List<Violation> found = new ArrayList<>();
        ScanListener listener = new ScanListener() {
            @Override
            public void rulesCompiled(String fileName, List<DacRule> rules) {
                compiled.addAll(rules);
            }

            @Override
            public void violationFound(Violation violation) {
                found.add(violation);
            }
        };

        FileCheckResult result = scanService.checkFile(ONE_VIOLATION, "m.sv", ScanOptions.defaults(), listener);

        assertEquals(36, compiled.size());
        assertEquals(result.violations(), found);
    }

    @Test
    void shouldReportMissingSourcesAsNotice() {
        ScanReport report = scanService.scan(tempDir.toString(), ScanOptions.defaults());

        assertEquals(0, report.getTotalFiles());
        assertEquals(1, report.getNotices().size());
    }

    @Test
    void shouldRejectMissingPath() {
        assertThrows(IllegalArgumentException.class,
                () -> scanService.scan(tempDir.resolve("missing").toString(), ScanOptions.defaults()));
    }

    @Test
    void shouldCacheLastReport() {
        assertTrue(scanService.getLastScanReport().isEmpty());
        ScanReport report = scanService.scanContent(ONE_VIOLATION, "m.sv", ScanOptions.defaults(), List.of());

        scanService.cacheLastScanReport(report);

        assertSame(report, scanService.getLastScanReport().orElseThrow());
    }
}
