package com.svdac.controller;

import com.svdac.config.SvDacProperties;
import com.svdac.exception.SvDacException;
import com.svdac.model.DacRule;
import com.svdac.model.ScanOptions;
import com.svdac.model.ScanReport;
import com.svdac.service.ReportExportService;
import com.svdac.service.RuleService;
import com.svdac.service.ScanService;
import com.svdac.util.TextDecodingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 域赋值检查 API 控制器
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ScanController {

    private static final Logger log = LoggerFactory.getLogger(ScanController.class);

    private final ScanService scanService;
    private final RuleService ruleService;
    private final ReportExportService reportExportService;
    private final SvDacProperties properties;

    public ScanController(ScanService scanService, RuleService ruleService,
                          ReportExportService reportExportService, SvDacProperties properties) {
        this.scanService = scanService;
        this.ruleService = ruleService;
        this.reportExportService = reportExportService;
        this.properties = properties;
    }

    /**
     * 扫描指定目录或文件
     */
    @PostMapping("/scan")
    public ResponseEntity<?> scan(@RequestBody Map<String, String> request) {
        String repoPath = request.get("repoPath");
        if (repoPath == null || repoPath.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供扫描路径 (repoPath)"));
        }

        try {
            log.info("收到扫描请求: {}", repoPath);
            ScanOptions options = new ScanOptions(Boolean.parseBoolean(request.get("stopOnFirst")), false);
            ScanReport report = scanService.scan(repoPath, options);
            scanService.cacheLastScanReport(report);
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException | SvDacException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("扫描失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "扫描过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 上传单个 HDL 源文件进行检查
     */
    @PostMapping("/scan/file")
    public ResponseEntity<?> scanFile(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请上传文件"));
        }

        String filename = file.getOriginalFilename();
        if (filename == null || !properties.isSourceFile(filename)) {
            return ResponseEntity.badRequest().body(Map.of("error",
                    "请上传以下格式的源文件: " + properties.getSourceExtensions()));
        }

        try {
            byte[] bytes = file.getBytes();
            var decoded = TextDecodingUtils.decodeBestEffort(bytes);
            log.info("收到文件检查请求: {}, 大小: {} bytes, 编码: {}", filename, bytes.length, decoded.charsetName());

            List<String> notices = new ArrayList<>();
            String decodeNotice = decoded.buildNotice(filename);
            if (decodeNotice != null) {
                notices.add(decodeNotice);
            }

            ScanReport report = scanService.scanContent(decoded.text(), filename, ScanOptions.defaults(), notices);
            scanService.cacheLastScanReport(report);
            return ResponseEntity.ok(report);
        } catch (SvDacException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("文件检查失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "检查过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 获取默认规则表
     */
    @GetMapping("/rules/default")
    public ResponseEntity<List<DacRule>> getDefaultRules() {
        return ResponseEntity.ok(ruleService.getDefaultRules());
    }

    /**
     * 编译源码中的内嵌规则，没有内嵌规则时返回默认规则
     */
    @PostMapping("/rules/compile")
    public ResponseEntity<?> compileRules(@RequestBody Map<String, String> request) {
        String source = request.get("source");
        if (source == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供源码 (source)"));
        }
        try {
            return ResponseEntity.ok(ruleService.rulesFor(source));
        } catch (SvDacException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * 导出 Markdown 报告（优先使用请求体中的报告；未传时回退到最近一次扫描结果）
     */
    @PostMapping("/report/export/markdown")
    public ResponseEntity<?> exportMarkdown(@RequestBody(required = false) ScanReport report) {
        return exportReport("markdown", report);
    }

    /**
     * 导出 JSON 报告（优先使用请求体中的报告；未传时回退到最近一次扫描结果）
     */
    @PostMapping("/report/export/json")
    public ResponseEntity<?> exportJson(@RequestBody(required = false) ScanReport report) {
        return exportReport("json", report);
    }

    @GetMapping("/report/export/markdown")
    public ResponseEntity<?> exportMarkdownLatest() {
        return exportReport("markdown", null);
    }

    @GetMapping("/report/export/json")
    public ResponseEntity<?> exportJsonLatest() {
        return exportReport("json", null);
    }

    private ResponseEntity<?> exportReport(String format, ScanReport requestReport) {
        try {
            ScanReport report = resolveReportForExport(requestReport);
            if (report == null) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                        .body(Map.of("error", "暂无可导出的检查报告，请先执行一次扫描"));
            }

            ReportExportService.ExportPayload payload = "markdown".equals(format)
                    ? reportExportService.exportMarkdown(report)
                    : reportExportService.exportJson(report);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(payload.contentType()));
            headers.setContentLength(payload.content().length);
            headers.setContentDisposition(ContentDisposition.attachment()
                    .filename(payload.filename(), StandardCharsets.UTF_8)
                    .build());
            return new ResponseEntity<>(payload.content(), headers, HttpStatus.OK);
        } catch (Exception e) {
            log.error("导出报告失败, format={}", format, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "导出失败: " + e.getMessage()));
        }
    }

    private ScanReport resolveReportForExport(ScanReport requestReport) {
        if (requestReport != null && requestReport.getScanTime() != null) {
            return requestReport;
        }
        return scanService.getLastScanReport().orElse(null);
    }
}
